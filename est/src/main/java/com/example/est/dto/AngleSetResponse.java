package com.example.est.dto;

public record AngleSetResponse(int count, double[] angles) {
}
