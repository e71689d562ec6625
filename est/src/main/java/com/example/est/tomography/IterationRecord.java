package com.example.est.tomography;

public record IterationRecord(int iteration, double maxError) {
}
