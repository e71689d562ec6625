package com.example.est.dto;

import com.example.est.tomography.IterationRecord;

import java.time.LocalDateTime;
import java.util.List;

public record ImageResult(
        double[][] pixels,
        String algoritmo,
        String tamanho,
        int iteracoes,
        String terminacao,
        double erroFinal,
        List<IterationRecord> trace,
        double tempoSegundos,
        double cpuPercent,
        double memPercent,
        LocalDateTime startTime,
        LocalDateTime endTime
) {}
