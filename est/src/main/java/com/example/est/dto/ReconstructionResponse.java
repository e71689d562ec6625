package com.example.est.dto;

import com.example.est.tomography.IterationRecord;

import java.time.ZonedDateTime;
import java.util.List;

public record ReconstructionResponse(String algorithmUsed,
    ZonedDateTime startTime,
    ZonedDateTime endTime,
    long reconstructionTimeMs,
    String pixelSize,
    int iterationsExecuted,
    String terminationReason,
    double finalMaxError,
    double cpuPercent,
    double memPercent,
    List<IterationRecord> trace,
    double[][] imageReconstructed) {
}
