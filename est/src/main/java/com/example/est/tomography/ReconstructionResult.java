package com.example.est.tomography;

import org.nd4j.linalg.api.ndarray.INDArray;

import java.util.List;

public record ReconstructionResult(INDArray image, TerminationReason terminationReason, List<IterationRecord> trace) {

    public ReconstructionResult {
        trace = List.copyOf(trace);
    }

    public int iterationsExecuted() {
        return trace.size();
    }

    public double finalMaxError() {
        return trace.isEmpty() ? Double.NaN : trace.get(trace.size() - 1).maxError();
    }
}
