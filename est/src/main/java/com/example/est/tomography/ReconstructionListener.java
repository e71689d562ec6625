package com.example.est.tomography;

@FunctionalInterface
public interface ReconstructionListener {

    void onIteration(IterationRecord record);

    static ReconstructionListener none() {
        return record -> { };
    }
}
