package com.example.est.tomography;

public enum TerminationReason {
    /** Successive max errors differed by less than the tolerance. */
    CONVERGED,
    /** The iteration budget ran out first. */
    EXHAUSTED
}
