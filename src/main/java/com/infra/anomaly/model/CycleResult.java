package com.infra.anomaly.model;

public enum CycleResult {
    /** No trigger fired; nothing was trained. */
    SKIPPED,
    PROMOTED,
    /** Candidate lost the evaluation gate and stays a CANDIDATE. */
    REJECTED,
    /** Training or evaluation threw; the incumbent stays active. */
    FAILED,
    TIMED_OUT
}
