package com.infra.anomaly.model;

public enum DriftStatus {
    DRIFT,
    NO_DRIFT,
    /** Recent window too small or no reference distribution; neither drift nor stability is implied. */
    INSUFFICIENT_DATA
}
