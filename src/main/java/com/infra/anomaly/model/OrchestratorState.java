package com.infra.anomaly.model;

public enum OrchestratorState {
    IDLE,
    TRAINING,
    EVALUATING,
    PROMOTED,
    REJECTED
}
