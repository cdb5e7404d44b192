package com.infra.anomaly.model;

public enum ModelStatus {
    CANDIDATE,
    ACTIVE,
    RETIRED
}
