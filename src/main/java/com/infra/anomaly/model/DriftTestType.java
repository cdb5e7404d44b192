package com.infra.anomaly.model;

public enum DriftTestType {
    KOLMOGOROV_SMIRNOV,
    WASSERSTEIN,
    ANDERSON_DARLING,
    JENSEN_SHANNON,
    MEAN_SHIFT
}
