package com.infra.anomaly.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Hyperparameters {
    double contamination;
    int treeCount;
    int subSampleSize;
    long randomSeed;
}
