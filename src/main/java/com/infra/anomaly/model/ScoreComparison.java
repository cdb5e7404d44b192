package com.infra.anomaly.model;

import lombok.Value;

@Value
public class ScoreComparison {
    Double spearmanCorrelation;
    double meanAbsoluteDelta;
}
