package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.exception.InvalidSampleException;
import com.infra.anomaly.model.MetricSample;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Rejects samples that would corrupt the window: wrong arity, non-finite values, and values
 * outside the configured physical range of each feature (e.g. CPU above 100%).
 */
@Component
public class SampleValidator {

    private final AnomalyConfig config;

    public SampleValidator(AnomalyConfig config) {
        this.config = config;
    }

    /**
     * @throws InvalidSampleException listing every problem found
     */
    public void validate(MetricSample sample) {
        List<String> issues = new ArrayList<>();
        if (sample == null) {
            throw new InvalidSampleException(List.of("sample is required"));
        }

        List<String> names = config.getIngestion().getFeatureNames();
        double[] features = sample.getFeatures();
        if (sample.getTimestamp() <= 0) {
            issues.add("timestamp must be a positive epoch millisecond value");
        }
        if (features == null) {
            issues.add("features are required");
            throw new InvalidSampleException(issues);
        }
        if (features.length != names.size()) {
            issues.add(String.format("expected %d features %s, got %d", names.size(), names, features.length));
            throw new InvalidSampleException(issues);
        }

        for (int i = 0; i < features.length; i++) {
            String name = names.get(i);
            double value = features[i];
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                issues.add(name + " is not a finite number");
                continue;
            }
            if (!config.getValidation().isEnabled()) {
                continue;
            }
            AnomalyConfig.Range range = config.getValidation().getRanges().get(name);
            if (range == null) {
                continue;
            }
            if (range.getMin() != null && value < range.getMin()) {
                issues.add(String.format("%s=%s below minimum %s", name, value, range.getMin()));
            }
            if (range.getMax() != null && value > range.getMax()) {
                issues.add(String.format("%s=%s above maximum %s", name, value, range.getMax()));
            }
        }

        if (!issues.isEmpty()) {
            throw new InvalidSampleException(issues);
        }
    }
}
