package com.infra.anomaly.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "anomaly")
public class AnomalyConfig {

    // Expected fraction of anomalous points; calibrates the verdict threshold.
    private double contamination = 0.02;

    // Number of isolation trees per model.
    private int treeCount = 100;

    // Sub-sampling size per tree. Effective size is min(subSampleSize, N).
    private int subSampleSize = 256;

    private Window window = new Window();

    private Training training = new Training();

    private Drift drift = new Drift();

    private Orchestrator orchestrator = new Orchestrator();

    private Ingestion ingestion = new Ingestion();

    private Validation validation = new Validation();

    @Data
    public static class Window {
        private int capacity = 2000;
        // Late samples within this tolerance are clamped to the newest timestamp.
        private long outOfOrderToleranceMs = 5000;
    }

    @Data
    public static class Training {
        private int minSamples = 50;
        private long randomSeed = 42L;
        private double validationFraction = 0.15;
        private double testFraction = 0.15;
    }

    @Data
    public static class Drift {
        // Size K of the recent window compared against the reference.
        private int windowSize = 200;
        private int minRecentSamples = 30;
        // Number of tests (out of five) that must vote "drifted".
        private int consensusThreshold = 3;
        private double ksSignificance = 0.05;
        private double wassersteinThreshold = 0.3;
        private double andersonDarlingSignificance = 0.05;
        private double jensenShannonThreshold = 0.2;
        private int jensenShannonBins = 20;
        private double meanShiftThreshold = 2.0;
        private int historySize = 100;
    }

    @Data
    public static class Orchestrator {
        private boolean enabled = true;
        private int cycleIntervalSeconds = 30;
        private int retrainIntervalSeconds = 300;
        // Drift-triggered attempts are suppressed this long after the previous attempt.
        private int driftCooldownSeconds = 60;
        private int trainingTimeoutSeconds = 60;
        private double f1RegressionTolerance = 0.02;
        private int eventHistorySize = 500;
    }

    @Data
    public static class Ingestion {
        private List<String> featureNames = List.of("cpu_usage", "memory_usage", "network_load");
        // Consecutive anomalous verdicts before a score is marked sustained (12 x 10s = 2 min).
        private int sustainedCount = 12;
        private int detectedAnomalyCapacity = 1000;
        private int scoreHistorySize = 1000;
    }

    @Data
    public static class Validation {
        private boolean enabled = true;
        private Map<String, Range> ranges = defaultRanges();

        private static Map<String, Range> defaultRanges() {
            Map<String, Range> ranges = new LinkedHashMap<>();
            ranges.put("cpu_usage", new Range(0.0, 100.0));
            ranges.put("memory_usage", new Range(0.0, 100.0));
            ranges.put("network_load", new Range(0.0, null));
            return ranges;
        }
    }

    @Data
    public static class Range {
        private Double min;
        private Double max;

        public Range() {}

        public Range(Double min, Double max) {
            this.min = min;
            this.max = max;
        }
    }
}
