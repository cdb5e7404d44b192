package com.infra.anomaly.engine.drift;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.config.MetricsConfig;
import com.infra.anomaly.model.DriftReport;
import com.infra.anomaly.model.DriftStatus;
import com.infra.anomaly.model.DriftTestResult;
import com.infra.anomaly.model.DriftTestType;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Runs every registered drift test against the same reference and recent window and
 * aggregates their votes. Drift is declared only when at least the configured number of
 * tests agree; confidence is the fraction of tests voting drifted.
 */
@Component
public class DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(DriftDetector.class);

    private final Map<DriftTestType, DriftTest> tests;
    private final AnomalyConfig config;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public DriftDetector(List<DriftTest> driftTests, AnomalyConfig config, Tracer tracer,
                         MetricsConfig metricsConfig, Clock clock) {
        this.tests = new EnumMap<>(DriftTestType.class);
        this.config = config;
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.clock = clock;

        for (DriftTest test : driftTests) {
            tests.put(test.getType(), test);
            log.info("Registered drift test: {} -> {}", test.getType(), test.getClass().getSimpleName());
        }
    }

    /**
     * Compare the recent window with the reference distribution.
     *
     * @param reference      raw training rows of the active model, or null if there is no active model
     * @param recent         newest raw rows from the feature window
     * @param modelVersionId active model id, recorded on the report
     * @return a report; status is INSUFFICIENT_DATA, never NO_DRIFT, when a verdict cannot be reached
     */
    @Observed(name = "drift.detect", contextualName = "detect-drift")
    public DriftReport detect(double[][] reference, double[][] recent, String modelVersionId) {
        long now = clock.millis();
        int referenceSize = reference == null ? 0 : reference.length;
        int recentSize = recent == null ? 0 : recent.length;

        if (referenceSize == 0) {
            return insufficient(now, referenceSize, recentSize, modelVersionId, "No reference distribution");
        }
        int minRecent = config.getDrift().getMinRecentSamples();
        if (recentSize < minRecent) {
            return insufficient(now, referenceSize, recentSize, modelVersionId,
                    String.format("Recent window has %d samples (min %d)", recentSize, minRecent));
        }
        if (reference[0].length != recent[0].length) {
            throw new IllegalArgumentException(String.format(
                    "Feature arity mismatch: reference=%d, recent=%d", reference[0].length, recent[0].length));
        }

        Map<DriftTestType, DriftTestResult> results = new EnumMap<>(DriftTestType.class);
        int votes = 0;

        for (DriftTest test : tests.values()) {
            Span testSpan = tracer.nextSpan()
                    .name("drift.test." + test.getType())
                    .tag("drift.test", test.getType().name())
                    .tag("drift.recent_size", String.valueOf(recentSize))
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(testSpan)) {
                DriftTestResult result = test.evaluate(reference, recent);
                results.put(test.getType(), result);

                testSpan.tag("drift.drifted", String.valueOf(result.isDrifted()));
                testSpan.tag("drift.statistic", String.valueOf(result.getStatistic()));

                if (result.isDrifted()) {
                    votes++;
                    metricsConfig.recordDriftVote(test.getType().name());
                    log.debug("Drift test {} voted drifted: statistic={}, perFeature={}",
                            test.getType(), result.getStatistic(), result.getFeatureStatistics());
                }
            } catch (Exception e) {
                testSpan.error(e);
                // A failing test abstains; the remaining tests still vote
                log.error("Error running drift test {}: {}", test.getType(), e.getMessage(), e);
            } finally {
                testSpan.end();
            }
        }

        int testCount = tests.size();
        boolean consensus = votes >= config.getDrift().getConsensusThreshold();
        double confidence = testCount == 0 ? 0.0 : (double) votes / testCount;
        DriftStatus status = consensus ? DriftStatus.DRIFT : DriftStatus.NO_DRIFT;

        metricsConfig.recordDriftCheck(status.name(), votes);
        log.info("Drift check: status={}, votes={}/{}, confidence={}, reference={}, recent={}, model={}",
                status, votes, testCount, confidence, referenceSize, recentSize, modelVersionId);

        return DriftReport.builder()
                .timestamp(now)
                .status(status)
                .testResults(Collections.unmodifiableMap(results))
                .votes(votes)
                .consensus(consensus)
                .confidence(confidence)
                .referenceSize(referenceSize)
                .recentSize(recentSize)
                .modelVersionId(modelVersionId)
                .build();
    }

    private DriftReport insufficient(long now, int referenceSize, int recentSize,
                                     String modelVersionId, String reason) {
        metricsConfig.recordDriftCheck(DriftStatus.INSUFFICIENT_DATA.name(), 0);
        log.debug("Drift check skipped: {}", reason);
        return DriftReport.builder()
                .timestamp(now)
                .status(DriftStatus.INSUFFICIENT_DATA)
                .testResults(Collections.emptyMap())
                .votes(0)
                .consensus(false)
                .confidence(0.0)
                .referenceSize(referenceSize)
                .recentSize(recentSize)
                .modelVersionId(modelVersionId)
                .reason(reason)
                .build();
    }
}
