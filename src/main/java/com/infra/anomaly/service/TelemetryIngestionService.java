package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.config.MetricsConfig;
import com.infra.anomaly.exception.InvalidSampleException;
import com.infra.anomaly.model.AnomalyScore;
import com.infra.anomaly.model.DetectedAnomaly;
import com.infra.anomaly.model.MetricSample;
import com.infra.anomaly.window.FeatureWindow;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for incoming telemetry.
 *
 * Flow:
 * 1. Validate the sample
 * 2. Assign the next arrival sequence and append it to the feature window
 * 3. Score it with the active model
 * 4. Track consecutive anomalies to mark sustained ones
 * 5. Publish detected anomalies
 *
 * Steps 2 to 4 run under one lock so that sequences, window order and sustained counts all
 * follow arrival order. Nothing in that section waits on training.
 */
@Service
public class TelemetryIngestionService {

    private static final Logger log = LoggerFactory.getLogger(TelemetryIngestionService.class);

    private final FeatureWindow window;
    private final SampleValidator validator;
    private final AnomalyScoringService scoringService;
    private final AnomalyConfig config;
    private final MetricsConfig metricsConfig;
    private final ApplicationEventPublisher eventPublisher;

    private final AtomicLong sequence = new AtomicLong();
    private final ReentrantLock ingestLock = new ReentrantLock();
    private int consecutiveAnomalies;
    private String lastModelVersionId;

    public TelemetryIngestionService(FeatureWindow window,
                                     SampleValidator validator,
                                     AnomalyScoringService scoringService,
                                     AnomalyConfig config,
                                     MetricsConfig metricsConfig,
                                     ApplicationEventPublisher eventPublisher) {
        this.window = window;
        this.validator = validator;
        this.scoringService = scoringService;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Validate, store and score one sample.
     *
     * @throws InvalidSampleException if the sample fails validation; nothing is stored
     */
    @Observed(name = "telemetry.ingest", contextualName = "ingest-sample")
    public AnomalyScore ingest(MetricSample sample) {
        try {
            validator.validate(sample);
        } catch (InvalidSampleException e) {
            metricsConfig.recordRejectedSample("invalid");
            log.warn("Rejected sample: {}", e.getIssues());
            throw e;
        }
        return store(sample);
    }

    /**
     * Validate every sample first, then ingest them in order. If any sample is invalid,
     * none are stored.
     */
    public List<AnomalyScore> ingestBatch(List<MetricSample> samples) {
        List<String> issues = new ArrayList<>();
        for (int i = 0; i < samples.size(); i++) {
            try {
                validator.validate(samples.get(i));
            } catch (InvalidSampleException e) {
                for (String issue : e.getIssues()) {
                    issues.add("samples[" + i + "]: " + issue);
                }
            }
        }
        if (!issues.isEmpty()) {
            metricsConfig.recordRejectedSample("invalid_batch");
            log.warn("Rejected batch of {} samples: {}", samples.size(), issues);
            throw new InvalidSampleException(issues);
        }

        List<AnomalyScore> scores = new ArrayList<>(samples.size());
        for (MetricSample sample : samples) {
            scores.add(store(sample));
        }
        return scores;
    }

    public long getIngestedCount() {
        return sequence.get();
    }

    private AnomalyScore store(MetricSample sample) {
        AnomalyScore score;
        ingestLock.lock();
        try {
            long seq = sequence.incrementAndGet();
            if (!window.append(sample)) {
                // Too late for the window, but the sample still gets a verdict
                metricsConfig.recordRejectedSample("out_of_order");
            }

            AnomalyScoringService.Verdict verdict = scoringService.score(sample.getFeatures());
            if (!Objects.equals(verdict.modelVersionId(), lastModelVersionId)) {
                consecutiveAnomalies = 0;
                lastModelVersionId = verdict.modelVersionId();
            }
            consecutiveAnomalies = verdict.anomaly() ? consecutiveAnomalies + 1 : 0;
            boolean sustained = consecutiveAnomalies >= config.getIngestion().getSustainedCount();

            score = AnomalyScore.builder()
                    .sequence(seq)
                    .sampleTimestamp(sample.getTimestamp())
                    .rawScore(verdict.rawScore())
                    .anomaly(verdict.anomaly())
                    .sustained(sustained)
                    .modelVersionId(verdict.modelVersionId())
                    .build();
        } finally {
            ingestLock.unlock();
        }

        metricsConfig.updateWindowSize(window.size());
        if (score.getModelVersionId() != null) {
            metricsConfig.recordScore(score.isAnomaly(), score.getRawScore());
        }
        log.debug("Scored sample seq={} ts={} score={} anomaly={} sustained={} model={}",
                score.getSequence(), score.getSampleTimestamp(), score.getRawScore(),
                score.isAnomaly(), score.isSustained(), score.getModelVersionId());

        eventPublisher.publishEvent(score);
        if (score.isAnomaly()) {
            eventPublisher.publishEvent(DetectedAnomaly.builder()
                    .sequence(score.getSequence())
                    .timestamp(score.getSampleTimestamp())
                    .features(namedFeatures(sample.getFeatures()))
                    .rawScore(score.getRawScore())
                    .sustained(score.isSustained())
                    .modelVersionId(score.getModelVersionId())
                    .build());
        }
        return score;
    }

    private Map<String, Double> namedFeatures(double[] features) {
        List<String> names = config.getIngestion().getFeatureNames();
        Map<String, Double> named = new LinkedHashMap<>();
        for (int i = 0; i < features.length; i++) {
            named.put(i < names.size() ? names.get(i) : "f" + i, features[i]);
        }
        return named;
    }
}
