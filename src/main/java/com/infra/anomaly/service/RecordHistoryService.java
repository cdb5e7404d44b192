package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.model.AnomalyScore;
import com.infra.anomaly.model.DetectedAnomaly;
import com.infra.anomaly.model.DriftReport;
import com.infra.anomaly.model.StateTransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Keeps the most recent scores, drift reports, orchestrator transitions and detected anomalies
 * in memory for the API. Everything except plain scores is also written as a structured log
 * line; scores are already logged at DEBUG where they are produced.
 */
@Service
public class RecordHistoryService {

    private static final Logger log = LoggerFactory.getLogger(RecordHistoryService.class);

    private final AnomalyConfig config;

    private final Deque<AnomalyScore> scores = new ArrayDeque<>();
    private final Deque<DriftReport> driftReports = new ArrayDeque<>();
    private final Deque<StateTransitionEvent> transitions = new ArrayDeque<>();
    private final Deque<DetectedAnomaly> anomalies = new ArrayDeque<>();

    public RecordHistoryService(AnomalyConfig config) {
        this.config = config;
    }

    @EventListener
    public void onAnomalyScore(AnomalyScore score) {
        append(scores, score, config.getIngestion().getScoreHistorySize());
    }

    @EventListener
    public void onDriftReport(DriftReport report) {
        log.info("drift_report status={} votes={} confidence={} consensus={} reference={} recent={} model={}",
                report.getStatus(), report.getVotes(), report.getConfidence(), report.isConsensus(),
                report.getReferenceSize(), report.getRecentSize(), report.getModelVersionId());
        append(driftReports, report, config.getDrift().getHistorySize());
    }

    @EventListener
    public void onStateTransition(StateTransitionEvent event) {
        log.info("state_transition cycle={} from={} to={} model={} reason=\"{}\"",
                event.getCycleId(), event.getFromState(), event.getToState(),
                event.getModelVersionId(), event.getReason());
        append(transitions, event, config.getOrchestrator().getEventHistorySize());
    }

    @EventListener
    public void onDetectedAnomaly(DetectedAnomaly anomaly) {
        if (anomaly.isSustained()) {
            log.warn("sustained_anomaly seq={} ts={} score={} features={} model={}",
                    anomaly.getSequence(), anomaly.getTimestamp(), anomaly.getRawScore(),
                    anomaly.getFeatures(), anomaly.getModelVersionId());
        } else {
            log.info("anomaly seq={} ts={} score={} features={} model={}",
                    anomaly.getSequence(), anomaly.getTimestamp(), anomaly.getRawScore(),
                    anomaly.getFeatures(), anomaly.getModelVersionId());
        }
        append(anomalies, anomaly, config.getIngestion().getDetectedAnomalyCapacity());
    }

    public DriftReport latestDriftReport() {
        synchronized (driftReports) {
            return driftReports.peekLast();
        }
    }

    /**
     * Newest first, at most {@code limit} entries.
     */
    public List<DriftReport> driftHistory(int limit) {
        return newestFirst(driftReports, limit);
    }

    public List<StateTransitionEvent> transitionHistory(int limit) {
        return newestFirst(transitions, limit);
    }

    public List<AnomalyScore> recentScores(int limit) {
        return newestFirst(scores, limit);
    }

    public List<DetectedAnomaly> detectedAnomalies(int limit) {
        return newestFirst(anomalies, limit);
    }

    private static <T> void append(Deque<T> history, T item, int capacity) {
        synchronized (history) {
            history.addLast(item);
            while (history.size() > Math.max(capacity, 1)) {
                history.pollFirst();
            }
        }
    }

    private static <T> List<T> newestFirst(Deque<T> history, int limit) {
        synchronized (history) {
            List<T> result = new ArrayList<>(Math.min(Math.max(limit, 0), history.size()));
            Iterator<T> it = history.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
            return result;
        }
    }
}
