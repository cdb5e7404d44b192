package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.model.AnomalyScore;
import com.infra.anomaly.model.DetectedAnomaly;
import com.infra.anomaly.model.DriftReport;
import com.infra.anomaly.model.OrchestratorState;
import com.infra.anomaly.model.StateTransitionEvent;
import com.infra.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RecordHistoryServiceTest {

    private AnomalyConfig config;
    private RecordHistoryService historyService;

    @BeforeEach
    void setUp() {
        config = new AnomalyConfig();
        config.getDrift().setHistorySize(3);
        config.getIngestion().setDetectedAnomalyCapacity(2);
        config.getIngestion().setScoreHistorySize(4);
        historyService = new RecordHistoryService(config);
    }

    @Test
    void driftHistory_boundedAndNewestFirst() {
        for (int votes = 0; votes <= 4; votes++) {
            historyService.onDriftReport(TestDataFactory.driftReport(votes));
        }

        assertThat(historyService.driftHistory(10)).extracting(DriftReport::getVotes).containsExactly(4, 3, 2);
        assertThat(historyService.driftHistory(1)).hasSize(1);
        assertThat(historyService.latestDriftReport().getVotes()).isEqualTo(4);
    }

    @Test
    void latestDriftReport_noneYet_null() {
        assertThat(historyService.latestDriftReport()).isNull();
    }

    @Test
    void transitionHistory_keepsOrder() {
        historyService.onStateTransition(transition(1, OrchestratorState.IDLE, OrchestratorState.TRAINING));
        historyService.onStateTransition(transition(1, OrchestratorState.TRAINING, OrchestratorState.EVALUATING));

        assertThat(historyService.transitionHistory(50))
                .extracting(StateTransitionEvent::getToState)
                .containsExactly(OrchestratorState.EVALUATING, OrchestratorState.TRAINING);
    }

    @Test
    void detectedAnomalies_evictsOldestBeyondCapacity() {
        for (int seq = 1; seq <= 3; seq++) {
            historyService.onDetectedAnomaly(DetectedAnomaly.builder()
                    .sequence(seq)
                    .timestamp(TestDataFactory.START_TS + seq)
                    .features(Map.of("cpu_usage", 97.0))
                    .rawScore(0.8)
                    .sustained(seq == 3)
                    .modelVersionId("v1")
                    .build());
        }

        assertThat(historyService.detectedAnomalies(100))
                .extracting(DetectedAnomaly::getSequence)
                .containsExactly(3L, 2L);
    }

    @Test
    void recentScores_boundedAndNewestFirst() {
        for (long seq = 1; seq <= 6; seq++) {
            historyService.onAnomalyScore(AnomalyScore.builder()
                    .sequence(seq)
                    .sampleTimestamp(TestDataFactory.START_TS + seq * 10_000L)
                    .rawScore(0.45)
                    .modelVersionId("v1")
                    .build());
        }

        assertThat(historyService.recentScores(10))
                .extracting(AnomalyScore::getSequence)
                .containsExactly(6L, 5L, 4L, 3L);
        assertThat(historyService.recentScores(2)).hasSize(2);
    }

    private static StateTransitionEvent transition(long cycle, OrchestratorState from, OrchestratorState to) {
        return StateTransitionEvent.builder()
                .cycleId(cycle)
                .fromState(from)
                .toState(to)
                .reason("test")
                .timestamp(TestDataFactory.START_TS)
                .build();
    }
}
