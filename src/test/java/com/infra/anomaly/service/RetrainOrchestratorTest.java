package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.config.MetricsConfig;
import com.infra.anomaly.exception.DegenerateDataException;
import com.infra.anomaly.model.CycleOutcome;
import com.infra.anomaly.model.CycleResult;
import com.infra.anomaly.model.ModelStatus;
import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.model.OrchestratorState;
import com.infra.anomaly.model.OrchestratorStatus;
import com.infra.anomaly.model.RetrainTrigger;
import com.infra.anomaly.model.StateTransitionEvent;
import com.infra.anomaly.registry.ModelVersionStore;
import com.infra.anomaly.repository.ModelVersionRepository;
import com.infra.anomaly.testutil.MutableClock;
import com.infra.anomaly.testutil.TestDataFactory;
import com.infra.anomaly.window.FeatureWindow;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetrainOrchestratorTest {

    private static TrainingResult trained;

    @Mock private DriftDetectionService driftDetectionService;
    @Mock private ModelTrainingService trainingService;
    @Mock private ModelEvaluationService evaluationService;
    @Mock private ModelVersionRepository repository;

    private AnomalyConfig config;
    private MutableClock clock;
    private FeatureWindow window;
    private ModelVersionStore store;
    private ExecutorService executor;
    private List<Object> events;
    private RetrainOrchestrator orchestrator;

    @BeforeAll
    static void trainOnce() {
        trained = new ModelTrainingService(TestDataFactory.testConfig())
                .train(TestDataFactory.normalSamples(200, 17));
    }

    @BeforeEach
    void setUp() {
        config = TestDataFactory.testConfig();
        clock = new MutableClock(Instant.ofEpochMilli(TestDataFactory.START_TS));
        window = new FeatureWindow(2000, 5000);
        store = new ModelVersionStore(repository, clock);
        executor = Executors.newSingleThreadExecutor();
        events = new CopyOnWriteArrayList<>();
        orchestrator = new RetrainOrchestrator(driftDetectionService, trainingService, evaluationService,
                store, window, config, new MetricsConfig(new SimpleMeterRegistry()), events::add,
                executor, clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private void fillWindow(int count) {
        TestDataFactory.normalSamples(count, 23).forEach(window::append);
    }

    private ModelVersion bootstrap() {
        fillWindow(200);
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.noDriftReport());
        when(trainingService.train(anyList())).thenReturn(trained);
        when(evaluationService.evaluateCandidate(any(), any(), any(), any()))
                .thenReturn(TestDataFactory.metrics(0.90, null));
        CycleOutcome outcome = orchestrator.runCycle();
        assertThat(outcome.getResult()).isEqualTo(CycleResult.PROMOTED);
        events.clear();
        return store.getActive();
    }

    private List<OrchestratorState> transitions() {
        return events.stream()
                .filter(StateTransitionEvent.class::isInstance)
                .map(e -> ((StateTransitionEvent) e).getToState())
                .collect(Collectors.toList());
    }

    @Test
    void runCycle_noActiveModelAndEnoughSamples_bootstrapsAndPromotes() {
        fillWindow(200);
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.noDriftReport());
        when(trainingService.train(anyList())).thenReturn(trained);
        when(evaluationService.evaluateCandidate(any(), any(), any(), any()))
                .thenReturn(TestDataFactory.metrics(0.90, null));

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getTrigger()).isEqualTo(RetrainTrigger.BOOTSTRAP);
        assertThat(outcome.getResult()).isEqualTo(CycleResult.PROMOTED);
        assertThat(outcome.getActiveVersionId()).isEqualTo(outcome.getCandidateVersionId());
        assertThat(store.getActiveId()).isEqualTo(outcome.getCandidateVersionId());
        assertThat(transitions()).containsExactly(
                OrchestratorState.TRAINING, OrchestratorState.EVALUATING,
                OrchestratorState.PROMOTED, OrchestratorState.IDLE);
        assertThat(orchestrator.getState()).isEqualTo(OrchestratorState.IDLE);
    }

    @Test
    void runCycle_noActiveModelAndTooFewSamples_skipsWithoutTraining() {
        fillWindow(10);
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.noDriftReport());

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getResult()).isEqualTo(CycleResult.SKIPPED);
        assertThat(outcome.getTrigger()).isNull();
        verify(trainingService, never()).train(anyList());
        assertThat(events).isEmpty();
    }

    @Test
    void runCycle_driftConsensusAfterCooldown_entersTrainingWithDriftReason() {
        bootstrap();
        clock.advance(Duration.ofSeconds(61));
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.driftReport(5));

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getTrigger()).isEqualTo(RetrainTrigger.DRIFT);
        StateTransitionEvent first = (StateTransitionEvent) events.get(0);
        assertThat(first.getFromState()).isEqualTo(OrchestratorState.IDLE);
        assertThat(first.getToState()).isEqualTo(OrchestratorState.TRAINING);
        assertThat(first.getReason()).startsWith("DRIFT").contains("5/5");
    }

    @Test
    void runCycle_driftConsensusWithinCooldown_skips() {
        bootstrap();
        clock.advance(Duration.ofSeconds(30));
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.driftReport(4));

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getResult()).isEqualTo(CycleResult.SKIPPED);
        assertThat(events).isEmpty();
    }

    @Test
    void runCycle_twoDriftVotes_noRetrain() {
        bootstrap();
        clock.advance(Duration.ofSeconds(120));
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.driftReport(2));

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getResult()).isEqualTo(CycleResult.SKIPPED);
    }

    @Test
    void runCycle_retrainIntervalElapsed_timerTrigger() {
        bootstrap();
        clock.advance(Duration.ofSeconds(301));

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getTrigger()).isEqualTo(RetrainTrigger.TIMER);
        assertThat(outcome.getResult()).isEqualTo(CycleResult.PROMOTED);
    }

    @Test
    void runCycle_candidateF1BelowIncumbent_rejectedAndIncumbentKept() {
        ModelVersion incumbent = bootstrap();
        clock.advance(Duration.ofSeconds(61));
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.driftReport(5));
        when(evaluationService.evaluateCandidate(any(), any(), any(), any()))
                .thenReturn(TestDataFactory.metrics(0.40, 0.90));

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getResult()).isEqualTo(CycleResult.REJECTED);
        assertThat(store.getActiveId()).isEqualTo(incumbent.getId());
        assertThat(transitions()).containsExactly(
                OrchestratorState.TRAINING, OrchestratorState.EVALUATING,
                OrchestratorState.REJECTED, OrchestratorState.IDLE);
        ModelVersion rejected = store.find(outcome.getCandidateVersionId()).orElseThrow();
        assertThat(rejected.getStatus()).isEqualTo(ModelStatus.CANDIDATE);
        assertThat(rejected.getEvaluationMetrics().getF1()).isEqualTo(0.40);
    }

    @Test
    void runCycle_candidateWithinTolerance_promoted() {
        bootstrap();
        clock.advance(Duration.ofSeconds(61));
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.driftReport(3));
        when(evaluationService.evaluateCandidate(any(), any(), any(), any()))
                .thenReturn(TestDataFactory.metrics(0.89, 0.90));

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getResult()).isEqualTo(CycleResult.PROMOTED);
        assertThat(store.getActiveId()).isEqualTo(outcome.getCandidateVersionId());
    }

    @Test
    void runCycle_trainingFails_returnsToIdleAndKeepsIncumbent() {
        ModelVersion incumbent = bootstrap();
        clock.advance(Duration.ofSeconds(61));
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.driftReport(5));
        when(trainingService.train(anyList())).thenThrow(new DegenerateDataException("All 3 features are constant"));

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getResult()).isEqualTo(CycleResult.FAILED);
        assertThat(outcome.getReason()).contains("constant");
        assertThat(outcome.getCandidateVersionId()).isNull();
        assertThat(store.getActiveId()).isEqualTo(incumbent.getId());
        assertThat(store.size()).isEqualTo(1);
        assertThat(transitions()).containsExactly(OrchestratorState.TRAINING, OrchestratorState.IDLE);
    }

    @Test
    void runCycle_trainingExceedsBudget_timedOutAndNoCandidateRegistered() {
        config.getOrchestrator().setTrainingTimeoutSeconds(1);
        fillWindow(200);
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.noDriftReport());
        when(trainingService.train(anyList())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return trained;
        });

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getResult()).isEqualTo(CycleResult.TIMED_OUT);
        assertThat(store.getActive()).isNull();
        assertThat(store.size()).isZero();
        assertThat(orchestrator.getState()).isEqualTo(OrchestratorState.IDLE);
    }

    @Test
    void runCycle_activeChangedDuringEvaluation_candidateStillPromoted() {
        fillWindow(200);
        when(driftDetectionService.checkDrift()).thenReturn(TestDataFactory.noDriftReport());
        when(trainingService.train(anyList())).thenReturn(trained);
        when(evaluationService.evaluateCandidate(any(), any(), any(), any())).thenAnswer(invocation -> {
            ModelVersion intruder = store.registerCandidate(trained.model());
            store.forcePromote(intruder.getId());
            return TestDataFactory.metrics(0.90, null);
        });

        CycleOutcome outcome = orchestrator.runCycle();

        assertThat(outcome.getResult()).isEqualTo(CycleResult.PROMOTED);
        assertThat(store.getActiveId()).isEqualTo(outcome.getCandidateVersionId());
    }

    @Test
    void retrainNow_trainsWithoutTrigger() {
        bootstrap();

        CycleOutcome outcome = orchestrator.retrainNow();

        assertThat(outcome.getTrigger()).isEqualTo(RetrainTrigger.MANUAL);
        assertThat(outcome.getResult()).isEqualTo(CycleResult.PROMOTED);
        assertThat(store.size()).isEqualTo(2);
    }

    @Test
    void scheduledCycle_disabled_doesNothing() {
        config.getOrchestrator().setEnabled(false);

        orchestrator.scheduledCycle();

        verify(driftDetectionService, never()).checkDrift();
    }

    @Test
    void getStatus_afterBootstrap_reportsTimerAndActiveModel() {
        ModelVersion active = bootstrap();

        OrchestratorStatus status = orchestrator.getStatus();

        assertThat(status.getState()).isEqualTo(OrchestratorState.IDLE);
        assertThat(status.getActiveVersionId()).isEqualTo(active.getId());
        assertThat(status.getCycleCount()).isEqualTo(1);
        assertThat(status.getLastAttemptAt()).isEqualTo(TestDataFactory.START_TS);
        assertThat(status.getNextTimerAt()).isEqualTo(TestDataFactory.START_TS + 300_000L);
        assertThat(status.getWindowSize()).isEqualTo(200);
        assertThat(status.getLastOutcome().getResult()).isEqualTo(CycleResult.PROMOTED);
    }
}
