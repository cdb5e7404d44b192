package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.config.MetricsConfig;
import com.infra.anomaly.exception.PromotionConflictException;
import com.infra.anomaly.exception.TrainingTimeoutException;
import com.infra.anomaly.model.CycleOutcome;
import com.infra.anomaly.model.CycleResult;
import com.infra.anomaly.model.DriftReport;
import com.infra.anomaly.model.EvaluationMetrics;
import com.infra.anomaly.model.MetricSample;
import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.model.OrchestratorState;
import com.infra.anomaly.model.OrchestratorStatus;
import com.infra.anomaly.model.RetrainTrigger;
import com.infra.anomaly.model.StateTransitionEvent;
import com.infra.anomaly.registry.ModelVersionStore;
import com.infra.anomaly.window.FeatureWindow;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides when to retrain and whether the result replaces the active model.
 *
 * <p>States: IDLE -> TRAINING -> EVALUATING -> PROMOTED | REJECTED -> IDLE. Every
 * transition is published as a {@link StateTransitionEvent}.
 *
 * <p>Each cycle runs one drift check and starts at most one training attempt. Triggers, in
 * order of precedence:
 * <ol>
 *   <li>BOOTSTRAP: no active model and the window holds enough samples to train</li>
 *   <li>DRIFT: the drift check reached consensus and the cooldown since the last attempt has passed</li>
 *   <li>TIMER: the retrain interval has passed since the last attempt (or since startup)</li>
 * </ol>
 * Operators can also start an attempt with {@link #retrainNow()}.
 *
 * <p>Training runs on the training executor with a wall-clock budget. Failures and timeouts
 * leave the incumbent active and return to IDLE; the next attempt waits for the next trigger.
 * Scoring never waits on any of this.
 */
@Service
public class RetrainOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RetrainOrchestrator.class);

    private final DriftDetectionService driftDetectionService;
    private final ModelTrainingService trainingService;
    private final ModelEvaluationService evaluationService;
    private final ModelVersionStore store;
    private final FeatureWindow window;
    private final AnomalyConfig config;
    private final MetricsConfig metricsConfig;
    private final ApplicationEventPublisher eventPublisher;
    private final ExecutorService trainingExecutor;
    private final Clock clock;

    private final Object cycleLock = new Object();
    private final AtomicLong cycleCounter = new AtomicLong();
    private final long startedAt;

    private volatile OrchestratorState state = OrchestratorState.IDLE;
    private volatile Long lastAttemptAt;
    private volatile CycleOutcome lastOutcome;

    public RetrainOrchestrator(DriftDetectionService driftDetectionService,
                               ModelTrainingService trainingService,
                               ModelEvaluationService evaluationService,
                               ModelVersionStore store,
                               FeatureWindow window,
                               AnomalyConfig config,
                               MetricsConfig metricsConfig,
                               ApplicationEventPublisher eventPublisher,
                               @Qualifier("trainingExecutor") ExecutorService trainingExecutor,
                               Clock clock) {
        this.driftDetectionService = driftDetectionService;
        this.trainingService = trainingService;
        this.evaluationService = evaluationService;
        this.store = store;
        this.window = window;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.eventPublisher = eventPublisher;
        this.trainingExecutor = trainingExecutor;
        this.clock = clock;
        this.startedAt = clock.millis();
    }

    @Scheduled(fixedDelayString = "${anomaly.orchestrator.cycle-interval-seconds:30}",
               initialDelayString = "${anomaly.orchestrator.cycle-interval-seconds:30}",
               timeUnit = TimeUnit.SECONDS)
    public void scheduledCycle() {
        if (!config.getOrchestrator().isEnabled()) {
            return;
        }
        try {
            runCycle();
        } catch (Exception e) {
            log.error("Orchestrator cycle failed unexpectedly", e);
        }
    }

    /**
     * Run one drift check and, if a trigger fires, one training attempt. Blocks until the
     * attempt has been promoted, rejected, failed or timed out.
     */
    @Observed(name = "orchestrator.cycle", contextualName = "orchestrator-cycle")
    public CycleOutcome runCycle() {
        synchronized (cycleLock) {
            long cycleId = cycleCounter.incrementAndGet();
            long now = clock.millis();
            DriftReport report = driftDetectionService.checkDrift();

            RetrainTrigger trigger = chooseTrigger(report, now);
            if (trigger == null) {
                CycleOutcome outcome = CycleOutcome.builder()
                        .cycleId(cycleId)
                        .result(CycleResult.SKIPPED)
                        .driftReport(report)
                        .activeVersionId(store.getActiveId())
                        .reason("No trigger fired (drift=" + report.getStatus() + ")")
                        .startedAt(now)
                        .finishedAt(clock.millis())
                        .build();
                lastOutcome = outcome;
                return outcome;
            }
            return attempt(cycleId, trigger, report, describe(trigger, report), now);
        }
    }

    /**
     * Train immediately regardless of triggers.
     */
    public CycleOutcome retrainNow() {
        synchronized (cycleLock) {
            long cycleId = cycleCounter.incrementAndGet();
            return attempt(cycleId, RetrainTrigger.MANUAL, null, "MANUAL: operator request", clock.millis());
        }
    }

    public OrchestratorState getState() {
        return state;
    }

    public CycleOutcome getLastOutcome() {
        return lastOutcome;
    }

    public OrchestratorStatus getStatus() {
        return OrchestratorStatus.builder()
                .state(state)
                .enabled(config.getOrchestrator().isEnabled())
                .activeVersionId(store.getActiveId())
                .cycleCount(cycleCounter.get())
                .lastAttemptAt(lastAttemptAt)
                .nextTimerAt(nextTimerAt())
                .lastOutcome(lastOutcome)
                .windowSize(window.size())
                .build();
    }

    RetrainTrigger chooseTrigger(DriftReport report, long now) {
        AnomalyConfig.Orchestrator settings = config.getOrchestrator();
        if (store.getActive() == null) {
            return window.size() >= config.getTraining().getMinSamples() ? RetrainTrigger.BOOTSTRAP : null;
        }
        Long previous = lastAttemptAt;
        if (report.isConsensus()
                && (previous == null || now - previous >= TimeUnit.SECONDS.toMillis(settings.getDriftCooldownSeconds()))) {
            return RetrainTrigger.DRIFT;
        }
        if (now >= nextTimerAt()) {
            return RetrainTrigger.TIMER;
        }
        return null;
    }

    private long nextTimerAt() {
        Long previous = lastAttemptAt;
        long base = previous != null ? previous : startedAt;
        return base + TimeUnit.SECONDS.toMillis(config.getOrchestrator().getRetrainIntervalSeconds());
    }

    private CycleOutcome attempt(long cycleId, RetrainTrigger trigger, DriftReport report,
                                 String reason, long cycleStart) {
        lastAttemptAt = cycleStart;
        CycleOutcome.CycleOutcomeBuilder outcome = CycleOutcome.builder()
                .cycleId(cycleId)
                .trigger(trigger)
                .driftReport(report)
                .startedAt(cycleStart);

        try {
            CycleOutcome result = trainEvaluatePromote(cycleId, reason, outcome);
            lastOutcome = result;
            return result;
        } catch (RuntimeException e) {
            log.error("Retrain cycle {} aborted", cycleId, e);
            if (state != OrchestratorState.IDLE) {
                transition(cycleId, OrchestratorState.IDLE, "Cycle aborted: " + e.getMessage(), null);
            }
            CycleOutcome result = finish(outcome, CycleResult.FAILED, e.getMessage());
            lastOutcome = result;
            return result;
        }
    }

    private CycleOutcome trainEvaluatePromote(long cycleId, String reason,
                                              CycleOutcome.CycleOutcomeBuilder outcome) {
        transition(cycleId, OrchestratorState.TRAINING, reason, store.getActiveId());

        TrainingResult trained;
        try {
            trained = trainWithTimeout();
        } catch (TrainingTimeoutException e) {
            metricsConfig.recordTrainingFailure("timeout");
            log.error("Cycle {}: {}", cycleId, e.getMessage());
            transition(cycleId, OrchestratorState.IDLE, e.getMessage(), store.getActiveId());
            return finish(outcome, CycleResult.TIMED_OUT, e.getMessage());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            metricsConfig.recordTrainingFailure(cause.getClass().getSimpleName());
            log.warn("Cycle {}: training failed, keeping active model {}: {}",
                    cycleId, store.getActiveId(), cause.getMessage());
            String message = "Training failed: " + cause.getMessage();
            transition(cycleId, OrchestratorState.IDLE, message, store.getActiveId());
            return finish(outcome, CycleResult.FAILED, message);
        }

        ModelVersion candidate = store.registerCandidate(trained.model());
        outcome.candidateVersionId(candidate.getId());
        transition(cycleId, OrchestratorState.EVALUATING,
                "Candidate trained on " + candidate.getTrainedOnCount() + " samples", candidate.getId());

        ModelVersion incumbent = store.getActive();
        String expectedActiveId = incumbent == null ? null : incumbent.getId();
        EvaluationMetrics metrics = evaluationService.evaluateCandidate(
                candidate, incumbent, trained.heldOut(), trained.heldOutLabels());
        store.recordEvaluation(candidate.getId(), metrics);

        double tolerance = config.getOrchestrator().getF1RegressionTolerance();
        if (incumbent != null && metrics.getIncumbentF1() != null
                && metrics.getF1() < metrics.getIncumbentF1() - tolerance) {
            String rejection = String.format("candidate F1 %.4f < incumbent F1 %.4f - tolerance %.2f",
                    metrics.getF1(), metrics.getIncumbentF1(), tolerance);
            transition(cycleId, OrchestratorState.REJECTED, rejection, candidate.getId());
            transition(cycleId, OrchestratorState.IDLE, "Candidate retained for audit", expectedActiveId);
            return finish(outcome, CycleResult.REJECTED, rejection);
        }

        try {
            store.promote(candidate.getId(), expectedActiveId);
        } catch (PromotionConflictException e) {
            log.warn("Cycle {}: {}; promoting anyway (last writer wins)", cycleId, e.getMessage());
            store.forcePromote(candidate.getId());
        }

        String promotion = incumbent == null
                ? String.format("first model, F1 %.4f", metrics.getF1())
                : String.format("candidate F1 %.4f >= incumbent F1 %.4f - tolerance %.2f",
                        metrics.getF1(), metrics.getIncumbentF1(), tolerance);
        transition(cycleId, OrchestratorState.PROMOTED, promotion, candidate.getId());
        transition(cycleId, OrchestratorState.IDLE, "Serving " + candidate.getId(), candidate.getId());
        return finish(outcome, CycleResult.PROMOTED, promotion);
    }

    private TrainingResult trainWithTimeout() throws ExecutionException {
        List<MetricSample> snapshot = window.snapshot();
        int timeoutSeconds = config.getOrchestrator().getTrainingTimeoutSeconds();
        Future<TrainingResult> future = trainingExecutor.submit(() -> trainingService.train(snapshot));
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TrainingTimeoutException(timeoutSeconds, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExecutionException("Interrupted while waiting for training", e);
        }
    }

    private CycleOutcome finish(CycleOutcome.CycleOutcomeBuilder outcome, CycleResult result, String reason) {
        return outcome.result(result)
                .reason(reason)
                .activeVersionId(store.getActiveId())
                .finishedAt(clock.millis())
                .build();
    }

    private void transition(long cycleId, OrchestratorState to, String reason, String modelVersionId) {
        OrchestratorState from = state;
        state = to;
        metricsConfig.recordTransition(from, to);
        log.info("Orchestrator cycle {}: {} -> {} ({}), model={}", cycleId, from, to, reason, modelVersionId);
        eventPublisher.publishEvent(StateTransitionEvent.builder()
                .cycleId(cycleId)
                .fromState(from)
                .toState(to)
                .reason(reason)
                .modelVersionId(modelVersionId)
                .timestamp(clock.millis())
                .build());
    }

    private static String describe(RetrainTrigger trigger, DriftReport report) {
        switch (trigger) {
            case BOOTSTRAP:
                return "BOOTSTRAP: no active model";
            case DRIFT:
                return String.format("DRIFT: consensus %d/%d (confidence %.2f)",
                        report.getVotes(), report.getTestResults().size(), report.getConfidence());
            case TIMER:
                return "TIMER: retrain interval elapsed";
            default:
                return trigger.name();
        }
    }
}
