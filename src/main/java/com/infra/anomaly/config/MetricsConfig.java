package com.infra.anomaly.config;

import com.infra.anomaly.model.OrchestratorState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;
    private final AtomicInteger orchestratorState;
    private final AtomicInteger windowSize;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
        this.orchestratorState = registry.gauge("orchestrator.state", new AtomicInteger(0));
        this.windowSize = registry.gauge("feature.window.size", new AtomicInteger(0));
    }

    public void recordScore(boolean anomaly, double rawScore) {
        String verdict = anomaly ? "anomaly" : "normal";
        Counter.builder("telemetry.scored.count")
                .tag("verdict", verdict)
                .register(registry)
                .increment();

        DistributionSummary.builder("telemetry.anomaly_score")
                .register(registry)
                .record(rawScore);
    }

    public void recordRejectedSample(String reason) {
        Counter.builder("telemetry.rejected.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordDriftCheck(String status, int votes) {
        Counter.builder("drift.check.count")
                .tag("status", status)
                .register(registry)
                .increment();

        DistributionSummary.builder("drift.votes")
                .register(registry)
                .record(votes);
    }

    public void recordDriftVote(String testName) {
        Counter.builder("drift.test.vote.count")
                .tag("test", testName)
                .register(registry)
                .increment();
    }

    public void recordTransition(OrchestratorState from, OrchestratorState to) {
        Counter.builder("orchestrator.transition.count")
                .tag("from", from.name())
                .tag("to", to.name())
                .register(registry)
                .increment();
        orchestratorState.set(to.ordinal());
    }

    public void recordTrainingFailure(String reason) {
        Counter.builder("model.training.failure.count")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void updateWindowSize(int size) {
        windowSize.set(size);
    }
}
