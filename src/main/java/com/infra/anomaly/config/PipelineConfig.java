package com.infra.anomaly.config;

import com.infra.anomaly.window.FeatureWindow;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FeatureWindow featureWindow(AnomalyConfig config) {
        return new FeatureWindow(config.getWindow().getCapacity(),
                config.getWindow().getOutOfOrderToleranceMs());
    }

    /**
     * Single background thread for model training. Kept apart from the request threads
     * so that tree building never competes with inference for a lock.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService trainingExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "model-training-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
