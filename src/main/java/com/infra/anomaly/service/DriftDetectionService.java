package com.infra.anomaly.service;

import com.infra.anomaly.config.AnomalyConfig;
import com.infra.anomaly.engine.drift.DriftDetector;
import com.infra.anomaly.engine.isolationforest.FeatureMatrix;
import com.infra.anomaly.model.DriftReport;
import com.infra.anomaly.model.MetricSample;
import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.registry.ModelVersionStore;
import com.infra.anomaly.window.FeatureWindow;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Compares the newest window samples with the data the active model was trained on.
 */
@Service
public class DriftDetectionService {

    private final DriftDetector detector;
    private final FeatureWindow window;
    private final ModelVersionStore store;
    private final AnomalyConfig config;
    private final ApplicationEventPublisher eventPublisher;

    public DriftDetectionService(DriftDetector detector,
                                 FeatureWindow window,
                                 ModelVersionStore store,
                                 AnomalyConfig config,
                                 ApplicationEventPublisher eventPublisher) {
        this.detector = detector;
        this.window = window;
        this.store = store;
        this.config = config;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Run one drift check and publish its report. Without an active model the report is
     * INSUFFICIENT_DATA.
     */
    public DriftReport checkDrift() {
        ModelVersion active = store.getActive();
        List<MetricSample> recent = window.recent(config.getDrift().getWindowSize());

        DriftReport report = detector.detect(
                active == null ? null : active.getReferenceData(),
                FeatureMatrix.of(recent),
                active == null ? null : active.getId());

        eventPublisher.publishEvent(report);
        return report;
    }
}
