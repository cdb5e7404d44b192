package com.infra.anomaly.service;

import com.infra.anomaly.model.ModelVersion;
import com.infra.anomaly.registry.ModelVersionStore;
import org.springframework.stereotype.Service;

/**
 * Scores feature vectors with whatever model is active at the moment of the call.
 * The active model is read once per call, so a promotion during scoring cannot mix two versions.
 */
@Service
public class AnomalyScoringService {

    private final ModelVersionStore store;

    public AnomalyScoringService(ModelVersionStore store) {
        this.store = store;
    }

    public Verdict score(double[] features) {
        ModelVersion model = store.getActive();
        if (model == null) {
            return Verdict.NO_MODEL;
        }
        double rawScore = model.score(features);
        return new Verdict(rawScore, model.isAnomaly(rawScore), model.getId());
    }

    /**
     * Raw score, thresholded verdict and the id of the model that produced them.
     * Before any model is promoted every sample scores 0 and is not anomalous.
     */
    public record Verdict(double rawScore, boolean anomaly, String modelVersionId) {
        static final Verdict NO_MODEL = new Verdict(0.0, false, null);
    }
}
