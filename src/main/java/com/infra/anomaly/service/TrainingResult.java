package com.infra.anomaly.service;

import com.infra.anomaly.model.ModelVersion;

/**
 * A trained but not yet registered model, with the test rows it never saw.
 *
 * @param model         the trained model; id and status are assigned on registration
 * @param heldOut       raw test rows used to evaluate the model against the incumbent
 * @param heldOutLabels ground truth for {@code heldOut}, or null unless every row was labelled
 */
public record TrainingResult(ModelVersion model, double[][] heldOut, Boolean[] heldOutLabels) {}
