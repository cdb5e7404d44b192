package com.infra.anomaly.model;

/**
 * Why a retraining attempt was started.
 */
public enum RetrainTrigger {
    /** No active model yet and the window holds enough samples. */
    BOOTSTRAP,
    /** Drift consensus reached by the latest drift check. */
    DRIFT,
    /** Retrain interval elapsed since the previous attempt. */
    TIMER,
    /** Operator request through the API. */
    MANUAL
}
