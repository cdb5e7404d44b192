package com.infra.anomaly.exception;

/**
 * Base type for failures of the training, evaluation and promotion lifecycle.
 * These never propagate into the scoring path.
 */
public class ModelLifecycleException extends RuntimeException {

    public ModelLifecycleException(String message) {
        super(message);
    }

    public ModelLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
