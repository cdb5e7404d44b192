package com.infra.anomaly.exception;

public class TrainingTimeoutException extends ModelLifecycleException {

    public TrainingTimeoutException(long timeoutSeconds, Throwable cause) {
        super("Training exceeded " + timeoutSeconds + "s and was abandoned", cause);
    }
}
