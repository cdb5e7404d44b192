package com.infra.anomaly.exception;

/**
 * Every feature of the reference window is constant, so no isolation split exists.
 */
public class DegenerateDataException extends ModelLifecycleException {

    public DegenerateDataException(String message) {
        super(message);
    }
}
