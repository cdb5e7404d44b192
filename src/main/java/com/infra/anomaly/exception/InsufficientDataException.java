package com.infra.anomaly.exception;

/**
 * Window too small for training or drift evaluation; the cycle is skipped.
 */
public class InsufficientDataException extends ModelLifecycleException {

    private final int available;
    private final int required;

    public InsufficientDataException(String what, int available, int required) {
        super(String.format("Insufficient data for %s: %d samples (min %d)", what, available, required));
        this.available = available;
        this.required = required;
    }

    public int getAvailable() { return available; }
    public int getRequired() { return required; }
}
