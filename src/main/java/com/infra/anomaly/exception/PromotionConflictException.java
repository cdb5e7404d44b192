package com.infra.anomaly.exception;

/**
 * The active model changed between evaluation and promotion.
 */
public class PromotionConflictException extends ModelLifecycleException {

    private final String expectedActiveId;
    private final String actualActiveId;

    public PromotionConflictException(String candidateId, String expectedActiveId, String actualActiveId) {
        super(String.format("Promotion of %s expected active %s but found %s",
                candidateId, expectedActiveId, actualActiveId));
        this.expectedActiveId = expectedActiveId;
        this.actualActiveId = actualActiveId;
    }

    public String getExpectedActiveId() { return expectedActiveId; }
    public String getActualActiveId() { return actualActiveId; }
}
