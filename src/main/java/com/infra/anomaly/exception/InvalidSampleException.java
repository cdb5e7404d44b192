package com.infra.anomaly.exception;

import java.util.List;

public class InvalidSampleException extends RuntimeException {

    private final List<String> issues;

    public InvalidSampleException(List<String> issues) {
        super("Invalid metric sample: " + String.join("; ", issues));
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() { return issues; }
}
