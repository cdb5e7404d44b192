package com.infra.anomaly.exception;

public class ModelVersionNotFoundException extends ModelLifecycleException {

    public ModelVersionNotFoundException(String versionId) {
        super("Model version not found: " + versionId);
    }
}
