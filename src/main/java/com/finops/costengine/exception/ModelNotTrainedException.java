package com.finops.costengine.exception;

public class ModelNotTrainedException extends RuntimeException {

    private final String tenantId;

    public ModelNotTrainedException(String tenantId) {
        super("No anomaly model trained for tenant " + tenantId);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
