package com.finops.costengine.exception;

/**
 * Thrown when a tenant has too little cost history to train an anomaly model.
 * Callers are expected to retry once more history is available.
 */
public class TrainingDataInsufficientException extends RuntimeException {

    private final String tenantId;
    private final int supplied;
    private final int required;

    public TrainingDataInsufficientException(String tenantId, int supplied, int required) {
        super(String.format("Tenant %s supplied %d cost observations; at least %d are required for training",
                tenantId, supplied, required));
        this.tenantId = tenantId;
        this.supplied = supplied;
        this.required = required;
    }

    public String getTenantId() { return tenantId; }
    public int getSupplied() { return supplied; }
    public int getRequired() { return required; }
}
