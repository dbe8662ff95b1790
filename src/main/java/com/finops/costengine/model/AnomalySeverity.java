package com.finops.costengine.model;

public enum AnomalySeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
