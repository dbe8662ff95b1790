package com.finops.costengine.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
