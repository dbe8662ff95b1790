package com.finops.costengine.model;

public enum AnomalyType {
    SPIKE,
    DROP,
    PATTERN_CHANGE
}
