package com.finops.costengine.engine.classification;

import com.finops.costengine.model.AnomalyType;

import java.util.List;

/**
 * Classifies an anomalous day by its change against the previous observation:
 * more than +50% is a SPIKE, more than -50% a DROP, anything else a PATTERN_CHANGE.
 */
public final class AnomalyTypeClassifier {

    public static final double ABRUPT_CHANGE_PCT = 50.0;

    private static final ClassificationTable<Double, AnomalyType> TABLE = new ClassificationTable<>(List.of(
            new ClassificationRule<>(pct -> pct > ABRUPT_CHANGE_PCT, AnomalyType.SPIKE),
            new ClassificationRule<>(pct -> pct < -ABRUPT_CHANGE_PCT, AnomalyType.DROP)
    ), AnomalyType.PATTERN_CHANGE);

    private AnomalyTypeClassifier() {}

    public static AnomalyType classify(double costChangePct) {
        return TABLE.classify(costChangePct);
    }

    /**
     * Percent change from {@code previousCost} to {@code cost}; 0 when there is no usable
     * previous cost.
     */
    public static double changePct(Double previousCost, double cost) {
        if (previousCost == null || previousCost == 0.0) return 0.0;
        return (cost - previousCost) / previousCost * 100.0;
    }
}
