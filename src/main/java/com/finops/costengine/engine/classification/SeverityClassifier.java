package com.finops.costengine.engine.classification;

import com.finops.costengine.model.AnomalySeverity;

import java.util.List;

/**
 * Maps a baseline z-score and an isolation score to a severity.
 *
 * <pre>
 *   CRITICAL  |z| > 3.0  or  score < -0.5
 *   HIGH      |z| > 2.0  or  score < -0.3
 *   MEDIUM    |z| > 1.5  or  score < -0.1
 *   LOW       otherwise
 * </pre>
 *
 * Thresholds tighten strictly from LOW to CRITICAL, so a larger |z| at the same score never
 * yields a lower severity.
 */
public final class SeverityClassifier {

    public record Input(double baselineZScore, double anomalyScore) {}

    private static final ClassificationTable<Input, AnomalySeverity> TABLE = new ClassificationTable<>(List.of(
            threshold(3.0, -0.5, AnomalySeverity.CRITICAL),
            threshold(2.0, -0.3, AnomalySeverity.HIGH),
            threshold(1.5, -0.1, AnomalySeverity.MEDIUM)
    ), AnomalySeverity.LOW);

    private SeverityClassifier() {}

    public static AnomalySeverity classify(double baselineZScore, double anomalyScore) {
        return TABLE.classify(new Input(baselineZScore, anomalyScore));
    }

    public static ClassificationTable<Input, AnomalySeverity> table() {
        return TABLE;
    }

    private static ClassificationRule<Input, AnomalySeverity> threshold(double absZ, double score,
                                                                        AnomalySeverity severity) {
        return new ClassificationRule<>(
                in -> Math.abs(in.baselineZScore()) > absZ || in.anomalyScore() < score,
                severity);
    }
}
