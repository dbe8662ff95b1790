package com.finops.costengine.engine.rightsizing;

import com.finops.costengine.model.Degradation;
import com.finops.costengine.model.RiskLevel;

import java.util.List;

/**
 * @param memoryHeadroomPct null when sizing was CPU-only
 */
public record RiskAssessment(RiskLevel riskLevel,
                             double confidence,
                             double cpuHeadroomPct,
                             Double memoryHeadroomPct,
                             List<Degradation> degradations) {
}
