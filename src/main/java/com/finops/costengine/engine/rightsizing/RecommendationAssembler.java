package com.finops.costengine.engine.rightsizing;

import com.finops.costengine.model.CatalogEntry;
import com.finops.costengine.model.Degradation;
import com.finops.costengine.model.Recommendation;
import com.finops.costengine.model.UtilizationProfile;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Renders a capacity match and its risk assessment into a {@link Recommendation}.
 */
@Component
public class RecommendationAssembler {

    public static final Comparator<Recommendation> BY_SAVINGS_DESC = Comparator
            .comparingDouble(Recommendation::getMonthlySavings).reversed()
            .thenComparing(Recommendation::getResourceId, Comparator.nullsLast(Comparator.naturalOrder()));

    public Recommendation assemble(CapacityMatch match, RiskAssessment risk) {
        return Recommendation.builder()
                .resourceId(match.utilization().getResourceId())
                .currentType(match.current().getTypeName())
                .recommendedType(match.candidate().getTypeName())
                .currentMonthlyCost(round2(match.currentMonthlyCost()))
                .recommendedMonthlyCost(round2(match.candidateMonthlyCost()))
                .monthlySavings(round2(match.monthlySavings()))
                .savingsPct(round1(match.savingsPct()))
                .requiredVcpu(round2(match.requiredVcpu()))
                .requiredMemoryGb(match.memoryKnown() ? round2(match.requiredMemoryGb()) : null)
                .cpuHeadroomPct(round1(risk.cpuHeadroomPct()))
                .memoryHeadroomPct(risk.memoryHeadroomPct() == null ? null : round1(risk.memoryHeadroomPct()))
                .riskLevel(risk.riskLevel())
                .confidence(risk.confidence())
                .reasoning(reasoning(match, risk))
                .degradations(risk.degradations())
                .build();
    }

    /**
     * Copy of the batch sorted by monthly savings, highest first.
     */
    public List<Recommendation> sortBySavings(List<Recommendation> recommendations) {
        return recommendations.stream().sorted(BY_SAVINGS_DESC).toList();
    }

    String reasoning(CapacityMatch match, RiskAssessment risk) {
        UtilizationProfile u = match.utilization();
        CatalogEntry current = match.current();
        CatalogEntry candidate = match.candidate();

        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT,
                "Current type %s (%s vCPU, %s GB) averages %.1f%% CPU (p95 %.1f%%, p99 %.1f%%)",
                current.getTypeName(), fmt(current.getVcpu()), fmt(current.getMemoryGb()),
                u.getAvgCpu(), u.getP95Cpu(), u.getP99Cpu()));
        if (match.memoryKnown()) {
            sb.append(String.format(Locale.ROOT, " and %.1f%% memory (p95 %.1f%%)",
                    u.getAvgMem() == null ? 0.0 : u.getAvgMem(),
                    u.getP95Mem() == null ? 0.0 : u.getP95Mem()));
        }
        sb.append(String.format(Locale.ROOT, ". With %.0f%% headroom it needs %.2f vCPU",
                match.headroom() * 100.0, match.requiredVcpu()));
        if (match.memoryKnown()) {
            sb.append(String.format(Locale.ROOT, " and %.2f GB", match.requiredMemoryGb()));
        }
        sb.append(String.format(Locale.ROOT,
                ". Switching to %s (%s vCPU, %s GB) saves $%.2f/month (%.1f%%).",
                candidate.getTypeName(), fmt(candidate.getVcpu()), fmt(candidate.getMemoryGb()),
                match.monthlySavings(), match.savingsPct()));
        for (Degradation degradation : risk.degradations()) {
            sb.append(' ').append(degradation.getDescription()).append('.');
        }
        return sb.toString();
    }

    private static String fmt(double value) {
        return value == Math.rint(value)
                ? String.valueOf((long) value)
                : String.format(Locale.ROOT, "%.1f", value);
    }

    static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    static double round1(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
