package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.CampaignTypeAnalysisDTO;
import dk.trustworks.attribution.aggregates.attribution.dto.CampaignTypeMetricsDTO;
import dk.trustworks.attribution.aggregates.attribution.dto.ExecutiveSummaryDTO;
import dk.trustworks.attribution.aggregates.attribution.dto.ReallocationAnalysisDTO;
import dk.trustworks.attribution.model.enums.PerformanceTier;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.util.*;

import static dk.trustworks.attribution.utils.Ratios.*;

/**
 * Recommendation records derived from the campaign type rollup.
 */
@JBossLog
@ApplicationScoped
public class InsightGenerator {

    /**
     * Budget reallocation candidates.
     * <p>
     * A type is inefficient when its share of total cost exceeds {@code costShareThreshold}
     * and its ROI is below the unweighted mean ROI across types. The recommended target is
     * the type with the highest ROI; on a tie the first type in input order wins.
     *
     * @param types              per-type rows, without the grand-total row
     * @param costShareThreshold cost share as a fraction, e.g. 0.10
     */
    public ReallocationAnalysisDTO reallocation(List<CampaignTypeMetricsDTO> types, double costShareThreshold) {
        double totalCost = types.stream().mapToDouble(CampaignTypeMetricsDTO::getTotalCost).sum();
        double averageRoi = types.stream().mapToDouble(CampaignTypeMetricsDTO::getRoi).average().orElse(0.0);
        CampaignTypeMetricsDTO best = bestByRoi(types).orElse(null);

        List<String> inefficientTypes = new ArrayList<>();
        double reallocationAmount = 0.0;
        Map<PerformanceTier, List<String>> tiers = new EnumMap<>(PerformanceTier.class);
        for (PerformanceTier tier : PerformanceTier.values()) {
            tiers.put(tier, new ArrayList<>());
        }

        for (CampaignTypeMetricsDTO type : types) {
            tiers.get(PerformanceTier.of(type.getRoi())).add(type.getCampaignType());
            double costShare = safeDivide(type.getTotalCost(), totalCost);
            if (costShare > costShareThreshold && type.getRoi() < averageRoi) {
                inefficientTypes.add(type.getCampaignType());
                reallocationAmount += type.getTotalCost();
            }
        }

        double bestRoi = best != null ? best.getRoi() : 0.0;
        log.debugf("Reallocation over %d types: %d inefficient, %.2f to move", Integer.valueOf(types.size()),
                Integer.valueOf(inefficientTypes.size()), Double.valueOf(reallocationAmount));
        return ReallocationAnalysisDTO.builder()
                .averageRoi(averageRoi)
                .totalCost(totalCost)
                .inefficientTypes(List.copyOf(inefficientTypes))
                .reallocationAmount(reallocationAmount)
                .reallocationPercentage(percentage(reallocationAmount, totalCost))
                .potentialGain(reallocationAmount * bestRoi / 100.0)
                .recommendedTarget(best != null ? best.getCampaignType() : null)
                .recommendedTargetRoi(bestRoi)
                .performanceTiers(frozen(tiers))
                .build();
    }

    /**
     * Headline figures. Totals come from the deduplicated grand-total row, so an
     * opportunity credited to several types is counted once.
     */
    public ExecutiveSummaryDTO executiveSummary(CampaignTypeAnalysisDTO analysis) {
        CampaignTypeMetricsDTO total = analysis.getTotal();
        List<CampaignTypeMetricsDTO> types = analysis.getTypes();
        Optional<CampaignTypeMetricsDTO> best = bestByRoi(types);

        double totalInvestment = total.getTotalCost();
        double totalClosedWon = total.getClosedWonValue();

        String summary = best
                .map(b -> String.format(Locale.ROOT,
                        "Based on the selected campaigns, %s campaigns show the strongest ROI performance at %.1f%%. "
                                + "Total marketing investment of $%.1fM generated $%.1fM in closed won revenue.",
                        b.getCampaignType(), b.getRoi(), totalInvestment / 1_000_000, totalClosedWon / 1_000_000))
                .orElse("No campaigns match the selection.");

        return ExecutiveSummaryDTO.builder()
                .totalInvestment(totalInvestment)
                .totalPipeline(total.getPipelineValue())
                .totalClosedWon(totalClosedWon)
                .overallRoi(percentage(totalClosedWon, totalInvestment))
                .averageWinRate(types.stream().mapToDouble(CampaignTypeMetricsDTO::getWinRate).average().orElse(0.0))
                .bestPerformingType(best.map(CampaignTypeMetricsDTO::getCampaignType).orElse(null))
                .bestPerformingRoi(best.map(CampaignTypeMetricsDTO::getRoi).orElse(0.0))
                .bestPerformingClosedWonValue(best.map(CampaignTypeMetricsDTO::getClosedWonValue).orElse(0.0))
                .summary(summary)
                .build();
    }

    private static Map<PerformanceTier, List<String>> frozen(Map<PerformanceTier, List<String>> tiers) {
        Map<PerformanceTier, List<String>> copy = new EnumMap<>(PerformanceTier.class);
        tiers.forEach((tier, types) -> copy.put(tier, List.copyOf(types)));
        return Collections.unmodifiableMap(copy);
    }

    private static Optional<CampaignTypeMetricsDTO> bestByRoi(List<CampaignTypeMetricsDTO> types) {
        CampaignTypeMetricsDTO best = null;
        for (CampaignTypeMetricsDTO type : types) {
            if (best == null || type.getRoi() > best.getRoi()) best = type;
        }
        return Optional.ofNullable(best);
    }
}
