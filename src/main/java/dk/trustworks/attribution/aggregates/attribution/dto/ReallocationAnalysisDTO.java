package dk.trustworks.attribution.aggregates.attribution.dto;

import dk.trustworks.attribution.model.enums.PerformanceTier;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Budget reallocation candidates derived from the campaign type rollup.
 *
 * A type is inefficient when its share of total cost exceeds the configured threshold
 * (10% by default) and its ROI is below the unweighted mean ROI of all types.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReallocationAnalysisDTO {

    /**
     * Unweighted mean of the per-type ROI
     */
    private double averageRoi;

    private double totalCost;

    private List<String> inefficientTypes;

    /**
     * Sum of the inefficient types' cost
     */
    private double reallocationAmount;

    private double reallocationPercentage;

    /**
     * reallocationAmount x best type ROI / 100
     */
    private double potentialGain;

    /**
     * Best performing type by ROI, null when there are no types
     */
    private String recommendedTarget;

    private double recommendedTargetRoi;

    private Map<PerformanceTier, List<String>> performanceTiers;
}
