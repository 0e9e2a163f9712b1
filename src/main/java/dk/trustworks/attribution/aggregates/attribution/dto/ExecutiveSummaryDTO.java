package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutiveSummaryDTO {
    private double totalInvestment;
    private double totalPipeline;
    private double totalClosedWon;

    /**
     * totalClosedWon / totalInvestment x 100
     */
    private double overallRoi;

    /**
     * Mean of the per-type win rates
     */
    private double averageWinRate;

    private String bestPerformingType;
    private double bestPerformingRoi;
    private double bestPerformingClosedWonValue;
    private String summary;
}
