package dk.trustworks.attribution.aggregates.attribution.dto;

import dk.trustworks.attribution.model.enums.MovementType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Movement rollup for one campaign type within the detection window.
 *
 * For {@link MovementType#NEW_PIPELINE} the opportunity count is the number of
 * opportunities that entered the pipeline in the window; Closed Lost entries are
 * only reported in {@code excludedClosedLostCount}.
 * For {@link MovementType#STAGE_ADVANCE} it is the number of positive stage movements.
 * An opportunity is counted at most once per campaign type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MovementMetricsDTO {
    private String campaignType;
    private MovementType movementType;
    private int windowDays;
    private int totalCampaigns;
    private double totalCost;
    private int opportunityCount;

    /**
     * Year-1 value of the counted movements
     */
    private double movementValue;

    private int closedWonCount;
    private double closedWonValue;
    private int activeCount;
    private double activeValue;

    /**
     * Distinct Closed Lost opportunities left out of the new pipeline, counted once per row
     */
    private int excludedClosedLostCount;

    /**
     * movementValue / totalCost, 0 when totalCost is 0
     */
    private double costEfficiency;
}
