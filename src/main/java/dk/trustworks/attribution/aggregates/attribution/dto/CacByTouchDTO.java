package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Economics of customers with exactly {@code touchCount} touches.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacByTouchDTO {
    private int touchCount;
    private int customers;

    /**
     * Sum of the customers' notional costs
     */
    private double cumulativeCost;

    private double pipelineValue;
    private double closedWonValue;
    private int closedWonCount;

    /**
     * pipelineValue / cumulativeCost, 0 when the bucket has no cost
     */
    private double efficiency;
}
