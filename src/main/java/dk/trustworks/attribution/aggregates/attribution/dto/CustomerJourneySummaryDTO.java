package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerJourneySummaryDTO {
    private int totalCustomers;
    private double averageTouchesPerCustomer;

    /**
     * Share of customers with more than one touch, in percent
     */
    private double multiTouchPercentage;

    private double pipelineConversionRate;
    private double closeConversionRate;
    private double averageDaysToEnterPipeline;

    /**
     * Mean days from first touch to close over closed won customers
     */
    private double averageDaysToClose;

    /**
     * Cost of the distinct campaigns involved, each counted once
     */
    private double totalCampaignCosts;

    private double totalPipelineValue;
    private double totalClosedWonValue;
    private List<TouchDistributionDTO> touchDistribution;
    private List<CacByTouchDTO> cacByTouch;
    private OptimalTouchCountDTO optimalTouchCount;

    /**
     * Null when there are no customers
     */
    private TouchEfficiencyDTO touchEfficiency;
}
