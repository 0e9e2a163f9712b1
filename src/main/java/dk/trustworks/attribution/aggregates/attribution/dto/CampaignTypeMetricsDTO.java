package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rollup of one campaign type (or of all campaigns combined for the grand-total row).
 *
 * Every opportunity-based figure is computed over the deduplicated set of qualifying
 * opportunities of the type, so an opportunity touched by several campaigns of the type
 * is counted once. The grand-total row is computed over all campaigns as one group and
 * is therefore NOT the sum of the per-type rows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignTypeMetricsDTO {

    /**
     * Campaign type, or {@code "All Campaigns"} for the grand-total row
     */
    private String campaignType;

    private int totalCampaigns;

    /**
     * Sum of campaign cost, each campaign counted once regardless of touches
     */
    private double totalCost;

    /**
     * Number of qualifying opportunities
     */
    private int totalCustomers;

    private int targetAccountCustomers;

    /**
     * targetAccountCustomers / totalCustomers x 100
     */
    private double targetAccountPercentage;

    /**
     * Year-1 value of qualifying opportunities, Closed Lost excluded, Closed Won included
     */
    private double pipelineValue;

    /**
     * Year-1 value of qualifying opportunities that are neither Closed Won nor Closed Lost
     */
    private double openPipelineValue;

    private double closedWonValue;

    private int closedWonCount;

    private int closedLostCount;

    private int openCount;

    /**
     * Attendees summed over the type's touches of qualifying opportunities
     */
    private int totalAttendees;

    /**
     * closedWonCount / (closedWonCount + closedLostCount) x 100, 0 when nothing has closed
     */
    private double winRate;

    /**
     * closedWonValue / totalCost x 100, 0 when totalCost is 0
     */
    private double roi;

    /**
     * pipelineValue / totalCost, 0 when totalCost is 0
     */
    private double costEfficiency;

    /**
     * pipelineValue / totalAttendees, 0 when no attendees were recorded
     */
    private double attendeeEfficiency;

    private double averageCostPerCampaign;

    private double averageCustomersPerCampaign;
}
