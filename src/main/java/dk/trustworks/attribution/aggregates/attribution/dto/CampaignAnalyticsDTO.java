package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Performance of a single campaign over its qualifying opportunities.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignAnalyticsDTO {
    private Long campaignId;
    private String campaignName;
    private String campaignType;
    private double cost;
    private LocalDate startDate;

    /**
     * Window in days after the start used for close acceleration and stage progression
     */
    private int windowDays;

    /**
     * Distinct opportunities touched by the campaign, qualifying or not
     */
    private int touchedOpportunities;

    private int qualifyingOpportunities;
    private int closedWonCount;
    private double closedWonValue;
    private int openCount;
    private double openValue;
    private int closedLostCount;
    private double winRate;

    /**
     * closedWonCount / qualifyingOpportunities x 100
     */
    private double closeRate;

    /**
     * cost / closedWonCount, null when nothing was won
     */
    private Double cac;

    private int totalAttendees;

    /**
     * Qualifying opportunities also touched by another campaign
     */
    private int sharedOpportunities;

    private double influenceRate;

    /**
     * Qualifying opportunities, shared ones weighted by 0.5
     */
    private double campaignInfluenceScore;

    private int targetAccountCustomers;
    private double targetAccountWinRate;
    private CloseAccelerationDTO closeAcceleration;
    private StageProgressionDTO stageProgression;
    private TouchPointEffectivenessDTO touchPointEffectiveness;
}
