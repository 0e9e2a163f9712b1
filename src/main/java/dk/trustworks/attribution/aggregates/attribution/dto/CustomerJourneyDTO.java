package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * Raw engagement history of one opportunity across all campaigns.
 *
 * Not filtered by qualification. {@code totalNotionalCost} is per-touch economics:
 * the FULL cost of every campaign that touched the customer, not divided across the
 * other customers the same campaign touched. It is not a normalized CAC.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerJourneyDTO {
    private Long opportunityId;
    private String customerName;

    /**
     * Distinct campaigns that touched the opportunity
     */
    private int totalTouches;

    private double totalNotionalCost;
    private LocalDate firstTouchDate;
    private LocalDate lastTouchDate;
    private LocalDate enteredPipelineDate;
    private List<JourneyTouchDTO> campaigns;

    /**
     * Stage of the current snapshot, null when no snapshot exists
     */
    private String currentStage;

    private double pipelineValue;
    private double closedWonValue;
    private boolean closedWon;

    /**
     * Days from first touch to entering the pipeline; negative when the opportunity was
     * already in pipeline before the first touch, null when it never entered
     */
    private Long daysFromFirstTouchToPipeline;

    /**
     * Days from first touch to close, Closed Won only
     */
    private Long daysFromFirstTouchToClose;
}
