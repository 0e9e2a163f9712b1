package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OpportunityMovementDTO {
    private Long opportunityId;
    private String customerName;

    /**
     * Stage before the movement; null for new pipeline entries
     */
    private String fromStage;

    private String toStage;

    /**
     * Entered-pipeline date for new pipeline, snapshot date of the later state for stage advances
     */
    private LocalDate movementDate;

    private double value;
    private boolean closedWon;
}
