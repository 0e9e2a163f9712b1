package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StageProgressionDTO {
    private int advancedStages;

    /**
     * advancedStages / touched opportunities x 100
     */
    private double stageAdvancementRate;

    private double averageDaysToAdvance;
}
