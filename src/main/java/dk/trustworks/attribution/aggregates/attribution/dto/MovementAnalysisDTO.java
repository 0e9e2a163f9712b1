package dk.trustworks.attribution.aggregates.attribution.dto;

import dk.trustworks.attribution.model.enums.MovementType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MovementAnalysisDTO {
    private MovementType movementType;
    private int windowDays;
    private List<MovementMetricsDTO> types;
    private MovementMetricsDTO total;
    private List<CampaignMovementDTO> campaigns;
}
