package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EngagementRecommendationDTO {

    /**
     * "target" or "non-target"
     */
    private String accountType;

    private String optimalAttendeeRange;
    private String reasoning;
    private double expectedROI;
}
