package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Close rates of a campaign's qualifying opportunities split by how many distinct
 * campaigns touched them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TouchPointEffectivenessDTO {
    private double averageTouchPoints;
    private int singleTouchOpportunities;
    private int multiTouchOpportunities;
    private double singleTouchCloseRate;
    private double multiTouchCloseRate;
}
