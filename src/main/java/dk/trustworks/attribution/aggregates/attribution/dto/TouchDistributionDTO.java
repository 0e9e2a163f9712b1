package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Histogram bucket: customers touched by exactly {@code touchCount} campaigns.
 * Buckets with no customers are omitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TouchDistributionDTO {
    private int touchCount;
    private int customerCount;
    private double percentage;
}
