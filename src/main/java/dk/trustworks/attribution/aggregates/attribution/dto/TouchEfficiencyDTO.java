package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The best and worst touch-count buckets by pipeline per unit of cost.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TouchEfficiencyDTO {
    private TouchBucketEfficiencyDTO mostEfficient;
    private TouchBucketEfficiencyDTO leastEfficient;
    private String recommendation;
}
