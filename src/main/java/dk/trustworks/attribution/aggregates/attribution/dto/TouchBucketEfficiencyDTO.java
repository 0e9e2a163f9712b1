package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TouchBucketEfficiencyDTO {
    private int touches;

    /**
     * Cumulative campaign cost per customer in the bucket
     */
    private double cac;

    private double efficiency;
}
