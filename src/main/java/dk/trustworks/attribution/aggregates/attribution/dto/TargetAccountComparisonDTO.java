package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Target vs. non-target account comparison.
 *
 * Opportunities whose target-account flag has not been set are left out of both sides.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TargetAccountComparisonDTO {

    private AccountSegmentMetricsDTO targetAccounts;

    private AccountSegmentMetricsDTO nonTargetAccounts;

    /**
     * Target average deal size / non-target average deal size, 0 when the latter is 0
     */
    private double dealSizeMultiplier;

    /**
     * Target win rate minus non-target win rate, in percentage points
     */
    private double winRateAdvantage;

    /**
     * Target pipeline per attendee / non-target pipeline per attendee, 0 when the latter is 0
     */
    private double attendeeEfficiency;
}
