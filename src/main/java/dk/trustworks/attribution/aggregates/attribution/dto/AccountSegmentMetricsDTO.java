package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metrics for one side of the target / non-target account split.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountSegmentMetricsDTO {
    private int totalCustomers;
    private double totalPipelineValue;
    private double averageDealSize;
    private double winRate;
    private int totalAttendees;
    private double averageAttendees;
    private double pipelinePerAttendee;
}
