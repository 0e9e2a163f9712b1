package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metrics for opportunities touched with an attendee count inside one range.
 *
 * Business Context:
 * - Shows whether sending more people to a customer pays off
 * - Cost is the cost of the distinct campaigns behind the bucket's touches
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttendeeSegmentDTO {
    private String attendeeRange;
    private int customerCount;
    private int totalAttendees;
    private double totalCost;
    private double totalPipelineValue;
    private double averageDealSize;
    private double winRate;
    private double costPerAttendee;
    private double pipelinePerAttendee;
}
