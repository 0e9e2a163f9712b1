package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OptimalAttendeeRangeDTO {
    private String attendeeRange;

    /**
     * Pipeline per attendee of the range
     */
    private double efficiency;

    private String recommendation;
}
