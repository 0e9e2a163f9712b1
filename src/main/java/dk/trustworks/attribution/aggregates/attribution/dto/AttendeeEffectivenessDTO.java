package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AttendeeEffectivenessDTO {
    private List<AttendeeSegmentDTO> segmentations;
    private OptimalAttendeeRangeDTO optimalRange;
}
