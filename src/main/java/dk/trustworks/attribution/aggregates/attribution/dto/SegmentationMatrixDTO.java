package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Attendee range x account type matrix with one recommendation per account type.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SegmentationMatrixDTO {
    private List<StrategicMatrixRowDTO> matrix;
    private List<EngagementRecommendationDTO> recommendations;
}
