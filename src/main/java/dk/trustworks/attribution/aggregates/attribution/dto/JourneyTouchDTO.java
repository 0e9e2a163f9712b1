package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JourneyTouchDTO {
    private Long campaignId;
    private String campaignName;
    private String campaignType;
    private LocalDate touchDate;
    private double cost;
}
