package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Per-type rows sorted by pipeline value descending, plus the deduplicated grand total.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CampaignTypeAnalysisDTO {
    private List<CampaignTypeMetricsDTO> types;
    private CampaignTypeMetricsDTO total;
}
