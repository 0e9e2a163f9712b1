package dk.trustworks.attribution.aggregates.attribution.dto;

import dk.trustworks.attribution.model.enums.MovementType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Movements detected for a single campaign.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CampaignMovementDTO {
    private Long campaignId;
    private String campaignName;
    private String campaignType;
    private MovementType movementType;
    private List<OpportunityMovementDTO> movements;

    /**
     * Opportunities that entered the pipeline in the window but are now Closed Lost
     */
    private List<Long> excludedClosedLostOpportunityIds;

    /**
     * Number of excluded Closed Lost opportunities, each counted once
     */
    public int getExcludedClosedLostCount() {
        return excludedClosedLostOpportunityIds != null ? excludedClosedLostOpportunityIds.size() : 0;
    }
}
