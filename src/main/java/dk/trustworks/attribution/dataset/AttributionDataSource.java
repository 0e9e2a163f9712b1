package dk.trustworks.attribution.dataset;

import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only feed of campaigns, touches, opportunities and snapshots.
 * <p>
 * Implementations own all I/O. Any failure is reported by throwing; the loader turns
 * it into a {@link dk.trustworks.attribution.exceptions.DataUnavailableException}.
 */
public interface AttributionDataSource {

    /**
     * @param type campaign type to filter on, null for all campaigns
     */
    List<Campaign> getCampaigns(String type);

    /**
     * @param campaignIds campaigns to filter on, null for all touches
     */
    List<CampaignTouch> getTouches(Set<Long> campaignIds);

    List<Opportunity> getOpportunities();

    /**
     * State of an opportunity as of a date: the snapshot with the greatest snapshot
     * date on or before {@code asOf}.
     *
     * @param asOf cut-off date, null for the current (latest) snapshot
     */
    Optional<OpportunitySnapshot> getLatestSnapshot(Long opportunityId, LocalDate asOf);

    /**
     * @return all snapshots of the opportunity ordered by snapshot date ascending
     */
    List<OpportunitySnapshot> getSnapshotHistory(Long opportunityId);

    /**
     * Bulk read of every snapshot, used to materialize a dataset in one pass.
     */
    List<OpportunitySnapshot> getAllSnapshots();
}
