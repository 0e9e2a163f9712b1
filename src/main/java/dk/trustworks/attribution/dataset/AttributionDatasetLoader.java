package dk.trustworks.attribution.dataset;

import dk.trustworks.attribution.exceptions.DataUnavailableException;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Materializes an {@link AttributionDataset} from the data source in one bulk read.
 * <p>
 * All-or-nothing: if any read fails the whole load fails with a
 * {@link DataUnavailableException} and no dataset is returned.
 */
@JBossLog
@ApplicationScoped
public class AttributionDatasetLoader {

    @Inject
    AttributionDataSource dataSource;

    public AttributionDataset load(CampaignFilter filter) {
        CampaignFilter effective = filter != null ? filter : CampaignFilter.all();
        long start = System.currentTimeMillis();

        try {
            List<Campaign> campaigns = readCampaigns(effective);
            Set<Long> campaignIds = campaigns.stream()
                    .map(Campaign::id)
                    .filter(Objects::nonNull)
                    .collect(Collectors.toSet());

            List<CampaignTouch> touches = campaignIds.isEmpty() ? List.of() : dataSource.getTouches(campaignIds);
            List<Opportunity> opportunities = dataSource.getOpportunities();
            List<OpportunitySnapshot> snapshots = dataSource.getAllSnapshots();

            // Types are normalized while the dataset is built, so the filter runs on the dataset
            AttributionDataset dataset = AttributionDataset.of(campaigns, opportunities, snapshots, touches)
                    .restrictTo(effective);
            log.debugf("Loaded attribution dataset in %d ms: %d of %d campaigns, %d touches, %d opportunities, %d snapshots, %d records dropped",
                    System.currentTimeMillis() - start, dataset.campaigns().size(), campaigns.size(),
                    dataset.touches().size(), opportunities.size(), snapshots.size(), dataset.droppedRecords());
            return dataset;
        } catch (DataUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.errorf(e, "Failed to read attribution data for filter %s", effective);
            throw new DataUnavailableException("Campaign attribution data could not be read: " + e.getMessage(), e);
        }
    }

    /**
     * A single selected type is pushed down to the source. Campaigns without a type are
     * stored untyped, so selecting the unspecified type reads everything.
     */
    private List<Campaign> readCampaigns(CampaignFilter filter) {
        if (filter.types().size() == 1) {
            String type = filter.types().iterator().next();
            if (!AttributionDataset.UNSPECIFIED_TYPE.equals(type)) {
                return dataSource.getCampaigns(type);
            }
        }
        return dataSource.getCampaigns(null);
    }
}
