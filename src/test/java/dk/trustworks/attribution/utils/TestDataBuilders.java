package dk.trustworks.attribution.utils;

import dk.trustworks.attribution.dataset.AttributionDataset;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Test data builders for attribution fixtures.
 * Dates default to a fixed base date so expectations never depend on today.
 */
public class TestDataBuilders {

    public static final LocalDate BASE_DATE = LocalDate.of(2025, 1, 1);

    public static LocalDate day(int offset) {
        return BASE_DATE.plusDays(offset);
    }

    public static Campaign campaign(long id, String type, Double cost, LocalDate startDate) {
        return new Campaign(id, type + " " + id, type, cost, startDate);
    }

    public static Opportunity opportunity(long id, String clientName, Boolean targetAccount) {
        return new Opportunity(id, "SF-" + id, "Opportunity " + id, clientName, targetAccount);
    }

    public static OpportunitySnapshot snapshot(long opportunityId, LocalDate snapshotDate, String stage,
                                               Double value, LocalDate enteredPipeline, LocalDate closeDate) {
        return new OpportunitySnapshot(opportunityId, snapshotDate, stage, value, enteredPipeline, closeDate);
    }

    public static CampaignTouch touch(long campaignId, long opportunityId, Integer attendees, LocalDate touchDate) {
        return new CampaignTouch(campaignId, opportunityId, attendees, touchDate);
    }

    public static DatasetBuilder dataset() {
        return new DatasetBuilder();
    }

    /**
     * Builder for AttributionDataset. Records are passed through {@link AttributionDataset#of}
     * unchanged, so invalid records can be added to test the dropping rules.
     */
    public static class DatasetBuilder {
        private final List<Campaign> campaigns = new ArrayList<>();
        private final List<Opportunity> opportunities = new ArrayList<>();
        private final List<OpportunitySnapshot> snapshots = new ArrayList<>();
        private final List<CampaignTouch> touches = new ArrayList<>();

        public DatasetBuilder campaign(long id, String type, double cost, LocalDate startDate) {
            return campaign(TestDataBuilders.campaign(id, type, cost, startDate));
        }

        public DatasetBuilder campaign(Campaign campaign) {
            campaigns.add(campaign);
            return this;
        }

        public DatasetBuilder opportunity(long id, String clientName) {
            return opportunity(TestDataBuilders.opportunity(id, clientName, null));
        }

        public DatasetBuilder opportunity(long id, String clientName, Boolean targetAccount) {
            return opportunity(TestDataBuilders.opportunity(id, clientName, targetAccount));
        }

        public DatasetBuilder opportunity(Opportunity opportunity) {
            opportunities.add(opportunity);
            return this;
        }

        public DatasetBuilder snapshot(long opportunityId, LocalDate snapshotDate, String stage, double value,
                                       LocalDate enteredPipeline, LocalDate closeDate) {
            return snapshot(TestDataBuilders.snapshot(opportunityId, snapshotDate, stage, value, enteredPipeline, closeDate));
        }

        public DatasetBuilder snapshot(OpportunitySnapshot snapshot) {
            snapshots.add(snapshot);
            return this;
        }

        /**
         * Touch dated on the given day with no attendee count.
         */
        public DatasetBuilder touch(long campaignId, long opportunityId, LocalDate touchDate) {
            return touch(campaignId, opportunityId, null, touchDate);
        }

        public DatasetBuilder touch(long campaignId, long opportunityId, Integer attendees, LocalDate touchDate) {
            touches.add(TestDataBuilders.touch(campaignId, opportunityId, attendees, touchDate));
            return this;
        }

        public List<Campaign> campaigns() {
            return campaigns;
        }

        public List<Opportunity> opportunities() {
            return opportunities;
        }

        public List<OpportunitySnapshot> snapshots() {
            return snapshots;
        }

        public List<CampaignTouch> touches() {
            return touches;
        }

        public AttributionDataset build() {
            return AttributionDataset.of(campaigns, opportunities, snapshots, touches);
        }
    }
}
