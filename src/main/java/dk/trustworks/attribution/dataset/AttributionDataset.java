package dk.trustworks.attribution.dataset;

import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Immutable, indexed view of one bulk read from the {@link AttributionDataSource}.
 * <p>
 * Every aggregation runs against a dataset rather than against the feed directly, so
 * a single call always sees one consistent history. Records pointing at unknown ids are
 * dropped while the dataset is built:
 * <ul>
 *   <li>touches referencing an unknown campaign or opportunity</li>
 *   <li>snapshots referencing an unknown opportunity or lacking a snapshot date</li>
 *   <li>campaigns without id or start date</li>
 * </ul>
 */
@JBossLog
public final class AttributionDataset {

    public static final String UNSPECIFIED_TYPE = "Unspecified";

    private static final Comparator<Campaign> CAMPAIGN_ORDER =
            Comparator.comparing(Campaign::startDate).thenComparing(Campaign::id);

    private final List<Campaign> campaigns;
    private final Map<Long, Campaign> campaignsById;
    private final Map<Long, Opportunity> opportunitiesById;
    private final Map<Long, List<OpportunitySnapshot>> historyByOpportunity;
    private final List<CampaignTouch> touches;
    private final Map<Long, List<CampaignTouch>> touchesByCampaign;
    private final Map<Long, List<CampaignTouch>> touchesByOpportunity;
    private final int droppedRecords;

    private AttributionDataset(List<Campaign> campaigns,
                               Map<Long, Opportunity> opportunitiesById,
                               Map<Long, List<OpportunitySnapshot>> historyByOpportunity,
                               List<CampaignTouch> touches,
                               int droppedRecords) {
        this.campaigns = List.copyOf(campaigns);
        this.campaignsById = campaigns.stream()
                .collect(Collectors.toUnmodifiableMap(Campaign::id, c -> c));
        this.opportunitiesById = Collections.unmodifiableMap(opportunitiesById);
        this.historyByOpportunity = Collections.unmodifiableMap(historyByOpportunity);
        this.touches = List.copyOf(touches);
        this.touchesByCampaign = touches.stream()
                .collect(Collectors.groupingBy(CampaignTouch::campaignId, LinkedHashMap::new, Collectors.toUnmodifiableList()));
        this.touchesByOpportunity = touches.stream()
                .collect(Collectors.groupingBy(CampaignTouch::opportunityId, LinkedHashMap::new, Collectors.toUnmodifiableList()));
        this.droppedRecords = droppedRecords;
    }

    /**
     * Build a dataset, dropping records with missing references.
     */
    public static AttributionDataset of(Collection<Campaign> campaigns,
                                        Collection<Opportunity> opportunities,
                                        Collection<OpportunitySnapshot> snapshots,
                                        Collection<CampaignTouch> touches) {
        int dropped = 0;

        List<Campaign> validCampaigns = new ArrayList<>();
        Set<Long> campaignIds = new HashSet<>();
        for (Campaign campaign : campaigns) {
            if (campaign.id() == null || campaign.startDate() == null || !campaignIds.add(campaign.id())) {
                log.debugf("Dropping campaign without id/start date or duplicate id: %s", campaign);
                dropped++;
                continue;
            }
            validCampaigns.add(campaign.type() == null || campaign.type().isBlank()
                    ? new Campaign(campaign.id(), campaign.name(), UNSPECIFIED_TYPE, campaign.cost(), campaign.startDate())
                    : campaign);
        }
        validCampaigns.sort(CAMPAIGN_ORDER);

        Map<Long, Opportunity> opportunitiesById = new LinkedHashMap<>();
        for (Opportunity opportunity : opportunities) {
            if (opportunity.id() == null) {
                dropped++;
                continue;
            }
            opportunitiesById.putIfAbsent(opportunity.id(), opportunity);
        }

        Map<Long, List<OpportunitySnapshot>> history = new HashMap<>();
        for (OpportunitySnapshot snapshot : snapshots) {
            if (snapshot.snapshotDate() == null || !opportunitiesById.containsKey(snapshot.opportunityId())) {
                log.debugf("Dropping snapshot for unknown opportunity %s", snapshot.opportunityId());
                dropped++;
                continue;
            }
            history.computeIfAbsent(snapshot.opportunityId(), id -> new ArrayList<>()).add(snapshot);
        }
        // Stable sort: snapshots sharing a date keep feed order, so the last one read wins
        Map<Long, List<OpportunitySnapshot>> sortedHistory = new HashMap<>();
        history.forEach((id, list) -> {
            list.sort(Comparator.comparing(OpportunitySnapshot::snapshotDate));
            sortedHistory.put(id, List.copyOf(list));
        });

        List<CampaignTouch> validTouches = new ArrayList<>();
        for (CampaignTouch touch : touches) {
            if (!campaignIds.contains(touch.campaignId()) || !opportunitiesById.containsKey(touch.opportunityId())) {
                log.debugf("Dropping touch %s -> %s with unknown reference", touch.campaignId(), touch.opportunityId());
                dropped++;
                continue;
            }
            validTouches.add(touch);
        }

        if (dropped > 0) {
            log.infof("Attribution dataset built with %d records dropped for missing references", dropped);
        }
        return new AttributionDataset(validCampaigns, opportunitiesById, sortedHistory, validTouches, dropped);
    }

    /**
     * Same history restricted to the campaigns accepted by the filter. Touches of
     * excluded campaigns go with them; opportunities and snapshots are kept.
     */
    public AttributionDataset restrictTo(CampaignFilter filter) {
        List<Campaign> kept = campaigns.stream().filter(filter::matches).toList();
        Set<Long> keptIds = kept.stream().map(Campaign::id).collect(Collectors.toSet());
        List<CampaignTouch> keptTouches = touches.stream()
                .filter(t -> keptIds.contains(t.campaignId()))
                .toList();
        return new AttributionDataset(kept, new LinkedHashMap<>(opportunitiesById),
                new HashMap<>(historyByOpportunity), keptTouches, droppedRecords);
    }

    /**
     * Campaigns ordered by start date, then id.
     */
    public List<Campaign> campaigns() {
        return campaigns;
    }

    public Optional<Campaign> campaign(Long campaignId) {
        return Optional.ofNullable(campaignsById.get(campaignId));
    }

    /**
     * Campaigns grouped by type, types in order of their earliest campaign.
     */
    public Map<String, List<Campaign>> campaignsByType() {
        return campaigns.stream()
                .collect(Collectors.groupingBy(Campaign::type, LinkedHashMap::new, Collectors.toList()));
    }

    public Collection<Opportunity> opportunities() {
        return opportunitiesById.values();
    }

    public Optional<Opportunity> opportunity(Long opportunityId) {
        return Optional.ofNullable(opportunitiesById.get(opportunityId));
    }

    public List<CampaignTouch> touches() {
        return touches;
    }

    public List<CampaignTouch> touchesForCampaign(Long campaignId) {
        return touchesByCampaign.getOrDefault(campaignId, List.of());
    }

    public List<CampaignTouch> touchesForCampaigns(Collection<Long> campaignIds) {
        List<CampaignTouch> result = new ArrayList<>();
        for (Long campaignId : new LinkedHashSet<>(campaignIds)) {
            result.addAll(touchesForCampaign(campaignId));
        }
        return result;
    }

    public List<CampaignTouch> touchesForOpportunity(Long opportunityId) {
        return touchesByOpportunity.getOrDefault(opportunityId, List.of());
    }

    /**
     * Ids of opportunities with at least one touch, in first-touch feed order.
     */
    public Set<Long> touchedOpportunityIds() {
        return Collections.unmodifiableSet(touchesByOpportunity.keySet());
    }

    /**
     * Snapshot history ordered by snapshot date ascending.
     */
    public List<OpportunitySnapshot> history(Long opportunityId) {
        return historyByOpportunity.getOrDefault(opportunityId, List.of());
    }

    /**
     * Current state: the snapshot with the greatest snapshot date.
     */
    public Optional<OpportunitySnapshot> latestSnapshot(Long opportunityId) {
        List<OpportunitySnapshot> history = history(opportunityId);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    /**
     * State as of a date: the snapshot with the greatest snapshot date on or before {@code asOf}.
     */
    public Optional<OpportunitySnapshot> latestSnapshot(Long opportunityId, LocalDate asOf) {
        if (asOf == null) return latestSnapshot(opportunityId);
        OpportunitySnapshot result = null;
        for (OpportunitySnapshot snapshot : history(opportunityId)) {
            if (snapshot.snapshotDate().isAfter(asOf)) break;
            result = snapshot;
        }
        return Optional.ofNullable(result);
    }

    public int droppedRecords() {
        return droppedRecords;
    }
}
