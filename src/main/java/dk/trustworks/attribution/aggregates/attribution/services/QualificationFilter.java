package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.dataset.AttributionDataset;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.*;

/**
 * Decides which opportunities may be credited to a group of campaigns.
 * <p>
 * An opportunity touched by any campaign in the group qualifies when its current
 * (latest) snapshot
 * <ol>
 *   <li>has an entered-pipeline date, and</li>
 *   <li>is still open (no close date) or closes after the opportunity's own first touch
 *       within the group.</li>
 * </ol>
 * The result is a set: an opportunity touched many times, or by several campaigns of the
 * group, is credited once.
 */
@JBossLog
@ApplicationScoped
public class QualificationFilter {

    /**
     * @param data          dataset to evaluate against
     * @param campaignGroup campaign ids forming the group; unknown ids are ignored
     * @return ids of qualifying opportunities, empty for an empty group
     */
    public Set<Long> qualify(AttributionDataset data, Collection<Long> campaignGroup) {
        return qualifyingSnapshots(data, campaignGroup).keySet();
    }

    /**
     * Qualifying opportunities with the current snapshot each was judged on.
     */
    public Map<Long, OpportunitySnapshot> qualifyingSnapshots(AttributionDataset data, Collection<Long> campaignGroup) {
        if (campaignGroup == null || campaignGroup.isEmpty()) {
            return Map.of();
        }

        Map<Long, LocalDate> firstTouchDates = firstTouchDates(data, campaignGroup);
        Map<Long, OpportunitySnapshot> qualifying = new LinkedHashMap<>();
        firstTouchDates.forEach((opportunityId, firstTouch) ->
                data.latestSnapshot(opportunityId)
                        .filter(snapshot -> qualifies(snapshot, firstTouch))
                        .ifPresent(snapshot -> qualifying.put(opportunityId, snapshot)));

        log.debugf("Qualification for %d campaigns: %d touched, %d qualifying",
                campaignGroup.size(), firstTouchDates.size(), qualifying.size());
        return Collections.unmodifiableMap(qualifying);
    }

    /**
     * Earliest touch date per opportunity within the group. A touch without its own date
     * falls back to the touching campaign's start date.
     */
    public Map<Long, LocalDate> firstTouchDates(AttributionDataset data, Collection<Long> campaignGroup) {
        Map<Long, LocalDate> firstTouch = new LinkedHashMap<>();
        for (CampaignTouch touch : data.touchesForCampaigns(campaignGroup)) {
            LocalDate touchDate = touch.touchDate() != null
                    ? touch.touchDate()
                    : data.campaign(touch.campaignId()).map(Campaign::startDate).orElse(null);
            if (touchDate == null) continue;
            firstTouch.merge(touch.opportunityId(), touchDate, (a, b) -> a.isBefore(b) ? a : b);
        }
        return firstTouch;
    }

    static boolean qualifies(OpportunitySnapshot snapshot, LocalDate firstTouch) {
        if (!snapshot.hasEnteredPipeline()) return false;
        return snapshot.closeDate() == null || snapshot.closeDate().isAfter(firstTouch);
    }
}
