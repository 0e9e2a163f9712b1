package dk.trustworks.attribution.dataset;

import dk.trustworks.attribution.model.Campaign;

import java.time.LocalDate;
import java.util.Set;

/**
 * Caller-side restriction of which campaigns take part in an aggregation.
 * Fiscal periods and similar calendar rules are translated into a start-date range
 * before the engine runs.
 *
 * @param types    campaign types to include, empty for all
 * @param fromDate earliest campaign start date (inclusive), null for unbounded
 * @param toDate   latest campaign start date (inclusive), null for unbounded
 */
public record CampaignFilter(Set<String> types, LocalDate fromDate, LocalDate toDate) {

    public CampaignFilter {
        types = types == null ? Set.of() : Set.copyOf(types);
        if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("fromDate " + fromDate + " is after toDate " + toDate);
        }
    }

    public static CampaignFilter all() {
        return new CampaignFilter(Set.of(), null, null);
    }

    /**
     * A campaign without a type only matches when no types are selected.
     */
    public boolean matches(Campaign campaign) {
        if (!types.isEmpty() && (campaign.type() == null || !types.contains(campaign.type()))) return false;
        LocalDate start = campaign.startDate();
        if (fromDate != null && (start == null || start.isBefore(fromDate))) return false;
        if (toDate != null && (start == null || start.isAfter(toDate))) return false;
        return true;
    }
}
