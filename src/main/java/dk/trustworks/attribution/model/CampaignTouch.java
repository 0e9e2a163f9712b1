package dk.trustworks.attribution.model;

import java.time.LocalDate;

/**
 * One campaign's contact with one opportunity.
 *
 * @param campaignId    touching campaign
 * @param opportunityId touched opportunity
 * @param attendees     number of attendees from the customer, null when not recorded
 * @param touchDate     date of the touch, null when only the campaign start is known
 */
public record CampaignTouch(Long campaignId, Long opportunityId, Integer attendees, LocalDate touchDate) {

    public int attendeesOrZero() {
        return attendees != null ? attendees : 0;
    }
}
