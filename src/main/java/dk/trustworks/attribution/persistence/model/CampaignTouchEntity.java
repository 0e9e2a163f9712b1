package dk.trustworks.attribution.persistence.model;

import dk.trustworks.attribution.model.CampaignTouch;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * Association of a campaign and an opportunity. {@code snapshotDate} is the date the
 * customer was added to the campaign and is used as the touch date.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "campaign_customers")
public class CampaignTouchEntity extends PanacheEntityBase {

    @Id
    private Long id;

    @Column(name = "campaign_id")
    private Long campaignId;

    @Column(name = "opportunity_id")
    private Long opportunityId;

    @Column(name = "snapshot_date")
    private LocalDate snapshotDate;

    private Integer attendees;

    public CampaignTouch toRecord() {
        return new CampaignTouch(campaignId, opportunityId, attendees, snapshotDate);
    }
}
