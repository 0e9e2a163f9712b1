package dk.trustworks.attribution.persistence.model;

import dk.trustworks.attribution.model.OpportunitySnapshot;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One row of an uploaded pipeline export. Only the columns used for attribution are mapped.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "snapshots")
public class OpportunitySnapshotEntity extends PanacheEntityBase {

    @Id
    private Long id;

    @Column(name = "opportunity_id")
    private Long opportunityId;

    @Column(name = "snapshot_date")
    private LocalDate snapshotDate;

    private String stage;

    @Column(name = "year1_value")
    private Double year1Value;

    @Column(name = "entered_pipeline")
    private LocalDate enteredPipeline;

    @Column(name = "close_date")
    private LocalDate closeDate;

    // 1 = target account, 0 = not, null = not classified yet
    @Column(name = "target_account")
    private Integer targetAccount;

    public OpportunitySnapshot toRecord() {
        return new OpportunitySnapshot(opportunityId, snapshotDate, stage, year1Value, enteredPipeline, closeDate);
    }
}
