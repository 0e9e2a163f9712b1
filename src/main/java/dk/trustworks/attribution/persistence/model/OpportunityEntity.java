package dk.trustworks.attribution.persistence.model;

import dk.trustworks.attribution.model.Opportunity;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@Entity
@Table(name = "opportunities")
public class OpportunityEntity extends PanacheEntityBase {

    @Id
    private Long id;

    @Column(name = "opportunity_id")
    private String opportunityId;

    private String name;

    @Column(name = "client_name")
    private String clientName;

    public Opportunity toRecord(Boolean targetAccount) {
        return new Opportunity(id, opportunityId, name, clientName, targetAccount);
    }
}
