package dk.trustworks.attribution.persistence.model;

import dk.trustworks.attribution.model.Campaign;
import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@NoArgsConstructor
@Entity
@Table(name = "campaigns")
public class CampaignEntity extends PanacheEntityBase {

    @Id
    private Long id;

    private String name;

    private String type;

    @Column(name = "start_date")
    private LocalDate startDate;

    private Double cost;

    public Campaign toRecord() {
        return new Campaign(id, name, type, cost, startDate);
    }
}
