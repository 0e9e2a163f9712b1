package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * All observed changes from one stage label to another after a campaign started.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StageTransitionDTO {
    private String fromStage;
    private String toStage;
    private int count;
    private List<Customer> customers;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Customer {
        private String customerName;
        private Long opportunityId;
        private LocalDate transitionDate;
    }
}
