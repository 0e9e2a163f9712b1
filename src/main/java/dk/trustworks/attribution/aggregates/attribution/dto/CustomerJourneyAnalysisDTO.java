package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CustomerJourneyAnalysisDTO {
    private List<CustomerJourneyDTO> customers;
    private CustomerJourneySummaryDTO summary;
}
