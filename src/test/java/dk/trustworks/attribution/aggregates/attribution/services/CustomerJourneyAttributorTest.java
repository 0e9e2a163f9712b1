package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.*;
import dk.trustworks.attribution.dataset.AttributionDataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static dk.trustworks.attribution.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CustomerJourneyAttributor Tests")
class CustomerJourneyAttributorTest {

    private static final double TOLERANCE = 1e-6;

    private final CustomerJourneyAttributor attributor = new CustomerJourneyAttributor();

    /**
     * O10: two campaigns (one of them twice), Closed Won. O11: one campaign, open.
     * O12: one campaign, not in pipeline. O13: three campaigns, Closed Lost.
     */
    private AttributionDataset journeyScenario() {
        return dataset()
                .campaign(1, "Webinar", 1000, day(0))
                .campaign(2, "Event", 2000, day(10))
                .campaign(3, "Email", 500, day(20))
                .opportunity(10, "Acme")
                .opportunity(11, "Beta")
                .opportunity(12, "Gamma")
                .opportunity(13, "Delta")
                .snapshot(10, day(45), "Closed Won", 6000, day(5), day(40))
                .snapshot(11, day(45), "Discovery", 2000, day(15), null)
                .snapshot(12, day(45), "Validation", 300, null, null)
                .snapshot(13, day(45), "Closed Lost", 9000, day(1), day(30))
                .touch(1, 10, day(2))
                .touch(1, 10, day(0))
                .touch(2, 10, day(10))
                .touch(1, 11, day(0))
                .touch(3, 12, day(20))
                .touch(1, 13, day(0))
                .touch(2, 13, day(10))
                .touch(3, 13, day(20))
                .build();
    }

    private static CustomerJourneyDTO customer(CustomerJourneyAnalysisDTO analysis, long opportunityId) {
        return analysis.getCustomers().stream()
                .filter(c -> c.getOpportunityId() == opportunityId)
                .findFirst()
                .orElseThrow();
    }

    // ============================================================================
    // Per customer
    // ============================================================================

    @Test
    @DisplayName("journey - touches are distinct campaigns, cost is the full campaign cost")
    void testJourney_PerCustomer() {
        // Act
        CustomerJourneyAnalysisDTO analysis = attributor.journey(journeyScenario());
        CustomerJourneyDTO acme = customer(analysis, 10);

        // Assert
        assertEquals(2, acme.getTotalTouches());
        assertEquals(3000.0, acme.getTotalNotionalCost(), TOLERANCE);
        assertEquals(day(0), acme.getFirstTouchDate());
        assertEquals(day(10), acme.getLastTouchDate());
        assertEquals(List.of(1L, 2L), acme.getCampaigns().stream().map(JourneyTouchDTO::getCampaignId).toList());
        assertEquals(day(0), acme.getCampaigns().get(0).getTouchDate());
        assertEquals("Closed Won", acme.getCurrentStage());
        assertTrue(acme.isClosedWon());
        assertEquals(6000.0, acme.getClosedWonValue(), TOLERANCE);
        assertEquals(5L, acme.getDaysFromFirstTouchToPipeline());
        assertEquals(40L, acme.getDaysFromFirstTouchToClose());
    }

    @Test
    @DisplayName("journey - lost and unqualified customers carry no pipeline value")
    void testJourney_NoPipelineValue() {
        // Act
        CustomerJourneyAnalysisDTO analysis = attributor.journey(journeyScenario());

        // Assert
        assertEquals(0.0, customer(analysis, 12).getPipelineValue());
        assertNull(customer(analysis, 12).getDaysFromFirstTouchToPipeline());
        assertEquals(0.0, customer(analysis, 13).getPipelineValue());
        assertNull(customer(analysis, 13).getDaysFromFirstTouchToClose());
        assertEquals(List.of(13L, 10L, 11L, 12L),
                analysis.getCustomers().stream().map(CustomerJourneyDTO::getOpportunityId).toList());
    }

    // ============================================================================
    // Summary
    // ============================================================================

    @Test
    @DisplayName("summary - histogram sums to the customer count and 100 percent, empty buckets omitted")
    void testSummary_Histogram() {
        // Act
        CustomerJourneySummaryDTO summary = attributor.journey(journeyScenario()).getSummary();

        // Assert
        List<TouchDistributionDTO> distribution = summary.getTouchDistribution();
        assertEquals(List.of(1, 2, 3), distribution.stream().map(TouchDistributionDTO::getTouchCount).toList());
        assertEquals(List.of(2, 1, 1), distribution.stream().map(TouchDistributionDTO::getCustomerCount).toList());
        assertEquals(summary.getTotalCustomers(), distribution.stream().mapToInt(TouchDistributionDTO::getCustomerCount).sum());
        assertEquals(100.0, distribution.stream().mapToDouble(TouchDistributionDTO::getPercentage).sum(), TOLERANCE);
    }

    @Test
    @DisplayName("summary - a touch count nobody has does not appear")
    void testSummary_ZeroBucketOmitted() {
        // Arrange: one customer with one touch, one with three
        AttributionDataset data = dataset()
                .campaign(1, "Webinar", 100, day(0))
                .campaign(2, "Event", 100, day(1))
                .campaign(3, "Email", 100, day(2))
                .opportunity(10, "Acme")
                .opportunity(11, "Beta")
                .touch(1, 10, day(0))
                .touch(1, 11, day(0))
                .touch(2, 11, day(1))
                .touch(3, 11, day(2))
                .build();

        // Act
        CustomerJourneySummaryDTO summary = attributor.journey(data).getSummary();

        // Assert
        assertEquals(List.of(1, 3), summary.getTouchDistribution().stream().map(TouchDistributionDTO::getTouchCount).toList());
        assertEquals(List.of(1, 3), summary.getCacByTouch().stream().map(CacByTouchDTO::getTouchCount).toList());
    }

    @Test
    @DisplayName("summary - averages, conversion rates and totals")
    void testSummary_Statistics() {
        // Act
        CustomerJourneySummaryDTO summary = attributor.journey(journeyScenario()).getSummary();

        // Assert
        assertEquals(4, summary.getTotalCustomers());
        assertEquals(1.75, summary.getAverageTouchesPerCustomer(), TOLERANCE);
        assertEquals(50.0, summary.getMultiTouchPercentage(), TOLERANCE);
        assertEquals(75.0, summary.getPipelineConversionRate(), TOLERANCE);
        assertEquals(25.0, summary.getCloseConversionRate(), TOLERANCE);
        assertEquals(7.0, summary.getAverageDaysToEnterPipeline(), TOLERANCE);
        assertEquals(40.0, summary.getAverageDaysToClose(), TOLERANCE);
        assertEquals(3500.0, summary.getTotalCampaignCosts(), TOLERANCE);
        assertEquals(8000.0, summary.getTotalPipelineValue(), TOLERANCE);
        assertEquals(6000.0, summary.getTotalClosedWonValue(), TOLERANCE);
    }

    @Test
    @DisplayName("summary - CAC curve per touch count and the most efficient bucket")
    void testSummary_CacCurveAndOptimum() {
        // Act
        CustomerJourneySummaryDTO summary = attributor.journey(journeyScenario()).getSummary();

        // Assert
        CacByTouchDTO single = summary.getCacByTouch().get(0);
        assertEquals(2, single.getCustomers());
        assertEquals(1500.0, single.getCumulativeCost(), TOLERANCE);
        assertEquals(2000.0, single.getPipelineValue(), TOLERANCE);
        assertEquals(2000.0 / 1500.0, single.getEfficiency(), TOLERANCE);

        CacByTouchDTO triple = summary.getCacByTouch().get(2);
        assertEquals(0.0, triple.getEfficiency());

        OptimalTouchCountDTO optimal = summary.getOptimalTouchCount();
        assertEquals(2, optimal.getTouches());
        assertEquals(2.0, optimal.getEfficiency(), TOLERANCE);
        assertTrue(optimal.getRecommendation().startsWith("Optimal touch count is 2"));
    }

    @Test
    @DisplayName("optimalTouchCount - equal efficiency goes to the lower touch count")
    void testOptimalTouchCount_Tie() {
        // Arrange
        List<CacByTouchDTO> curve = List.of(
                CacByTouchDTO.builder().touchCount(1).customers(1).efficiency(3.0).build(),
                CacByTouchDTO.builder().touchCount(2).customers(1).efficiency(3.0).build());

        // Act / Assert
        assertEquals(1, CustomerJourneyAttributor.optimalTouchCount(curve).getTouches());
        assertNull(CustomerJourneyAttributor.optimalTouchCount(List.of()));
    }

    @Test
    @DisplayName("summary - most and least efficient touch buckets with their CAC")
    void testSummary_TouchEfficiency() {
        // Act
        TouchEfficiencyDTO efficiency = attributor.journey(journeyScenario()).getSummary().getTouchEfficiency();

        // Assert
        assertEquals(2, efficiency.getMostEfficient().getTouches());
        assertEquals(3000.0, efficiency.getMostEfficient().getCac(), TOLERANCE);
        assertEquals(2.0, efficiency.getMostEfficient().getEfficiency(), TOLERANCE);
        assertEquals(3, efficiency.getLeastEfficient().getTouches());
        assertEquals(3500.0, efficiency.getLeastEfficient().getCac(), TOLERANCE);
        assertEquals(0.0, efficiency.getLeastEfficient().getEfficiency());
        assertEquals("2 touches return $2.00 pipeline per $1 of campaign cost against $0.00 for 3 touches",
                efficiency.getRecommendation());
    }

    @Test
    @DisplayName("touchEfficiency - equal efficiency goes to the higher touch count for the least efficient")
    void testTouchEfficiency_Tie() {
        // Arrange
        List<CacByTouchDTO> curve = List.of(
                CacByTouchDTO.builder().touchCount(1).customers(2).cumulativeCost(400).efficiency(3.0).build(),
                CacByTouchDTO.builder().touchCount(2).customers(1).cumulativeCost(500).efficiency(3.0).build());

        // Act
        TouchEfficiencyDTO efficiency = CustomerJourneyAttributor.touchEfficiency(curve);

        // Assert
        assertEquals(1, efficiency.getMostEfficient().getTouches());
        assertEquals(200.0, efficiency.getMostEfficient().getCac(), TOLERANCE);
        assertEquals(2, efficiency.getLeastEfficient().getTouches());
        assertNull(CustomerJourneyAttributor.touchEfficiency(List.of()));
    }

    @Test
    @DisplayName("journey - empty dataset gives zero statistics and no optimum")
    void testJourney_Empty() {
        // Act
        CustomerJourneyAnalysisDTO analysis = attributor.journey(dataset().build());

        // Assert
        assertTrue(analysis.getCustomers().isEmpty());
        assertEquals(0.0, analysis.getSummary().getAverageTouchesPerCustomer());
        assertEquals(0.0, analysis.getSummary().getMultiTouchPercentage());
        assertTrue(analysis.getSummary().getTouchDistribution().isEmpty());
        assertNull(analysis.getSummary().getOptimalTouchCount());
        assertNull(analysis.getSummary().getTouchEfficiency());
        assertEquals(0.0, analysis.getSummary().getAverageDaysToClose());
    }
}
