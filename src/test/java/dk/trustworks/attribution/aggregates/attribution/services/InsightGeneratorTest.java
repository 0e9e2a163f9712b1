package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.CampaignTypeAnalysisDTO;
import dk.trustworks.attribution.aggregates.attribution.dto.CampaignTypeMetricsDTO;
import dk.trustworks.attribution.aggregates.attribution.dto.ExecutiveSummaryDTO;
import dk.trustworks.attribution.aggregates.attribution.dto.ReallocationAnalysisDTO;
import dk.trustworks.attribution.model.enums.PerformanceTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InsightGenerator Tests")
class InsightGeneratorTest {

    private static final double TOLERANCE = 1e-6;

    private final InsightGenerator generator = new InsightGenerator();

    private static CampaignTypeMetricsDTO type(String name, double cost, double roi) {
        return CampaignTypeMetricsDTO.builder()
                .campaignType(name)
                .totalCost(cost)
                .roi(roi)
                .build();
    }

    // ============================================================================
    // Reallocation
    // ============================================================================

    @Test
    @DisplayName("reallocation - large cost share below mean ROI is inefficient")
    void testReallocation() {
        // Arrange: mean ROI is 262.5
        List<CampaignTypeMetricsDTO> types = List.of(
                type("Webinar", 1000, 600),
                type("Event", 8000, 50),
                type("Email", 500, 150),
                type("Ads", 500, 250));

        // Act
        ReallocationAnalysisDTO result = generator.reallocation(types, 0.10);

        // Assert
        assertEquals(262.5, result.getAverageRoi(), TOLERANCE);
        assertEquals(10000.0, result.getTotalCost(), TOLERANCE);
        assertEquals(List.of("Event"), result.getInefficientTypes());
        assertEquals(8000.0, result.getReallocationAmount(), TOLERANCE);
        assertEquals(80.0, result.getReallocationPercentage(), TOLERANCE);
        assertEquals("Webinar", result.getRecommendedTarget());
        assertEquals(600.0, result.getRecommendedTargetRoi(), TOLERANCE);
        assertEquals(48000.0, result.getPotentialGain(), TOLERANCE);
    }

    @Test
    @DisplayName("reallocation - cost share exactly at the threshold is not inefficient")
    void testReallocation_ThresholdIsExclusive() {
        // Arrange: Webinar holds exactly 10% of cost at the lowest ROI
        List<CampaignTypeMetricsDTO> types = List.of(
                type("Webinar", 1000, 10),
                type("Event", 9000, 300));

        // Act
        ReallocationAnalysisDTO result = generator.reallocation(types, 0.10);

        // Assert
        assertTrue(result.getInefficientTypes().isEmpty());
        assertEquals(0.0, result.getPotentialGain());
    }

    @Test
    @DisplayName("reallocation - every type lands in exactly one performance tier")
    void testReallocation_PerformanceTiers() {
        // Arrange
        List<CampaignTypeMetricsDTO> types = List.of(
                type("Webinar", 1000, 600),
                type("Event", 8000, 50),
                type("Email", 500, 150),
                type("Ads", 500, 250));

        // Act
        ReallocationAnalysisDTO result = generator.reallocation(types, 0.10);

        // Assert
        assertEquals(List.of("Webinar"), result.getPerformanceTiers().get(PerformanceTier.EXCELLENT));
        assertEquals(List.of("Ads"), result.getPerformanceTiers().get(PerformanceTier.GOOD));
        assertEquals(List.of("Email"), result.getPerformanceTiers().get(PerformanceTier.MODERATE));
        assertEquals(List.of("Event"), result.getPerformanceTiers().get(PerformanceTier.POOR));
        assertThrows(UnsupportedOperationException.class,
                () -> result.getPerformanceTiers().get(PerformanceTier.POOR).add("Email"));
        assertThrows(UnsupportedOperationException.class, () -> result.getInefficientTypes().clear());
    }

    @Test
    @DisplayName("reallocation - no types gives no target and empty tiers")
    void testReallocation_Empty() {
        // Act
        ReallocationAnalysisDTO result = generator.reallocation(List.of(), 0.10);

        // Assert
        assertNull(result.getRecommendedTarget());
        assertEquals(0.0, result.getAverageRoi());
        assertEquals(0.0, result.getReallocationPercentage());
        assertEquals(PerformanceTier.values().length, result.getPerformanceTiers().size());
        assertTrue(result.getPerformanceTiers().values().stream().allMatch(List::isEmpty));
    }

    // ============================================================================
    // Executive summary
    // ============================================================================

    @Test
    @DisplayName("executiveSummary - totals from the deduplicated total row")
    void testExecutiveSummary() {
        // Arrange
        CampaignTypeMetricsDTO webinar = type("Webinar", 1_000_000, 300);
        webinar.setWinRate(40);
        webinar.setClosedWonValue(3_000_000);
        CampaignTypeMetricsDTO event = type("Event", 1_500_000, 100);
        event.setWinRate(60);
        CampaignTypeMetricsDTO total = CampaignTypeMetricsDTO.builder()
                .campaignType(CampaignTypeAggregator.ALL_CAMPAIGNS)
                .totalCost(2_500_000)
                .pipelineValue(7_000_000)
                .closedWonValue(5_000_000)
                .build();

        // Act
        ExecutiveSummaryDTO result = generator.executiveSummary(
                new CampaignTypeAnalysisDTO(List.of(webinar, event), total));

        // Assert
        assertEquals(2_500_000.0, result.getTotalInvestment(), TOLERANCE);
        assertEquals(7_000_000.0, result.getTotalPipeline(), TOLERANCE);
        assertEquals(200.0, result.getOverallRoi(), TOLERANCE);
        assertEquals(50.0, result.getAverageWinRate(), TOLERANCE);
        assertEquals("Webinar", result.getBestPerformingType());
        assertEquals(3_000_000.0, result.getBestPerformingClosedWonValue(), TOLERANCE);
        assertEquals("Based on the selected campaigns, Webinar campaigns show the strongest ROI performance at 300.0%. "
                + "Total marketing investment of $2.5M generated $5.0M in closed won revenue.", result.getSummary());
    }

    @Test
    @DisplayName("executiveSummary - empty selection")
    void testExecutiveSummary_Empty() {
        // Arrange
        CampaignTypeMetricsDTO total = CampaignTypeMetricsDTO.builder()
                .campaignType(CampaignTypeAggregator.ALL_CAMPAIGNS)
                .build();

        // Act
        ExecutiveSummaryDTO result = generator.executiveSummary(new CampaignTypeAnalysisDTO(List.of(), total));

        // Assert
        assertNull(result.getBestPerformingType());
        assertEquals(0.0, result.getOverallRoi());
        assertEquals("No campaigns match the selection.", result.getSummary());
    }
}
