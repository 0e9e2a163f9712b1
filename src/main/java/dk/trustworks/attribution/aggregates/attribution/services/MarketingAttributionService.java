package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.*;
import dk.trustworks.attribution.config.AttributionConfig;
import dk.trustworks.attribution.dataset.AttributionDataset;
import dk.trustworks.attribution.dataset.AttributionDatasetLoader;
import dk.trustworks.attribution.dataset.CampaignFilter;
import dk.trustworks.attribution.model.Campaign;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.NotFoundException;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;

/**
 * Entry point for the attribution reports: loads one dataset per call and hands it to
 * the engine components. Holds no state between calls.
 */
@JBossLog
@ApplicationScoped
public class MarketingAttributionService {

    @Inject
    AttributionDatasetLoader loader;

    @Inject
    AttributionConfig config;

    @Inject
    CampaignTypeAggregator campaignTypeAggregator;

    @Inject
    MovementDetector movementDetector;

    @Inject
    CustomerJourneyAttributor customerJourneyAttributor;

    @Inject
    SegmentationService segmentationService;

    @Inject
    InsightGenerator insightGenerator;

    @Inject
    CampaignAnalyticsService campaignAnalyticsService;

    public CampaignTypeAnalysisDTO campaignTypes(CampaignFilter filter) {
        return campaignTypeAggregator.aggregate(loader.load(filter));
    }

    public MovementAnalysisDTO newPipeline(CampaignFilter filter, Integer windowDays) {
        return movementDetector.detectNewPipeline(loader.load(filter), window(windowDays));
    }

    public MovementAnalysisDTO stageAdvances(CampaignFilter filter, Integer windowDays) {
        return movementDetector.detectStageAdvances(loader.load(filter), window(windowDays));
    }

    public CustomerJourneyAnalysisDTO customerJourney(CampaignFilter filter) {
        return customerJourneyAttributor.journey(loader.load(filter));
    }

    public AttendeeEffectivenessDTO attendeeEffectiveness(CampaignFilter filter) {
        return segmentationService.attendeeEffectiveness(loader.load(filter));
    }

    public TargetAccountComparisonDTO targetAccounts(CampaignFilter filter) {
        return segmentationService.targetAccountComparison(loader.load(filter));
    }

    public SegmentationMatrixDTO strategicMatrix(CampaignFilter filter) {
        return segmentationService.strategicMatrix(loader.load(filter));
    }

    public ReallocationAnalysisDTO reallocation(CampaignFilter filter) {
        CampaignTypeAnalysisDTO analysis = campaignTypes(filter);
        return insightGenerator.reallocation(analysis.getTypes(), config.getReallocationCostShareThreshold());
    }

    public ExecutiveSummaryDTO executiveSummary(CampaignFilter filter) {
        return insightGenerator.executiveSummary(campaignTypes(filter));
    }

    public CampaignAnalyticsDTO campaignAnalytics(Long campaignId, Integer windowDays) {
        AttributionDataset data = loader.load(CampaignFilter.all());
        return campaignAnalyticsService.analyze(data, requireCampaign(data, campaignId), window(windowDays));
    }

    public List<StageTransitionDTO> stageTransitions(Long campaignId, Integer windowDays) {
        AttributionDataset data = loader.load(CampaignFilter.all());
        return movementDetector.stageTransitions(data, requireCampaign(data, campaignId), window(windowDays));
    }

    private int window(Integer windowDays) {
        return windowDays != null ? windowDays : config.getMovementWindowDays();
    }

    private static Campaign requireCampaign(AttributionDataset data, Long campaignId) {
        return data.campaign(campaignId).orElseThrow(() -> {
            log.warnf("Campaign %d not found", campaignId);
            return new NotFoundException("Campaign " + campaignId + " not found");
        });
    }
}
