package dk.trustworks.attribution.aggregates.attribution.resources;

import dk.trustworks.attribution.aggregates.attribution.dto.*;
import dk.trustworks.attribution.aggregates.attribution.services.MarketingAttributionService;
import dk.trustworks.attribution.dataset.CampaignFilter;
import io.quarkus.cache.CacheInvalidateAll;
import io.quarkus.cache.CacheResult;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.List;

/**
 * Memoizes whole reports for the HTTP layer. Keys are the report arguments; the report
 * name is part of every key so two reports with the same arguments never share an entry.
 * Entries expire after the TTL configured for the cache.
 */
@JBossLog
@ApplicationScoped
public class AttributionReportCache {

    static final String CACHE_NAME = "marketing-attribution";

    @Inject
    MarketingAttributionService service;

    @CacheResult(cacheName = CACHE_NAME)
    public CampaignTypeAnalysisDTO campaignTypes(String report, CampaignFilter filter) {
        return service.campaignTypes(filter);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public MovementAnalysisDTO newPipeline(String report, CampaignFilter filter, Integer windowDays) {
        return service.newPipeline(filter, windowDays);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public MovementAnalysisDTO stageAdvances(String report, CampaignFilter filter, Integer windowDays) {
        return service.stageAdvances(filter, windowDays);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public CustomerJourneyAnalysisDTO customerJourney(String report, CampaignFilter filter) {
        return service.customerJourney(filter);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public AttendeeEffectivenessDTO attendeeEffectiveness(String report, CampaignFilter filter) {
        return service.attendeeEffectiveness(filter);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public TargetAccountComparisonDTO targetAccounts(String report, CampaignFilter filter) {
        return service.targetAccounts(filter);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public SegmentationMatrixDTO strategicMatrix(String report, CampaignFilter filter) {
        return service.strategicMatrix(filter);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public ReallocationAnalysisDTO reallocation(String report, CampaignFilter filter) {
        return service.reallocation(filter);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public ExecutiveSummaryDTO executiveSummary(String report, CampaignFilter filter) {
        return service.executiveSummary(filter);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public CampaignAnalyticsDTO campaignAnalytics(String report, Long campaignId, Integer windowDays) {
        return service.campaignAnalytics(campaignId, windowDays);
    }

    @CacheResult(cacheName = CACHE_NAME)
    public List<StageTransitionDTO> stageTransitions(String report, Long campaignId, Integer windowDays) {
        return service.stageTransitions(campaignId, windowDays);
    }

    @CacheInvalidateAll(cacheName = CACHE_NAME)
    public void invalidateAll() {
        log.info("Marketing attribution report cache cleared");
    }
}
