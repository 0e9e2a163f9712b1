package dk.trustworks.attribution.aggregates.attribution.resources;

import dk.trustworks.attribution.aggregates.attribution.dto.*;
import dk.trustworks.attribution.config.AttributionConfig;
import dk.trustworks.attribution.dataset.CampaignFilter;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import static dk.trustworks.attribution.utils.DateUtils.dateIt;

/**
 * Campaign attribution reports. Every report accepts an optional campaign selection:
 * {@code types} (repeatable or comma separated), {@code fromDate} and {@code toDate}
 * (yyyy-MM-dd, inclusive, on the campaign start date).
 */
@Tag(name = "Marketing Attribution")
@JBossLog
@Path("/marketing/attribution")
@RequestScoped
@Produces(MediaType.APPLICATION_JSON)
public class MarketingAttributionResource {

    @Inject
    AttributionReportCache reports;

    @Inject
    AttributionConfig config;

    @GET
    @Path("/campaign-types")
    @Operation(summary = "Deduplicated pipeline, revenue and ROI per campaign type")
    public CampaignTypeAnalysisDTO campaignTypes(@QueryParam("types") List<String> types,
                                                 @QueryParam("fromDate") String fromDate,
                                                 @QueryParam("toDate") String toDate) {
        return reports.campaignTypes("campaign-types", filter(types, fromDate, toDate));
    }

    @GET
    @Path("/movements/new-pipeline")
    @Operation(summary = "Opportunities entering the pipeline within the window after each campaign")
    public MovementAnalysisDTO newPipeline(@QueryParam("types") List<String> types,
                                           @QueryParam("fromDate") String fromDate,
                                           @QueryParam("toDate") String toDate,
                                           @QueryParam("windowDays") Integer windowDays) {
        return reports.newPipeline("new-pipeline", filter(types, fromDate, toDate), window(windowDays));
    }

    @GET
    @Path("/movements/stage-advance")
    @Operation(summary = "Opportunities advancing a sales stage within the window after each campaign")
    public MovementAnalysisDTO stageAdvance(@QueryParam("types") List<String> types,
                                            @QueryParam("fromDate") String fromDate,
                                            @QueryParam("toDate") String toDate,
                                            @QueryParam("windowDays") Integer windowDays) {
        return reports.stageAdvances("stage-advance", filter(types, fromDate, toDate), window(windowDays));
    }

    @GET
    @Path("/customer-journey")
    @Operation(summary = "Touches per customer, cost per touch count and the optimal touch count")
    public CustomerJourneyAnalysisDTO customerJourney(@QueryParam("types") List<String> types,
                                                      @QueryParam("fromDate") String fromDate,
                                                      @QueryParam("toDate") String toDate) {
        return reports.customerJourney("customer-journey", filter(types, fromDate, toDate));
    }

    @GET
    @Path("/attendee-effectiveness")
    public AttendeeEffectivenessDTO attendeeEffectiveness(@QueryParam("types") List<String> types,
                                                          @QueryParam("fromDate") String fromDate,
                                                          @QueryParam("toDate") String toDate) {
        return reports.attendeeEffectiveness("attendee-effectiveness", filter(types, fromDate, toDate));
    }

    @GET
    @Path("/target-accounts")
    public TargetAccountComparisonDTO targetAccounts(@QueryParam("types") List<String> types,
                                                     @QueryParam("fromDate") String fromDate,
                                                     @QueryParam("toDate") String toDate) {
        return reports.targetAccounts("target-accounts", filter(types, fromDate, toDate));
    }

    @GET
    @Path("/strategic-matrix")
    public SegmentationMatrixDTO strategicMatrix(@QueryParam("types") List<String> types,
                                                 @QueryParam("fromDate") String fromDate,
                                                 @QueryParam("toDate") String toDate) {
        return reports.strategicMatrix("strategic-matrix", filter(types, fromDate, toDate));
    }

    @GET
    @Path("/reallocation")
    @Operation(summary = "Campaign types that take a large cost share at below-average ROI")
    public ReallocationAnalysisDTO reallocation(@QueryParam("types") List<String> types,
                                                @QueryParam("fromDate") String fromDate,
                                                @QueryParam("toDate") String toDate) {
        return reports.reallocation("reallocation", filter(types, fromDate, toDate));
    }

    @GET
    @Path("/executive-summary")
    public ExecutiveSummaryDTO executiveSummary(@QueryParam("types") List<String> types,
                                                @QueryParam("fromDate") String fromDate,
                                                @QueryParam("toDate") String toDate) {
        return reports.executiveSummary("executive-summary", filter(types, fromDate, toDate));
    }

    @GET
    @Path("/campaigns/{campaignId}/analytics")
    public CampaignAnalyticsDTO campaignAnalytics(@PathParam("campaignId") Long campaignId,
                                                  @QueryParam("windowDays") Integer windowDays) {
        return reports.campaignAnalytics("campaign-analytics", campaignId, window(windowDays));
    }

    @GET
    @Path("/campaigns/{campaignId}/stage-transitions")
    public List<StageTransitionDTO> stageTransitions(@PathParam("campaignId") Long campaignId,
                                                     @QueryParam("windowDays") Integer windowDays) {
        return reports.stageTransitions("stage-transitions", campaignId, window(windowDays));
    }

    @DELETE
    @Path("/cache")
    @Operation(summary = "Drop all cached attribution reports")
    public void clearCache() {
        reports.invalidateAll();
    }

    static CampaignFilter filter(List<String> types, String fromDate, String toDate) {
        Set<String> typeSet = new LinkedHashSet<>();
        if (types != null) {
            for (String value : types) {
                if (value == null) continue;
                for (String type : value.split(",")) {
                    if (!type.isBlank()) typeSet.add(type.trim());
                }
            }
        }
        try {
            return new CampaignFilter(typeSet, dateIt(fromDate), dateIt(toDate));
        } catch (IllegalArgumentException e) {
            throw new BadRequestException(e.getMessage(), e);
        }
    }

    private int window(Integer windowDays) {
        if (windowDays == null) return config.getMovementWindowDays();
        if (windowDays < 0) throw new BadRequestException("windowDays must not be negative");
        return windowDays;
    }
}
