package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.CampaignTypeAnalysisDTO;
import dk.trustworks.attribution.aggregates.attribution.dto.CampaignTypeMetricsDTO;
import dk.trustworks.attribution.dataset.AttributionDataset;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.*;

import static dk.trustworks.attribution.utils.Ratios.*;

/**
 * Rolls qualifying opportunities up into cost, pipeline and return metrics per campaign type.
 * <p>
 * Each type is one campaign group for the {@link QualificationFilter}, so an opportunity
 * touched by several campaigns of the same type counts once for that type. The grand
 * total runs the filter once more over all campaigns; because one opportunity may qualify
 * under several types, the total is not the sum of the type rows.
 */
@JBossLog
@ApplicationScoped
public class CampaignTypeAggregator {

    public static final String ALL_CAMPAIGNS = "All Campaigns";

    private static final Comparator<CampaignTypeMetricsDTO> BY_PIPELINE_DESC =
            Comparator.comparingDouble(CampaignTypeMetricsDTO::getPipelineValue).reversed()
                    .thenComparing(CampaignTypeMetricsDTO::getCampaignType);

    @Inject
    QualificationFilter qualificationFilter;

    /**
     * Aggregate every campaign in the dataset, grouped by campaign type.
     */
    public CampaignTypeAnalysisDTO aggregate(AttributionDataset data) {
        return aggregate(data, data.campaignsByType());
    }

    /**
     * @param campaignsByType campaigns to aggregate keyed by type
     * @return type rows sorted by pipeline value descending, and the grand total
     */
    public CampaignTypeAnalysisDTO aggregate(AttributionDataset data, Map<String, List<Campaign>> campaignsByType) {
        List<CampaignTypeMetricsDTO> rows = new ArrayList<>();
        List<Campaign> allCampaigns = new ArrayList<>();

        campaignsByType.forEach((type, campaigns) -> {
            rows.add(metricsFor(data, type, campaigns));
            allCampaigns.addAll(campaigns);
        });
        rows.sort(BY_PIPELINE_DESC);

        CampaignTypeMetricsDTO total = metricsFor(data, ALL_CAMPAIGNS, allCampaigns);
        log.debugf("Campaign type aggregation: %d types, %d qualifying opportunities overall",
                rows.size(), total.getTotalCustomers());
        return new CampaignTypeAnalysisDTO(List.copyOf(rows), total);
    }

    /**
     * Metrics for one group of campaigns treated as a single type.
     */
    public CampaignTypeMetricsDTO metricsFor(AttributionDataset data, String campaignType, Collection<Campaign> campaigns) {
        // A campaign listed twice still costs once
        Map<Long, Campaign> uniqueCampaigns = new LinkedHashMap<>();
        campaigns.forEach(c -> uniqueCampaigns.putIfAbsent(c.id(), c));

        double totalCost = uniqueCampaigns.values().stream().mapToDouble(Campaign::costOrZero).sum();
        Map<Long, OpportunitySnapshot> qualifying =
                qualificationFilter.qualifyingSnapshots(data, uniqueCampaigns.keySet());

        double pipelineValue = 0.0;
        double openPipelineValue = 0.0;
        double closedWonValue = 0.0;
        int closedWonCount = 0;
        int closedLostCount = 0;
        int openCount = 0;
        int targetAccountCustomers = 0;

        for (Map.Entry<Long, OpportunitySnapshot> entry : qualifying.entrySet()) {
            OpportunitySnapshot snapshot = entry.getValue();
            pipelineValue += snapshot.pipelineValue();
            if (snapshot.isOpen()) {
                openCount++;
                openPipelineValue += snapshot.value();
            } else if (snapshot.isClosedWon()) {
                closedWonCount++;
                closedWonValue += snapshot.value();
            } else {
                closedLostCount++;
            }
            boolean target = data.opportunity(entry.getKey())
                    .map(Opportunity::targetAccount)
                    .map(Boolean.TRUE::equals)
                    .orElse(false);
            if (target) targetAccountCustomers++;
        }

        int totalAttendees = 0;
        for (CampaignTouch touch : data.touchesForCampaigns(uniqueCampaigns.keySet())) {
            if (qualifying.containsKey(touch.opportunityId())) {
                totalAttendees += touch.attendeesOrZero();
            }
        }

        int totalCampaigns = uniqueCampaigns.size();
        int totalCustomers = qualifying.size();

        return CampaignTypeMetricsDTO.builder()
                .campaignType(campaignType)
                .totalCampaigns(totalCampaigns)
                .totalCost(totalCost)
                .totalCustomers(totalCustomers)
                .targetAccountCustomers(targetAccountCustomers)
                .targetAccountPercentage(percentage(targetAccountCustomers, totalCustomers))
                .pipelineValue(pipelineValue)
                .openPipelineValue(openPipelineValue)
                .closedWonValue(closedWonValue)
                .closedWonCount(closedWonCount)
                .closedLostCount(closedLostCount)
                .openCount(openCount)
                .totalAttendees(totalAttendees)
                .winRate(winRate(closedWonCount, closedLostCount))
                .roi(percentage(closedWonValue, totalCost))
                .costEfficiency(safeDivide(pipelineValue, totalCost))
                .attendeeEfficiency(safeDivide(pipelineValue, totalAttendees))
                .averageCostPerCampaign(safeDivide(totalCost, totalCampaigns))
                .averageCustomersPerCampaign(safeDivide(totalCustomers, totalCampaigns))
                .build();
    }
}
