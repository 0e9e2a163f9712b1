package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.*;
import dk.trustworks.attribution.dataset.AttributionDataset;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

import static dk.trustworks.attribution.utils.Ratios.*;

/**
 * Multi-touch view of every opportunity with at least one touch.
 * <p>
 * No qualification is applied: this is raw engagement, not pipeline credit. Cost is
 * per-touch economics. Every campaign touching a customer contributes its full nominal
 * cost to that customer, so summing customer costs counts a campaign once per customer
 * it touched. The summary's {@code totalCampaignCosts} counts each campaign once.
 */
@JBossLog
@ApplicationScoped
public class CustomerJourneyAttributor {

    private static final Comparator<CustomerJourneyDTO> BY_TOUCHES_DESC =
            Comparator.comparingInt(CustomerJourneyDTO::getTotalTouches).reversed()
                    .thenComparing(CustomerJourneyDTO::getOpportunityId);

    public CustomerJourneyAnalysisDTO journey(AttributionDataset data) {
        List<CustomerJourneyDTO> customers = new ArrayList<>();
        for (Long opportunityId : data.touchedOpportunityIds()) {
            customers.add(customerJourney(data, opportunityId));
        }
        customers.sort(BY_TOUCHES_DESC);

        Set<Long> campaignIds = data.touches().stream()
                .map(CampaignTouch::campaignId)
                .collect(Collectors.toSet());
        double totalCampaignCosts = campaignIds.stream()
                .map(data::campaign)
                .flatMap(Optional::stream)
                .mapToDouble(Campaign::costOrZero)
                .sum();

        CustomerJourneySummaryDTO summary = summarize(customers, totalCampaignCosts);
        Object optimal = summary.getOptimalTouchCount() != null ? summary.getOptimalTouchCount().getTouches() : "n/a";
        log.debugf("Customer journey over %d customers and %d campaigns, optimal touch count %s",
                Integer.valueOf(customers.size()), Integer.valueOf(campaignIds.size()), optimal);
        return new CustomerJourneyAnalysisDTO(List.copyOf(customers), summary);
    }

    CustomerJourneyDTO customerJourney(AttributionDataset data, Long opportunityId) {
        // One entry per campaign, dated by that campaign's earliest touch of the customer
        Map<Long, JourneyTouchDTO> byCampaign = new LinkedHashMap<>();
        for (CampaignTouch touch : data.touchesForOpportunity(opportunityId)) {
            Optional<Campaign> campaign = data.campaign(touch.campaignId());
            if (campaign.isEmpty()) continue;
            Campaign c = campaign.get();
            LocalDate touchDate = touch.touchDate() != null ? touch.touchDate() : c.startDate();

            JourneyTouchDTO existing = byCampaign.get(c.id());
            if (existing == null) {
                byCampaign.put(c.id(), new JourneyTouchDTO(c.id(), c.name(), c.type(), touchDate, c.costOrZero()));
            } else if (touchDate.isBefore(existing.getTouchDate())) {
                existing.setTouchDate(touchDate);
            }
        }

        List<JourneyTouchDTO> campaigns = new ArrayList<>(byCampaign.values());
        campaigns.sort(Comparator.comparing(JourneyTouchDTO::getTouchDate).thenComparing(JourneyTouchDTO::getCampaignId));

        LocalDate firstTouch = campaigns.isEmpty() ? null : campaigns.get(0).getTouchDate();
        LocalDate lastTouch = campaigns.isEmpty() ? null : campaigns.get(campaigns.size() - 1).getTouchDate();

        CustomerJourneyDTO.CustomerJourneyDTOBuilder journey = CustomerJourneyDTO.builder()
                .opportunityId(opportunityId)
                .customerName(data.opportunity(opportunityId)
                        .map(Opportunity::customerName)
                        .orElse(Opportunity.UNKNOWN_CUSTOMER))
                .totalTouches(campaigns.size())
                .totalNotionalCost(campaigns.stream().mapToDouble(JourneyTouchDTO::getCost).sum())
                .firstTouchDate(firstTouch)
                .lastTouchDate(lastTouch)
                .campaigns(List.copyOf(campaigns));

        Optional<OpportunitySnapshot> current = data.latestSnapshot(opportunityId);
        if (current.isPresent()) {
            OpportunitySnapshot snapshot = current.get();
            journey.currentStage(snapshot.stage())
                    .enteredPipelineDate(snapshot.enteredPipeline())
                    .pipelineValue(snapshot.hasEnteredPipeline() ? snapshot.pipelineValue() : 0.0)
                    .closedWonValue(snapshot.closedWonValue())
                    .closedWon(snapshot.isClosedWon());
            if (firstTouch != null && snapshot.hasEnteredPipeline()) {
                journey.daysFromFirstTouchToPipeline(ChronoUnit.DAYS.between(firstTouch, snapshot.enteredPipeline()));
            }
            if (firstTouch != null && snapshot.isClosedWon() && snapshot.closeDate() != null) {
                journey.daysFromFirstTouchToClose(ChronoUnit.DAYS.between(firstTouch, snapshot.closeDate()));
            }
        }
        return journey.build();
    }

    CustomerJourneySummaryDTO summarize(List<CustomerJourneyDTO> customers, double totalCampaignCosts) {
        int totalCustomers = customers.size();

        // TreeMap: buckets ascending by touch count, only counts that occur
        Map<Integer, List<CustomerJourneyDTO>> buckets = customers.stream()
                .collect(Collectors.groupingBy(CustomerJourneyDTO::getTotalTouches, TreeMap::new, Collectors.toList()));

        List<TouchDistributionDTO> distribution = new ArrayList<>();
        List<CacByTouchDTO> cacByTouch = new ArrayList<>();
        buckets.forEach((touches, bucket) -> {
            distribution.add(new TouchDistributionDTO(touches, bucket.size(), percentage(bucket.size(), totalCustomers)));
            cacByTouch.add(cacBucket(touches, bucket));
        });

        long multiTouch = customers.stream().filter(c -> c.getTotalTouches() > 1).count();
        long enteredPipeline = customers.stream().filter(c -> c.getEnteredPipelineDate() != null).count();
        long closedWon = customers.stream().filter(CustomerJourneyDTO::isClosedWon).count();
        // Customers already in pipeline before their first touch say nothing about touch-to-pipeline time
        double averageDaysToPipeline = customers.stream()
                .map(CustomerJourneyDTO::getDaysFromFirstTouchToPipeline)
                .filter(days -> days != null && days >= 0)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0.0);
        double averageDaysToClose = customers.stream()
                .map(CustomerJourneyDTO::getDaysFromFirstTouchToClose)
                .filter(days -> days != null && days >= 0)
                .mapToLong(Long::longValue)
                .average()
                .orElse(0.0);

        return CustomerJourneySummaryDTO.builder()
                .totalCustomers(totalCustomers)
                .averageTouchesPerCustomer(safeDivide(
                        customers.stream().mapToInt(CustomerJourneyDTO::getTotalTouches).sum(), totalCustomers))
                .multiTouchPercentage(percentage(multiTouch, totalCustomers))
                .pipelineConversionRate(percentage(enteredPipeline, totalCustomers))
                .closeConversionRate(percentage(closedWon, totalCustomers))
                .averageDaysToEnterPipeline(round2(averageDaysToPipeline))
                .averageDaysToClose(round2(averageDaysToClose))
                .totalCampaignCosts(totalCampaignCosts)
                .totalPipelineValue(customers.stream().mapToDouble(CustomerJourneyDTO::getPipelineValue).sum())
                .totalClosedWonValue(customers.stream().mapToDouble(CustomerJourneyDTO::getClosedWonValue).sum())
                .touchDistribution(List.copyOf(distribution))
                .cacByTouch(List.copyOf(cacByTouch))
                .optimalTouchCount(optimalTouchCount(cacByTouch))
                .touchEfficiency(touchEfficiency(cacByTouch))
                .build();
    }

    private static CacByTouchDTO cacBucket(int touches, List<CustomerJourneyDTO> bucket) {
        double cumulativeCost = bucket.stream().mapToDouble(CustomerJourneyDTO::getTotalNotionalCost).sum();
        double pipelineValue = bucket.stream().mapToDouble(CustomerJourneyDTO::getPipelineValue).sum();
        return CacByTouchDTO.builder()
                .touchCount(touches)
                .customers(bucket.size())
                .cumulativeCost(cumulativeCost)
                .pipelineValue(pipelineValue)
                .closedWonValue(bucket.stream().mapToDouble(CustomerJourneyDTO::getClosedWonValue).sum())
                .closedWonCount((int) bucket.stream().filter(CustomerJourneyDTO::isClosedWon).count())
                .efficiency(safeDivide(pipelineValue, cumulativeCost))
                .build();
    }

    /**
     * Bucket with the highest efficiency; on a tie the lower touch count wins.
     * Null when there are no buckets.
     */
    static OptimalTouchCountDTO optimalTouchCount(List<CacByTouchDTO> cacByTouch) {
        CacByTouchDTO best = null;
        for (CacByTouchDTO bucket : cacByTouch) {
            if (best == null || bucket.getEfficiency() > best.getEfficiency()) {
                best = bucket;
            }
        }
        if (best == null) return null;

        String recommendation = String.format(Locale.ROOT,
                "Optimal touch count is %d with $%,.2f pipeline per $1 of campaign cost across %d customers",
                best.getTouchCount(), best.getEfficiency(), best.getCustomers());
        return new OptimalTouchCountDTO(best.getTouchCount(), best.getEfficiency(), recommendation);
    }

    /**
     * Most and least efficient touch buckets. Ties go to the lower touch count for the
     * most efficient bucket and to the higher one for the least efficient.
     */
    static TouchEfficiencyDTO touchEfficiency(List<CacByTouchDTO> cacByTouch) {
        CacByTouchDTO most = null;
        CacByTouchDTO least = null;
        for (CacByTouchDTO bucket : cacByTouch) {
            if (most == null || bucket.getEfficiency() > most.getEfficiency()) most = bucket;
            if (least == null || bucket.getEfficiency() <= least.getEfficiency()) least = bucket;
        }
        if (most == null) return null;

        String recommendation = String.format(Locale.ROOT,
                "%d touches return $%,.2f pipeline per $1 of campaign cost against $%,.2f for %d touches",
                most.getTouchCount(), most.getEfficiency(), least.getEfficiency(), least.getTouchCount());
        return new TouchEfficiencyDTO(bucketEfficiency(most), bucketEfficiency(least), recommendation);
    }

    private static TouchBucketEfficiencyDTO bucketEfficiency(CacByTouchDTO bucket) {
        return new TouchBucketEfficiencyDTO(bucket.getTouchCount(),
                safeDivide(bucket.getCumulativeCost(), bucket.getCustomers()), bucket.getEfficiency());
    }
}
