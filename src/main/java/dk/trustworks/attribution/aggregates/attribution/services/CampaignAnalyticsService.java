package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.*;
import dk.trustworks.attribution.dataset.AttributionDataset;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static dk.trustworks.attribution.utils.Ratios.*;

/**
 * Analytics for a single campaign, using the campaign on its own as the qualification group.
 * <p>
 * Close acceleration and stage progression look at the window after the campaign start.
 * Touch points count the distinct campaigns that touched a qualifying opportunity,
 * this one included.
 */
@JBossLog
@ApplicationScoped
public class CampaignAnalyticsService {

    @Inject
    QualificationFilter qualificationFilter;

    @Inject
    MovementDetector movementDetector;

    public CampaignAnalyticsDTO analyze(AttributionDataset data, Campaign campaign, int windowDays) {
        Map<Long, OpportunitySnapshot> qualifying = qualificationFilter.qualifyingSnapshots(data, Set.of(campaign.id()));

        int closedWonCount = 0;
        int closedLostCount = 0;
        int openCount = 0;
        int shared = 0;
        int targetCustomers = 0;
        int targetWon = 0;
        int targetLost = 0;
        double closedWonValue = 0.0;
        double openValue = 0.0;

        for (Map.Entry<Long, OpportunitySnapshot> entry : qualifying.entrySet()) {
            OpportunitySnapshot snapshot = entry.getValue();
            if (snapshot.isOpen()) {
                openCount++;
                openValue += snapshot.value();
            } else if (snapshot.isClosedWon()) {
                closedWonCount++;
                closedWonValue += snapshot.value();
            } else {
                closedLostCount++;
            }
            if (touchPoints(data, entry.getKey()) > 1) shared++;
            if (isTargetAccount(data, entry.getKey())) {
                targetCustomers++;
                if (snapshot.isClosedWon()) targetWon++;
                if (snapshot.isClosedLost()) targetLost++;
            }
        }

        int totalAttendees = 0;
        for (CampaignTouch touch : data.touchesForCampaign(campaign.id())) {
            if (qualifying.containsKey(touch.opportunityId())) totalAttendees += touch.attendeesOrZero();
        }

        int qualifyingCount = qualifying.size();
        int touchedCount = (int) data.touchesForCampaign(campaign.id()).stream()
                .map(CampaignTouch::opportunityId)
                .distinct()
                .count();
        log.debugf("Campaign %d analytics: %d touched, %d qualifying, %d won, %d shared",
                campaign.id(), touchedCount, qualifyingCount, closedWonCount, shared);

        return CampaignAnalyticsDTO.builder()
                .campaignId(campaign.id())
                .campaignName(campaign.name())
                .campaignType(campaign.type())
                .cost(campaign.costOrZero())
                .startDate(campaign.startDate())
                .windowDays(windowDays)
                .touchedOpportunities(touchedCount)
                .qualifyingOpportunities(qualifyingCount)
                .closedWonCount(closedWonCount)
                .closedWonValue(closedWonValue)
                .openCount(openCount)
                .openValue(openValue)
                .closedLostCount(closedLostCount)
                .winRate(winRate(closedWonCount, closedLostCount))
                .closeRate(percentage(closedWonCount, qualifyingCount))
                .cac(closedWonCount > 0 ? campaign.costOrZero() / closedWonCount : null)
                .totalAttendees(totalAttendees)
                .sharedOpportunities(shared)
                .influenceRate(percentage(shared, qualifyingCount))
                .campaignInfluenceScore((qualifyingCount - shared) + 0.5 * shared)
                .targetAccountCustomers(targetCustomers)
                .targetAccountWinRate(winRate(targetWon, targetLost))
                .closeAcceleration(closeAcceleration(campaign, qualifying, windowDays))
                .stageProgression(stageProgression(data, campaign, windowDays, touchedCount))
                .touchPointEffectiveness(touchPointEffectiveness(data, qualifying))
                .build();
    }

    /**
     * Days are counted between the campaign start and the close date in either direction.
     */
    CloseAccelerationDTO closeAcceleration(Campaign campaign, Map<Long, OpportunitySnapshot> qualifying, int windowDays) {
        List<Long> daysToClose = qualifying.values().stream()
                .filter(OpportunitySnapshot::isClosedWon)
                .map(OpportunitySnapshot::closeDate)
                .filter(closeDate -> closeDate != null)
                .map(closeDate -> Math.abs(ChronoUnit.DAYS.between(campaign.startDate(), closeDate)))
                .toList();
        long closedWon = qualifying.values().stream().filter(OpportunitySnapshot::isClosedWon).count();
        int closedWithinWindow = (int) daysToClose.stream().filter(days -> days <= windowDays).count();
        double averageDays = daysToClose.stream().mapToLong(Long::longValue).average().orElse(0.0);

        return new CloseAccelerationDTO(closedWithinWindow, round2(averageDays), percentage(closedWithinWindow, closedWon));
    }

    StageProgressionDTO stageProgression(AttributionDataset data, Campaign campaign, int windowDays, int touchedCount) {
        List<OpportunityMovementDTO> advances =
                movementDetector.stageAdvancesForCampaign(data, campaign, windowDays).getMovements();
        LocalDate start = campaign.startDate();
        double averageDays = advances.stream()
                .mapToLong(m -> ChronoUnit.DAYS.between(start, m.getMovementDate()))
                .average()
                .orElse(0.0);
        return new StageProgressionDTO(advances.size(), percentage(advances.size(), touchedCount), round2(averageDays));
    }

    TouchPointEffectivenessDTO touchPointEffectiveness(AttributionDataset data, Map<Long, OpportunitySnapshot> qualifying) {
        int single = 0;
        int multi = 0;
        int singleWon = 0;
        int multiWon = 0;
        long touchPointSum = 0;
        for (Map.Entry<Long, OpportunitySnapshot> entry : qualifying.entrySet()) {
            int touchPoints = touchPoints(data, entry.getKey());
            touchPointSum += touchPoints;
            boolean won = entry.getValue().isClosedWon();
            if (touchPoints > 1) {
                multi++;
                if (won) multiWon++;
            } else {
                single++;
                if (won) singleWon++;
            }
        }
        return new TouchPointEffectivenessDTO(
                safeDivide(touchPointSum, qualifying.size()),
                single,
                multi,
                percentage(singleWon, single),
                percentage(multiWon, multi));
    }

    private static int touchPoints(AttributionDataset data, Long opportunityId) {
        return data.touchesForOpportunity(opportunityId).stream()
                .map(CampaignTouch::campaignId)
                .collect(Collectors.toSet())
                .size();
    }

    private static boolean isTargetAccount(AttributionDataset data, Long opportunityId) {
        return data.opportunity(opportunityId)
                .map(Opportunity::targetAccount)
                .map(Boolean.TRUE::equals)
                .orElse(false);
    }
}
