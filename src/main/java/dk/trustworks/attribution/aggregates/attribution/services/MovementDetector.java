package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.*;
import dk.trustworks.attribution.dataset.AttributionDataset;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import dk.trustworks.attribution.model.enums.MovementType;
import dk.trustworks.attribution.model.enums.SalesStage;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.time.LocalDate;
import java.util.*;
import java.util.function.BiFunction;

import static dk.trustworks.attribution.utils.Ratios.safeDivide;

/**
 * Detects pipeline movement that happened within a fixed window after a campaign started.
 * <p>
 * Two variants:
 * <ul>
 *   <li><b>New pipeline</b>: a touched opportunity whose current snapshot entered the
 *       pipeline within [start, start + window]. Closed Lost entries are excluded and
 *       only counted.</li>
 *   <li><b>Stage advance</b>: a touched opportunity whose state at the end of the window
 *       (latest snapshot on or before start + window, taken on or after start) ranks
 *       strictly higher than its state before that snapshot.</li>
 * </ul>
 * Per type, cost is summed once per campaign and an opportunity is counted once, using
 * the detection of the earliest campaign of the type.
 */
@JBossLog
@ApplicationScoped
public class MovementDetector {

    public MovementAnalysisDTO detectNewPipeline(AttributionDataset data, int windowDays) {
        return analyze(data, MovementType.NEW_PIPELINE, windowDays,
                (campaign, window) -> newPipelineForCampaign(data, campaign, window));
    }

    public MovementAnalysisDTO detectStageAdvances(AttributionDataset data, int windowDays) {
        return analyze(data, MovementType.STAGE_ADVANCE, windowDays,
                (campaign, window) -> stageAdvancesForCampaign(data, campaign, window));
    }

    /**
     * Opportunities touched by the campaign that entered the pipeline inside the window.
     */
    public CampaignMovementDTO newPipelineForCampaign(AttributionDataset data, Campaign campaign, int windowDays) {
        validateWindow(windowDays);
        LocalDate start = campaign.startDate();
        LocalDate end = start.plusDays(windowDays);

        List<OpportunityMovementDTO> movements = new ArrayList<>();
        List<Long> excludedClosedLost = new ArrayList<>();

        for (Long opportunityId : touchedOpportunities(data, campaign)) {
            Optional<OpportunitySnapshot> current = data.latestSnapshot(opportunityId);
            if (current.isEmpty() || !within(current.get().enteredPipeline(), start, end)) continue;

            OpportunitySnapshot snapshot = current.get();
            if (snapshot.isClosedLost()) {
                excludedClosedLost.add(opportunityId);
                continue;
            }
            movements.add(new OpportunityMovementDTO(opportunityId, customerName(data, opportunityId),
                    null, snapshot.stage(), snapshot.enteredPipeline(), snapshot.value(), snapshot.isClosedWon()));
        }

        return new CampaignMovementDTO(campaign.id(), campaign.name(), campaign.type(),
                MovementType.NEW_PIPELINE, List.copyOf(movements), List.copyOf(excludedClosedLost));
    }

    /**
     * Positive stage movements of opportunities touched by the campaign.
     * <p>
     * The later state is the latest snapshot on or before start + window and must be
     * dated on or after the campaign start. The earlier state is the latest snapshot on or
     * before the campaign start that precedes it, or, when the history only begins after
     * the start, the first snapshot observed. At most one movement per opportunity.
     */
    public CampaignMovementDTO stageAdvancesForCampaign(AttributionDataset data, Campaign campaign, int windowDays) {
        validateWindow(windowDays);
        LocalDate start = campaign.startDate();
        LocalDate end = start.plusDays(windowDays);

        List<OpportunityMovementDTO> movements = new ArrayList<>();
        for (Long opportunityId : touchedOpportunities(data, campaign)) {
            Optional<OpportunitySnapshot> after = data.latestSnapshot(opportunityId, end);
            if (after.isEmpty() || after.get().snapshotDate().isBefore(start)) continue;

            Optional<OpportunitySnapshot> before = baseline(data.history(opportunityId), after.get(), start);
            if (before.isEmpty()) continue;

            OpportunitySnapshot from = before.get();
            OpportunitySnapshot to = after.get();
            if (isPositiveMovement(from.stage(), to.stage())) {
                movements.add(new OpportunityMovementDTO(opportunityId, customerName(data, opportunityId),
                        from.stage(), to.stage(), to.snapshotDate(), to.value(), to.isClosedWon()));
            }
        }

        return new CampaignMovementDTO(campaign.id(), campaign.name(), campaign.type(),
                MovementType.STAGE_ADVANCE, List.copyOf(movements), List.of());
    }

    /**
     * Every stage label change between consecutive snapshots dated inside
     * [start, start + window], grouped by from/to stage and sorted by count descending.
     */
    public List<StageTransitionDTO> stageTransitions(AttributionDataset data, Campaign campaign, int windowDays) {
        validateWindow(windowDays);
        LocalDate start = campaign.startDate();
        LocalDate end = start.plusDays(windowDays);

        Map<List<String>, StageTransitionDTO> transitions = new LinkedHashMap<>();
        for (Long opportunityId : touchedOpportunities(data, campaign)) {
            OpportunitySnapshot previous = null;
            for (OpportunitySnapshot snapshot : data.history(opportunityId)) {
                if (snapshot.stage() == null || !within(snapshot.snapshotDate(), start, end)) continue;
                if (previous != null && !previous.stage().equals(snapshot.stage())) {
                    StageTransitionDTO transition = transitions.computeIfAbsent(
                            List.of(previous.stage(), snapshot.stage()),
                            key -> new StageTransitionDTO(key.get(0), key.get(1), 0, new ArrayList<>()));
                    transition.setCount(transition.getCount() + 1);
                    transition.getCustomers().add(new StageTransitionDTO.Customer(
                            customerName(data, opportunityId), opportunityId, snapshot.snapshotDate()));
                }
                previous = snapshot;
            }
        }

        List<StageTransitionDTO> result = new ArrayList<>(transitions.values());
        result.forEach(t -> t.getCustomers().sort(
                Comparator.comparing(StageTransitionDTO.Customer::getTransitionDate).reversed()));
        result.forEach(t -> t.setCustomers(List.copyOf(t.getCustomers())));
        result.sort(Comparator.comparingInt(StageTransitionDTO::getCount).reversed()
                .thenComparing(StageTransitionDTO::getFromStage)
                .thenComparing(StageTransitionDTO::getToStage));
        return List.copyOf(result);
    }

    /**
     * True when the stage changed and the new stage ranks strictly higher than the old one.
     * Stages without a rank (Closed Lost, unknown labels) never take part in a positive movement.
     */
    public static boolean isPositiveMovement(String fromStage, String toStage) {
        if (fromStage == null || toStage == null || fromStage.equalsIgnoreCase(toStage)) return false;
        OptionalInt fromRank = SalesStage.rankOf(fromStage);
        OptionalInt toRank = SalesStage.rankOf(toStage);
        return fromRank.isPresent() && toRank.isPresent() && toRank.getAsInt() > fromRank.getAsInt();
    }

    private MovementAnalysisDTO analyze(AttributionDataset data, MovementType type, int windowDays,
                                        BiFunction<Campaign, Integer, CampaignMovementDTO> detector) {
        validateWindow(windowDays);

        List<CampaignMovementDTO> perCampaign = new ArrayList<>();
        Map<String, List<Campaign>> campaignsByType = data.campaignsByType();
        Map<String, List<CampaignMovementDTO>> detectionsByType = new LinkedHashMap<>();

        campaignsByType.forEach((campaignType, campaigns) -> {
            for (Campaign campaign : campaigns) {
                CampaignMovementDTO detection = detector.apply(campaign, windowDays);
                perCampaign.add(detection);
                detectionsByType.computeIfAbsent(campaignType, k -> new ArrayList<>()).add(detection);
            }
        });

        List<MovementMetricsDTO> rows = new ArrayList<>();
        campaignsByType.forEach((campaignType, campaigns) ->
                rows.add(rollup(campaignType, type, windowDays, campaigns,
                        detectionsByType.getOrDefault(campaignType, List.of()))));
        rows.sort(Comparator.comparingDouble(MovementMetricsDTO::getMovementValue).reversed()
                .thenComparing(MovementMetricsDTO::getCampaignType));

        MovementMetricsDTO total = rollup(CampaignTypeAggregator.ALL_CAMPAIGNS, type, windowDays,
                data.campaigns(), perCampaign);

        log.debugf("%s detection over %d campaigns with %d day window: %d opportunities",
                type, perCampaign.size(), windowDays, total.getOpportunityCount());
        return new MovementAnalysisDTO(type, windowDays, List.copyOf(rows), total, List.copyOf(perCampaign));
    }

    private MovementMetricsDTO rollup(String campaignType, MovementType type, int windowDays,
                                      List<Campaign> campaigns, List<CampaignMovementDTO> detections) {
        double totalCost = campaigns.stream().mapToDouble(Campaign::costOrZero).sum();

        // Campaigns arrive in start-date order, so the earliest campaign's detection wins
        Map<Long, OpportunityMovementDTO> counted = new LinkedHashMap<>();
        Set<Long> excludedClosedLost = new HashSet<>();
        for (CampaignMovementDTO detection : detections) {
            detection.getMovements().forEach(m -> counted.putIfAbsent(m.getOpportunityId(), m));
            excludedClosedLost.addAll(detection.getExcludedClosedLostOpportunityIds());
        }

        double movementValue = 0.0;
        double closedWonValue = 0.0;
        double activeValue = 0.0;
        int closedWonCount = 0;
        int activeCount = 0;
        for (OpportunityMovementDTO movement : counted.values()) {
            movementValue += movement.getValue();
            if (movement.isClosedWon()) {
                closedWonCount++;
                closedWonValue += movement.getValue();
            } else {
                activeCount++;
                activeValue += movement.getValue();
            }
        }

        return MovementMetricsDTO.builder()
                .campaignType(campaignType)
                .movementType(type)
                .windowDays(windowDays)
                .totalCampaigns(campaigns.size())
                .totalCost(totalCost)
                .opportunityCount(counted.size())
                .movementValue(movementValue)
                .closedWonCount(closedWonCount)
                .closedWonValue(closedWonValue)
                .activeCount(activeCount)
                .activeValue(activeValue)
                .excludedClosedLostCount(excludedClosedLost.size())
                .costEfficiency(safeDivide(movementValue, totalCost))
                .build();
    }

    private static Optional<OpportunitySnapshot> baseline(List<OpportunitySnapshot> history,
                                                          OpportunitySnapshot after, LocalDate campaignStart) {
        OpportunitySnapshot first = null;
        OpportunitySnapshot atStart = null;
        for (OpportunitySnapshot snapshot : history) {
            if (!snapshot.snapshotDate().isBefore(after.snapshotDate())) break;
            if (first == null) first = snapshot;
            if (!snapshot.snapshotDate().isAfter(campaignStart)) atStart = snapshot;
        }
        return Optional.ofNullable(atStart != null ? atStart : first);
    }

    private static Set<Long> touchedOpportunities(AttributionDataset data, Campaign campaign) {
        Set<Long> ids = new LinkedHashSet<>();
        for (CampaignTouch touch : data.touchesForCampaign(campaign.id())) {
            ids.add(touch.opportunityId());
        }
        return ids;
    }

    private static String customerName(AttributionDataset data, Long opportunityId) {
        return data.opportunity(opportunityId).map(Opportunity::customerName).orElse(Opportunity.UNKNOWN_CUSTOMER);
    }

    private static boolean within(LocalDate date, LocalDate start, LocalDate end) {
        return date != null && !date.isBefore(start) && !date.isAfter(end);
    }

    private static void validateWindow(int windowDays) {
        if (windowDays < 0) {
            throw new IllegalArgumentException("Movement window must not be negative: " + windowDays);
        }
    }
}
