package dk.trustworks.attribution.aggregates.attribution.services;

import dk.trustworks.attribution.aggregates.attribution.dto.*;
import dk.trustworks.attribution.dataset.AttributionDataset;
import dk.trustworks.attribution.model.Campaign;
import dk.trustworks.attribution.model.CampaignTouch;
import dk.trustworks.attribution.model.Opportunity;
import dk.trustworks.attribution.model.OpportunitySnapshot;
import dk.trustworks.attribution.utils.Ratios;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

import static dk.trustworks.attribution.utils.Ratios.*;

/**
 * Cross-tabulates touched opportunities by attendee count and target-account flag.
 * <p>
 * All views work on the current snapshot of each touched opportunity; opportunities
 * without any snapshot are left out. Within a segment an opportunity is counted once,
 * attendees are summed per touch and cost is summed once per distinct campaign behind
 * the segment's touches. Value is pipeline value, so Closed Lost contributes 0.
 */
@JBossLog
@ApplicationScoped
public class SegmentationService {

    public static final String TARGET = "target";
    public static final String NON_TARGET = "non-target";

    static final List<AttendeeRange> EFFECTIVENESS_RANGES = List.of(
            new AttendeeRange("1-2", 1, 2),
            new AttendeeRange("3-5", 3, 5),
            new AttendeeRange("6-10", 6, 10),
            new AttendeeRange("11+", 11, Integer.MAX_VALUE));

    static final List<AttendeeRange> MATRIX_RANGES = List.of(
            new AttendeeRange("1-2", 1, 2),
            new AttendeeRange("3-5", 3, 5),
            new AttendeeRange("6+", 6, Integer.MAX_VALUE));

    record AttendeeRange(String label, int min, int max) {
        boolean contains(CampaignTouch touch) {
            return touch.attendees() != null && touch.attendees() >= min && touch.attendees() <= max;
        }
    }

    /**
     * Attendee-effectiveness segmentation over the ranges 1-2, 3-5, 6-10 and 11+. The optimal
     * range has the highest pipeline per attendee; ties go to the smaller range.
     */
    public AttendeeEffectivenessDTO attendeeEffectiveness(AttributionDataset data) {
        List<AttendeeSegmentDTO> segments = new ArrayList<>();
        for (AttendeeRange range : EFFECTIVENESS_RANGES) {
            Segment segment = Segment.of(data, touchesWhere(data, range::contains));
            segments.add(AttendeeSegmentDTO.builder()
                    .attendeeRange(range.label())
                    .customerCount(segment.customerCount())
                    .totalAttendees(segment.totalAttendees)
                    .totalCost(segment.totalCost)
                    .totalPipelineValue(segment.pipelineValue)
                    .averageDealSize(segment.averageDealSize())
                    .winRate(segment.winRate())
                    .costPerAttendee(safeDivide(segment.totalCost, segment.totalAttendees))
                    .pipelinePerAttendee(segment.pipelinePerAttendee())
                    .build());
        }

        AttendeeSegmentDTO best = null;
        for (AttendeeSegmentDTO segment : segments) {
            if (best == null || segment.getPipelinePerAttendee() > best.getPipelinePerAttendee()) best = segment;
        }
        OptimalAttendeeRangeDTO optimal = new OptimalAttendeeRangeDTO(best.getAttendeeRange(), best.getPipelinePerAttendee(),
                String.format(Locale.ROOT, "Optimal attendee count is %s with $%,d pipeline per attendee",
                        best.getAttendeeRange(), Math.round(best.getPipelinePerAttendee())));

        log.debugf("Attendee effectiveness: optimal range %s", optimal.getAttendeeRange());
        return new AttendeeEffectivenessDTO(List.copyOf(segments), optimal);
    }

    /**
     * Target versus non-target accounts. Opportunities whose flag is not set yet are left out.
     */
    public TargetAccountComparisonDTO targetAccountComparison(AttributionDataset data) {
        Segment target = Segment.of(data, touchesWhere(data, t -> hasTargetFlag(data, t, true)));
        Segment nonTarget = Segment.of(data, touchesWhere(data, t -> hasTargetFlag(data, t, false)));

        AccountSegmentMetricsDTO targetMetrics = accountMetrics(target);
        AccountSegmentMetricsDTO nonTargetMetrics = accountMetrics(nonTarget);

        log.debugf("Target account comparison: %d target, %d non-target customers",
                targetMetrics.getTotalCustomers(), nonTargetMetrics.getTotalCustomers());
        return new TargetAccountComparisonDTO(
                targetMetrics,
                nonTargetMetrics,
                safeDivide(targetMetrics.getAverageDealSize(), nonTargetMetrics.getAverageDealSize()),
                targetMetrics.getWinRate() - nonTargetMetrics.getWinRate(),
                safeDivide(targetMetrics.getPipelinePerAttendee(), nonTargetMetrics.getPipelinePerAttendee()));
    }

    /**
     * Attendee ranges 1-2, 3-5 and 6+ crossed with the target-account flag, plus one
     * recommendation per account type naming the range with the highest ROI.
     */
    public SegmentationMatrixDTO strategicMatrix(AttributionDataset data) {
        List<StrategicMatrixRowDTO> matrix = new ArrayList<>();
        for (AttendeeRange range : MATRIX_RANGES) {
            Segment target = Segment.of(data, touchesWhere(data,
                    t -> range.contains(t) && hasTargetFlag(data, t, true)));
            Segment nonTarget = Segment.of(data, touchesWhere(data,
                    t -> range.contains(t) && hasTargetFlag(data, t, false)));
            matrix.add(new StrategicMatrixRowDTO(range.label(), matrixCell(target), matrixCell(nonTarget)));
        }

        List<EngagementRecommendationDTO> recommendations = List.of(
                recommend(matrix, TARGET, "Target accounts", StrategicMatrixRowDTO::getTargetAccounts),
                recommend(matrix, NON_TARGET, "Non-target accounts", StrategicMatrixRowDTO::getNonTargetAccounts));
        return new SegmentationMatrixDTO(List.copyOf(matrix), recommendations);
    }

    private static EngagementRecommendationDTO recommend(List<StrategicMatrixRowDTO> matrix, String accountType,
                                                         String label, Function<StrategicMatrixRowDTO, MatrixCellDTO> cell) {
        StrategicMatrixRowDTO best = null;
        for (StrategicMatrixRowDTO row : matrix) {
            if (best == null || cell.apply(row).getRoi() > cell.apply(best).getRoi()) best = row;
        }
        double roi = cell.apply(best).getRoi();
        String reasoning = String.format(Locale.ROOT, "%s show highest ROI (%.1f%%) with %s attendees",
                label, roi, best.getAttendeeRange());
        return new EngagementRecommendationDTO(accountType, best.getAttendeeRange(), reasoning, roi);
    }

    private static AccountSegmentMetricsDTO accountMetrics(Segment segment) {
        return AccountSegmentMetricsDTO.builder()
                .totalCustomers(segment.customerCount())
                .totalPipelineValue(segment.pipelineValue)
                .averageDealSize(segment.averageDealSize())
                .winRate(segment.winRate())
                .totalAttendees(segment.totalAttendees)
                .averageAttendees(safeDivide(segment.totalAttendees, segment.customerCount()))
                .pipelinePerAttendee(segment.pipelinePerAttendee())
                .build();
    }

    private static MatrixCellDTO matrixCell(Segment segment) {
        return MatrixCellDTO.builder()
                .customerCount(segment.customerCount())
                .winRate(segment.winRate())
                .averageDealSize(segment.averageDealSize())
                .totalCost(segment.totalCost)
                .closedWonValue(segment.closedWonValue)
                .roi(percentage(segment.closedWonValue, segment.totalCost))
                .build();
    }

    private static List<CampaignTouch> touchesWhere(AttributionDataset data, Predicate<CampaignTouch> predicate) {
        return data.touches().stream()
                .filter(t -> data.latestSnapshot(t.opportunityId()).isPresent())
                .filter(predicate)
                .toList();
    }

    private static boolean hasTargetFlag(AttributionDataset data, CampaignTouch touch, boolean flag) {
        return data.opportunity(touch.opportunityId())
                .map(Opportunity::targetAccount)
                .map(value -> value == flag)
                .orElse(false);
    }

    /**
     * Totals over one set of touches.
     */
    private static final class Segment {
        private final Map<Long, OpportunitySnapshot> opportunities = new LinkedHashMap<>();
        private int totalAttendees;
        private double totalCost;
        private double pipelineValue;
        private double closedWonValue;
        private int closedWonCount;
        private int closedLostCount;

        static Segment of(AttributionDataset data, List<CampaignTouch> touches) {
            Segment segment = new Segment();
            Set<Long> campaignIds = new HashSet<>();
            for (CampaignTouch touch : touches) {
                segment.totalAttendees += touch.attendeesOrZero();
                if (campaignIds.add(touch.campaignId())) {
                    segment.totalCost += data.campaign(touch.campaignId()).map(Campaign::costOrZero).orElse(0.0);
                }
                if (!segment.opportunities.containsKey(touch.opportunityId())) {
                    data.latestSnapshot(touch.opportunityId()).ifPresent(s -> segment.add(touch.opportunityId(), s));
                }
            }
            return segment;
        }

        private void add(Long opportunityId, OpportunitySnapshot snapshot) {
            opportunities.put(opportunityId, snapshot);
            pipelineValue += snapshot.pipelineValue();
            closedWonValue += snapshot.closedWonValue();
            if (snapshot.isClosedWon()) closedWonCount++;
            if (snapshot.isClosedLost()) closedLostCount++;
        }

        int customerCount() {
            return opportunities.size();
        }

        double averageDealSize() {
            return safeDivide(pipelineValue, customerCount());
        }

        double winRate() {
            return Ratios.winRate(closedWonCount, closedLostCount);
        }

        double pipelinePerAttendee() {
            return safeDivide(pipelineValue, totalAttendees);
        }
    }
}
