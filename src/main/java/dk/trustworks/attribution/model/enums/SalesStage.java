package dk.trustworks.attribution.model.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Fixed ordinal chain of sales stages used to detect forward progress.
 * <p>
 * Stage labels on snapshots are free-form text exported from the CRM. Only the
 * labels below carry a rank; anything else (including Closed Lost) is outside
 * the chain and never counts as an advance.
 */
public enum SalesStage {

    VALIDATION_INTRODUCTION(1, "Validation", "Introduction", "Validation/Introduction"),
    DISCOVERY(2, "Discovery"),
    DEVELOPING_CHAMPIONS(3, "Developing Champions"),
    ROI_ANALYSIS_PRICING(4, "ROI Analysis", "Pricing", "ROI Analysis/Pricing"),
    NEGOTIATION_COMMIT(5, "Negotiation", "Commit", "Negotiation/Commit"),
    CLOSED_WON(6, "Closed Won"),
    CLOSED_LOST(0, "Closed Lost");

    private final int rank;
    private final List<String> labels;

    SalesStage(int rank, String... labels) {
        this.rank = rank;
        this.labels = List.of(labels);
    }

    /**
     * Ordinal rank in the stage chain. Empty for {@link #CLOSED_LOST}.
     */
    public OptionalInt getRank() {
        return this == CLOSED_LOST ? OptionalInt.empty() : OptionalInt.of(rank);
    }

    public String getLabel() {
        return labels.get(labels.size() - 1);
    }

    /**
     * Resolve a CRM stage label. Matching is case-insensitive and ignores surrounding
     * whitespace; labels containing "closed won" or "closed lost" resolve to the
     * terminal stages regardless of any prefix the CRM puts in front of them.
     *
     * @param label raw stage label, may be null
     * @return the matching stage, or empty for unknown labels
     */
    public static Optional<SalesStage> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        if (normalized.contains("closed won")) return Optional.of(CLOSED_WON);
        if (normalized.contains("closed lost")) return Optional.of(CLOSED_LOST);

        return Arrays.stream(values())
                .filter(stage -> stage.labels.stream().anyMatch(l -> l.toLowerCase(Locale.ROOT).equals(normalized)))
                .findFirst();
    }

    /**
     * Rank of a raw label, empty when the label is unknown or Closed Lost.
     */
    public static OptionalInt rankOf(String label) {
        return fromLabel(label).map(SalesStage::getRank).orElse(OptionalInt.empty());
    }

    public static boolean isClosedWon(String label) {
        return fromLabel(label).filter(s -> s == CLOSED_WON).isPresent();
    }

    public static boolean isClosedLost(String label) {
        return fromLabel(label).filter(s -> s == CLOSED_LOST).isPresent();
    }

    public static boolean isClosed(String label) {
        return isClosedWon(label) || isClosedLost(label);
    }
}
