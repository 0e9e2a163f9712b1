package dk.trustworks.attribution.model.enums;

public enum PerformanceTier {

    EXCELLENT(500.0),
    GOOD(200.0),
    MODERATE(100.0),
    POOR(Double.NEGATIVE_INFINITY);

    private final double minimumRoi;

    PerformanceTier(double minimumRoi) {
        this.minimumRoi = minimumRoi;
    }

    public double getMinimumRoi() {
        return minimumRoi;
    }

    /**
     * Tier for an ROI percentage. Tiers are checked from the top, so the first
     * threshold the ROI reaches wins.
     */
    public static PerformanceTier of(double roi) {
        for (PerformanceTier tier : values()) {
            if (roi >= tier.minimumRoi) {
                return tier;
            }
        }
        return POOR;
    }
}
