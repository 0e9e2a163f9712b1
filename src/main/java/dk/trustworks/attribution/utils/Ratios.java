package dk.trustworks.attribution.utils;

/**
 * Division helpers for ratio metrics. A zero (or non-finite) denominator always
 * yields 0, never NaN or an exception.
 */
public final class Ratios {

    private Ratios() {
    }

    public static double safeDivide(double numerator, double denominator) {
        if (denominator == 0.0 || !Double.isFinite(denominator) || !Double.isFinite(numerator)) {
            return 0.0;
        }
        return numerator / denominator;
    }

    /**
     * numerator / denominator x 100, 0 when the denominator is 0.
     */
    public static double percentage(double numerator, double denominator) {
        return safeDivide(numerator, denominator) * 100.0;
    }

    /**
     * Closed-won share of closed deals as a percentage; 0 when nothing has closed.
     */
    public static double winRate(long closedWon, long closedLost) {
        return percentage(closedWon, closedWon + closedLost);
    }

    public static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
