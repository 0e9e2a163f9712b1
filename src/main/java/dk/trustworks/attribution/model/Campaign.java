package dk.trustworks.attribution.model;

import java.time.LocalDate;

/**
 * Marketing campaign. {@code type} is free text and is the grouping key for all
 * campaign type aggregation.
 */
public record Campaign(Long id, String name, String type, Double cost, LocalDate startDate) {

    public double costOrZero() {
        return cost != null ? cost : 0.0;
    }
}
