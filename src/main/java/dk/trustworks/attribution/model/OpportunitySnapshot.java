package dk.trustworks.attribution.model;

import dk.trustworks.attribution.model.enums.SalesStage;

import java.time.LocalDate;

/**
 * Immutable point-in-time state of an opportunity as observed on {@code snapshotDate}.
 *
 * @param opportunityId   owning opportunity
 * @param snapshotDate    date the state was observed
 * @param stage           free-form stage label
 * @param year1Value      year-1 value, null when not estimated
 * @param enteredPipeline date the opportunity passed qualification, null if it has not
 * @param closeDate       close date, null while the opportunity is open
 */
public record OpportunitySnapshot(
        Long opportunityId,
        LocalDate snapshotDate,
        String stage,
        Double year1Value,
        LocalDate enteredPipeline,
        LocalDate closeDate) {

    public double value() {
        return year1Value != null ? year1Value : 0.0;
    }

    public boolean hasEnteredPipeline() {
        return enteredPipeline != null;
    }

    public boolean isClosedWon() {
        return SalesStage.isClosedWon(stage);
    }

    public boolean isClosedLost() {
        return SalesStage.isClosedLost(stage);
    }

    /**
     * Neither Closed Won nor Closed Lost.
     */
    public boolean isOpen() {
        return !SalesStage.isClosed(stage);
    }

    /**
     * Value counted towards pipeline: everything except Closed Lost.
     */
    public double pipelineValue() {
        return isClosedLost() ? 0.0 : value();
    }

    public double closedWonValue() {
        return isClosedWon() ? value() : 0.0;
    }
}
