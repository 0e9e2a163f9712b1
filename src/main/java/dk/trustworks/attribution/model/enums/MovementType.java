package dk.trustworks.attribution.model.enums;

/**
 * The two time-windowed movement variants reported per campaign type.
 */
public enum MovementType {

    /** Opportunity entered the pipeline within the window after the campaign started. */
    NEW_PIPELINE,

    /** Opportunity moved to a higher ranked stage within the window. */
    STAGE_ADVANCE
}
