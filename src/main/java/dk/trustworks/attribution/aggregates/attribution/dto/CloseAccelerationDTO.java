package dk.trustworks.attribution.aggregates.attribution.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How quickly a campaign's closed won deals closed, measured from the campaign start.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CloseAccelerationDTO {

    /**
     * Closed won deals whose close date lies within the window of the campaign start
     */
    private int closedWithinWindow;

    private double averageDaysToClose;

    /**
     * closedWithinWindow / closed won deals x 100
     */
    private double accelerationRate;
}
