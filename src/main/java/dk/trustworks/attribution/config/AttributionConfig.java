package dk.trustworks.attribution.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class AttributionConfig {

    // Window after campaign start in which pipeline entries and stage advances are credited
    @ConfigProperty(name = "attribution.movement.window-days", defaultValue = "30")
    int movementWindowDays;

    // A campaign type above this share of total cost and below mean ROI is a reallocation candidate
    @ConfigProperty(name = "attribution.reallocation.cost-share-threshold", defaultValue = "0.10")
    double reallocationCostShareThreshold;

    public int getMovementWindowDays() {
        return movementWindowDays;
    }

    public double getReallocationCostShareThreshold() {
        return reallocationCostShareThreshold;
    }
}
