package org.Aayush.proximity.accessibility;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.proximity.ProximityException;
import org.Aayush.proximity.index.ProximityIndexConfig;

import java.util.List;

/**
 * Startup configuration for {@link AccessibilityService}.
 *
 * <p>Bound once when the service is created; every published snapshot is built with
 * {@link #getIndexConfig()}.</p>
 */
@Value
@Builder(toBuilder = true)
public class AccessibilityConfig {
    public static final List<Double> DEFAULT_SUMMARY_RADII_METERS = List.of(500.0d, 1_000.0d, 2_000.0d);
    public static final int DEFAULT_HEAT_GRID_SIZE = 42;
    public static final double DEFAULT_HEAT_RADIUS_METERS = 3_000.0d;
    public static final double DEFAULT_HEAT_MAX_METERS = 3_000.0d;

    /**
     * Index configuration used for every snapshot build.
     */
    @Builder.Default
    ProximityIndexConfig indexConfig = ProximityIndexConfig.defaults();

    /**
     * Radii reported by {@link AccessibilityService#summarize(double, double)}, in report order.
     * Empty means the defaults.
     */
    @Singular("summaryRadiusMeters")
    List<Double> summaryRadiiMeters;

    /**
     * Number of heat cells per side.
     */
    @Builder.Default
    int heatGridSize = DEFAULT_HEAT_GRID_SIZE;

    /**
     * Half-width of the heat window around the centre, in meters.
     */
    @Builder.Default
    double heatRadiusMeters = DEFAULT_HEAT_RADIUS_METERS;

    /**
     * Distance mapped to the far end of the heat ramp.
     */
    @Builder.Default
    double heatMaxMeters = DEFAULT_HEAT_MAX_METERS;

    /**
     * Returns the default configuration.
     */
    public static AccessibilityConfig defaults() {
        return AccessibilityConfig.builder().build();
    }

    /**
     * Radii to summarize; falls back to {@link #DEFAULT_SUMMARY_RADII_METERS} when none were set.
     */
    public List<Double> effectiveSummaryRadii() {
        return summaryRadiiMeters.isEmpty() ? DEFAULT_SUMMARY_RADII_METERS : summaryRadiiMeters;
    }

    /**
     * Validates all fields.
     *
     * @return this config.
     */
    public AccessibilityConfig validate() {
        if (indexConfig == null) {
            throw invalid("indexConfig must not be null");
        }
        indexConfig.validate();
        for (Double radius : summaryRadiiMeters) {
            if (radius == null || !Double.isFinite(radius) || radius < 0.0d) {
                throw invalid("summary radii must be finite and >= 0, got " + radius);
            }
        }
        HeatGridSpec.validate(heatGridSize, heatRadiusMeters, heatMaxMeters);
        return this;
    }

    private static ProximityException invalid(String message) {
        return new ProximityException(ProximityException.REASON_INVALID_CONFIG, message);
    }
}
