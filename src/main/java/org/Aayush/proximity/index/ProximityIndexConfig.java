package org.Aayush.proximity.index;

import lombok.Builder;
import lombok.Value;
import org.Aayush.proximity.ProximityException;

/**
 * Build-time configuration for {@link ProximityIndex}.
 *
 * <p>Defaults are tuned for city-scale transit stop sets: a 900 m cell holds a handful of stops
 * in a typical urban area, and 24 rings cover roughly 21.6 km around the query cell.</p>
 */
@Value
@Builder(toBuilder = true)
public class ProximityIndexConfig {
    public static final double DEFAULT_CELL_SIZE_METERS = 900.0d;
    public static final double MIN_CELL_SIZE_METERS = 1.0d;
    public static final int DEFAULT_MAX_RING_RADIUS = 24;
    public static final int DEFAULT_MIN_K = 1;
    public static final int DEFAULT_MAX_K = 32;

    /**
     * Grid cell edge length in projected meters.
     */
    @Builder.Default
    double cellSizeMeters = DEFAULT_CELL_SIZE_METERS;

    /**
     * Maximum Chebyshev ring visited by nearest and k-nearest searches.
     */
    @Builder.Default
    int maxRingRadius = DEFAULT_MAX_RING_RADIUS;

    /**
     * Lower clamp for requested k.
     */
    @Builder.Default
    int minK = DEFAULT_MIN_K;

    /**
     * Upper clamp for requested k; also the candidate-set capacity bound.
     */
    @Builder.Default
    int maxK = DEFAULT_MAX_K;

    /**
     * Returns the default configuration.
     */
    public static ProximityIndexConfig defaults() {
        return ProximityIndexConfig.builder().build();
    }

    /**
     * Returns the default configuration with a custom cell size.
     */
    public static ProximityIndexConfig withCellSize(double cellSizeMeters) {
        return ProximityIndexConfig.builder().cellSizeMeters(cellSizeMeters).build();
    }

    /**
     * Clamps a requested k into {@code [minK, maxK]}.
     */
    public int clampK(int k) {
        return Math.max(minK, Math.min(maxK, k));
    }

    /**
     * Validates all fields.
     *
     * @return this config.
     * @throws ProximityException with {@link ProximityException#REASON_INVALID_CONFIG} on violation.
     */
    public ProximityIndexConfig validate() {
        if (!Double.isFinite(cellSizeMeters) || cellSizeMeters < MIN_CELL_SIZE_METERS) {
            throw invalid("cellSizeMeters must be finite and >= " + MIN_CELL_SIZE_METERS + ", got " + cellSizeMeters);
        }
        if (maxRingRadius < 0) {
            throw invalid("maxRingRadius must be >= 0, got " + maxRingRadius);
        }
        if (minK < 1 || maxK < minK) {
            throw invalid("k bounds must satisfy 1 <= minK <= maxK, got [" + minK + ", " + maxK + "]");
        }
        return this;
    }

    private static ProximityException invalid(String message) {
        return new ProximityException(ProximityException.REASON_INVALID_CONFIG, message);
    }
}
