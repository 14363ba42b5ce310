package org.Aayush.proximity.accessibility;

import org.Aayush.proximity.ProximityException;

/**
 * Shape of one heat grid request.
 *
 * @param gridSize cells per side.
 * @param radiusMeters half-width of the square window around the centre.
 * @param maxMeters distance mapped to the far end of the ramp; also the cap for reported cell distances.
 */
public record HeatGridSpec(int gridSize, double radiusMeters, double maxMeters) {
    public static final int MAX_GRID_SIZE = 512;

    public HeatGridSpec {
        validate(gridSize, radiusMeters, maxMeters);
    }

    /**
     * Builds the spec configured on an {@link AccessibilityConfig}.
     */
    public static HeatGridSpec from(AccessibilityConfig config) {
        return new HeatGridSpec(config.getHeatGridSize(), config.getHeatRadiusMeters(), config.getHeatMaxMeters());
    }

    static void validate(int gridSize, double radiusMeters, double maxMeters) {
        if (gridSize <= 0 || gridSize > MAX_GRID_SIZE) {
            throw invalid("heat grid size must be in [1, " + MAX_GRID_SIZE + "], got " + gridSize);
        }
        if (!Double.isFinite(radiusMeters) || radiusMeters <= 0.0d) {
            throw invalid("heat radius must be finite and > 0, got " + radiusMeters);
        }
        if (!Double.isFinite(maxMeters) || maxMeters <= 0.0d) {
            throw invalid("heat max distance must be finite and > 0, got " + maxMeters);
        }
    }

    private static ProximityException invalid(String message) {
        return new ProximityException(ProximityException.REASON_INVALID_CONFIG, message);
    }
}
