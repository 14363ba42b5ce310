package org.Aayush.proximity.index;

/**
 * Point-in-time shape and degradation counters of one {@link ProximityIndex}.
 *
 * @param pointCount number of indexed points.
 * @param occupiedCellCount number of grid cells holding at least one point.
 * @param cellSizeMeters grid cell edge length.
 * @param maxRingRadius ring cap for nearest and k-nearest searches.
 * @param searchBoundExceededCount queries that hit the ring cap before the answer was proven.
 */
public record ProximityTelemetry(
        int pointCount,
        int occupiedCellCount,
        double cellSizeMeters,
        int maxRingRadius,
        long searchBoundExceededCount
) {
}
