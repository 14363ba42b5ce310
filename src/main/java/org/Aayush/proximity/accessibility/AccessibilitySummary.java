package org.Aayush.proximity.accessibility;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * Accessibility metrics around one location.
 *
 * @param nearestMeters distance to the nearest stop, empty when none is known.
 * @param countsByRadius stop counts keyed by radius in meters, in configured order.
 */
public record AccessibilitySummary(OptionalDouble nearestMeters, Map<Double, Integer> countsByRadius) {

    public AccessibilitySummary {
        countsByRadius = Collections.unmodifiableMap(new LinkedHashMap<>(countsByRadius));
    }

    /**
     * Count for one summarized radius, empty when that radius was not summarized.
     */
    public OptionalInt countWithin(double radiusMeters) {
        Integer count = countsByRadius.get(radiusMeters);
        return count == null ? OptionalInt.empty() : OptionalInt.of(count);
    }
}
