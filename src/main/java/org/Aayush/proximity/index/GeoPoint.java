package org.Aayush.proximity.index;

import org.Aayush.proximity.ProximityException;

/**
 * Input point for a {@link ProximityIndex}: an opaque identifier plus a geographic coordinate in degrees.
 */
public record GeoPoint(String id, double lat, double lon) {

    public GeoPoint {
        if (id == null) {
            throw new ProximityException(ProximityException.REASON_NULL_POINTS, "point id must not be null");
        }
        if (!Double.isFinite(lat) || !Double.isFinite(lon)) {
            throw new ProximityException(
                    ProximityException.REASON_NON_FINITE_COORDINATE,
                    "point " + id + " has non-finite coordinate (" + lat + ", " + lon + ")");
        }
    }
}
