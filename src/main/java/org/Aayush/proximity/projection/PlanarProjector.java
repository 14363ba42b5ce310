package org.Aayush.proximity.projection;

import lombok.experimental.UtilityClass;
import org.Aayush.proximity.ProximityException;

/**
 * Spherical Web-Mercator projection into meters, used only to compare short-range distances.
 * <p>
 * Distances on this plane are stretched by roughly {@code 1/cos(latitude)} relative to ground
 * distance. Inside a single city the stretch is near-uniform, so nearest-neighbour ordering and
 * radius checks stay meaningful, but the values are an approximation and not geodesic truth.
 * Never use these coordinates for display.
 * </p>
 * <p>
 * Input policy is permissive: latitude is clamped to {@code [-85, 85]} to stay clear of the pole
 * singularity and longitude to {@code [-180, 180]}. Only non-finite input is rejected.
 * </p>
 */
@UtilityClass
public class PlanarProjector {
    /** Spherical Mercator radius (WGS84 semi-major axis) in meters. */
    public static final double EARTH_RADIUS_METERS = 6_378_137.0d;
    public static final double MAX_LATITUDE_DEGREES = 85.0d;
    public static final double MAX_LONGITUDE_DEGREES = 180.0d;

    /**
     * Projects a geographic coordinate onto the comparison plane.
     *
     * @param latDeg latitude in degrees.
     * @param lonDeg longitude in degrees.
     * @return projected coordinate in meters.
     */
    public static PlanarCoordinate project(double latDeg, double lonDeg) {
        return new PlanarCoordinate(projectX(lonDeg), projectY(latDeg));
    }

    /**
     * Projected x (easting) for a longitude in degrees.
     */
    public static double projectX(double lonDeg) {
        requireFinite(lonDeg, "longitude");
        double lon = clamp(lonDeg, -MAX_LONGITUDE_DEGREES, MAX_LONGITUDE_DEGREES);
        return EARTH_RADIUS_METERS * Math.toRadians(lon);
    }

    /**
     * Projected y (northing) for a latitude in degrees.
     */
    public static double projectY(double latDeg) {
        requireFinite(latDeg, "latitude");
        double lat = clamp(latDeg, -MAX_LATITUDE_DEGREES, MAX_LATITUDE_DEGREES);
        return EARTH_RADIUS_METERS * Math.log(Math.tan(Math.PI / 4.0d + Math.toRadians(lat) / 2.0d));
    }

    private static void requireFinite(double value, String name) {
        if (!Double.isFinite(value)) {
            throw new ProximityException(
                    ProximityException.REASON_NON_FINITE_COORDINATE,
                    name + " must be finite, got " + value);
        }
    }

    private static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
