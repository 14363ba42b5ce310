package org.Aayush.proximity.projection;

/**
 * Projected coordinate in meters on the comparison plane used by {@link PlanarProjector}.
 */
public record PlanarCoordinate(double x, double y) {

    /**
     * Squared Euclidean distance to another projected coordinate.
     */
    public double distanceSquaredTo(PlanarCoordinate other) {
        double dx = other.x - x;
        double dy = other.y - y;
        return dx * dx + dy * dy;
    }
}
