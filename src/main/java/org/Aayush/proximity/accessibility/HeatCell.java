package org.Aayush.proximity.accessibility;

/**
 * One rasterized heat cell.
 *
 * @param row row index; latitude grows with row.
 * @param col column index; longitude grows with column.
 * @param southLat southern edge.
 * @param westLon western edge.
 * @param northLat northern edge.
 * @param eastLon eastern edge.
 * @param centerLat latitude the distance was measured from.
 * @param centerLon longitude the distance was measured from.
 * @param meters nearest-stop distance, capped at the grid's max distance (also used when no stop was found).
 * @param heatValue normalized distance in {@code [0, 1]}.
 * @param color ramp colour for {@code heatValue}.
 */
public record HeatCell(
        int row,
        int col,
        double southLat,
        double westLon,
        double northLat,
        double eastLon,
        double centerLat,
        double centerLon,
        double meters,
        double heatValue,
        HeatColor color
) {
}
