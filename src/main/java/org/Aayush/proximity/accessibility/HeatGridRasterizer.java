package org.Aayush.proximity.accessibility;

import lombok.experimental.UtilityClass;
import org.Aayush.proximity.index.ProximityIndex;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Rasterizes nearest-stop distance over a square lat/lon window.
 * <p>
 * The window is derived with an equirectangular approximation: one degree of latitude is
 * {@value #METERS_PER_DEGREE_LATITUDE} m, and longitude degrees shrink with {@code cos(latitude)},
 * floored at {@value #MIN_COS_LATITUDE} so the window stays bounded near the poles.
 * </p>
 */
@UtilityClass
class HeatGridRasterizer {
    static final double METERS_PER_DEGREE_LATITUDE = 111_320.0d;
    static final double MIN_COS_LATITUDE = 0.15d;

    static HeatGrid rasterize(ProximityIndex index, double centerLat, double centerLon, HeatGridSpec spec) {
        double latDelta = spec.radiusMeters() / METERS_PER_DEGREE_LATITUDE;
        double cosLat = Math.max(MIN_COS_LATITUDE, Math.cos(Math.toRadians(centerLat)));
        double lonDelta = spec.radiusMeters() / (METERS_PER_DEGREE_LATITUDE * cosLat);

        double minLat = centerLat - latDelta;
        double maxLat = centerLat + latDelta;
        double minLon = centerLon - lonDelta;
        double maxLon = centerLon + lonDelta;

        int size = spec.gridSize();
        double latStep = (maxLat - minLat) / size;
        double lonStep = (maxLon - minLon) / size;
        double maxMeters = spec.maxMeters();

        List<HeatCell> cells = new ArrayList<>(size * size);
        for (int row = 0; row < size; row++) {
            double south = minLat + row * latStep;
            double north = minLat + (row + 1) * latStep;
            double cellLat = minLat + (row + 0.5d) * latStep;
            for (int col = 0; col < size; col++) {
                double west = minLon + col * lonStep;
                double east = minLon + (col + 1) * lonStep;
                double cellLon = minLon + (col + 0.5d) * lonStep;

                OptionalDouble nearest = index.nearestDistance(cellLat, cellLon);
                double meters = nearest.isPresent() ? Math.min(nearest.getAsDouble(), maxMeters) : maxMeters;
                double heat = HeatRamp.heatValue(meters, maxMeters);
                cells.add(new HeatCell(
                        row,
                        col,
                        south,
                        west,
                        north,
                        east,
                        cellLat,
                        cellLon,
                        meters,
                        heat,
                        HeatRamp.colorAt(heat)
                ));
            }
        }
        return new HeatGrid(spec, centerLat, centerLon, minLat, minLon, maxLat, maxLon, cells);
    }
}
