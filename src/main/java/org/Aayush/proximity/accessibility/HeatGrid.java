package org.Aayush.proximity.accessibility;

import java.util.List;

/**
 * Row-major heat grid over a square window around a centre point.
 *
 * @param spec grid shape.
 * @param centerLat window centre latitude.
 * @param centerLon window centre longitude.
 * @param minLat southern window edge.
 * @param minLon western window edge.
 * @param maxLat northern window edge.
 * @param maxLon eastern window edge.
 * @param cells {@code gridSize * gridSize} cells, row-major.
 */
public record HeatGrid(
        HeatGridSpec spec,
        double centerLat,
        double centerLon,
        double minLat,
        double minLon,
        double maxLat,
        double maxLon,
        List<HeatCell> cells
) {

    public HeatGrid {
        cells = List.copyOf(cells);
    }

    /**
     * Cell at {@code (row, col)}.
     */
    public HeatCell cell(int row, int col) {
        int size = spec.gridSize();
        if (row < 0 || row >= size || col < 0 || col >= size) {
            throw new IndexOutOfBoundsException("cell (" + row + ", " + col + ") outside " + size + "x" + size);
        }
        return cells.get(row * size + col);
    }
}
