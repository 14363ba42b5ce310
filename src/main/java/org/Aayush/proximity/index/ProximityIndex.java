package org.Aayush.proximity.index;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;
import org.Aayush.proximity.ProximityException;
import org.Aayush.proximity.projection.PlanarProjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.atomic.LongAdder;

/**
 * Uniform-grid proximity index over projected geographic points.
 * <p>
 * Points are projected with {@link PlanarProjector} and binned into square cells of
 * {@code cellSizeMeters}. Storage is compressed: point coordinates and ids live in parallel arrays
 * grouped by cell, and a packed {@code (ix, iy)} key maps to the cell's slot. Within a cell, points
 * keep their input order.
 * </p>
 * <p>
 * The index is immutable after {@link #build(Collection, ProximityIndexConfig)} and safe for
 * concurrent reads. A new data snapshot requires a new index. The only mutable state is the
 * telemetry counters.
 * </p>
 * <p>
 * Query semantics:
 * </p>
 * <ul>
 * <li>Empty index: empty optional, zero count or empty list. Never an error.</li>
 * <li>Out-of-range input is clamped (latitude, longitude, k, negative radius); only non-finite
 *     numbers are rejected.</li>
 * <li>Nearest and k-nearest expand square rings around the query cell up to
 *     {@link ProximityIndexConfig#getMaxRingRadius()}. If the cap is hit before the answer is
 *     proven, the best answer found so far is returned (possibly empty or under-filled) and the
 *     event is counted in {@link #telemetry()}.</li>
 * </ul>
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProximityIndex {
    private static final Logger log = LoggerFactory.getLogger(ProximityIndex.class);

    private static final int NO_SLOT = -1;
    // Wider than the whole projected plane at the minimum cell size; keeps block arithmetic in range.
    private static final long MAX_BLOCK_RADIUS_CELLS = 1L << 30;

    @Getter
    @Accessors(fluent = true)
    private final ProximityIndexConfig config;
    private final double cellSize;

    private final Long2IntOpenHashMap cellSlots;
    private final int[] cellIx;
    private final int[] cellIy;
    private final int[] cellStart;
    private final int[] cellPointCount;

    private final double[] pointX;
    private final double[] pointY;
    private final String[] pointIds;

    private final LongAdder searchBoundExceeded = new LongAdder();

    /**
     * Builds an index with default configuration.
     */
    public static ProximityIndex build(Collection<GeoPoint> points) {
        return build(points, ProximityIndexConfig.defaults());
    }

    /**
     * Builds an index with default configuration and a custom cell size.
     */
    public static ProximityIndex build(Collection<GeoPoint> points, double cellSizeMeters) {
        return build(points, ProximityIndexConfig.withCellSize(cellSizeMeters));
    }

    /**
     * Builds an index over a copy of the given points.
     *
     * @param points points to index; the collection is read once and never retained.
     * @param config index configuration.
     * @return immutable index.
     */
    public static ProximityIndex build(Collection<GeoPoint> points, ProximityIndexConfig config) {
        if (points == null) {
            throw new ProximityException(ProximityException.REASON_NULL_POINTS, "points must not be null");
        }
        if (config == null) {
            throw new ProximityException(ProximityException.REASON_INVALID_CONFIG, "config must not be null");
        }
        config.validate();
        long startNanos = System.nanoTime();
        double cellSize = config.getCellSizeMeters();

        int n = points.size();
        double[] rawX = new double[n];
        double[] rawY = new double[n];
        String[] rawIds = new String[n];
        int[] rawSlot = new int[n];

        Long2IntOpenHashMap cellSlots = new Long2IntOpenHashMap(Math.max(16, n / 2));
        cellSlots.defaultReturnValue(NO_SLOT);
        IntArrayList slotIx = new IntArrayList();
        IntArrayList slotIy = new IntArrayList();
        IntArrayList slotCounts = new IntArrayList();

        int i = 0;
        for (GeoPoint point : points) {
            if (i >= n) {
                throw new ProximityException(
                        ProximityException.REASON_NULL_POINTS, "points collection grew during build");
            }
            if (point == null) {
                throw new ProximityException(
                        ProximityException.REASON_NULL_POINTS, "points[" + i + "] must not be null");
            }
            double x = PlanarProjector.projectX(point.lon());
            double y = PlanarProjector.projectY(point.lat());
            int ix = cellCoordinate(x, cellSize);
            int iy = cellCoordinate(y, cellSize);
            long key = cellKey(ix, iy);

            int slot = cellSlots.get(key);
            if (slot == NO_SLOT) {
                slot = slotIx.size();
                cellSlots.put(key, slot);
                slotIx.add(ix);
                slotIy.add(iy);
                slotCounts.add(0);
            }
            slotCounts.set(slot, slotCounts.getInt(slot) + 1);

            rawX[i] = x;
            rawY[i] = y;
            rawIds[i] = point.id();
            rawSlot[i] = slot;
            i++;
        }
        if (i != n) {
            throw new ProximityException(
                    ProximityException.REASON_NULL_POINTS, "points collection shrank during build");
        }

        int slotCount = slotIx.size();
        int[] cellStart = new int[slotCount];
        int[] cellPointCount = slotCounts.toIntArray();
        int offset = 0;
        for (int s = 0; s < slotCount; s++) {
            cellStart[s] = offset;
            offset += cellPointCount[s];
        }

        double[] pointX = new double[n];
        double[] pointY = new double[n];
        String[] pointIds = new String[n];
        int[] cursor = cellStart.clone();
        for (int p = 0; p < n; p++) {
            int target = cursor[rawSlot[p]]++;
            pointX[target] = rawX[p];
            pointY[target] = rawY[p];
            pointIds[target] = rawIds[p];
        }
        cellSlots.trim();

        ProximityIndex index = new ProximityIndex(
                config,
                cellSize,
                cellSlots,
                slotIx.toIntArray(),
                slotIy.toIntArray(),
                cellStart,
                cellPointCount,
                pointX,
                pointY,
                pointIds
        );
        if (log.isDebugEnabled()) {
            log.debug("Built proximity index: {} points in {} cells (cell={} m) in {} us",
                    n, slotCount, cellSize, (System.nanoTime() - startNanos) / 1_000L);
        }
        return index;
    }

    /**
     * Returns an empty index with the given configuration.
     */
    public static ProximityIndex empty(ProximityIndexConfig config) {
        return build(List.of(), config);
    }

    /**
     * Number of indexed points.
     */
    public int size() {
        return pointIds.length;
    }

    public boolean isEmpty() {
        return pointIds.length == 0;
    }

    /**
     * Number of cells holding at least one point.
     */
    public int occupiedCellCount() {
        return cellStart.length;
    }

    public double cellSizeMeters() {
        return cellSize;
    }

    /**
     * Distance in meters to the nearest indexed point.
     *
     * @return nearest distance, or empty when the index is empty or nothing lies within the ring cap.
     */
    public OptionalDouble nearestDistance(double lat, double lon) {
        if (isEmpty()) {
            return OptionalDouble.empty();
        }
        double qx = PlanarProjector.projectX(lon);
        double qy = PlanarProjector.projectY(lat);
        int position = nearestPosition(qx, qy, lat, lon);
        if (position < 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Math.sqrt(distanceSquared(position, qx, qy)));
    }

    /**
     * Nearest indexed point with its distance.
     * Tie-break is deterministic: the first point met in ring order wins.
     *
     * @return nearest match, or empty when the index is empty or nothing lies within the ring cap.
     */
    public Optional<ProximityMatch> nearest(double lat, double lon) {
        if (isEmpty()) {
            return Optional.empty();
        }
        double qx = PlanarProjector.projectX(lon);
        double qy = PlanarProjector.projectY(lat);
        int position = nearestPosition(qx, qy, lat, lon);
        if (position < 0) {
            return Optional.empty();
        }
        return Optional.of(new ProximityMatch(pointIds[position], Math.sqrt(distanceSquared(position, qx, qy))));
    }

    /**
     * Up to {@code k} nearest points, ascending by distance, ties in discovery order.
     *
     * @param k requested count, clamped to the configured k bounds.
     * @return {@code min(k, size())} matches, fewer only when the ring cap truncated the search.
     */
    public List<ProximityMatch> kNearest(double lat, double lon, int k) {
        if (isEmpty()) {
            return List.of();
        }
        double qx = PlanarProjector.projectX(lon);
        double qy = PlanarProjector.projectY(lat);
        int ix0 = cellCoordinate(qx, cellSize);
        int iy0 = cellCoordinate(qy, cellSize);
        int maxRing = config.getMaxRingRadius();

        CandidateSet candidates = new CandidateSet(config.clampK(k));
        int seen = 0;
        boolean proven = false;
        for (int r = 0; r <= maxRing; r++) {
            if (seen == pointIds.length) {
                proven = true;
                break;
            }
            if (candidates.isFull() && exceeds(ringLowerBound(r), candidates.worstDistanceSquared())) {
                proven = true;
                break;
            }
            for (int dx = -r; dx <= r; dx++) {
                int step = Math.abs(dx) == r ? 1 : 2 * r;
                for (int dy = -r; dy <= r; dy += step) {
                    int slot = cellSlots.get(cellKey(ix0 + dx, iy0 + dy));
                    if (slot == NO_SLOT) {
                        continue;
                    }
                    int start = cellStart[slot];
                    int end = start + cellPointCount[slot];
                    for (int p = start; p < end; p++) {
                        candidates.offer(p, distanceSquared(p, qx, qy));
                    }
                    seen += end - start;
                }
            }
        }
        if (!proven) {
            proven = seen == pointIds.length
                    || (candidates.isFull() && exceeds(ringLowerBound(maxRing + 1), candidates.worstDistanceSquared()));
        }
        if (!proven) {
            recordSearchBoundExceeded("kNearest", lat, lon);
        }

        int[] order = candidates.sortedSlots();
        List<ProximityMatch> matches = new ArrayList<>(order.length);
        for (int slot : order) {
            matches.add(new ProximityMatch(
                    pointIds[candidates.positionAt(slot)],
                    Math.sqrt(candidates.distanceSquaredAt(slot))));
        }
        return matches;
    }

    /**
     * Exact count of points whose projected distance is {@code <= radiusMeters}.
     *
     * @param radiusMeters search radius; negative values clamp to 0.
     */
    public int countWithinRadius(double lat, double lon, double radiusMeters) {
        double radius = requireRadius(radiusMeters);
        if (isEmpty()) {
            return 0;
        }
        double qx = PlanarProjector.projectX(lon);
        double qy = PlanarProjector.projectY(lat);
        double radiusSquared = radius * radius;
        int[] count = new int[1];
        visitBlock(qx, qy, radius, (p, distanceSquared) -> {
            if (distanceSquared <= radiusSquared) {
                count[0]++;
            }
        });
        return count[0];
    }

    /**
     * All points whose projected distance is {@code <= radiusMeters}, ascending by distance.
     *
     * @param radiusMeters search radius; negative values clamp to 0.
     */
    public List<ProximityMatch> withinRadius(double lat, double lon, double radiusMeters) {
        double radius = requireRadius(radiusMeters);
        if (isEmpty()) {
            return List.of();
        }
        double qx = PlanarProjector.projectX(lon);
        double qy = PlanarProjector.projectY(lat);
        double radiusSquared = radius * radius;
        List<ProximityMatch> matches = new ArrayList<>();
        visitBlock(qx, qy, radius, (p, distanceSquared) -> {
            if (distanceSquared <= radiusSquared) {
                matches.add(new ProximityMatch(pointIds[p], Math.sqrt(distanceSquared)));
            }
        });
        matches.sort(Comparator.comparingDouble(ProximityMatch::meters));
        return matches;
    }

    /**
     * Returns a snapshot of shape and degradation counters.
     */
    public ProximityTelemetry telemetry() {
        return new ProximityTelemetry(
                pointIds.length,
                cellStart.length,
                cellSize,
                config.getMaxRingRadius(),
                searchBoundExceeded.sum()
        );
    }

    @Override
    public String toString() {
        return "ProximityIndex[points=" + pointIds.length +
                ", cells=" + cellStart.length +
                ", cellSizeMeters=" + cellSize + "]";
    }

    private int nearestPosition(double qx, double qy, double lat, double lon) {
        int ix0 = cellCoordinate(qx, cellSize);
        int iy0 = cellCoordinate(qy, cellSize);
        int maxRing = config.getMaxRingRadius();

        int best = -1;
        double bestDistanceSquared = Double.POSITIVE_INFINITY;
        int seen = 0;
        boolean proven = false;
        for (int r = 0; r <= maxRing; r++) {
            if (seen == pointIds.length) {
                proven = true;
                break;
            }
            if (best >= 0 && exceeds(ringLowerBound(r), bestDistanceSquared)) {
                proven = true;
                break;
            }
            for (int dx = -r; dx <= r; dx++) {
                int step = Math.abs(dx) == r ? 1 : 2 * r;
                for (int dy = -r; dy <= r; dy += step) {
                    int slot = cellSlots.get(cellKey(ix0 + dx, iy0 + dy));
                    if (slot == NO_SLOT) {
                        continue;
                    }
                    int start = cellStart[slot];
                    int end = start + cellPointCount[slot];
                    for (int p = start; p < end; p++) {
                        double distanceSquared = distanceSquared(p, qx, qy);
                        if (distanceSquared < bestDistanceSquared) {
                            bestDistanceSquared = distanceSquared;
                            best = p;
                        }
                    }
                    seen += end - start;
                }
            }
        }
        if (!proven) {
            proven = seen == pointIds.length
                    || (best >= 0 && exceeds(ringLowerBound(maxRing + 1), bestDistanceSquared));
        }
        if (!proven) {
            recordSearchBoundExceeded("nearest", lat, lon);
        }
        return best;
    }

    private void visitBlock(double qx, double qy, double radius, PointVisitor visitor) {
        int ix0 = cellCoordinate(qx, cellSize);
        int iy0 = cellCoordinate(qy, cellSize);
        long blockRadius = Math.min((long) Math.ceil(radius / cellSize), MAX_BLOCK_RADIUS_CELLS);

        long side = 2L * blockRadius + 1L;
        if (side * side > cellStart.length) {
            // Sparse relative to the block: walk occupied cells instead of every block cell.
            for (int slot = 0; slot < cellStart.length; slot++) {
                if (Math.abs((long) cellIx[slot] - ix0) <= blockRadius
                        && Math.abs((long) cellIy[slot] - iy0) <= blockRadius) {
                    visitCell(slot, qx, qy, visitor);
                }
            }
            return;
        }
        // Dense path: side * side <= occupied cells, so the block radius fits an int.
        int cells = (int) blockRadius;
        for (int dx = -cells; dx <= cells; dx++) {
            for (int dy = -cells; dy <= cells; dy++) {
                int slot = cellSlots.get(cellKey(ix0 + dx, iy0 + dy));
                if (slot != NO_SLOT) {
                    visitCell(slot, qx, qy, visitor);
                }
            }
        }
    }

    private void visitCell(int slot, double qx, double qy, PointVisitor visitor) {
        int start = cellStart[slot];
        int end = start + cellPointCount[slot];
        for (int p = start; p < end; p++) {
            visitor.visit(p, distanceSquared(p, qx, qy));
        }
    }

    private double distanceSquared(int position, double qx, double qy) {
        double dx = pointX[position] - qx;
        double dy = pointY[position] - qy;
        return dx * dx + dy * dy;
    }

    /**
     * Smallest possible distance between a query anywhere in its home cell and a point in ring {@code r}.
     */
    private double ringLowerBound(int r) {
        return Math.max(0, r - 1) * cellSize;
    }

    private static boolean exceeds(double lowerBound, double distanceSquared) {
        return lowerBound * lowerBound > distanceSquared;
    }

    private void recordSearchBoundExceeded(String query, double lat, double lon) {
        searchBoundExceeded.increment();
        log.debug("{} search hit ring cap {} at ({}, {}); returning best-effort result",
                query, config.getMaxRingRadius(), lat, lon);
    }

    private static double requireRadius(double radiusMeters) {
        if (Double.isNaN(radiusMeters) || radiusMeters == Double.POSITIVE_INFINITY) {
            throw new ProximityException(
                    ProximityException.REASON_NON_FINITE_RADIUS, "radiusMeters must be finite, got " + radiusMeters);
        }
        return Math.max(0.0d, radiusMeters);
    }

    static int cellCoordinate(double projected, double cellSize) {
        return (int) Math.floor(projected / cellSize);
    }

    static long cellKey(int ix, int iy) {
        return ((long) ix << 32) | (iy & 0xFFFF_FFFFL);
    }

    @FunctionalInterface
    private interface PointVisitor {
        void visit(int position, double distanceSquared);
    }
}
