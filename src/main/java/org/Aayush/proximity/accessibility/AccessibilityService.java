package org.Aayush.proximity.accessibility;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.proximity.ProximityException;
import org.Aayush.proximity.index.GeoPoint;
import org.Aayush.proximity.index.ProximityIndex;
import org.Aayush.proximity.index.ProximityMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Consumer-facing accessibility façade over the current stop snapshot.
 * <p>
 * Snapshot contract:
 * </p>
 * <ul>
 * <li>Each publication builds a complete {@link ProximityIndex} before it becomes visible. Readers
 *     switch from the old snapshot to the new one with a single reference swap and never observe a
 *     partially built index.</li>
 * <li>Versions are assigned when a publication is requested. A build that completes after a newer
 *     one was installed is dropped.</li>
 * <li>Publishing a point list equal to the current one does not rebuild. When no other publication
 *     is pending the current snapshot is returned; otherwise the current index is re-installed under a
 *     new version so that the pending, older request cannot replace it.</li>
 * </ul>
 * <p>
 * Queries are synchronous, allocation-light and bounded; they can run on a render thread while a
 * rebuild runs on another executor.
 * </p>
 */
public final class AccessibilityService {
    private static final Logger log = LoggerFactory.getLogger(AccessibilityService.class);

    @Getter
    @Accessors(fluent = true)
    private final AccessibilityConfig config;
    private final HeatGridSpec defaultHeatGrid;
    private final AtomicLong versionSequence = new AtomicLong();
    private final AtomicReference<IndexSnapshot> current;

    /**
     * Creates a service with an empty initial snapshot (version 0).
     *
     * @param config service configuration.
     */
    public AccessibilityService(AccessibilityConfig config) {
        if (config == null) {
            throw new ProximityException(ProximityException.REASON_INVALID_CONFIG, "config must not be null");
        }
        this.config = config.validate();
        this.defaultHeatGrid = HeatGridSpec.from(config);
        this.current = new AtomicReference<>(
                new IndexSnapshot(0L, List.of(), ProximityIndex.empty(config.getIndexConfig())));
    }

    /**
     * Creates a service with {@link AccessibilityConfig#defaults()}.
     */
    public static AccessibilityService withDefaults() {
        return new AccessibilityService(AccessibilityConfig.defaults());
    }

    /**
     * Builds and installs a snapshot on the calling thread.
     *
     * @param points new point set; copied before building.
     * @return the snapshot built for this call, or the current one when the points are unchanged.
     */
    public IndexSnapshot publish(Collection<GeoPoint> points) {
        List<GeoPoint> copy = copyPoints(points);
        IndexSnapshot reused = reuseIfUnchanged(copy);
        if (reused != null) {
            return reused;
        }
        long version = versionSequence.incrementAndGet();
        return install(buildSnapshot(version, copy));
    }

    /**
     * Builds a snapshot on {@code executor} and installs it when the build completes.
     * <p>
     * Queries keep answering from the previous snapshot until the swap. On failure the returned
     * future completes exceptionally and the previous snapshot stays current.
     * </p>
     *
     * @param points new point set; copied on the calling thread.
     * @param executor executor that runs the build.
     * @return future of the built snapshot (or of the current one when the points are unchanged).
     */
    public CompletableFuture<IndexSnapshot> publishAsync(Collection<GeoPoint> points, Executor executor) {
        if (executor == null) {
            throw new ProximityException(ProximityException.REASON_NULL_EXECUTOR, "executor must not be null");
        }
        List<GeoPoint> copy = copyPoints(points);
        IndexSnapshot reused = reuseIfUnchanged(copy);
        if (reused != null) {
            return CompletableFuture.completedFuture(reused);
        }
        long version = versionSequence.incrementAndGet();
        return CompletableFuture
                .supplyAsync(() -> install(buildSnapshot(version, copy)), executor)
                .whenComplete((snapshot, failure) -> {
                    if (failure != null) {
                        log.warn("Snapshot v{} build failed; keeping v{}", version, current.get().version(), failure);
                    }
                });
    }

    /**
     * Currently installed snapshot.
     */
    public IndexSnapshot currentSnapshot() {
        return current.get();
    }

    /**
     * Index of the currently installed snapshot.
     */
    public ProximityIndex currentIndex() {
        return current.get().index();
    }

    /**
     * Distance in meters to the nearest stop.
     */
    public OptionalDouble nearestStopMeters(double lat, double lon) {
        return currentIndex().nearestDistance(lat, lon);
    }

    /**
     * Nearest stop with its distance.
     */
    public Optional<ProximityMatch> nearestStop(double lat, double lon) {
        return currentIndex().nearest(lat, lon);
    }

    /**
     * Up to {@code k} nearest stops, ascending by distance.
     */
    public List<ProximityMatch> nearestStops(double lat, double lon, int k) {
        return currentIndex().kNearest(lat, lon, k);
    }

    /**
     * Stops within {@code radiusMeters}, ascending by distance.
     */
    public List<ProximityMatch> stopsWithin(double lat, double lon, double radiusMeters) {
        return currentIndex().withinRadius(lat, lon, radiusMeters);
    }

    /**
     * Nearest-stop distance plus stop counts at each configured summary radius.
     * All values come from the same snapshot.
     */
    public AccessibilitySummary summarize(double lat, double lon) {
        ProximityIndex index = currentIndex();
        Map<Double, Integer> counts = new LinkedHashMap<>();
        for (Double radius : config.effectiveSummaryRadii()) {
            counts.put(radius, index.countWithinRadius(lat, lon, radius));
        }
        return new AccessibilitySummary(index.nearestDistance(lat, lon), counts);
    }

    /**
     * Heat grid around a centre using the configured grid shape.
     */
    public HeatGrid heatGrid(double centerLat, double centerLon) {
        return heatGrid(centerLat, centerLon, defaultHeatGrid);
    }

    /**
     * Heat grid around a centre with an explicit grid shape.
     */
    public HeatGrid heatGrid(double centerLat, double centerLon, HeatGridSpec spec) {
        if (spec == null) {
            throw new ProximityException(ProximityException.REASON_INVALID_CONFIG, "heat grid spec must not be null");
        }
        return HeatGridRasterizer.rasterize(currentIndex(), centerLat, centerLon, spec);
    }

    /**
     * Returns a snapshot for {@code points} without rebuilding when they equal the installed points.
     * <p>
     * If no newer publication was requested since the installed one, the installed snapshot is
     * returned as is. Otherwise a build for other points is still pending, so the installed index is
     * re-installed under a fresh version and the pending build is dropped when it completes.
     * </p>
     *
     * @return reused snapshot, or {@code null} when the points differ and a build is needed.
     */
    private IndexSnapshot reuseIfUnchanged(List<GeoPoint> points) {
        IndexSnapshot existing = current.get();
        if (!existing.points().equals(points)) {
            return null;
        }
        if (existing.version() == versionSequence.get()) {
            log.debug("Snapshot v{} unchanged ({} points); skipping rebuild", existing.version(), points.size());
            return existing;
        }
        long version = versionSequence.incrementAndGet();
        log.debug("Snapshot v{} unchanged but a newer build is pending; re-installing as v{}",
                existing.version(), version);
        return install(new IndexSnapshot(version, existing.points(), existing.index()));
    }

    private IndexSnapshot buildSnapshot(long version, List<GeoPoint> points) {
        return new IndexSnapshot(version, points, ProximityIndex.build(points, config.getIndexConfig()));
    }

    private IndexSnapshot install(IndexSnapshot candidate) {
        IndexSnapshot installed = current.accumulateAndGet(
                candidate,
                (previous, next) -> next.version() > previous.version() ? next : previous
        );
        if (installed == candidate) {
            log.info("Installed stop snapshot v{}: {}", candidate.version(), candidate.index());
        } else {
            log.debug("Dropped stop snapshot v{}; v{} is newer", candidate.version(), installed.version());
        }
        return candidate;
    }

    private static List<GeoPoint> copyPoints(Collection<GeoPoint> points) {
        if (points == null) {
            throw new ProximityException(ProximityException.REASON_NULL_POINTS, "points must not be null");
        }
        List<GeoPoint> copy = new ArrayList<>(points.size());
        for (GeoPoint point : points) {
            if (point == null) {
                throw new ProximityException(
                        ProximityException.REASON_NULL_POINTS, "points[" + copy.size() + "] must not be null");
            }
            copy.add(point);
        }
        return Collections.unmodifiableList(copy);
    }
}
