package org.Aayush.proximity.accessibility;

import org.Aayush.proximity.index.GeoPoint;
import org.Aayush.proximity.index.ProximityIndex;

import java.util.List;

/**
 * One published data snapshot: the immutable point list and the index built from it.
 *
 * @param version publication order; later requests carry larger versions.
 * @param points immutable copy of the source points.
 * @param index index built over {@code points}.
 */
public record IndexSnapshot(long version, List<GeoPoint> points, ProximityIndex index) {
}
