package org.Aayush.proximity.index;

/**
 * One indexed point returned by a proximity query, with its projected distance in meters.
 */
public record ProximityMatch(String id, double meters) {
}
