package org.Aayush.proximity.index;

import it.unimi.dsi.fastutil.ints.IntArrays;

/**
 * Fixed-capacity "k best so far" buffer for k-nearest searches.
 * <p>
 * Capacity is bounded by {@link ProximityIndexConfig#getMaxK()}, so a linear worst-scan is used
 * instead of a heap. Each offer carries a discovery sequence so that equal distances are reported
 * in the order they were first seen, even after the slot they landed in was reused.
 * </p>
 * <p>Not thread-safe; one instance per query.</p>
 */
final class CandidateSet {
    private final int[] positions;
    private final double[] distancesSquared;
    private final int[] sequences;
    private int size;
    private int nextSequence;
    private int worstSlot = -1;
    private double worstDistanceSquared = Double.POSITIVE_INFINITY;

    CandidateSet(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got " + capacity);
        }
        this.positions = new int[capacity];
        this.distancesSquared = new double[capacity];
        this.sequences = new int[capacity];
    }

    /**
     * Offers one point.
     *
     * @return true when the point was kept.
     */
    boolean offer(int position, double distanceSquared) {
        int sequence = nextSequence++;
        if (size < positions.length) {
            positions[size] = position;
            distancesSquared[size] = distanceSquared;
            sequences[size] = sequence;
            size++;
            if (size == positions.length) {
                rescanWorst();
            }
            return true;
        }
        if (distanceSquared >= worstDistanceSquared) {
            return false;
        }
        positions[worstSlot] = position;
        distancesSquared[worstSlot] = distanceSquared;
        sequences[worstSlot] = sequence;
        rescanWorst();
        return true;
    }

    boolean isFull() {
        return size == positions.length;
    }

    int size() {
        return size;
    }

    /**
     * Worst kept squared distance, or {@code +INF} while the set is under capacity.
     */
    double worstDistanceSquared() {
        return worstDistanceSquared;
    }

    /**
     * Slots ordered ascending by distance, ties by discovery sequence.
     */
    int[] sortedSlots() {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        IntArrays.mergeSort(order, (a, b) -> {
            int byDistance = Double.compare(distancesSquared[a], distancesSquared[b]);
            return byDistance != 0 ? byDistance : Integer.compare(sequences[a], sequences[b]);
        });
        return order;
    }

    int positionAt(int slot) {
        return positions[slot];
    }

    double distanceSquaredAt(int slot) {
        return distancesSquared[slot];
    }

    private void rescanWorst() {
        int slot = 0;
        double worst = distancesSquared[0];
        for (int i = 1; i < size; i++) {
            // Among equal distances the latest discovery is evicted first.
            if (distancesSquared[i] > worst
                    || (distancesSquared[i] == worst && sequences[i] > sequences[slot])) {
                worst = distancesSquared[i];
                slot = i;
            }
        }
        worstSlot = slot;
        worstDistanceSquared = worst;
    }
}
