package org.Aayush.proximity.index;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Candidate Set Tests")
class CandidateSetTest {

    @Test
    @DisplayName("Fills to capacity before reporting a worst distance")
    void testFillsToCapacity() {
        CandidateSet set = new CandidateSet(3);
        assertTrue(set.offer(10, 9.0));
        assertTrue(set.offer(11, 1.0));
        assertFalse(set.isFull());
        assertEquals(Double.POSITIVE_INFINITY, set.worstDistanceSquared());

        assertTrue(set.offer(12, 4.0));
        assertTrue(set.isFull());
        assertEquals(9.0, set.worstDistanceSquared(), 0.0);
    }

    @Test
    @DisplayName("Replaces the worst only when strictly closer")
    void testReplacesWorst() {
        CandidateSet set = new CandidateSet(2);
        set.offer(1, 4.0);
        set.offer(2, 9.0);

        assertFalse(set.offer(3, 9.0), "equal distance must not replace");
        assertFalse(set.offer(4, 16.0));
        assertTrue(set.offer(5, 1.0));
        assertEquals(4.0, set.worstDistanceSquared(), 0.0);

        int[] order = set.sortedSlots();
        assertEquals(2, order.length);
        assertEquals(5, set.positionAt(order[0]));
        assertEquals(1, set.positionAt(order[1]));
    }

    @Test
    @DisplayName("Sorted order breaks ties by discovery order after slot reuse")
    void testStableTies() {
        CandidateSet set = new CandidateSet(2);
        set.offer(1, 10.0);
        set.offer(2, 20.0);
        set.offer(3, 10.0); // reuses slot 1

        int[] order = set.sortedSlots();
        assertEquals(1, set.positionAt(order[0]));
        assertEquals(3, set.positionAt(order[1]));
        assertEquals(10.0, set.distanceSquaredAt(order[1]), 0.0);
    }

    @Test
    @DisplayName("Evicts the latest of several equally worst candidates")
    void testEvictsLatestAmongEqualWorst() {
        CandidateSet set = new CandidateSet(2);
        set.offer(1, 25.0);
        set.offer(2, 25.0);
        assertTrue(set.offer(3, 1.0));

        int[] order = set.sortedSlots();
        assertEquals(3, set.positionAt(order[0]));
        assertEquals(1, set.positionAt(order[1]));
    }

    @Test
    @DisplayName("Rejects non-positive capacity")
    void testCapacityValidation() {
        assertThrows(IllegalArgumentException.class, () -> new CandidateSet(0));
    }
}
