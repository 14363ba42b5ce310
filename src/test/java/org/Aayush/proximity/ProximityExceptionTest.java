package org.Aayush.proximity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Proximity Exception Tests")
class ProximityExceptionTest {

    @Test
    @DisplayName("Message is prefixed with reason code")
    void testMessagePrefix() {
        ProximityException ex = new ProximityException("PX_TEST", "something failed");
        assertEquals("PX_TEST", ex.reasonCode());
        assertEquals("[PX_TEST] something failed", ex.getMessage());
    }

    @Test
    @DisplayName("Cause is preserved")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        ProximityException ex = new ProximityException("PX_TEST", "wrapped", cause);
        assertSame(cause, ex.getCause());
    }

    @Test
    @DisplayName("Blank or null reason code is rejected")
    void testReasonCodeValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ProximityException(" ", "msg"));
        assertThrows(NullPointerException.class, () -> new ProximityException(null, "msg"));
        assertThrows(NullPointerException.class, () -> new ProximityException("PX_TEST", null));
    }
}
