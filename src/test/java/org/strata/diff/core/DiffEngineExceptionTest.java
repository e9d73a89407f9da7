package org.strata.diff.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Diff Engine Exception Tests")
class DiffEngineExceptionTest {

    @Test
    @DisplayName("Message carries the reason code prefix")
    void testMessageFormat() {
        DiffEngineException ex = new DiffEngineException("DIFF_TEST", "something broke");
        assertEquals("DIFF_TEST", ex.getReasonCode());
        assertEquals("[DIFF_TEST] something broke", ex.getMessage());
    }

    @Test
    @DisplayName("Invariant failures keep their cause")
    void testCause() {
        IllegalStateException cause = new IllegalStateException("root");
        DiffInvariantException ex = new DiffInvariantException("DIFF_TEST", "wrapped", cause);
        assertSame(cause, ex.getCause());
        assertInstanceOf(DiffEngineException.class, ex);
    }

    @Test
    @DisplayName("Reason codes are mandatory")
    void testReasonCodeRequired() {
        assertThrows(IllegalArgumentException.class, () -> new DiffEngineException(" ", "msg"));
        assertThrows(NullPointerException.class, () -> new DiffEngineException(null, "msg"));
    }
}
