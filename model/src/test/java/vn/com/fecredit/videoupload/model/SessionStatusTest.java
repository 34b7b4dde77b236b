package vn.com.fecredit.videoupload.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionStatusTest {

    @Test
    void testLegalTransitions() {
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.COMPLETING));
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.CANCELLED));
        assertTrue(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.EXPIRED));
        assertTrue(SessionStatus.COMPLETING.canTransitionTo(SessionStatus.COMPLETED));
        assertTrue(SessionStatus.COMPLETING.canTransitionTo(SessionStatus.ACTIVE));

        assertFalse(SessionStatus.ACTIVE.canTransitionTo(SessionStatus.COMPLETED));
        assertFalse(SessionStatus.COMPLETING.canTransitionTo(SessionStatus.CANCELLED));
    }

    @Test
    void testNothingLeavesTerminalStatus() {
        for (SessionStatus terminal : SessionStatus.TERMINAL) {
            assertTrue(terminal.isTerminal());
            for (SessionStatus next : SessionStatus.values()) {
                assertFalse(terminal.canTransitionTo(next), terminal + " -> " + next);
            }
        }
    }

    @Test
    void testWireNameIsLowercase() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"cancelled\"", mapper.writeValueAsString(SessionStatus.CANCELLED));
        assertEquals(SessionStatus.EXPIRED, mapper.readValue("\"expired\"", SessionStatus.class));
    }
}
