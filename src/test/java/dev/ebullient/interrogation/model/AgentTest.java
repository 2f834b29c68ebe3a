package dev.ebullient.interrogation.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AgentTest {

    Agent agent;

    @BeforeEach
    void setUp() {
        agent = new Agent(new AgentRecord("a-1", "story", "char", "Pell", null,
                List.of("ev_1", "ev_2"), List.of("loc_1"), Instant.now()), false);
    }

    private static Turn turn(int index, Role role, String text) {
        return new Turn(index, role, text, text, Instant.now(), List.of(), List.of());
    }

    @Test
    void appendTurn_assignsContiguousIndices() {
        assertEquals(0, agent.nextIndex());
        agent.appendTurn(Role.INSTRUCTION, "You are Pell.", "", List.of(), List.of());
        Turn user = agent.appendTurn(Role.USER, "Hi", "Hi", List.of(), List.of());

        assertEquals(1, user.index());
        assertEquals(2, agent.nextIndex());
        assertEquals("", agent.personality());
    }

    @Test
    void recordReveals_isIdempotentUnion() {
        agent.recordReveals(List.of("ev_2"), List.of());
        agent.recordReveals(List.of("ev_1", "ev_2"), List.of("loc_1"));
        agent.recordReveals(List.of("ev_1"), List.of("loc_1"));

        assertEquals(List.of("ev_2", "ev_1"), List.copyOf(agent.revealedEvidenceIds()));
        assertEquals(List.of("loc_1"), List.copyOf(agent.revealedLocationIds()));
    }

    @Test
    void recordReveals_outsideCapability_throwsAndChangesNothing() {
        assertThrows(IllegalStateException.class, () -> agent.recordReveals(List.of("ev_1", "ev_9"), List.of()));
        assertThrows(IllegalStateException.class, () -> agent.recordReveals(List.of(), List.of("loc_2")));

        assertTrue(agent.revealedEvidenceIds().isEmpty());
        assertTrue(agent.revealedLocationIds().isEmpty());
    }

    @Test
    void restoreTurn_rejectsOutOfOrderIndex() {
        agent.restoreTurn(turn(0, Role.INSTRUCTION, "You are Pell."));
        agent.restoreTurn(turn(1, Role.USER, "Hi"));

        assertThrows(IllegalStateException.class, () -> agent.restoreTurn(turn(1, Role.CHARACTER, "Hello")));
        assertEquals(2, agent.nextIndex());
    }

    @Test
    void history_isACopy() {
        agent.appendTurn(Role.USER, "Hi", "Hi", List.of(), List.of());
        List<Turn> history = agent.history();

        assertThrows(UnsupportedOperationException.class, () -> history.add(turn(5, Role.USER, "x")));
        agent.appendTurn(Role.CHARACTER, "Hello", "Hello", List.of(), List.of());
        assertEquals(1, history.size());
        assertEquals(2, agent.historySize());
        assertThrows(UnsupportedOperationException.class, () -> agent.revealedEvidenceIds().add("ev_1"));
    }
}
