package dev.ebullient.interrogation.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A live character instance. Owns its conversation history and the sets of
 * evidence and locations it has given away so far.
 * <p>
 * Not safe for overlapping turns: callers hold the per-agent lock from
 * {@code AgentStore#lockFor} while mutating it.
 */
public class Agent {

    private final String id;
    private final String storyRef;
    private final String characterRef;
    private final String characterName;
    private final String personality;
    private final CapabilityModel capability;
    private final boolean reconstructedFromStore;

    private final List<Turn> history = new ArrayList<>();
    private final Set<String> revealedEvidenceIds = new LinkedHashSet<>();
    private final Set<String> revealedLocationIds = new LinkedHashSet<>();

    public Agent(AgentRecord record, boolean reconstructedFromStore) {
        this.id = record.id();
        this.storyRef = record.storyRef();
        this.characterRef = record.characterRef();
        this.characterName = record.characterName();
        this.personality = record.personality() == null ? "" : record.personality();
        this.capability = record.capability();
        this.reconstructedFromStore = reconstructedFromStore;
    }

    public String id() {
        return id;
    }

    public String storyRef() {
        return storyRef;
    }

    public String characterRef() {
        return characterRef;
    }

    public String characterName() {
        return characterName;
    }

    public String personality() {
        return personality;
    }

    public CapabilityModel capability() {
        return capability;
    }

    public boolean reconstructedFromStore() {
        return reconstructedFromStore;
    }

    public List<Turn> history() {
        return List.copyOf(history);
    }

    public int historySize() {
        return history.size();
    }

    public Set<String> revealedEvidenceIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(revealedEvidenceIds));
    }

    public Set<String> revealedLocationIds() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(revealedLocationIds));
    }

    /**
     * Next index to assign: one past the last turn, 0 for an empty history.
     */
    public int nextIndex() {
        return history.isEmpty() ? 0 : history.get(history.size() - 1).index() + 1;
    }

    public Turn appendTurn(Role role, String fullText, String clientText,
            List<String> evidenceIds, List<String> locationIds) {
        Turn turn = new Turn(nextIndex(), role, fullText, clientText, Instant.now(), evidenceIds, locationIds);
        history.add(turn);
        return turn;
    }

    /**
     * Used while rebuilding an agent; the turn keeps its index, which must be
     * greater than the index of the last turn.
     */
    public void restoreTurn(Turn turn) {
        if (!history.isEmpty() && turn.index() <= history.get(history.size() - 1).index()) {
            throw new IllegalStateException("Turn index %d does not follow %d for agent %s".formatted(
                    turn.index(), history.get(history.size() - 1).index(), id));
        }
        history.add(turn);
    }

    /**
     * Union the given IDs into the revealed sets. Re-adding a revealed ID is a no-op.
     *
     * @throws IllegalStateException if an ID is outside this agent's capability model
     */
    public void recordReveals(Collection<String> evidenceIds, Collection<String> locationIds) {
        for (String evidenceId : evidenceIds) {
            if (!capability.holds(evidenceId)) {
                throw new IllegalStateException("Agent %s does not hold evidence %s".formatted(id, evidenceId));
            }
        }
        for (String locationId : locationIds) {
            if (!capability.knows(locationId)) {
                throw new IllegalStateException("Agent %s does not know location %s".formatted(id, locationId));
            }
        }
        revealedEvidenceIds.addAll(evidenceIds);
        revealedLocationIds.addAll(locationIds);
    }
}
