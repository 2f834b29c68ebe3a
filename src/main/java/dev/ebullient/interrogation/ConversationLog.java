package dev.ebullient.interrogation;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import dev.ebullient.interrogation.model.AgentRecord;
import dev.ebullient.interrogation.model.Turn;

/**
 * Durable, ordered turn log keyed by agent ID, plus a side record holding the
 * agent's static fields.
 * <p>
 * Implementations throw unchecked exceptions on I/O failure; callers on the
 * turn path route writes through {@link TurnPersister}, which logs and swallows them.
 */
public interface ConversationLog {

    Pattern AGENT_ID = Pattern.compile("[A-Za-z0-9-]{1,64}");

    static boolean isValidId(String agentId) {
        return agentId != null && AGENT_ID.matcher(agentId).matches();
    }

    /**
     * Store the side record of a new agent.
     *
     * @return the ID of the agent: the record's own ID if it has one, otherwise a generated one
     */
    String createAgent(AgentRecord record);

    Optional<AgentRecord> findAgent(String agentId);

    void appendTurn(String agentId, Turn turn);

    /** Persisted turns of an agent, ordered by index. Empty if the agent is unknown. */
    List<Turn> listTurns(String agentId);

    /** Replace the whole turn log of an agent. */
    void replaceTurns(String agentId, List<Turn> turns);

    /** IDs of agents whose log changed at or after {@code since}, most recent first. */
    List<String> recentlyActive(Instant since, int limit);
}
