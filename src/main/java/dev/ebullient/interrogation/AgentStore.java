package dev.ebullient.interrogation;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.interrogation.model.Agent;
import dev.ebullient.interrogation.model.AgentRecord;
import io.quarkus.runtime.StartupEvent;

/**
 * Registry of live agents, backed by the {@link ConversationLog}.
 * <p>
 * The map is guarded by a single monitor held only for map access.
 * Reconstruction runs outside it; when two misses for the same ID race, the
 * first registered instance wins and both callers get it.
 */
@Singleton
public class AgentStore {
    private static final Logger log = Logger.getLogger(AgentStore.class);

    private final Object registryLock = new Object();
    private final Map<String, Agent> agents = new HashMap<>();
    final ConcurrentHashMap<String, Object> agentLocks = new ConcurrentHashMap<>();

    @Inject
    ConversationLog conversationLog;

    @Inject
    HistoryReconstructor reconstructor;

    @ConfigProperty(name = "interrogation.agents.preload-hours", defaultValue = "0")
    int preloadHours;

    @ConfigProperty(name = "interrogation.agents.preload-limit", defaultValue = "50")
    int preloadLimit = 50;

    void onStart(@Observes StartupEvent event) {
        preload();
    }

    /**
     * Fetch a live agent, rebuilding it from the durable log on a miss.
     *
     * @throws AgentException NOT_FOUND for unknown or malformed IDs,
     *         INVALID_AGENT_STATE for a corrupt record, UNAVAILABLE if the log cannot be read
     */
    public Agent getOrLoad(String agentId) {
        if (!ConversationLog.isValidId(agentId)) {
            throw AgentException.notFound("Agent not found: " + agentId);
        }
        synchronized (registryLock) {
            Agent agent = agents.get(agentId);
            if (agent != null) {
                log.debugf("Agent %s found in memory", agentId);
                return agent;
            }
        }

        log.debugf("Agent %s not in memory, loading from conversation log", agentId);
        AgentRecord record;
        try {
            record = conversationLog.findAgent(agentId)
                    .orElseThrow(() -> AgentException.notFound("Agent not found: " + agentId));
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw AgentException.unavailable("Cannot read agent " + agentId, e);
        }
        Agent loaded = reconstructor.reconstruct(record);

        synchronized (registryLock) {
            Agent existing = agents.putIfAbsent(agentId, loaded);
            return existing == null ? loaded : existing;
        }
    }

    public void register(Agent agent) {
        synchronized (registryLock) {
            agents.put(agent.id(), agent);
        }
    }

    public void evict(String agentId) {
        synchronized (registryLock) {
            agents.remove(agentId);
        }
        agentLocks.remove(agentId);
    }

    public boolean isLive(String agentId) {
        synchronized (registryLock) {
            return agents.containsKey(agentId);
        }
    }

    public int size() {
        synchronized (registryLock) {
            return agents.size();
        }
    }

    /**
     * Monitor serializing turns for one agent.
     */
    public Object lockFor(String agentId) {
        return agentLocks.computeIfAbsent(agentId, k -> new Object());
    }

    /**
     * Rebuild agents that were active recently, so the first message after a
     * restart does not pay for reconstruction.
     */
    int preload() {
        if (preloadHours <= 0) {
            return 0;
        }
        Instant since = Instant.now().minus(Duration.ofHours(preloadHours));
        List<String> ids;
        try {
            ids = conversationLog.recentlyActive(since, preloadLimit);
        } catch (RuntimeException e) {
            log.warnf(e, "Could not list recently active agents");
            return 0;
        }
        int loaded = 0;
        for (String id : ids) {
            try {
                getOrLoad(id);
                loaded++;
            } catch (AgentException e) {
                log.warnf("Skipping preload of agent %s: %s", id, e.getMessage());
            }
        }
        log.infof("Preloaded %d of %d recently active agents", loaded, ids.size());
        return loaded;
    }
}
