package dev.ebullient.interrogation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.interrogation.chat.CharacterPrompts;
import dev.ebullient.interrogation.model.Agent;
import dev.ebullient.interrogation.model.AgentRecord;
import dev.ebullient.interrogation.model.HistoryEntry;
import dev.ebullient.interrogation.model.HistoryPage;
import dev.ebullient.interrogation.model.MessageReply;
import dev.ebullient.interrogation.model.Role;
import dev.ebullient.interrogation.model.Story;
import dev.ebullient.interrogation.model.StoryCharacter;
import dev.ebullient.interrogation.model.Turn;

/**
 * Entry point for callers: spawn agents, send them messages, read their history.
 */
@ApplicationScoped
public class ConversationEngine {
    private static final Logger log = Logger.getLogger(ConversationEngine.class);

    @Inject
    StoryProvider storyProvider;

    @Inject
    ConversationLog conversationLog;

    @Inject
    AgentStore store;

    @Inject
    TurnPipeline pipeline;

    @Inject
    TurnPersister persister;

    @ConfigProperty(name = "interrogation.history.default-limit", defaultValue = "50")
    int defaultLimit = 50;

    @ConfigProperty(name = "interrogation.history.max-limit", defaultValue = "100")
    int maxLimit = 100;

    /**
     * Create an agent for a story character. The agent starts with a single
     * instruction turn and nothing revealed.
     *
     * @return the new agent's ID
     */
    public String spawn(String storyId, String characterId) {
        if (StringUtils.isBlank(storyId) || StringUtils.isBlank(characterId)) {
            throw AgentException.badInput("Story and character are required");
        }
        Story story = storyProvider.findStory(storyId)
                .orElseThrow(() -> AgentException.notFound("Story not found: " + storyId));
        StoryCharacter character = story.character(characterId)
                .orElseThrow(() -> AgentException.notFound(
                        "Character %s not found in story %s".formatted(characterId, storyId)));

        AgentRecord record = new AgentRecord(null, storyId, characterId, character.name(),
                character.personality(), character.heldEvidenceIds(), character.knowsLocationIds(), Instant.now());
        String agentId;
        try {
            agentId = conversationLog.createAgent(record);
        } catch (RuntimeException e) {
            throw AgentException.unavailable("Could not store new agent", e);
        }

        Agent agent = new Agent(record.withId(agentId), false);
        Turn instruction = agent.appendTurn(Role.INSTRUCTION, CharacterPrompts.instruction(character, story), "",
                List.of(), List.of());
        store.register(agent);
        persister.persist(agentId, instruction);

        log.infof("Spawned agent %s for %s (%s) in story %s", agentId, character.name(), characterId, storyId);
        return agentId;
    }

    /**
     * Run one conversational turn. Turns for the same agent are serialized.
     *
     * @param presentedEvidenceIds evidence the player shows the character, may be null
     * @param locationId where the conversation takes place, may be null
     */
    public MessageReply sendMessage(String agentId, String text, List<String> presentedEvidenceIds, String locationId) {
        if (!ConversationLog.isValidId(agentId)) {
            throw AgentException.notFound("Agent not found: " + agentId);
        }
        // locks are only created for agents that exist
        if (!store.isLive(agentId) && !isStored(agentId)) {
            throw AgentException.notFound("Agent not found: " + agentId);
        }
        synchronized (store.lockFor(agentId)) {
            Agent agent = store.getOrLoad(agentId);
            if (StringUtils.isBlank(agent.storyRef())) {
                throw AgentException.invalidState("Agent %s has no story reference".formatted(agentId));
            }
            MessageReply reply = pipeline.run(agent, text, presentedEvidenceIds, locationId);
            log.debugf("Agent %s replied: %s", agentId, StringUtils.abbreviate(reply.replyText(), 120));
            return reply;
        }
    }

    /**
     * A page of the visible conversation. Live agents are read from memory,
     * others from the durable log without rebuilding them.
     *
     * @param limit page size; values outside 1..max-limit fall back to the default
     * @param offset entries to skip; negative values count as 0
     * @param includeFull show the full text sent to the generator instead of the player-safe text
     */
    public HistoryPage history(String agentId, int limit, int offset, boolean includeFull) {
        if (!ConversationLog.isValidId(agentId)) {
            throw AgentException.notFound("Agent not found: " + agentId);
        }
        int pageSize = limit < 1 || limit > maxLimit ? defaultLimit : limit;
        int skip = Math.max(0, offset);

        List<Turn> turns;
        if (store.isLive(agentId)) {
            synchronized (store.lockFor(agentId)) {
                turns = store.getOrLoad(agentId).history();
            }
        } else {
            if (!isStored(agentId)) {
                throw AgentException.notFound("Agent not found: " + agentId);
            }
            try {
                turns = conversationLog.listTurns(agentId);
            } catch (RuntimeException e) {
                throw AgentException.unavailable("Cannot read history of agent " + agentId, e);
            }
        }

        List<HistoryEntry> visible = new ArrayList<>();
        for (Turn turn : turns) {
            String content = includeFull ? turn.fullText() : turn.clientText();
            if (content.isEmpty() && !includeFull && turn.role() != Role.INSTRUCTION) {
                content = MessageFormatter.clientText(turn.role(), turn.fullText());
            }
            if (content.isBlank()) {
                continue;
            }
            visible.add(new HistoryEntry(turn.role(), content, turn.timestamp(),
                    turn.revealedEvidenceIds(), turn.revealedLocationIds()));
        }

        int from = Math.min(skip, visible.size());
        int to = Math.min(from + pageSize, visible.size());
        return new HistoryPage(agentId, List.copyOf(visible.subList(from, to)), visible.size(), to < visible.size());
    }

    private boolean isStored(String agentId) {
        try {
            return conversationLog.findAgent(agentId).isPresent();
        } catch (RuntimeException e) {
            throw AgentException.unavailable("Cannot read agent " + agentId, e);
        }
    }
}
