package dev.ebullient.interrogation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import dev.ebullient.interrogation.chat.CharacterPrompts;
import dev.ebullient.interrogation.chat.CharacterReply;
import dev.ebullient.interrogation.chat.DialogueGenerator;
import dev.ebullient.interrogation.chat.FallbackLines;
import dev.ebullient.interrogation.chat.LocationRevealDetector;
import dev.ebullient.interrogation.chat.MalformedReplyException;
import dev.ebullient.interrogation.chat.ReplyParser;
import dev.ebullient.interrogation.chat.RevealValidator;
import dev.ebullient.interrogation.model.Agent;
import dev.ebullient.interrogation.model.Evidence;
import dev.ebullient.interrogation.model.Location;
import dev.ebullient.interrogation.model.MessageReply;
import dev.ebullient.interrogation.model.Role;
import dev.ebullient.interrogation.model.Turn;

/**
 * One request/response cycle for an agent:
 *
 * <pre>
 * AUGMENTING -> GENERATING -> PARSING -> VALIDATING -> PERSISTING -> DONE
 *                                |  ^
 *                                v  |
 *                              RETRYING
 * </pre>
 *
 * A reply that does not parse gets one retry with a clarification turn; if
 * that fails too, the character answers with a canned line for its
 * personality. Evidence reveals are filtered against what the character
 * holds. Location reveals come from the {@link LocationRevealDetector}, never
 * from the generator's own report.
 * <p>
 * Callers hold {@link AgentStore#lockFor(String)} for the agent while this runs.
 */
@ApplicationScoped
public class TurnPipeline {
    private static final Logger log = Logger.getLogger(TurnPipeline.class);

    public enum Stage {
        AUGMENTING,
        GENERATING,
        PARSING,
        RETRYING,
        VALIDATING,
        PERSISTING,
        DONE
    }

    @Inject
    DialogueGenerator generator;

    @Inject
    ReplyParser parser;

    @Inject
    RevealValidator validator;

    @Inject
    LocationRevealDetector locationDetector;

    @Inject
    StoryProvider storyProvider;

    @Inject
    TurnPersister persister;

    /**
     * State carried between stages of one turn.
     */
    static final class TurnContext {
        final Agent agent;
        final String message;
        final List<String> presentedEvidenceIds;
        final String locationId;
        final List<Stage> visited = new ArrayList<>();

        String raw;
        boolean retried;
        boolean fallback;
        CharacterReply reply;
        List<String> evidence = List.of();
        List<String> locations = List.of();
        MessageReply result;

        TurnContext(Agent agent, String message, List<String> presentedEvidenceIds, String locationId) {
            this.agent = agent;
            this.message = message == null ? "" : message;
            this.presentedEvidenceIds = presentedEvidenceIds == null ? List.of() : presentedEvidenceIds;
            this.locationId = locationId;
        }
    }

    public MessageReply run(Agent agent, String message, List<String> presentedEvidenceIds, String locationId) {
        return execute(new TurnContext(agent, message, presentedEvidenceIds, locationId)).result;
    }

    TurnContext execute(TurnContext ctx) {
        Stage stage = Stage.AUGMENTING;
        while (stage != Stage.DONE) {
            ctx.visited.add(stage);
            stage = switch (stage) {
                case AUGMENTING -> augment(ctx);
                case GENERATING -> generate(ctx);
                case PARSING -> parse(ctx);
                case RETRYING -> retry(ctx);
                case VALIDATING -> validate(ctx);
                case PERSISTING -> persist(ctx);
                case DONE -> Stage.DONE;
            };
        }
        ctx.visited.add(Stage.DONE);
        log.debugf("Turn for agent %s: %s%s", ctx.agent.id(), ctx.visited, ctx.fallback ? " (fallback)" : "");
        return ctx;
    }

    private Stage augment(TurnContext ctx) {
        Agent agent = ctx.agent;

        Location location = null;
        if (!StringUtils.isBlank(ctx.locationId)) {
            location = storyProvider.findLocation(agent.storyRef(), ctx.locationId).orElse(null);
            if (location == null) {
                log.debugf("Unknown location %s in story %s; no location marker", ctx.locationId, agent.storyRef());
            }
        }

        List<Evidence> presented = storyProvider.findEvidence(agent.storyRef(), ctx.presentedEvidenceIds);
        if (presented.size() < ctx.presentedEvidenceIds.size()) {
            log.debugf("Ignoring %d unknown presented evidence id(s) for agent %s",
                    ctx.presentedEvidenceIds.size() - presented.size(), agent.id());
        }

        if (ctx.message.isBlank() && presented.isEmpty()) {
            throw AgentException.badInput("Message cannot be empty");
        }

        String fullText = MessageFormatter.augment(ctx.message, location, presented);
        Turn userTurn = agent.appendTurn(Role.USER, fullText,
                MessageFormatter.clientText(Role.USER, fullText), List.of(), List.of());
        persister.persist(agent.id(), userTurn);
        return Stage.GENERATING;
    }

    private Stage generate(TurnContext ctx) {
        ctx.raw = callGenerator(outgoing(ctx.agent, null));
        return Stage.PARSING;
    }

    private Stage parse(TurnContext ctx) {
        try {
            ctx.reply = parser.parse(ctx.raw);
            return Stage.VALIDATING;
        } catch (MalformedReplyException e) {
            if (!ctx.retried) {
                log.warnf("Unparsable reply from agent %s (%s): %s", ctx.agent.id(), ctx.agent.characterName(),
                        e.getMessage());
                log.debugf("Raw reply: %s", ctx.raw);
                return Stage.RETRYING;
            }
            log.warnf("Retry reply from agent %s still unparsable; using fallback", ctx.agent.id());
            useFallback(ctx);
            return Stage.VALIDATING;
        }
    }

    private Stage retry(TurnContext ctx) {
        ctx.retried = true;
        try {
            ctx.raw = callGenerator(outgoing(ctx.agent, CharacterPrompts.RETRY_CLARIFICATION));
            return Stage.PARSING;
        } catch (RuntimeException e) {
            log.warnf(e, "Retry for agent %s failed; using fallback", ctx.agent.id());
            useFallback(ctx);
            return Stage.VALIDATING;
        }
    }

    private Stage validate(TurnContext ctx) {
        Agent agent = ctx.agent;
        CharacterReply reply = ctx.reply;

        String text = reply.reply().trim();
        if (text.isEmpty()) {
            log.warnf("Agent %s returned an empty reply; using default line", agent.id());
            text = FallbackLines.EMPTY_REPLY;
        }

        List<String> evidence = validator.validateEvidence(reply.revealedEvidences(), agent.capability());
        if (evidence.size() < reply.revealedEvidences().size()) {
            log.infof("Filtered out %d invalid evidence reveal(s) for %s",
                    reply.revealedEvidences().size() - evidence.size(), agent.characterName());
        }

        List<Location> candidates = knownLocations(agent);
        Set<String> detected = locationDetector.detect(text, candidates);
        List<String> locations = validator.validateLocations(detected, agent.capability());
        if (!reply.revealedLocations().isEmpty() || !locations.isEmpty()) {
            log.debugf("Agent %s self-reported locations %s, detector found %s",
                    agent.id(), reply.revealedLocations(), locations);
        }

        ctx.reply = new CharacterReply(text, reply.revealedEvidences(), reply.revealedLocations());
        ctx.evidence = evidence;
        ctx.locations = locations;
        return Stage.PERSISTING;
    }

    private Stage persist(TurnContext ctx) {
        Agent agent = ctx.agent;
        String text = ctx.reply.reply();
        Turn turn = agent.appendTurn(Role.CHARACTER, text, text, ctx.evidence, ctx.locations);
        agent.recordReveals(ctx.evidence, ctx.locations);
        persister.persist(agent.id(), turn);
        ctx.result = new MessageReply(text, ctx.evidence, ctx.locations);
        return Stage.DONE;
    }

    private void useFallback(TurnContext ctx) {
        ctx.fallback = true;
        ctx.reply = CharacterReply.of(FallbackLines.forPersonality(ctx.agent.personality()));
    }

    private String callGenerator(List<Turn> turns) {
        try {
            return generator.generate(turns, true);
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw AgentException.unavailable("Generator call failed: " + e.getMessage(), e);
        }
    }

    /**
     * Turns sent to the generator: the non-blank history, a format reminder
     * for agents rebuilt from the log, and an optional trailing user turn.
     * Neither addition is stored in the agent's history.
     */
    List<Turn> outgoing(Agent agent, String extraUserText) {
        List<Turn> turns = new ArrayList<>();
        for (Turn turn : agent.history()) {
            if (!turn.isBlank()) {
                turns.add(turn);
            }
        }
        int next = agent.nextIndex();
        if (agent.reconstructedFromStore()) {
            turns.add(new Turn(next++, Role.INSTRUCTION, CharacterPrompts.FORMAT_REMINDER, "", Instant.now(),
                    List.of(), List.of()));
        }
        if (extraUserText != null) {
            turns.add(new Turn(next, Role.USER, extraUserText, "", Instant.now(), List.of(), List.of()));
        }
        return turns;
    }

    private List<Location> knownLocations(Agent agent) {
        List<Location> known = new ArrayList<>();
        for (String id : agent.capability().knownLocationIds()) {
            Optional<Location> location = storyProvider.findLocation(agent.storyRef(), id);
            if (location.isPresent()) {
                known.add(location.get());
            } else {
                log.debugf("Known location %s of agent %s is not in story %s", id, agent.id(), agent.storyRef());
            }
        }
        return known;
    }
}
