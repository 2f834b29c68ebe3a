package dev.ebullient.interrogation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.interrogation.chat.CharacterPrompts;
import dev.ebullient.interrogation.chat.RevealValidator;
import dev.ebullient.interrogation.model.Agent;
import dev.ebullient.interrogation.model.AgentRecord;
import dev.ebullient.interrogation.model.Role;
import dev.ebullient.interrogation.model.Story;
import dev.ebullient.interrogation.model.StoryCharacter;
import dev.ebullient.interrogation.model.Turn;

/**
 * Rebuilds a live {@link Agent} from its durable record and turn log.
 * <p>
 * Blank persisted turns are dropped. The first turn is always an instruction:
 * regenerated from current story data when the story and character still
 * resolve, otherwise the persisted one, otherwise a generic continuation
 * instruction. Indices are renumbered to 0..n-1 when the log has gaps, and
 * the durable log is rewritten in the background whenever the rebuilt history
 * differs from what was read.
 */
@Singleton
public class HistoryReconstructor {
    private static final Logger log = Logger.getLogger(HistoryReconstructor.class);

    @Inject
    ConversationLog conversationLog;

    @Inject
    StoryProvider storyProvider;

    @Inject
    RevealValidator validator;

    @Inject
    TurnPersister persister;

    public Agent reconstruct(AgentRecord record) {
        if (StringUtils.isBlank(record.storyRef()) || StringUtils.isBlank(record.characterRef())) {
            throw AgentException.invalidState("Agent %s has no story or character reference".formatted(record.id()));
        }

        List<Turn> persisted;
        try {
            persisted = conversationLog.listTurns(record.id());
        } catch (RuntimeException e) {
            throw AgentException.unavailable("Cannot read conversation log of agent " + record.id(), e);
        }

        List<Turn> turns = new ArrayList<>(persisted.size());
        int skipped = 0;
        for (Turn turn : persisted) {
            if (turn.isBlank()) {
                log.debugf("Skipping empty %s turn %d of agent %s", turn.role(), turn.index(), record.id());
                skipped++;
            } else {
                turns.add(turn);
            }
        }

        Turn persistedInstruction = null;
        if (!turns.isEmpty() && isInstruction(turns.get(0))) {
            persistedInstruction = turns.remove(0);
        }

        String instruction = regenerateInstruction(record)
                .orElse(persistedInstruction == null ? CharacterPrompts.CONTINUATION : persistedInstruction.fullText());
        boolean changed = skipped > 0
                || persistedInstruction == null
                || persistedInstruction.role() != Role.INSTRUCTION
                || persistedInstruction.index() != 0
                || !instruction.equals(persistedInstruction.fullText());

        Instant created = persistedInstruction != null && persistedInstruction.timestamp() != null
                ? persistedInstruction.timestamp()
                : record.createdAt();

        Agent agent = new Agent(record, true);
        List<Turn> rebuilt = new ArrayList<>(turns.size() + 1);
        rebuilt.add(new Turn(0, Role.INSTRUCTION, instruction, "", created, List.of(), List.of()));

        Set<String> evidence = new LinkedHashSet<>();
        Set<String> locations = new LinkedHashSet<>();
        int index = 1;
        for (Turn turn : turns) {
            Turn restored = turn;
            if (restored.index() != index) {
                restored = restored.withIndex(index);
                changed = true;
            }
            if (restored.clientText().isEmpty()) {
                restored = new Turn(restored.index(), restored.role(), restored.fullText(),
                        MessageFormatter.clientText(restored.role(), restored.fullText()),
                        restored.timestamp(), restored.revealedEvidenceIds(), restored.revealedLocationIds());
            }
            if (restored.role() == Role.CHARACTER) {
                evidence.addAll(restored.revealedEvidenceIds());
                locations.addAll(restored.revealedLocationIds());
            }
            rebuilt.add(restored);
            index++;
        }

        for (Turn turn : rebuilt) {
            agent.restoreTurn(turn);
        }
        agent.recordReveals(
                validator.validateEvidence(evidence, agent.capability()),
                validator.validateLocations(locations, agent.capability()));

        log.infof("Reconstructed agent %s (%s) with %d turns, %d empty turns skipped",
                record.id(), record.characterName(), rebuilt.size(), skipped);

        if (changed) {
            log.debugf("Rewriting conversation log of agent %s", record.id());
            persister.replaceAll(record.id(), rebuilt);
        }
        return agent;
    }

    private Optional<String> regenerateInstruction(AgentRecord record) {
        Optional<Story> story = storyProvider.findStory(record.storyRef());
        if (story.isEmpty()) {
            log.warnf("Story %s of agent %s not found; keeping the persisted instruction",
                    record.storyRef(), record.id());
            return Optional.empty();
        }
        Optional<StoryCharacter> character = story.get().character(record.characterRef());
        if (character.isEmpty()) {
            log.warnf("Character %s of agent %s not found in story %s; keeping the persisted instruction",
                    record.characterRef(), record.id(), record.storyRef());
            return Optional.empty();
        }
        log.debugf("Regenerating instruction for agent %s", record.id());
        return Optional.of(CharacterPrompts.instruction(character.get(), story.get()));
    }

    /**
     * Instruction turns are recognized by role, or by content for logs that
     * stored the instruction as the character's first turn.
     */
    static boolean isInstruction(Turn turn) {
        return turn.role() == Role.INSTRUCTION
                || (turn.role() == Role.CHARACTER && MessageFormatter.isInstructionText(turn.fullText()));
    }
}
