package dev.ebullient.interrogation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.ebullient.interrogation.TurnPipeline.Stage;
import dev.ebullient.interrogation.TurnPipeline.TurnContext;
import dev.ebullient.interrogation.chat.CharacterPrompts;
import dev.ebullient.interrogation.model.Agent;
import dev.ebullient.interrogation.model.AgentRecord;
import dev.ebullient.interrogation.model.Role;
import dev.ebullient.interrogation.model.Turn;

class TurnPipelineTest {

    @TempDir
    Path tempDir;

    TestWiring wiring;
    Agent agent;

    @BeforeEach
    void setUp() {
        wiring = new TestWiring(tempDir);
        agent = wiring.store.getOrLoad(wiring.engine.spawn(TestStories.STORY_ID, TestStories.NERVOUS_ID));
    }

    private TurnContext run(String message) {
        return wiring.pipeline.execute(new TurnContext(agent, message, null, null));
    }

    @Test
    void execute_parsableReply_visitsEachStageOnce() {
        wiring.generator.reply(FakeGenerator.json("Hello.", List.of(), List.of()));

        TurnContext ctx = run("Hi");

        assertEquals(List.of(Stage.AUGMENTING, Stage.GENERATING, Stage.PARSING, Stage.VALIDATING,
                Stage.PERSISTING, Stage.DONE), ctx.visited);
        assertFalse(ctx.retried);
        assertFalse(ctx.fallback);
    }

    @Test
    void execute_unparsableReply_retriesOnce() {
        wiring.generator.reply("nope").reply(FakeGenerator.json("Hello.", List.of(), List.of()));

        TurnContext ctx = run("Hi");

        assertEquals(List.of(Stage.AUGMENTING, Stage.GENERATING, Stage.PARSING, Stage.RETRYING, Stage.PARSING,
                Stage.VALIDATING, Stage.PERSISTING, Stage.DONE), ctx.visited);
        assertTrue(ctx.retried);
        assertFalse(ctx.fallback);
    }

    @Test
    void execute_retryFails_fallsBackWithoutThirdCall() {
        wiring.generator.reply("nope").reply("```json\n{ broken\n```");

        TurnContext ctx = run("Hi");

        assertTrue(ctx.fallback);
        assertEquals(2, wiring.generator.calls.size());
        assertEquals(Stage.DONE, ctx.visited.get(ctx.visited.size() - 1));
        assertTrue(ctx.result.revealedEvidenceIds().isEmpty());
    }

    @Test
    void execute_fallbackStillRunsLocationDetection() {
        // a fallback line never names a location; nothing is revealed
        wiring.generator.reply("nope").fail(new IllegalStateException("down"));

        TurnContext ctx = run("Where is the secret lab?");

        assertTrue(ctx.fallback);
        assertTrue(ctx.locations.isEmpty());
        assertTrue(agent.revealedLocationIds().isEmpty());
    }

    @Test
    void outgoing_freshAgent_hasNoReminder() {
        List<Turn> turns = wiring.pipeline.outgoing(agent, null);

        assertEquals(1, turns.size());
        assertEquals(Role.INSTRUCTION, turns.get(0).role());
    }

    @Test
    void outgoing_reconstructedAgent_appendsTransientReminder() {
        AgentRecord record = wiring.conversationLog.findAgent(agent.id()).orElseThrow();
        Agent rebuilt = wiring.reconstructor.reconstruct(record);

        List<Turn> turns = wiring.pipeline.outgoing(rebuilt, CharacterPrompts.RETRY_CLARIFICATION);

        assertEquals(3, turns.size());
        assertEquals(CharacterPrompts.FORMAT_REMINDER, turns.get(1).fullText());
        assertEquals(CharacterPrompts.RETRY_CLARIFICATION, turns.get(2).fullText());
        assertEquals(List.of(0, 1, 2), turns.stream().map(Turn::index).toList());
        assertEquals(1, rebuilt.historySize());
    }

    @Test
    void execute_userTurnCarriesClientText() {
        wiring.generator.reply(FakeGenerator.json("Hm.", List.of(), List.of()));

        wiring.pipeline.execute(new TurnContext(agent, "  Look at this.  ", List.of(TestStories.KEYCARD.id()), "loc_2"));

        Turn user = agent.history().get(1);
        assertEquals(Role.USER, user.role());
        assertEquals("Look at this.", user.clientText());
        assertTrue(user.fullText().startsWith("[CURRENT LOCATION: Captain's Office"));
        assertTrue(user.fullText().contains("Image: https://example.com/keycard.png"));
    }
}
