package dev.ebullient.interrogation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import dev.ebullient.interrogation.model.Agent;

class AgentStoreTest {

    @TempDir
    Path tempDir;

    TestWiring wiring;
    String agentId;

    @BeforeEach
    void setUp() {
        wiring = new TestWiring(tempDir);
        agentId = wiring.engine.spawn(TestStories.STORY_ID, TestStories.NERVOUS_ID);
    }

    @Test
    void getOrLoad_liveAgent_isSameInstance() {
        Agent first = wiring.store.getOrLoad(agentId);
        assertSame(first, wiring.store.getOrLoad(agentId));
        assertFalse(first.reconstructedFromStore());
    }

    @Test
    void getOrLoad_unknownAgent_isNotFound() {
        AgentException e = assertThrows(AgentException.class, () -> wiring.store.getOrLoad("no-such-agent"));
        assertEquals(AgentException.Kind.NOT_FOUND, e.kind());
    }

    @Test
    void getOrLoad_malformedId_isNotFound() {
        for (String id : List.of("", "../../etc/passwd", "a b", "x".repeat(65))) {
            AgentException e = assertThrows(AgentException.class, () -> wiring.store.getOrLoad(id));
            assertEquals(AgentException.Kind.NOT_FOUND, e.kind());
        }
        assertThrows(AgentException.class, () -> wiring.store.getOrLoad(null));
    }

    @Test
    void getOrLoad_afterRestart_reconstructs() {
        TestWiring restarted = new TestWiring(tempDir);
        assertFalse(restarted.store.isLive(agentId));

        Agent agent = restarted.store.getOrLoad(agentId);

        assertTrue(agent.reconstructedFromStore());
        assertTrue(restarted.store.isLive(agentId));
        assertEquals(wiring.store.getOrLoad(agentId).history(), agent.history());
    }

    @Test
    void getOrLoad_concurrentMisses_convergeOnOneInstance() throws Exception {
        TestWiring restarted = new TestWiring(tempDir);
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Agent>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Agent> load = () -> {
                    start.await();
                    return restarted.store.getOrLoad(agentId);
                };
                futures.add(pool.submit(load));
            }
            start.countDown();

            Set<Agent> seen = new HashSet<>();
            for (Future<Agent> future : futures) {
                seen.add(future.get(10, TimeUnit.SECONDS));
            }
            assertEquals(1, seen.size());
            assertSame(seen.iterator().next(), restarted.store.getOrLoad(agentId));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void evict_thenReload_rebuildsFromLog() {
        Agent live = wiring.store.getOrLoad(agentId);
        wiring.store.evict(agentId);
        assertFalse(wiring.store.isLive(agentId));

        Agent reloaded = wiring.store.getOrLoad(agentId);
        assertNotSame(live, reloaded);
        assertTrue(reloaded.reconstructedFromStore());
        assertEquals(live.history(), reloaded.history());
    }

    @Test
    void lockFor_isStablePerAgent() {
        assertSame(wiring.store.lockFor(agentId), wiring.store.lockFor(agentId));
        assertNotSame(wiring.store.lockFor(agentId), wiring.store.lockFor("other-agent"));
    }

    @Test
    void preload_rebuildsRecentlyActiveAgents() {
        String second = wiring.engine.spawn(TestStories.STORY_ID, TestStories.ARROGANT_ID);

        TestWiring restarted = new TestWiring(tempDir);
        assertEquals(0, restarted.store.preload());

        restarted.store.preloadHours = 1;
        assertEquals(2, restarted.store.preload());
        assertTrue(restarted.store.isLive(agentId));
        assertTrue(restarted.store.isLive(second));
        assertEquals(2, restarted.store.size());
    }
}
