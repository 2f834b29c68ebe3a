package dev.ebullient.interrogation;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.interrogation.model.Turn;

/**
 * Fire-and-forget writes to the {@link ConversationLog}. Writes run one at a
 * time on a single worker thread, in submission order, so a log rewrite never
 * overtakes an append queued after it. Each write has its own timeout and a
 * few attempts; failures are logged and never reach the caller.
 */
@Singleton
public class TurnPersister {
    private static final Logger log = Logger.getLogger(TurnPersister.class);

    @Inject
    ConversationLog conversationLog;

    @ConfigProperty(name = "interrogation.persistence.timeout", defaultValue = "5S")
    Duration timeout = Duration.ofSeconds(5);

    @ConfigProperty(name = "interrogation.persistence.attempts", defaultValue = "3")
    int attempts = 3;

    Executor executor;

    private ExecutorService workers;

    @PostConstruct
    void init() {
        workers = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "turn-persister");
            t.setDaemon(true);
            return t;
        });
        executor = workers;
    }

    @PreDestroy
    void shutdown() {
        if (workers != null) {
            workers.shutdown();
            try {
                if (!workers.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warnf("Pending turn writes did not finish within %s", timeout);
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                workers.shutdownNow();
            }
        }
    }

    /**
     * Append one turn to the durable log. Blank turns are never written.
     */
    public CompletableFuture<Void> persist(String agentId, Turn turn) {
        if (turn.isBlank()) {
            log.debugf("Not persisting blank %s turn %d for agent %s", turn.role(), turn.index(), agentId);
            return CompletableFuture.completedFuture(null);
        }
        return submit(agentId, "append turn " + turn.index(),
                () -> conversationLog.appendTurn(agentId, turn));
    }

    /**
     * Rewrite the durable log of an agent with the given turns, minus blank ones.
     */
    public CompletableFuture<Void> replaceAll(String agentId, List<Turn> turns) {
        List<Turn> nonBlank = turns.stream()
                .filter(t -> !t.isBlank())
                .toList();
        return submit(agentId, "rewrite " + nonBlank.size() + " turns",
                () -> conversationLog.replaceTurns(agentId, nonBlank));
    }

    private CompletableFuture<Void> submit(String agentId, String what, Runnable write) {
        CompletableFuture<Void> future;
        try {
            future = CompletableFuture.runAsync(() -> withRetries(agentId, what, write), executor);
        } catch (RuntimeException e) {
            // executor rejected the task (shutting down)
            log.warnf(e, "Could not schedule %s for agent %s", what, agentId);
            return CompletableFuture.completedFuture(null);
        }
        return future
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .exceptionally(e -> {
                    log.warnf(e, "Failed to %s for agent %s", what, agentId);
                    return null;
                });
    }

    private void withRetries(String agentId, String what, Runnable write) {
        int max = Math.max(1, attempts);
        for (int attempt = 1;; attempt++) {
            try {
                write.run();
                return;
            } catch (RuntimeException e) {
                if (attempt >= max) {
                    throw e;
                }
                log.debugf("Attempt %d to %s for agent %s failed: %s", attempt, what, agentId, e.getMessage());
                try {
                    Thread.sleep(100L * attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
