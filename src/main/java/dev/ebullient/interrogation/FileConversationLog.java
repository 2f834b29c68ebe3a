package dev.ebullient.interrogation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import dev.ebullient.interrogation.model.AgentRecord;
import dev.ebullient.interrogation.model.Turn;

/**
 * File-backed conversation log. Each agent gets a directory holding
 * {@code agent.json} and {@code turns.jsonl} (one JSON turn per line).
 */
@Singleton
public class FileConversationLog implements ConversationLog {
    private static final Logger log = Logger.getLogger(FileConversationLog.class);

    static final String AGENT_FILE = "agent.json";
    static final String TURNS_FILE = "turns.jsonl";

    private final ConcurrentHashMap<String, Object> agentLocks = new ConcurrentHashMap<>();

    @ConfigProperty(name = "interrogation.log.dir", defaultValue = "${user.home}/.interrogation/agents")
    String logDir;

    private final ObjectMapper mapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Path resolveLogDir() {
        Path dir = Path.of(logDir);
        if (!Files.exists(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create conversation log directory: " + dir, e);
            }
        }
        return dir;
    }

    private Path agentDir(String agentId) {
        if (!ConversationLog.isValidId(agentId)) {
            throw new IllegalArgumentException("Invalid agent id: " + agentId);
        }
        return resolveLogDir().resolve(agentId);
    }

    private Object lockFor(String agentId) {
        return agentLocks.computeIfAbsent(agentId, k -> new Object());
    }

    @Override
    public String createAgent(AgentRecord record) {
        String id = StringUtils.isBlank(record.id()) ? UUID.randomUUID().toString() : record.id();
        AgentRecord stored = record.withId(id);
        Path dir = agentDir(id);
        synchronized (lockFor(id)) {
            try {
                Files.createDirectories(dir);
                writeAtomically(dir.resolve(AGENT_FILE), mapper.writeValueAsString(stored));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create agent " + id, e);
            }
        }
        log.debugf("Created agent record %s in %s", id, dir);
        return id;
    }

    @Override
    public Optional<AgentRecord> findAgent(String agentId) {
        if (!ConversationLog.isValidId(agentId)) {
            return Optional.empty();
        }
        Path file = agentDir(agentId).resolve(AGENT_FILE);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), AgentRecord.class));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read agent " + agentId, e);
        }
    }

    @Override
    public void appendTurn(String agentId, Turn turn) {
        Path dir = agentDir(agentId);
        if (!Files.isDirectory(dir)) {
            throw new IllegalStateException("Unknown agent " + agentId);
        }
        synchronized (lockFor(agentId)) {
            try {
                Files.writeString(dir.resolve(TURNS_FILE), mapper.writeValueAsString(turn) + "\n",
                        StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to append turn %d for agent %s".formatted(turn.index(), agentId), e);
            }
        }
    }

    @Override
    public List<Turn> listTurns(String agentId) {
        if (!ConversationLog.isValidId(agentId)) {
            return List.of();
        }
        Path file = agentDir(agentId).resolve(TURNS_FILE);
        if (!Files.exists(file)) {
            return List.of();
        }
        List<String> lines;
        synchronized (lockFor(agentId)) {
            try {
                lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read turns for agent " + agentId, e);
            }
        }
        List<Turn> turns = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                turns.add(mapper.readValue(line, Turn.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warnf("Skipping unreadable turn at %s:%d: %s", file, lineNo, e.getMessage());
            }
        }
        turns.sort(Comparator.comparingInt(Turn::index));
        return turns;
    }

    @Override
    public void replaceTurns(String agentId, List<Turn> turns) {
        Path dir = agentDir(agentId);
        if (!Files.isDirectory(dir)) {
            throw new IllegalStateException("Unknown agent " + agentId);
        }
        StringBuilder sb = new StringBuilder();
        try {
            for (Turn turn : turns) {
                sb.append(mapper.writeValueAsString(turn)).append('\n');
            }
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize turns for agent " + agentId, e);
        }
        synchronized (lockFor(agentId)) {
            try {
                writeAtomically(dir.resolve(TURNS_FILE), sb.toString());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to rewrite turns for agent " + agentId, e);
            }
        }
        log.debugf("Rewrote %d turns for agent %s", turns.size(), agentId);
    }

    @Override
    public List<String> recentlyActive(Instant since, int limit) {
        Path root = resolveLogDir();
        List<Map.Entry<String, Instant>> active = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(root, Files::isDirectory)) {
            for (Path dir : dirs) {
                String id = dir.getFileName().toString();
                if (!ConversationLog.isValidId(id) || !Files.exists(dir.resolve(AGENT_FILE))) {
                    continue;
                }
                Instant modified = lastModified(dir);
                if (!modified.isBefore(since)) {
                    active.add(Map.entry(id, modified));
                }
            }
        } catch (IOException e) {
            log.errorf(e, "Failed to list agents in %s", root);
            return List.of();
        }
        return active.stream()
                .sorted(Map.Entry.<String, Instant> comparingByValue().reversed())
                .limit(Math.max(0, limit))
                .map(Map.Entry::getKey)
                .toList();
    }

    private static Instant lastModified(Path dir) throws IOException {
        Path turns = dir.resolve(TURNS_FILE);
        FileTime time = Files.getLastModifiedTime(Files.exists(turns) ? turns : dir.resolve(AGENT_FILE));
        return time.toInstant();
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
