package dev.ebullient.interrogation;

/**
 * Domain failure surfaced to callers of {@link ConversationEngine}.
 */
public class AgentException extends RuntimeException {

    public enum Kind {
        /** Unknown or malformed agent, story, or character ID. */
        NOT_FOUND,
        /** Empty or malformed request. */
        BAD_INPUT,
        /** Corrupt persisted agent, e.g. a story reference that no longer resolves. */
        INVALID_AGENT_STATE,
        /** Generator or store transiently unreachable. */
        UNAVAILABLE
    }

    private final Kind kind;

    public AgentException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public AgentException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public static AgentException notFound(String message) {
        return new AgentException(Kind.NOT_FOUND, message);
    }

    public static AgentException badInput(String message) {
        return new AgentException(Kind.BAD_INPUT, message);
    }

    public static AgentException invalidState(String message) {
        return new AgentException(Kind.INVALID_AGENT_STATE, message);
    }

    public static AgentException unavailable(String message, Throwable cause) {
        return new AgentException(Kind.UNAVAILABLE, message, cause);
    }
}
