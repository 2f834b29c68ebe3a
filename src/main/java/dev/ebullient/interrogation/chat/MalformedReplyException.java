package dev.ebullient.interrogation.chat;

/**
 * The generator answered, but not in the requested shape. Always recovered
 * by the turn pipeline (retry, then fallback); never reaches a caller.
 */
public class MalformedReplyException extends RuntimeException {

    public MalformedReplyException(String message) {
        super(message);
    }

    public MalformedReplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
