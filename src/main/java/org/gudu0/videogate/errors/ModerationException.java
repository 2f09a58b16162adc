package org.gudu0.videogate.errors;

/**
 * Base type for every failure the bot reports back to a caller or to the logs.
 */
public class ModerationException extends RuntimeException {
    public ModerationException(String message) {
        super(message);
    }

    public ModerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
