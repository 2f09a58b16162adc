package org.gudu0.videogate.errors;

/**
 * The chat platform could not perform an action (missing guild/channel, permissions, network).
 * Logged only; never rolls back bookkeeping that was already committed.
 */
public class GatewayException extends ModerationException {
    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
