package org.gudu0.videogate.errors;

/**
 * A non-admin tried to run a privileged command. Nothing was changed.
 */
public class AuthorizationException extends ModerationException {
    public AuthorizationException(String message) {
        super(message);
    }
}
