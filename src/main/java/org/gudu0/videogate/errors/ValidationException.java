package org.gudu0.videogate.errors;

/**
 * Out-of-range or malformed input. Nothing was changed.
 */
public class ValidationException extends ModerationException {
    public ValidationException(String message) {
        super(message);
    }
}
