package org.gudu0.videogate.verification;

import java.time.Duration;

/**
 * Result of a video post or timer fire. {@link Kind#NONE} means the entry was already gone
 * (verified, expired, never tracked, or consumed by a concurrent handler).
 */
public record VerificationOutcome(Kind kind, VerificationKey key, String displayName,
                                  Duration elapsed, int timeoutSeconds) {

    public enum Kind { NONE, VERIFIED, EXPIRED }

    private static final VerificationOutcome NONE = new VerificationOutcome(Kind.NONE, null, null, Duration.ZERO, 0);

    public static VerificationOutcome none() {
        return NONE;
    }

    static VerificationOutcome verified(VerificationEntry entry, Duration elapsed) {
        return new VerificationOutcome(Kind.VERIFIED, entry.key, entry.displayName, elapsed, entry.timeoutSeconds);
    }

    static VerificationOutcome expired(VerificationEntry entry) {
        return new VerificationOutcome(Kind.EXPIRED, entry.key, entry.displayName,
                Duration.ofSeconds(entry.timeoutSeconds), entry.timeoutSeconds);
    }

    public boolean isNone() { return kind == Kind.NONE; }

    public boolean isVerified() { return kind == Kind.VERIFIED; }

    public boolean isExpired() { return kind == Kind.EXPIRED; }
}
