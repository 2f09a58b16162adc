package org.gudu0.videogate.verification;

/**
 * Result of {@link VerificationTracker#claimForRemoval}.
 */
public enum RemovalClaim {
    /** Was pending; entry and timer are gone now. */
    PENDING,
    /** Not tracked at all (joined before the bot, or while paused). */
    UNTRACKED,
    /** Verified by the time of the claim; must not be removed. */
    VERIFIED;

    public boolean mayRemove() {
        return this != VERIFIED;
    }
}
