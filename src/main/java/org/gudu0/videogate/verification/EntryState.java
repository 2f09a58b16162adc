package org.gudu0.videogate.verification;

public enum EntryState {
    /** Not tracked and not verified. Never stored. */
    IDLE,
    /** Timer armed when the member joined. */
    PENDING_JOIN,
    /** Timer armed on the member's first message (interaction mode). */
    PENDING_INTERACTION,
    VERIFIED,
    EXPIRED;

    public boolean isPending() {
        return this == PENDING_JOIN || this == PENDING_INTERACTION;
    }
}
