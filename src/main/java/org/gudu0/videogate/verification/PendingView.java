package org.gudu0.videogate.verification;

import java.time.Instant;

/** Read-only copy of a pending entry for status output. */
public record PendingView(VerificationKey key, String displayName, EntryState state,
                          Instant startedAt, int timeoutSeconds) {
}
