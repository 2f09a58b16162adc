package org.gudu0.videogate.verification;

import java.time.Instant;

/**
 * One tracked member inside their verification window.
 * <p>
 * Only touched while holding the tracker lock.
 */
final class VerificationEntry {
    final VerificationKey key;
    final String displayName;
    final Instant startedAt;
    final int timeoutSeconds;
    final long sessionId;

    EntryState state;
    TimerHandle timer;

    VerificationEntry(VerificationKey key, String displayName, Instant startedAt,
                      int timeoutSeconds, long sessionId, EntryState state) {
        this.key = key;
        this.displayName = displayName;
        this.startedAt = startedAt;
        this.timeoutSeconds = timeoutSeconds;
        this.sessionId = sessionId;
        this.state = state;
    }

    void cancelTimer() {
        if (timer != null) timer.cancel();
    }
}
