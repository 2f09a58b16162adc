package org.gudu0.videogate.spam;

import org.gudu0.videogate.stats.StatsCounter;

/** Violation kinds in the order they are checked. */
public enum ViolationKind {
    LINK(StatsCounter.LINKS_BLOCKED),
    BANNED_WORD(StatsCounter.SPAM_BLOCKED),
    SUSPICIOUS_IDENTITY(StatsCounter.SUSPICIOUS_KICKED);

    private final StatsCounter counter;

    ViolationKind(StatsCounter counter) {
        this.counter = counter;
    }

    public StatsCounter counter() {
        return counter;
    }
}
