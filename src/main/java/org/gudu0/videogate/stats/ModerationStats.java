package org.gudu0.videogate.stats;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime counters. Only ever incremented.
 */
public class ModerationStats {

    private final Map<StatsCounter, AtomicLong> counters = new EnumMap<>(StatsCounter.class);

    public ModerationStats() {
        for (StatsCounter c : StatsCounter.values()) {
            counters.put(c, new AtomicLong());
        }
    }

    public long increment(StatsCounter counter) {
        return counters.get(counter).incrementAndGet();
    }

    public long get(StatsCounter counter) {
        return counters.get(counter).get();
    }

    public StatsSnapshot snapshot() {
        return new StatsSnapshot(
                get(StatsCounter.TOTAL_JOINS),
                get(StatsCounter.USERS_VERIFIED),
                get(StatsCounter.USERS_KICKED),
                get(StatsCounter.SPAM_BLOCKED),
                get(StatsCounter.LINKS_BLOCKED),
                get(StatsCounter.SUSPICIOUS_KICKED)
        );
    }
}
