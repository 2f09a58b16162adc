package org.gudu0.videogate.stats;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ModerationStats")
class ModerationStatsTest {

    @Test
    @DisplayName("rates divide by joins and treat zero joins as one")
    void rates() {
        ModerationStats stats = new ModerationStats();
        assertThat(stats.snapshot().successRate()).isZero();

        for (int i = 0; i < 4; i++) stats.increment(StatsCounter.TOTAL_JOINS);
        for (int i = 0; i < 3; i++) stats.increment(StatsCounter.USERS_VERIFIED);
        stats.increment(StatsCounter.USERS_KICKED);
        stats.increment(StatsCounter.LINKS_BLOCKED);

        StatsSnapshot s = stats.snapshot();
        assertThat(s.successRate()).isCloseTo(75.0, within(0.001));
        assertThat(s.protectionActions()).isEqualTo(2);
        assertThat(s.protectionRate()).isCloseTo(50.0, within(0.001));
    }

    @Test
    @DisplayName("increments from many threads are not lost")
    void concurrentIncrements() throws Exception {
        ModerationStats stats = new ModerationStats();
        List<Thread> threads = new ArrayList<>();
        for (int t = 0; t < 8; t++) {
            Thread th = new Thread(() -> {
                for (int i = 0; i < 1000; i++) stats.increment(StatsCounter.SPAM_BLOCKED);
            });
            threads.add(th);
            th.start();
        }
        for (Thread th : threads) th.join();

        assertThat(stats.get(StatsCounter.SPAM_BLOCKED)).isEqualTo(8000);
    }
}
