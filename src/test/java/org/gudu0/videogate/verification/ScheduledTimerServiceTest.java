package org.gudu0.videogate.verification;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ScheduledTimerService")
class ScheduledTimerServiceTest {

    private final ScheduledTimerService timers = new ScheduledTimerService(1);

    @AfterEach
    void tearDown() {
        timers.shutdown();
    }

    @Test
    @DisplayName("runs the callback after the delay")
    void fires() throws Exception {
        CountDownLatch ran = new CountDownLatch(1);

        timers.schedule(Duration.ofMillis(20), ran::countDown);

        assertThat(ran.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("a cancelled timer never runs")
    void cancel() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();
        CountDownLatch later = new CountDownLatch(1);

        TimerHandle handle = timers.schedule(Duration.ofMillis(20), () -> ran.set(true));
        assertThat(handle.cancel()).isTrue();

        // Single worker thread: once the later timer has run, the cancelled one would have too.
        timers.schedule(Duration.ofMillis(100), later::countDown);
        assertThat(later.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(ran).isFalse();
    }

    @Test
    @DisplayName("a throwing callback doesn't kill the scheduler")
    void survivesFailures() throws Exception {
        CountDownLatch second = new CountDownLatch(1);

        timers.schedule(Duration.ofMillis(10), () -> { throw new IllegalStateException("boom"); });
        timers.schedule(Duration.ofMillis(50), second::countDown);

        assertThat(second.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
