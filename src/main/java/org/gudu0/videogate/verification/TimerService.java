package org.gudu0.videogate.verification;

import java.time.Duration;

public interface TimerService {

    TimerHandle schedule(Duration delay, Runnable task);

    /** Cancels every outstanding timer. No callbacks run afterwards. */
    void shutdown();
}
