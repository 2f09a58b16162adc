package org.gudu0.videogate.verification;

import org.gudu0.videogate.util.ConsoleLog;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Verification timers on a small scheduled pool.
 * <p>
 * Callbacks must stay short: they only re-enter the tracker and hand async work to the gateway.
 */
public class ScheduledTimerService implements TimerService {

    private final ScheduledThreadPoolExecutor scheduler;

    public ScheduledTimerService(int threads) {
        AtomicInteger seq = new AtomicInteger();
        this.scheduler = new ScheduledThreadPoolExecutor(threads, r -> {
            Thread t = new Thread(r, "verification-timer-" + seq.incrementAndGet());
            t.setDaemon(true); // don't keep the JVM alive for pending kicks
            return t;
        });
        // Cancelled timers would otherwise sit in the queue until their delay passes.
        this.scheduler.setRemoveOnCancelPolicy(true);
    }

    @Override
    public TimerHandle schedule(Duration delay, Runnable task) {
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            try {
                task.run();
            } catch (Exception e) {
                ConsoleLog.error("Timers", "Timer callback failed: " + e.getMessage(), e);
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);

        ConsoleLog.debug("Timers", "Scheduled timer in " + delay.toMillis() + "ms (queued=" + scheduler.getQueue().size() + ")");
        return () -> future.cancel(false);
    }

    @Override
    public void shutdown() {
        int dropped = scheduler.shutdownNow().size();
        ConsoleLog.info("Timers", "Timer service stopped; cancelled " + dropped + " pending timer(s)");
    }
}
