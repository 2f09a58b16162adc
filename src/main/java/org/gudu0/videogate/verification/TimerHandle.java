package org.gudu0.videogate.verification;

/**
 * A pending timer callback. Cancel is best effort: a timer that is already firing may still run.
 */
public interface TimerHandle {
    /** @return true if this call prevented the callback from running */
    boolean cancel();
}
