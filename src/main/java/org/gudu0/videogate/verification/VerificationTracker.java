package org.gudu0.videogate.verification;

import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.util.ConsoleLog;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Owns every member's verification state: join -> pending -> verified | expired.
 * <p>
 * All state sits behind one lock and every operation does O(1) work under it. Timer
 * callbacks re-enter through the same lock; the one that removes an entry first wins and
 * everyone else sees {@link VerificationOutcome#none()}. No platform calls happen here:
 * expired outcomes go to the expiry listener after the lock is released.
 */
public class VerificationTracker {

    private final Object lock = new Object();

    // guarded by lock
    private final Map<VerificationKey, VerificationEntry> pending = new HashMap<>();
    private final Set<VerificationKey> verified = new HashSet<>();
    private long nextSessionId = 1;

    private final Settings settings;
    private final TimerService timers;
    private final Clock clock;

    private volatile Consumer<VerificationOutcome> expiryListener = outcome -> { };

    public VerificationTracker(Settings settings, TimerService timers, Clock clock) {
        this.settings = settings;
        this.timers = timers;
        this.clock = clock;
    }

    /** Receives every EXPIRED outcome produced by a timer. Called outside the tracker lock. */
    public void setExpiryListener(Consumer<VerificationOutcome> listener) {
        this.expiryListener = listener;
    }

    // ----------------------------
    // Transitions
    // ----------------------------

    public WelcomeAction onJoin(long groupId, long userId, String name) {
        VerificationKey key = new VerificationKey(groupId, userId);
        Instant now = clock.instant();

        synchronized (lock) {
            if (settings.isPaused()) {
                return new WelcomeAction(WelcomeAction.Kind.PAUSED, name, 0);
            }
            if (!settings.isWithinActiveHours(now)) {
                return new WelcomeAction(WelcomeAction.Kind.OFF_HOURS, name, 0);
            }
            if (settings.isInteractionMode()) {
                return new WelcomeAction(WelcomeAction.Kind.AWAITING_INTERACTION, name, 0);
            }
            if (verified.contains(key)) {
                return new WelcomeAction(WelcomeAction.Kind.ALREADY_VERIFIED, name, 0);
            }

            VerificationEntry previous = pending.remove(key);
            if (previous != null) {
                previous.cancelTimer();
                ConsoleLog.debug("Tracker", "Rejoin replaced session=" + previous.sessionId + " key=" + key);
            }

            VerificationEntry entry = arm(key, name, EntryState.PENDING_JOIN, now);
            return new WelcomeAction(WelcomeAction.Kind.TIMER_STARTED, name, entry.timeoutSeconds);
        }
    }

    /**
     * Interaction mode: arms the timer on a member's first message.
     *
     * @return true if this call armed a timer
     */
    public boolean onFirstInteraction(long groupId, long userId, String name) {
        VerificationKey key = new VerificationKey(groupId, userId);
        Instant now = clock.instant();

        synchronized (lock) {
            if (!settings.isInteractionMode() || settings.isPaused()) return false;
            if (!settings.isWithinActiveHours(now)) return false;
            if (pending.containsKey(key) || verified.contains(key)) return false;

            arm(key, name, EntryState.PENDING_INTERACTION, now);
            return true;
        }
    }

    public VerificationOutcome onVideoPosted(long groupId, long userId, String name, Instant now) {
        VerificationKey key = new VerificationKey(groupId, userId);

        synchronized (lock) {
            VerificationEntry entry = pending.remove(key);
            if (entry == null) return VerificationOutcome.none();

            entry.cancelTimer();
            entry.state = EntryState.VERIFIED;
            verified.add(key);

            Duration elapsed = Duration.between(entry.startedAt, now);
            if (elapsed.isNegative()) elapsed = Duration.ZERO;

            return VerificationOutcome.verified(entry, elapsed);
        }
    }

    /**
     * Expires whatever entry is pending for the key. Timer callbacks use the session-checked
     * variant so a late fire from a replaced session can't expire the new one.
     */
    public VerificationOutcome onTimerFire(long groupId, long userId, String name) {
        VerificationKey key = new VerificationKey(groupId, userId);

        synchronized (lock) {
            VerificationEntry entry = pending.remove(key);
            if (entry == null) return VerificationOutcome.none();

            entry.cancelTimer();
            entry.state = EntryState.EXPIRED;
            return VerificationOutcome.expired(entry);
        }
    }

    /** Validated to [10, 600]. Applies to timers armed from now on. */
    public void setTimeout(int seconds) {
        settings.setTimeoutSeconds(seconds);
    }

    /**
     * Drops a pending entry without a verdict (spam removal, member left).
     *
     * @return true if something was pending
     */
    public boolean discard(long groupId, long userId) {
        VerificationKey key = new VerificationKey(groupId, userId);

        synchronized (lock) {
            VerificationEntry entry = pending.remove(key);
            if (entry == null) return false;
            entry.cancelTimer();
            return true;
        }
    }

    /**
     * Spam removal: takes the member out of verification in one step, so neither a late
     * timer nor a late video can act on them afterwards.
     */
    public RemovalClaim claimForRemoval(long groupId, long userId) {
        VerificationKey key = new VerificationKey(groupId, userId);

        synchronized (lock) {
            if (verified.contains(key)) return RemovalClaim.VERIFIED;

            VerificationEntry entry = pending.remove(key);
            if (entry == null) return RemovalClaim.UNTRACKED;
            entry.cancelTimer();
            return RemovalClaim.PENDING;
        }
    }

    // ----------------------------
    // Queries
    // ----------------------------

    public boolean isVerified(long groupId, long userId) {
        synchronized (lock) {
            return verified.contains(new VerificationKey(groupId, userId));
        }
    }

    public boolean isPending(long groupId, long userId) {
        synchronized (lock) {
            return pending.containsKey(new VerificationKey(groupId, userId));
        }
    }

    public EntryState stateOf(long groupId, long userId) {
        VerificationKey key = new VerificationKey(groupId, userId);
        synchronized (lock) {
            VerificationEntry entry = pending.get(key);
            if (entry != null) return entry.state;
            return verified.contains(key) ? EntryState.VERIFIED : EntryState.IDLE;
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public int verifiedCount() {
        synchronized (lock) {
            return verified.size();
        }
    }

    /** Oldest first. */
    public List<PendingView> pendingSnapshot() {
        List<PendingView> out = new ArrayList<>();
        synchronized (lock) {
            for (VerificationEntry e : pending.values()) {
                out.add(new PendingView(e.key, e.displayName, e.state, e.startedAt, e.timeoutSeconds));
            }
        }
        out.sort(Comparator.comparing(PendingView::startedAt));
        return out;
    }

    /** Cancels every pending timer. Entries are dropped without a verdict. */
    public void shutdown() {
        int cancelled;
        synchronized (lock) {
            cancelled = pending.size();
            pending.values().forEach(VerificationEntry::cancelTimer);
            pending.clear();
        }
        ConsoleLog.info("Tracker", "Shutdown: cancelled " + cancelled + " pending verification(s)");
    }

    // ----------------------------
    // Internals
    // ----------------------------

    // Caller holds lock.
    private VerificationEntry arm(VerificationKey key, String name, EntryState state, Instant now) {
        int timeout = settings.timeoutSeconds();
        long sessionId = nextSessionId++;

        VerificationEntry entry = new VerificationEntry(key, name, now, timeout, sessionId, state);
        pending.put(key, entry);

        // The callback blocks on the lock until we return, so it always sees the entry.
        entry.timer = timers.schedule(Duration.ofSeconds(timeout), () -> fire(key, sessionId));

        ConsoleLog.info("Tracker", "Armed " + state + " timer=" + timeout + "s session=" + sessionId
                + " guildId=" + key.groupId() + " userId=" + key.userId() + " name=" + name);
        return entry;
    }

    private void fire(VerificationKey key, long sessionId) {
        VerificationOutcome outcome;

        synchronized (lock) {
            VerificationEntry entry = pending.get(key);
            if (entry == null || entry.sessionId != sessionId) {
                ConsoleLog.debug("Tracker", "Timer fired for consumed session=" + sessionId + " key=" + key + " (no-op)");
                return;
            }
            pending.remove(key);
            entry.state = EntryState.EXPIRED;
            outcome = VerificationOutcome.expired(entry);
        }

        expiryListener.accept(outcome);
    }
}
