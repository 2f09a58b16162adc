package org.gudu0.videogate.rewards;

import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.util.ConsoleLog;
import org.gudu0.videogate.verification.VerificationKey;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Points for fast verifications, per (guild, user). Totals only grow.
 */
public class RewardLedger {

    public static final int SUPER_FAST_POINTS = 100;
    public static final int FAST_POINTS = 50;
    public static final int REGULAR_POINTS = 25;

    private static final Duration SUPER_FAST = Duration.ofSeconds(10);
    private static final Duration FAST = Duration.ofSeconds(30);

    private final Object lock = new Object();

    // Insertion order doubles as the tie-break on the leaderboard.
    private final Map<VerificationKey, Account> accounts = new LinkedHashMap<>();

    private final Settings settings;

    public RewardLedger(Settings settings) {
        this.settings = settings;
    }

    public static int pointsFor(Duration elapsed) {
        if (elapsed.compareTo(SUPER_FAST) <= 0) return SUPER_FAST_POINTS;
        if (elapsed.compareTo(FAST) <= 0) return FAST_POINTS;
        return REGULAR_POINTS;
    }

    /**
     * @return points awarded, 0 when the reward system is off (nothing recorded then)
     */
    public int awardFor(VerificationKey key, String displayName, Duration elapsed) {
        if (!settings.isRewards()) return 0;

        int points = pointsFor(elapsed);
        long total;
        synchronized (lock) {
            Account a = accounts.computeIfAbsent(key, k -> new Account());
            a.points += points;
            a.displayName = displayName;
            total = a.points;
        }

        ConsoleLog.info("Rewards", "Awarded " + points + " to " + key + " (elapsed=" + elapsed.toMillis() + "ms total=" + total + ")");
        return points;
    }

    public long totalFor(VerificationKey key) {
        synchronized (lock) {
            Account a = accounts.get(key);
            return a == null ? 0 : a.points;
        }
    }

    public boolean isEmpty() {
        synchronized (lock) {
            return accounts.isEmpty();
        }
    }

    /** Every guild, highest first. */
    public List<LeaderboardEntry> leaderboard(int limit) {
        return ranked(k -> true, limit);
    }

    /** One guild, highest first. */
    public List<LeaderboardEntry> leaderboard(long groupId, int limit) {
        return ranked(k -> k.groupId() == groupId, limit);
    }

    private List<LeaderboardEntry> ranked(Predicate<VerificationKey> filter, int limit) {
        List<LeaderboardEntry> out = new ArrayList<>();
        synchronized (lock) {
            for (Map.Entry<VerificationKey, Account> e : accounts.entrySet()) {
                if (filter.test(e.getKey())) {
                    out.add(new LeaderboardEntry(e.getKey(), e.getValue().displayName, e.getValue().points));
                }
            }
        }

        // List.sort is stable: ties keep insertion order.
        out.sort(Comparator.comparingLong(LeaderboardEntry::points).reversed());
        return out.size() > limit ? List.copyOf(out.subList(0, Math.max(limit, 0))) : List.copyOf(out);
    }

    private static final class Account {
        long points;
        String displayName;
    }
}
