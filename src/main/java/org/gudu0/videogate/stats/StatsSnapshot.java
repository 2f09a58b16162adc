package org.gudu0.videogate.stats;

/** Point-in-time copy of the counters. */
public record StatsSnapshot(long totalJoins, long usersVerified, long usersKicked,
                            long spamBlocked, long linksBlocked, long suspiciousKicked) {

    /** Kicks plus every spam removal. */
    public long protectionActions() {
        return usersKicked + spamBlocked + linksBlocked + suspiciousKicked;
    }

    /** Verified / joins, in percent. */
    public double successRate() {
        return percentOfJoins(usersVerified);
    }

    public double protectionRate() {
        return percentOfJoins(protectionActions());
    }

    private double percentOfJoins(long value) {
        return value * 100.0 / Math.max(totalJoins, 1);
    }
}
