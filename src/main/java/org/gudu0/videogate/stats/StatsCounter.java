package org.gudu0.videogate.stats;

public enum StatsCounter {
    TOTAL_JOINS,
    USERS_VERIFIED,
    USERS_KICKED,
    SPAM_BLOCKED,
    LINKS_BLOCKED,
    SUSPICIOUS_KICKED
}
