package org.gudu0.videogate.spam;

/**
 * @param kind   null when clean
 * @param reason machine reason: "link", "banned-word:&lt;word&gt;", "suspicious-identity"
 * @param detail human text for the removal notice ("posting links", ...)
 */
public record SpamVerdict(ViolationKind kind, String reason, String detail) {

    private static final SpamVerdict CLEAN = new SpamVerdict(null, "clean", "");

    public static SpamVerdict clean() {
        return CLEAN;
    }

    static SpamVerdict link() {
        return new SpamVerdict(ViolationKind.LINK, "link", "posting links");
    }

    static SpamVerdict bannedWord(String word) {
        return new SpamVerdict(ViolationKind.BANNED_WORD, "banned-word:" + word, "using banned word: " + word);
    }

    static SpamVerdict suspiciousIdentity() {
        return new SpamVerdict(ViolationKind.SUSPICIOUS_IDENTITY, "suspicious-identity", "suspicious username");
    }

    public boolean isViolation() {
        return kind != null;
    }
}
