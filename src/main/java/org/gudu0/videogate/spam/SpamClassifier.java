package org.gudu0.videogate.spam;

import org.gudu0.videogate.settings.Settings;

import java.util.List;
import java.util.Locale;

/**
 * Stateless spam checks. First match wins: links, then banned words, then sender identity.
 */
public class SpamClassifier {

    static final List<String> LINK_MARKERS = List.of("http", "www.", ".com", ".org", "t.me");

    static final List<String> SUSPICIOUS_PATTERNS = List.of(
            "crypto", "bitcoin", "forex", "investment", "profit", "earn",
            "casino", "betting", "loan", "pharmacy", "pills"
    );

    private final Settings settings;

    public SpamClassifier(Settings settings) {
        this.settings = settings;
    }

    public SpamVerdict classify(String text, String username, String displayName, boolean senderVerified) {
        if (!settings.isAntiSpam() || senderVerified) return SpamVerdict.clean();

        String lower = text == null ? "" : text.toLowerCase(Locale.ROOT);

        if (!lower.isEmpty()) {
            for (String marker : LINK_MARKERS) {
                if (lower.contains(marker)) return SpamVerdict.link();
            }

            for (String word : settings.bannedWords()) {
                if (lower.contains(word)) return SpamVerdict.bannedWord(word);
            }
        }

        if (isSuspiciousIdentity(username, displayName)) return SpamVerdict.suspiciousIdentity();

        return SpamVerdict.clean();
    }

    static boolean isSuspiciousIdentity(String username, String displayName) {
        String combined = ((username == null ? "" : username) + " " + (displayName == null ? "" : displayName))
                .toLowerCase(Locale.ROOT);
        for (String p : SUSPICIOUS_PATTERNS) {
            if (combined.contains(p)) return true;
        }
        return false;
    }
}
