package org.gudu0.videogate.commands;

import org.gudu0.videogate.errors.AuthorizationException;
import org.gudu0.videogate.errors.ValidationException;
import org.gudu0.videogate.gateway.MemberRole;
import org.gudu0.videogate.logging.LogService;
import org.gudu0.videogate.rewards.LeaderboardEntry;
import org.gudu0.videogate.rewards.RewardLedger;
import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.stats.ModerationStats;
import org.gudu0.videogate.stats.StatsSnapshot;
import org.gudu0.videogate.util.ConsoleLog;
import org.gudu0.videogate.verification.VerificationTracker;

import java.util.List;
import java.util.Locale;

/**
 * Platform-free command handlers. Each returns the reply text.
 * <p>
 * Privileged handlers check the caller's role before touching anything and throw
 * {@link AuthorizationException} otherwise; bad arguments throw {@link ValidationException}.
 */
public class ModerationCommands {

    public static final int LEADERBOARD_SIZE = 10;

    private final Settings settings;
    private final VerificationTracker tracker;
    private final RewardLedger ledger;
    private final ModerationStats stats;
    private final LogService logs;

    public ModerationCommands(Settings settings,
                              VerificationTracker tracker,
                              RewardLedger ledger,
                              ModerationStats stats,
                              LogService logs) {
        this.settings = settings;
        this.tracker = tracker;
        this.ledger = ledger;
        this.stats = stats;
        this.logs = logs;
    }

    // ----------------------------
    // Open to everyone
    // ----------------------------

    public String help() {
        return """
                **Video Gate commands**

                **Basic controls**
                `/help` - show commands
                `/status` - bot status
                `/settimer <seconds>` - change the timer (%d-%d)
                `/pause` - stop kicking
                `/resume` - start kicking

                **Protection**
                `/antispam` - toggle spam protection
                `/interaction` - toggle interaction mode
                `/stats` - show statistics
                `/report` - protection report
                `/bannedwords add|remove|list` - manage banned words

                **Extras**
                `/setwelcome [template]` - custom welcome message
                `/rewards` - toggle point system
                `/leaderboard` - top video posters
                `/schedule toggle|hours|view` - active hours

                **Current settings**
                Timer: %ds | Interaction: %s | Anti-spam: %s
                Rewards: %s | Schedule: %s
                """.formatted(
                Settings.MIN_TIMEOUT_SECONDS, Settings.MAX_TIMEOUT_SECONDS,
                settings.timeoutSeconds(), onOff(settings.isInteractionMode()), onOff(settings.isAntiSpam()),
                onOff(settings.isRewards()), onOff(settings.isScheduledMode())
        ).trim();
    }

    public String status() {
        StatsSnapshot s = stats.snapshot();
        return "**Video Gate status**\n\n"
                + "Timer: " + settings.timeoutSeconds() + " seconds\n"
                + "Status: " + (settings.isPaused() ? "Paused" : "Active") + "\n"
                + "Pending verification: " + tracker.pendingCount() + "\n"
                + "Verified members: " + tracker.verifiedCount() + "\n\n"
                + "**Statistics**\n"
                + "- Total joins: " + s.totalJoins() + "\n"
                + "- Users verified: " + s.usersVerified() + "\n"
                + "- Users kicked: " + s.usersKicked();
    }

    public String leaderboard(long groupId) {
        List<LeaderboardEntry> top = ledger.leaderboard(groupId, LEADERBOARD_SIZE);
        if (top.isEmpty()) {
            return "No points awarded yet! The reward system may be disabled.";
        }

        StringBuilder sb = new StringBuilder("**Leaderboard - top video posters**\n\n");
        int rank = 1;
        for (LeaderboardEntry e : top) {
            sb.append(rank).append(". ")
                    .append(e.displayName() == null ? "<@" + e.key().userId() + ">" : e.displayName())
                    .append(" - **").append(e.points()).append("** points\n");
            rank++;
        }
        return sb.toString().trim();
    }

    // ----------------------------
    // Admin only
    // ----------------------------

    public String stats(MemberRole caller) {
        requireAdmin(caller, "view statistics");

        StatsSnapshot s = stats.snapshot();
        int t = settings.timeoutSeconds();
        return "**Detailed statistics**\n\n"
                + "Current timer: " + t + " seconds\n"
                + "Success rate: " + percent(s.successRate()) + "%\n\n"
                + "**Activity**\n"
                + "Total joins: " + s.totalJoins() + "\n"
                + "Users verified: " + s.usersVerified() + "\n"
                + "Users kicked: " + s.usersKicked() + "\n"
                + "Spam blocked: " + s.spamBlocked() + "\n"
                + "Links blocked: " + s.linksBlocked() + "\n"
                + "Suspicious kicked: " + s.suspiciousKicked() + "\n"
                + "Currently pending: " + tracker.pendingCount() + "\n\n"
                + "**Settings**\n"
                + "Status: " + (settings.isPaused() ? "Paused" : "Active") + "\n"
                + "Anti-spam: " + onOff(settings.isAntiSpam()) + "\n"
                + "Timer: " + t + "s (" + (t / 60) + "min " + (t % 60) + "s)";
    }

    public String report(MemberRole caller) {
        requireAdmin(caller, "view the report");

        StatsSnapshot s = stats.snapshot();
        return "**Protection report**\n\n"
                + "Total protection actions: " + s.protectionActions() + "\n"
                + "New members: " + s.totalJoins() + "\n"
                + "Verified: " + s.usersVerified() + "\n"
                + "Kicked (no video): " + s.usersKicked() + "\n"
                + "Spam blocked: " + s.spamBlocked() + "\n"
                + "Links blocked: " + s.linksBlocked() + "\n"
                + "Suspicious users: " + s.suspiciousKicked() + "\n\n"
                + "Success rate: " + percent(s.successRate()) + "%\n"
                + "Protection rate: " + percent(s.protectionRate()) + "%\n\n"
                + "Settings:\n"
                + "Timer: " + settings.timeoutSeconds() + "s\n"
                + "Anti-spam: " + onOff(settings.isAntiSpam()) + "\n"
                + "Status: " + (settings.isPaused() ? "Paused" : "Active");
    }

    public String setTimer(MemberRole caller, long groupId, Integer seconds) {
        requireAdmin(caller, "change the timer");
        if (seconds == null) {
            throw new ValidationException("Usage: /settimer <seconds> (" + Settings.MIN_TIMEOUT_SECONDS
                    + "-" + Settings.MAX_TIMEOUT_SECONDS + ")");
        }

        tracker.setTimeout(seconds);
        logs.log(groupId, "Timer set to " + seconds + "s");
        return "Timer set to **" + seconds + "** seconds. Applies to members who join from now on.";
    }

    public String pause(MemberRole caller, long groupId) {
        requireAdmin(caller, "pause the bot");
        settings.setPaused(true);
        logs.log(groupId, "Verification paused");
        return "Bot paused! New members won't be kicked until you use /resume.";
    }

    public String resume(MemberRole caller, long groupId) {
        requireAdmin(caller, "resume the bot");
        settings.setPaused(false);
        logs.log(groupId, "Verification resumed");
        return "Bot resumed! Video verification is now active.";
    }

    public String toggleInteraction(MemberRole caller, long groupId) {
        requireAdmin(caller, "change bot settings");
        boolean on = settings.toggleInteractionMode();
        logs.log(groupId, "Interaction mode " + onOff(on));
        return on
                ? "Interaction mode ON! The timer now starts at a member's first message."
                : "Interaction mode OFF! The timer starts as soon as members join.";
    }

    public String toggleAntiSpam(MemberRole caller, long groupId) {
        requireAdmin(caller, "change bot settings");
        boolean on = settings.toggleAntiSpam();
        logs.log(groupId, "Anti-spam " + onOff(on));
        return on
                ? "Anti-spam protection ON! Blocking links, banned words and suspicious users."
                : "Anti-spam protection OFF! Only video verification is active.";
    }

    public String toggleRewards(MemberRole caller, long groupId) {
        requireAdmin(caller, "change bot settings");
        boolean on = settings.toggleRewards();
        logs.log(groupId, "Rewards " + onOff(on));
        if (!on) return "Reward system OFF! No points will be awarded for videos.";
        return "Reward system ON! Members earn points for posting videos quickly:\n"
                + "- 10s or less: " + RewardLedger.SUPER_FAST_POINTS + " points\n"
                + "- 30s or less: " + RewardLedger.FAST_POINTS + " points\n"
                + "- Regular: " + RewardLedger.REGULAR_POINTS + " points";
    }

    /**
     * Without a template, shows the current one.
     */
    public String setWelcome(MemberRole caller, long groupId, String template) {
        requireAdmin(caller, "change bot settings");

        if (template == null || template.isBlank()) {
            String current = settings.welcomeTemplate().replace("{name}", "[NAME]").replace("{timer}", "[TIMER]");
            return "Current welcome message:\n\n" + current
                    + "\n\nUse `/setwelcome <message>`; `{name}` is the member name and `{timer}` the timer seconds.";
        }

        settings.setWelcomeTemplate(template);
        logs.log(groupId, "Welcome message updated");
        return "Welcome message updated!\n\nPreview:\n" + settings.renderWelcome("John", settings.timeoutSeconds());
    }

    public String scheduleToggle(MemberRole caller, long groupId) {
        requireAdmin(caller, "change bot settings");
        boolean on = settings.toggleScheduledMode();
        logs.log(groupId, "Scheduled mode " + onOff(on));
        return on
                ? "Scheduled mode ON! Verification only runs " + settings.activeHours() + "."
                : "Scheduled mode OFF! Verification runs around the clock.";
    }

    public String scheduleHours(MemberRole caller, long groupId, Integer start, Integer end) {
        requireAdmin(caller, "change bot settings");
        if (start == null || end == null) {
            throw new ValidationException("Usage: /schedule hours <start> <end> (0-23)");
        }

        settings.setActiveHours(start, end);
        logs.log(groupId, "Active hours set to " + settings.activeHours());
        return "Active hours set to " + settings.activeHours()
                + (settings.isScheduledMode() ? "." : ". Scheduled mode is OFF; use `/schedule toggle` to enable it.");
    }

    public String scheduleView(MemberRole caller) {
        requireAdmin(caller, "change bot settings");
        return "Scheduled mode: " + onOff(settings.isScheduledMode()) + "\n"
                + "Active hours: " + settings.activeHours() + " (" + settings.zone() + ")\n\n"
                + "Use `/schedule toggle` or `/schedule hours <start> <end>`.";
    }

    public String bannedWordsAdd(MemberRole caller, long groupId, String word) {
        requireAdmin(caller, "change bot settings");
        if (!settings.addBannedWord(word)) {
            return "`" + normalize(word) + "` is already banned.";
        }
        logs.log(groupId, "Banned word added: " + normalize(word));
        return "Added `" + normalize(word) + "` to the banned words.";
    }

    public String bannedWordsRemove(MemberRole caller, long groupId, String word) {
        requireAdmin(caller, "change bot settings");
        if (!settings.removeBannedWord(word)) {
            return "`" + normalize(word) + "` is not on the list.";
        }
        logs.log(groupId, "Banned word removed: " + normalize(word));
        return "Removed `" + normalize(word) + "` from the banned words.";
    }

    public String bannedWordsList(MemberRole caller) {
        requireAdmin(caller, "change bot settings");
        List<String> words = settings.bannedWords();
        if (words.isEmpty()) return "No banned words configured.";
        return "Banned words (" + words.size() + "): " + String.join(", ", words);
    }

    private static void requireAdmin(MemberRole caller, String action) {
        if (caller == null || !caller.isStaff()) {
            ConsoleLog.debug("Commands", "Denied " + action + " for role=" + caller);
            throw new AuthorizationException("Only server admins can " + action + ".");
        }
    }

    private static String normalize(String word) {
        return word == null ? "" : word.trim().toLowerCase(Locale.ROOT);
    }

    private static String onOff(boolean on) {
        return on ? "ON" : "OFF";
    }

    private static String percent(double v) {
        return String.format(Locale.ROOT, "%.1f", v);
    }
}
