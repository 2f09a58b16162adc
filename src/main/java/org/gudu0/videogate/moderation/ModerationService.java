package org.gudu0.videogate.moderation;

import org.gudu0.videogate.gateway.MemberRole;
import org.gudu0.videogate.gateway.ModerationGateway;
import org.gudu0.videogate.logging.LogService;
import org.gudu0.videogate.rewards.RewardLedger;
import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.spam.SpamClassifier;
import org.gudu0.videogate.spam.SpamVerdict;
import org.gudu0.videogate.stats.ModerationStats;
import org.gudu0.videogate.stats.StatsCounter;
import org.gudu0.videogate.util.ConsoleLog;
import org.gudu0.videogate.verification.RemovalClaim;
import org.gudu0.videogate.verification.VerificationKey;
import org.gudu0.videogate.verification.VerificationOutcome;
import org.gudu0.videogate.verification.VerificationTracker;
import org.gudu0.videogate.verification.WelcomeAction;

import java.time.Clock;
import java.time.Instant;
import java.util.function.BiConsumer;

/**
 * Routes joins, leaves, messages and timer expiries.
 * <p>
 * State changes (tracker, stats, ledger) are committed first; platform calls follow as
 * async side effects whose failures are only logged.
 */
public class ModerationService {

    private final Settings settings;
    private final VerificationTracker tracker;
    private final SpamClassifier classifier;
    private final RewardLedger ledger;
    private final ModerationStats stats;
    private final ModerationGateway gateway;
    private final LogService logs;
    private final Clock clock;

    public ModerationService(Settings settings,
                             VerificationTracker tracker,
                             SpamClassifier classifier,
                             RewardLedger ledger,
                             ModerationStats stats,
                             ModerationGateway gateway,
                             LogService logs,
                             Clock clock) {
        this.settings = settings;
        this.tracker = tracker;
        this.classifier = classifier;
        this.ledger = ledger;
        this.stats = stats;
        this.gateway = gateway;
        this.logs = logs;
        this.clock = clock;

        tracker.setExpiryListener(this::handleExpiry);
    }

    // ----------------------------
    // Membership
    // ----------------------------

    public void handleJoin(long groupId, long userId, String name) {
        stats.increment(StatsCounter.TOTAL_JOINS);

        WelcomeAction action = tracker.onJoin(groupId, userId, name);
        ConsoleLog.info("Moderation", ConsoleLog.scope(groupId, userId) + " joined name=" + name + " -> " + action.kind());

        gateway.sendToGroup(groupId, Messages.welcome(action, settings), true)
                .whenComplete(logFailure("welcome message", groupId, userId));
    }

    public void handleMemberLeft(long groupId, long userId) {
        if (tracker.discard(groupId, userId)) {
            ConsoleLog.info("Moderation", ConsoleLog.scope(groupId, userId) + " left while pending; timer cancelled");
        }
    }

    // ----------------------------
    // Messages
    // ----------------------------

    public void handleMessage(IncomingMessage msg) {
        long groupId = msg.groupId();
        long userId = msg.userId();
        Instant now = clock.instant();

        // Spam filtering follows pause/schedule; already pending members can still verify.
        if (!settings.isPaused() && settings.isWithinActiveHours(now)) {
            boolean verifiedSender = tracker.isVerified(groupId, userId);
            SpamVerdict verdict = classifier.classify(msg.text(), msg.username(), msg.displayName(), verifiedSender);
            if (verdict.isViolation()) {
                handleViolation(msg, verdict);
                return;
            }
        }

        if (msg.hasVideo()) {
            VerificationOutcome outcome = tracker.onVideoPosted(groupId, userId, msg.displayName(), now);
            if (outcome.isVerified()) {
                onVerified(msg.channelId(), outcome);
            } else {
                ConsoleLog.debug("Moderation", ConsoleLog.scope(groupId, userId) + " video from untracked member (no-op)");
            }
            return;
        }

        if (msg.text() != null && !msg.text().isBlank()
                && tracker.onFirstInteraction(groupId, userId, msg.displayName())) {
            gateway.sendToChannel(msg.channelId(), Messages.interactionReminder(msg.displayName(), settings.timeoutSeconds()), true)
                    .whenComplete(logFailure("interaction reminder", groupId, userId));
        }
    }

    private void onVerified(long channelId, VerificationOutcome outcome) {
        VerificationKey key = outcome.key();
        stats.increment(StatsCounter.USERS_VERIFIED);

        int points = ledger.awardFor(key, outcome.displayName(), outcome.elapsed());
        long total = ledger.totalFor(key);

        gateway.sendToChannel(channelId, Messages.verified(outcome, points, total), true)
                .whenComplete(logFailure("verified message", key.groupId(), key.userId()));

        logs.log(key.groupId(), "Verified " + outcome.displayName() + " (" + key.userId() + ") in "
                + outcome.elapsed().toMillis() + "ms, +" + points + " points");
    }

    // ----------------------------
    // Spam
    // ----------------------------

    private void handleViolation(IncomingMessage msg, SpamVerdict verdict) {
        long groupId = msg.groupId();
        long userId = msg.userId();

        if (msg.role() != null) {
            if (msg.role().isStaff()) {
                logStaffExempt(msg, verdict);
                return;
            }
            RemovalClaim claim = tracker.claimForRemoval(groupId, userId);
            if (claim.mayRemove()) enforceViolation(msg, verdict, claim);
            return;
        }

        // Role unknown: claim first so the lookup window can't race a timer or a video.
        RemovalClaim claim = tracker.claimForRemoval(groupId, userId);
        if (!claim.mayRemove()) return;

        gateway.getMemberRole(groupId, userId).handle((role, err) -> {
            if (err != null) {
                ConsoleLog.warn("Moderation", ConsoleLog.scope(groupId, userId) + " role lookup failed, treating as member: " + err.getMessage());
                role = MemberRole.OTHER;
            }
            if (role.isStaff()) {
                logStaffExempt(msg, verdict);
                return null;
            }
            enforceViolation(msg, verdict, claim);
            return null;
        }).whenComplete(logFailure("spam enforcement", groupId, userId));
    }

    private void logStaffExempt(IncomingMessage msg, SpamVerdict verdict) {
        logs.log(msg.groupId(), "Spam rule " + verdict.reason() + " matched staff member " + msg.displayName()
                + " (" + msg.userId() + "); not removed");
    }

    // Caller already claimed the member from the tracker.
    private void enforceViolation(IncomingMessage msg, SpamVerdict verdict, RemovalClaim claim) {
        long groupId = msg.groupId();
        long userId = msg.userId();

        stats.increment(verdict.kind().counter());

        gateway.deleteMessage(msg.channelId(), msg.messageId())
                .whenComplete(logFailure("delete spam message", groupId, userId));

        gateway.removeMember(groupId, userId, "Spam: " + verdict.reason())
                .thenCompose(v -> gateway.sendToChannel(msg.channelId(), Messages.spamRemoved(msg.displayName(), verdict.detail()), true))
                .whenComplete(logFailure("spam removal", groupId, userId));

        logs.log(groupId, "Removed " + msg.displayName() + " (" + userId + ") for " + verdict.reason()
                + (claim == RemovalClaim.PENDING ? " while pending verification" : ""));
    }

    // ----------------------------
    // Timer expiry
    // ----------------------------

    void handleExpiry(VerificationOutcome outcome) {
        if (!outcome.isExpired()) return;

        VerificationKey key = outcome.key();
        long groupId = key.groupId();
        long userId = key.userId();

        stats.increment(StatsCounter.USERS_KICKED);

        gateway.removeMember(groupId, userId, "No video within " + outcome.timeoutSeconds() + "s")
                .thenCompose(v -> gateway.sendToGroup(groupId, Messages.expired(outcome), true))
                .whenComplete(logFailure("timeout removal", groupId, userId));

        logs.log(groupId, "Kicked " + outcome.displayName() + " (" + userId + ") for timeout ("
                + outcome.timeoutSeconds() + "s)");
    }

    private static <T> BiConsumer<T, Throwable> logFailure(String action, long groupId, long userId) {
        return (ok, err) -> {
            if (err != null) {
                ConsoleLog.error("Moderation", ConsoleLog.scope(groupId, userId) + " " + action + " failed: " + err.getMessage(), err);
            }
        };
    }
}
