package org.gudu0.videogate.moderation;

import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.verification.VerificationOutcome;
import org.gudu0.videogate.verification.WelcomeAction;

import java.util.Locale;

/**
 * Member-facing texts.
 */
final class Messages {
    private Messages() {}

    static String welcome(WelcomeAction action, Settings settings) {
        String name = action.displayName();
        return switch (action.kind()) {
            case PAUSED -> "Welcome " + name + "!\n"
                    + "Verification is paused right now, no video needed. Enjoy the server!";
            case OFF_HOURS -> "Welcome " + name + "!\n"
                    + "Verification only runs " + settings.activeHours() + ", so no video needed right now.";
            case AWAITING_INTERACTION -> "Welcome " + name + "!\n"
                    + "To stay in this server, post a video after your first message.\n"
                    + "The timer starts when you first say something!";
            case ALREADY_VERIFIED -> "Welcome back " + name + "! You're already verified.";
            case TIMER_STARTED -> settings.renderWelcome(name, action.timeoutSeconds());
        };
    }

    static String interactionReminder(String name, int timeoutSeconds) {
        return "Hi " + name + "! You have **" + timeoutSeconds + "** seconds to post a video to stay in the server!";
    }

    static String verified(VerificationOutcome outcome, int points, long total) {
        String base = "Great job " + outcome.displayName() + "! You posted a video in "
                + seconds(outcome) + " seconds. Welcome to the server!";
        if (points <= 0) return base;
        return base + "\nYou earned **" + points + "** points! Total: **" + total + "** points";
    }

    static String expired(VerificationOutcome outcome) {
        return outcome.displayName() + " was removed for not posting a video within "
                + outcome.timeoutSeconds() + " seconds.";
    }

    static String spamRemoved(String name, String detail) {
        return name + " was removed for " + detail + ".";
    }

    private static String seconds(VerificationOutcome outcome) {
        return String.format(Locale.ROOT, "%.1f", outcome.elapsed().toMillis() / 1000.0);
    }
}
