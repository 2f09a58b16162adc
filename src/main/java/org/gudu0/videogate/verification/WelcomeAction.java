package org.gudu0.videogate.verification;

/**
 * What the join handler should tell a new member.
 *
 * @param timeoutSeconds seconds on the armed timer, 0 when no timer was armed
 */
public record WelcomeAction(Kind kind, String displayName, int timeoutSeconds) {

    public enum Kind {
        /** Bot paused: no verification. */
        PAUSED,
        /** Scheduled mode and outside the active hours: no verification. */
        OFF_HOURS,
        /** Interaction mode: timer starts on the first message. */
        AWAITING_INTERACTION,
        /** Already verified before: never re-timed. */
        ALREADY_VERIFIED,
        TIMER_STARTED
    }

    public boolean timerArmed() {
        return kind == Kind.TIMER_STARTED;
    }
}
