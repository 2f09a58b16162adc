package org.gudu0.videogate.settings;

import org.gudu0.videogate.errors.ValidationException;

/**
 * Hour window [start, end) in which the bot enforces verification.
 * start > end wraps past midnight; start == end covers the whole day.
 */
public record ActiveHours(int start, int end) {

    public ActiveHours {
        requireHour(start, "start");
        requireHour(end, "end");
    }

    public boolean contains(int hour) {
        if (start == end) return true;
        if (start < end) return hour >= start && hour < end;
        return hour >= start || hour < end;
    }

    @Override
    public String toString() {
        return start + ":00-" + end + ":00";
    }

    private static void requireHour(int hour, String which) {
        if (hour < 0 || hour > 23) {
            throw new ValidationException("Hours must be between 0-23 (" + which + "=" + hour + ").");
        }
    }
}
