package org.gudu0.videogate.util;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

public final class ConsoleLog {
    private ConsoleLog() {}

    // Set from config.json ("debug": true) at startup.
    @SuppressWarnings("CanBeFinal")
    public static volatile boolean DEBUG = false;

    private static final String ESC = "\u001B[";

    private static final DateTimeFormatter TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS")
                    .withZone(ZoneId.systemDefault());

    private static String fmt(String level, String tag, String msg) {
        return "[" + TS.format(Instant.now()) + "] [" + Thread.currentThread().getName() + "] ["
                + level + "] [" + tag + "] " + msg;
    }

    private static String colour(String code, String level) {
        return ESC + code + "m" + level + ESC + "0m";
    }

    public static void info(String tag, String msg) {
        System.out.println(fmt("INFO", tag, msg));
    }

    public static void warn(String tag, String msg) {
        System.out.println(fmt(colour("93", "WARN"), tag, msg));
    }

    public static void debug(String tag, String msg) {
        if (!DEBUG) return;
        System.out.println(fmt(colour("32", "DEBUG"), tag, msg));
    }

    public static void error(String tag, String msg) {
        System.err.println(fmt(colour("31", "ERROR"), tag, msg));
    }

    public static void error(String tag, String msg, Throwable t) {
        System.err.println(fmt(colour("31", "ERROR"), tag, msg));
        if (t != null) t.printStackTrace(System.err);
    }

    /** Guild-scoped prefix used by every moderation log line. */
    public static String scope(long guildId, long userId) {
        return "guildId=" + guildId + " userId=" + userId;
    }
}
