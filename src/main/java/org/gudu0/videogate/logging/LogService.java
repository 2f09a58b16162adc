package org.gudu0.videogate.logging;

import org.gudu0.videogate.gateway.ModerationGateway;
import org.gudu0.videogate.util.ConsoleLog;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;

/**
 * Moderation audit trail: always to the console, optionally mirrored to a Discord log channel.
 */
public class LogService {

    public static final DateTimeFormatter TS = DateTimeFormatter.ofLocalizedDateTime(FormatStyle.MEDIUM);

    private final ModerationGateway gateway;
    private final long logChannelId;
    private final boolean enabled;
    private final ZoneId zone;

    public LogService(ModerationGateway gateway, String logChannelId, boolean enabled, ZoneId zone) {
        this.gateway = gateway;
        this.logChannelId = parseId(logChannelId);
        this.enabled = enabled;
        this.zone = zone;
    }

    public void log(long guildId, String message) {
        ConsoleLog.info("Audit", "guildId=" + guildId + " " + message);

        if (!enabled) {
            ConsoleLog.debug("Audit", "Discord logging disabled (enableLogs=false)");
            return;
        }
        if (logChannelId == 0) {
            ConsoleLog.debug("Audit", "Discord logging disabled (logChannelId missing)");
            return;
        }

        String out = "[" + ZonedDateTime.now(zone).format(TS) + "] [guild " + guildId + "] " + message;

        gateway.sendToChannel(logChannelId, out, true).whenComplete((ok, err) -> {
            if (err != null) ConsoleLog.error("Audit", "Log send failed: " + err.getMessage(), err);
        });
    }

    private static long parseId(String s) {
        if (s == null || s.isBlank()) return 0;
        try { return Long.parseLong(s.trim()); }
        catch (NumberFormatException e) {
            ConsoleLog.warn("Audit", "logChannelId is not a number: " + s);
            return 0;
        }
    }
}
