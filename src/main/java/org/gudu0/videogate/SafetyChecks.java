package org.gudu0.videogate;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import org.gudu0.videogate.util.ConsoleLog;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup / join-time permission checks. Only warns; moderation keeps running and
 * individual gateway calls fail (and get logged) if a permission is really missing.
 */
public final class SafetyChecks {

    private SafetyChecks() {}

    /**
     * @return the problems found, empty when the guild looks usable
     */
    public static List<String> runForGuild(JDA jda, long guildId, long announceChannelId) {
        List<String> problems = new ArrayList<>();

        Guild guild = jda.getGuildById(guildId);
        if (guild == null) {
            problems.add("Guild missing in JDA cache (bot not in guild?)");
            report(guildId, "?", problems);
            return problems;
        }

        Member self = guild.getSelfMember();
        if (!self.hasPermission(Permission.KICK_MEMBERS)) problems.add("missing KICK_MEMBERS");
        if (!self.hasPermission(Permission.MESSAGE_MANAGE)) problems.add("missing MANAGE_MESSAGES (spam deletion)");

        TextChannel announce = announceChannelId != 0
                ? guild.getTextChannelById(announceChannelId)
                : guild.getSystemChannel();

        if (announce == null) {
            problems.add(announceChannelId != 0
                    ? "announce channel " + announceChannelId + " not found / not visible"
                    : "no system channel and no announceChannelId configured");
        } else if (!self.hasPermission(announce, Permission.VIEW_CHANNEL, Permission.MESSAGE_SEND)) {
            problems.add("cannot post in #" + announce.getName());
        }

        report(guildId, guild.getName(), problems);
        return problems;
    }

    private static void report(long guildId, String name, List<String> problems) {
        if (problems.isEmpty()) {
            ConsoleLog.info("Safety", "guildId=" + guildId + " guild=" + name + " OK");
            return;
        }
        ConsoleLog.warn("Safety", "guildId=" + guildId + " guild=" + name + " problems: " + String.join("; ", problems));
    }
}
