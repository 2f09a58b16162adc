package org.gudu0.videogate.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;
import org.gudu0.videogate.util.ConsoleLog;

import java.util.List;

/**
 * Guild-scoped slash command definitions.
 */
public final class SlashCommands {

    private SlashCommands() {}

    public static List<SlashCommandData> definitions() {
        return List.of(
                Commands.slash("help", "Show commands and current settings"),
                Commands.slash("status", "Bot status and counters"),
                Commands.slash("leaderboard", "Top video posters in this server"),

                Commands.slash("settimer", "Set the verification timer (admin only)")
                        .addOption(OptionType.INTEGER, "seconds", "Seconds to post a video (10-600)", true),
                Commands.slash("pause", "Stop kicking new members (admin only)"),
                Commands.slash("resume", "Start kicking again (admin only)"),
                Commands.slash("stats", "Detailed statistics (admin only)"),
                Commands.slash("report", "Protection report (admin only)"),
                Commands.slash("interaction", "Toggle interaction mode (admin only)"),
                Commands.slash("antispam", "Toggle spam protection (admin only)"),
                Commands.slash("rewards", "Toggle the point system (admin only)"),
                Commands.slash("setwelcome", "Set or show the welcome message (admin only)")
                        .addOption(OptionType.STRING, "template", "Use {name} and {timer}; leave empty to view", false),

                Commands.slash("schedule", "Active hours (admin only)")
                        .addSubcommands(
                                new SubcommandData("toggle", "Turn scheduled mode on/off"),
                                new SubcommandData("hours", "Set the active window")
                                        .addOption(OptionType.INTEGER, "start", "Start hour (0-23)", true)
                                        .addOption(OptionType.INTEGER, "end", "End hour (0-23, exclusive)", true),
                                new SubcommandData("view", "Show the current window")
                        ),

                Commands.slash("bannedwords", "Manage banned words (admin only)")
                        .addSubcommands(
                                new SubcommandData("add", "Ban a word or phrase")
                                        .addOption(OptionType.STRING, "word", "Word or phrase", true),
                                new SubcommandData("remove", "Unban a word or phrase")
                                        .addOption(OptionType.STRING, "word", "Word or phrase", true),
                                new SubcommandData("list", "List banned words")
                        )
        );
    }

    public static void registerFor(Guild g) {
        g.updateCommands()
                .addCommands(definitions())
                .queue(
                        ok -> ConsoleLog.info("Commands", "Guild commands updated: " + g.getName() + " (" + g.getId() + ")"),
                        err -> ConsoleLog.error("Commands", "Failed registering commands in guildId=" + g.getId() + ": " + err.getMessage(), err)
                );
    }
}
