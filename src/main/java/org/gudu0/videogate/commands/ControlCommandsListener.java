package org.gudu0.videogate.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.gudu0.videogate.gateway.MemberRole;
import org.jetbrains.annotations.NotNull;

import java.util.Set;

/**
 * Admin commands. The role check itself lives in {@link ModerationCommands}.
 */
public class ControlCommandsListener extends ListenerAdapter implements CommandGuards {

    private static final Set<String> HANDLED = Set.of(
            "settimer", "pause", "resume", "stats", "report", "interaction", "antispam",
            "setwelcome", "rewards", "schedule", "bannedwords"
    );

    private final ModerationCommands commands;

    public ControlCommandsListener(ModerationCommands commands) {
        this.commands = commands;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        if (!HANDLED.contains(event.getName())) return;

        logCommand(event);

        Guild g = requireGuild(event);
        if (g == null) return;

        long guildId = g.getIdLong();
        MemberRole role = callerRole(event);

        switch (event.getName()) {
            case "settimer" -> replyWith(event, true,
                    () -> commands.setTimer(role, guildId, event.getOption("seconds", OptionMapping::getAsInt)));
            case "pause" -> replyWith(event, false, () -> commands.pause(role, guildId));
            case "resume" -> replyWith(event, false, () -> commands.resume(role, guildId));
            case "stats" -> replyWith(event, true, () -> commands.stats(role));
            case "report" -> replyWith(event, true, () -> commands.report(role));
            case "interaction" -> replyWith(event, true, () -> commands.toggleInteraction(role, guildId));
            case "antispam" -> replyWith(event, true, () -> commands.toggleAntiSpam(role, guildId));
            case "rewards" -> replyWith(event, true, () -> commands.toggleRewards(role, guildId));
            case "setwelcome" -> replyWith(event, true,
                    () -> commands.setWelcome(role, guildId, event.getOption("template", OptionMapping::getAsString)));
            case "schedule" -> schedule(event, role, guildId);
            case "bannedwords" -> bannedWords(event, role, guildId);
            default -> { }
        }
    }

    private void schedule(SlashCommandInteractionEvent event, MemberRole role, long guildId) {
        String sub = event.getSubcommandName();
        if (sub == null) sub = "view";

        switch (sub) {
            case "toggle" -> replyWith(event, true, () -> commands.scheduleToggle(role, guildId));
            case "hours" -> replyWith(event, true, () -> commands.scheduleHours(role, guildId,
                    event.getOption("start", OptionMapping::getAsInt),
                    event.getOption("end", OptionMapping::getAsInt)));
            case "view" -> replyWith(event, true, () -> commands.scheduleView(role));
            default -> event.reply("Unknown subcommand: " + sub).setEphemeral(true).queue();
        }
    }

    private void bannedWords(SlashCommandInteractionEvent event, MemberRole role, long guildId) {
        String sub = event.getSubcommandName();
        if (sub == null) sub = "list";

        String word = event.getOption("word", OptionMapping::getAsString);
        switch (sub) {
            case "add" -> replyWith(event, true, () -> commands.bannedWordsAdd(role, guildId, word));
            case "remove" -> replyWith(event, true, () -> commands.bannedWordsRemove(role, guildId, word));
            case "list" -> replyWith(event, true, () -> commands.bannedWordsList(role));
            default -> event.reply("Unknown subcommand: " + sub).setEphemeral(true).queue();
        }
    }
}
