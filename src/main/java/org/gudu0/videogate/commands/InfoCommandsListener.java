package org.gudu0.videogate.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.jetbrains.annotations.NotNull;

/**
 * /help, /status, /leaderboard. Open to everyone.
 */
public class InfoCommandsListener extends ListenerAdapter implements CommandGuards {

    private final ModerationCommands commands;

    public InfoCommandsListener(ModerationCommands commands) {
        this.commands = commands;
    }

    @Override
    public void onSlashCommandInteraction(@NotNull SlashCommandInteractionEvent event) {
        String name = event.getName();
        if (!name.equals("help") && !name.equals("status") && !name.equals("leaderboard")) return;

        logCommand(event);

        Guild g = requireGuild(event);
        if (g == null) return;

        switch (name) {
            case "help" -> replyWith(event, true, commands::help);
            case "status" -> replyWith(event, true, commands::status);
            case "leaderboard" -> replyWith(event, false, () -> commands.leaderboard(g.getIdLong()));
            default -> { }
        }
    }
}
