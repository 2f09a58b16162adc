package org.gudu0.videogate.commands;

import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import org.gudu0.videogate.errors.AuthorizationException;
import org.gudu0.videogate.errors.ModerationException;
import org.gudu0.videogate.errors.ValidationException;
import org.gudu0.videogate.gateway.MemberRole;
import org.gudu0.videogate.util.ConsoleLog;

import java.util.function.Supplier;

public interface CommandGuards {

    default Guild requireGuild(SlashCommandInteractionEvent event) {
        Guild g = event.getGuild();
        if (g == null) {
            event.reply("This command can only be used in a server.")
                    .setEphemeral(true).queue();
            return null;
        }
        return g;
    }

    default MemberRole callerRole(SlashCommandInteractionEvent event) {
        return MemberRole.of(event.getMember());
    }

    default void logCommand(SlashCommandInteractionEvent event) {
        ConsoleLog.info("Command - " + this.getClass().getSimpleName(),
                "/" + event.getName()
                        + (event.getSubcommandName() != null ? " " + event.getSubcommandName() : "")
                        + " by userId=" + event.getUser().getId()
                        + " name=" + event.getUser().getName()
                        + " guildId=" + (event.getGuild() != null ? event.getGuild().getId() : "DM")
                        + " channelId=" + event.getChannel().getId());
    }

    /**
     * Runs a handler and replies with its text. Rejections are replied ephemerally.
     */
    default void replyWith(SlashCommandInteractionEvent event, boolean ephemeral, Supplier<String> handler) {
        String text;
        try {
            text = handler.get();
        } catch (AuthorizationException e) {
            ConsoleLog.warn("Commands", "Denied /" + event.getName() + " userId=" + event.getUser().getId() + ": " + e.getMessage());
            event.reply(e.getMessage()).setEphemeral(true).queue();
            return;
        } catch (ValidationException e) {
            event.reply(e.getMessage()).setEphemeral(true).queue();
            return;
        } catch (ModerationException e) {
            ConsoleLog.error("Commands", "/" + event.getName() + " failed: " + e.getMessage(), e);
            event.reply("Something went wrong: " + e.getMessage()).setEphemeral(true).queue();
            return;
        }

        event.reply(text).setEphemeral(ephemeral).queue(
                ok -> {},
                err -> ConsoleLog.error("Commands", "Reply to /" + event.getName() + " failed: " + err.getMessage(), err)
        );
    }
}
