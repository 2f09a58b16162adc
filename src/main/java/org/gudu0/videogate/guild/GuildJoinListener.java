package org.gudu0.videogate.guild;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.events.guild.GuildJoinEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.videogate.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

import java.util.function.BiConsumer;

/**
 * Bot added to a new server while running: check permissions and register commands there.
 */
public class GuildJoinListener extends ListenerAdapter {

    /**
     * Per-guild setup callback. Signature: (JDA, Guild) -> void
     */
    private final BiConsumer<JDA, Guild> setupGuild;

    public GuildJoinListener(BiConsumer<JDA, Guild> setupGuild) {
        this.setupGuild = setupGuild;
    }

    @Override
    public void onGuildJoin(@NotNull GuildJoinEvent event) {
        Guild g = event.getGuild();
        ConsoleLog.warn("GuildJoin", "Joined new guild: " + g.getName() + " (" + g.getId() + ")");

        setupGuild.accept(event.getJDA(), g);

        ConsoleLog.info("GuildJoin", "Handled join for guildId=" + g.getId());
    }
}
