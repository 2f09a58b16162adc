package org.gudu0.videogate.moderation;

import net.dv8tion.jda.api.events.guild.member.GuildMemberJoinEvent;
import net.dv8tion.jda.api.events.guild.member.GuildMemberRemoveEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.jetbrains.annotations.NotNull;

/**
 * Joins start verification; leaves drop whatever is pending.
 * Needs the GUILD_MEMBERS intent.
 */
public class MemberListener extends ListenerAdapter {

    private final ModerationService moderation;

    public MemberListener(ModerationService moderation) {
        this.moderation = moderation;
    }

    @Override
    public void onGuildMemberJoin(@NotNull GuildMemberJoinEvent event) {
        if (event.getUser().isBot()) return;

        moderation.handleJoin(
                event.getGuild().getIdLong(),
                event.getUser().getIdLong(),
                event.getMember().getEffectiveName()
        );
    }

    @Override
    public void onGuildMemberRemove(@NotNull GuildMemberRemoveEvent event) {
        if (event.getUser().isBot()) return;

        moderation.handleMemberLeft(event.getGuild().getIdLong(), event.getUser().getIdLong());
    }
}
