package org.gudu0.videogate.moderation;

import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.message.MessageReceivedEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import org.gudu0.videogate.gateway.MemberRole;
import org.gudu0.videogate.util.ConsoleLog;
import org.jetbrains.annotations.NotNull;

public class MessageListener extends ListenerAdapter {

    private final ModerationService moderation;

    public MessageListener(ModerationService moderation) {
        this.moderation = moderation;
    }

    @Override
    public void onMessageReceived(@NotNull MessageReceivedEvent event) {
        if (!event.isFromGuild()) return;
        if (event.isWebhookMessage()) return;

        User author = event.getAuthor();
        if (author.isBot() || author.isSystem()) return;

        Message msg = event.getMessage();
        boolean hasVideo = msg.getAttachments().stream().anyMatch(Message.Attachment::isVideo);

        String displayName = event.getMember() != null
                ? event.getMember().getEffectiveName()
                : author.getEffectiveName();

        IncomingMessage in = new IncomingMessage(
                event.getGuild().getIdLong(),
                event.getChannel().getIdLong(),
                msg.getIdLong(),
                author.getIdLong(),
                author.getName(),
                displayName,
                event.getMember() != null ? MemberRole.of(event.getMember()) : null,
                msg.getContentRaw(),
                hasVideo
        );

        ConsoleLog.debug("Messages", "guildId=" + in.groupId() + " author=" + in.userId()
                + " video=" + hasVideo + " len=" + in.text().length());

        moderation.handleMessage(in);
    }
}
