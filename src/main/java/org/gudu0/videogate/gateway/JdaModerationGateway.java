package org.gudu0.videogate.gateway;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.UserSnowflake;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import org.gudu0.videogate.errors.GatewayException;
import org.gudu0.videogate.util.ConsoleLog;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link ModerationGateway} on top of JDA REST actions.
 * <p>
 * Usable only after {@link #attach(JDA)}; before that every call fails with a GatewayException.
 */
public class JdaModerationGateway implements ModerationGateway {

    private final long announceChannelId;

    private volatile JDA jda;

    public JdaModerationGateway(String announceChannelId) {
        this.announceChannelId = parseId(announceChannelId);
    }

    public void attach(JDA jda) {
        this.jda = jda;
    }

    @Override
    public CompletableFuture<Void> removeMember(long groupId, long userId, String reason) {
        Guild g = guild(groupId);
        if (g == null) return missing("guild " + groupId);

        return g.kick(UserSnowflake.fromId(userId))
                .reason(reason)
                .submit();
    }

    @Override
    public CompletableFuture<Void> sendToGroup(long groupId, String text, boolean silent) {
        Guild g = guild(groupId);
        if (g == null) return missing("guild " + groupId);

        MessageChannel ch = null;
        if (announceChannelId != 0) {
            TextChannel configured = g.getTextChannelById(announceChannelId);
            if (configured == null) {
                ConsoleLog.warn("Gateway", "announceChannelId=" + announceChannelId + " not in guildId=" + groupId + "; using system channel");
            }
            ch = configured;
        }
        if (ch == null) ch = g.getSystemChannel();
        if (ch == null) return missing("announcement channel in guild " + groupId);

        return send(ch, text, silent);
    }

    @Override
    public CompletableFuture<Void> sendToChannel(long channelId, String text, boolean silent) {
        JDA j = this.jda;
        if (j == null) return missing("JDA (not attached)");

        MessageChannel ch = j.getChannelById(MessageChannel.class, channelId);
        if (ch == null) return missing("channel " + channelId);

        return send(ch, text, silent);
    }

    @Override
    public CompletableFuture<Void> deleteMessage(long channelId, long messageId) {
        JDA j = this.jda;
        if (j == null) return missing("JDA (not attached)");

        MessageChannel ch = j.getChannelById(MessageChannel.class, channelId);
        if (ch == null) return missing("channel " + channelId);

        return ch.deleteMessageById(messageId).submit();
    }

    @Override
    public CompletableFuture<MemberRole> getMemberRole(long groupId, long userId) {
        Guild g = guild(groupId);
        if (g == null) return CompletableFuture.completedFuture(MemberRole.OTHER);

        return g.retrieveMemberById(userId).submit()
                .thenApply(MemberRole::of)
                .exceptionally(err -> {
                    Throwable cause = err instanceof CompletionException && err.getCause() != null ? err.getCause() : err;
                    if (cause instanceof ErrorResponseException e && e.getErrorResponse() == ErrorResponse.UNKNOWN_MEMBER) {
                        return MemberRole.OTHER;
                    }
                    ConsoleLog.warn("Gateway", "Role lookup failed guildId=" + groupId + " userId=" + userId + ": " + cause.getMessage());
                    return MemberRole.OTHER;
                });
    }

    private static CompletableFuture<Void> send(MessageChannel ch, String text, boolean silent) {
        return ch.sendMessage(text)
                .setSuppressedNotifications(silent)
                .submit()
                .thenApply(msg -> null);
    }

    private Guild guild(long groupId) {
        JDA j = this.jda;
        return j == null ? null : j.getGuildById(groupId);
    }

    private static <T> CompletableFuture<T> missing(String what) {
        return CompletableFuture.failedFuture(new GatewayException("Not found / not visible: " + what));
    }

    private static long parseId(String s) {
        if (s == null) return 0;
        s = s.trim();
        if (s.isEmpty()) return 0;
        try { return Long.parseLong(s); }
        catch (NumberFormatException e) { return 0; }
    }
}
