package org.gudu0.videogate.gateway;

import java.util.concurrent.CompletableFuture;

/**
 * Everything the bot does to the chat platform. All calls are asynchronous; a failed future
 * never undoes bookkeeping the caller already committed.
 */
public interface ModerationGateway {

    /** Kick: the member is removed but may rejoin. */
    CompletableFuture<Void> removeMember(long groupId, long userId, String reason);

    /** Post to the guild's announcement channel (configured, else the system channel). */
    CompletableFuture<Void> sendToGroup(long groupId, String text, boolean silent);

    CompletableFuture<Void> sendToChannel(long channelId, String text, boolean silent);

    CompletableFuture<Void> deleteMessage(long channelId, long messageId);

    CompletableFuture<MemberRole> getMemberRole(long groupId, long userId);
}
