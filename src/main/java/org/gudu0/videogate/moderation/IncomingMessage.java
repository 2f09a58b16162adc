package org.gudu0.videogate.moderation;

import org.gudu0.videogate.gateway.MemberRole;

/**
 * Platform-neutral copy of a guild message, built by {@link MessageListener}.
 *
 * @param role sender's role from the event, or null when the member wasn't delivered with it
 */
public record IncomingMessage(long groupId, long channelId, long messageId,
                              long userId, String username, String displayName, MemberRole role,
                              String text, boolean hasVideo) {
}
