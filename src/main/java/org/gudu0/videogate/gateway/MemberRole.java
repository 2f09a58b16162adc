package org.gudu0.videogate.gateway;

import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Member;

public enum MemberRole {
    CREATOR,
    ADMIN,
    MEMBER,
    OTHER;

    /** Creator or admin: may run privileged commands and is never removed for spam. */
    public boolean isStaff() {
        return this == CREATOR || this == ADMIN;
    }

    public static MemberRole of(Member m) {
        if (m == null) return OTHER;
        if (m.isOwner()) return CREATOR;
        if (m.hasPermission(Permission.ADMINISTRATOR)
                || m.hasPermission(Permission.MANAGE_SERVER)
                || m.hasPermission(Permission.BAN_MEMBERS)) {
            return ADMIN;
        }
        return MEMBER;
    }
}
