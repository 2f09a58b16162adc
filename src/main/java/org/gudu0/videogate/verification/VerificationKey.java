package org.gudu0.videogate.verification;

/** (guild, user) pair every piece of verification state is keyed by. */
public record VerificationKey(long groupId, long userId) {

    @Override
    public String toString() {
        return groupId + "/" + userId;
    }
}
