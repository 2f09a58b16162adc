package org.gudu0.videogate.rewards;

import org.gudu0.videogate.verification.VerificationKey;

public record LeaderboardEntry(VerificationKey key, String displayName, long points) {
}
