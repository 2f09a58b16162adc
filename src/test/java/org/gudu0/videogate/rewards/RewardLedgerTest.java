package org.gudu0.videogate.rewards;

import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.verification.VerificationKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RewardLedger")
class RewardLedgerTest {

    private static final VerificationKey A = new VerificationKey(1L, 10L);
    private static final VerificationKey B = new VerificationKey(1L, 11L);
    private static final VerificationKey C = new VerificationKey(1L, 12L);

    private Settings settings;
    private RewardLedger ledger;

    @BeforeEach
    void setUp() {
        settings = new Settings();
        ledger = new RewardLedger(settings);
    }

    @ParameterizedTest(name = "{0} ms -> {1} points")
    @CsvSource({
            "0, 100",
            "5000, 100",
            "10000, 100",
            "10001, 50",
            "15000, 50",
            "30000, 50",
            "30001, 25",
            "45000, 25"
    })
    @DisplayName("points by elapsed time")
    void tiers(long millis, int points) {
        assertThat(RewardLedger.pointsFor(Duration.ofMillis(millis))).isEqualTo(points);
    }

    @Test
    @DisplayName("awards accumulate per member")
    void accumulates() {
        assertThat(ledger.awardFor(A, "Ann", Duration.ofSeconds(5))).isEqualTo(100);
        assertThat(ledger.awardFor(A, "Ann", Duration.ofSeconds(15))).isEqualTo(50);

        assertThat(ledger.totalFor(A)).isEqualTo(150);
        assertThat(ledger.totalFor(B)).isZero();
    }

    @Test
    @DisplayName("with rewards off nothing is recorded")
    void disabled() {
        settings.toggleRewards();

        assertThat(ledger.awardFor(A, "Ann", Duration.ofSeconds(5))).isZero();
        assertThat(ledger.isEmpty()).isTrue();
        assertThat(ledger.totalFor(A)).isZero();
    }

    @Test
    @DisplayName("leaderboard is highest first, ties in first-award order")
    void ordering() {
        ledger.awardFor(A, "A", Duration.ofSeconds(1));
        ledger.awardFor(B, "B", Duration.ofSeconds(2));
        ledger.awardFor(C, "C", Duration.ofSeconds(20));

        List<LeaderboardEntry> board = ledger.leaderboard(10);

        assertThat(board).extracting(LeaderboardEntry::displayName).containsExactly("A", "B", "C");
        assertThat(board).extracting(LeaderboardEntry::points).containsExactly(100L, 100L, 50L);
    }

    @Test
    @DisplayName("leaderboard respects the limit")
    void limit() {
        for (int i = 0; i < 15; i++) {
            ledger.awardFor(new VerificationKey(1L, i), "u" + i, Duration.ofSeconds(i * 3L));
        }

        assertThat(ledger.leaderboard(10)).hasSize(10);
        assertThat(ledger.leaderboard(0)).isEmpty();
    }

    @Test
    @DisplayName("per-guild leaderboard only shows that guild")
    void perGuild() {
        ledger.awardFor(A, "A", Duration.ofSeconds(1));
        ledger.awardFor(new VerificationKey(2L, 10L), "Other", Duration.ofSeconds(1));

        assertThat(ledger.leaderboard(1L, 10)).extracting(LeaderboardEntry::displayName).containsExactly("A");
        assertThat(ledger.leaderboard(10)).hasSize(2);
    }
}
