package org.gudu0.videogate.moderation;

import org.gudu0.videogate.errors.GatewayException;
import org.gudu0.videogate.gateway.MemberRole;
import org.gudu0.videogate.gateway.ModerationGateway;
import org.gudu0.videogate.logging.LogService;
import org.gudu0.videogate.rewards.RewardLedger;
import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.spam.SpamClassifier;
import org.gudu0.videogate.stats.ModerationStats;
import org.gudu0.videogate.stats.StatsCounter;
import org.gudu0.videogate.testutil.ManualTimerService;
import org.gudu0.videogate.testutil.MutableClock;
import org.gudu0.videogate.verification.VerificationKey;
import org.gudu0.videogate.verification.VerificationTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ModerationService")
class ModerationServiceTest {

    private static final long GUILD = 500L;
    private static final long CHANNEL = 600L;
    private static final long USER = 42L;
    private static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ModerationGateway gateway;

    private Settings settings;
    private ManualTimerService timers;
    private MutableClock clock;
    private VerificationTracker tracker;
    private RewardLedger ledger;
    private ModerationStats stats;
    private ModerationService service;

    private long nextMessageId = 1;

    @BeforeEach
    void setUp() {
        settings = new Settings();
        settings.setZone(ZoneOffset.UTC);
        settings.addBannedWord("buy now");
        timers = new ManualTimerService();
        clock = new MutableClock(T0);
        tracker = new VerificationTracker(settings, timers, clock);
        ledger = new RewardLedger(settings);
        stats = new ModerationStats();
        LogService logs = new LogService(gateway, "", false, ZoneOffset.UTC);

        service = new ModerationService(settings, tracker, new SpamClassifier(settings), ledger, stats, gateway, logs, clock);

        CompletableFuture<Void> done = CompletableFuture.completedFuture(null);
        lenient().when(gateway.removeMember(anyLong(), anyLong(), anyString())).thenReturn(done);
        lenient().when(gateway.sendToGroup(anyLong(), anyString(), anyBoolean())).thenReturn(done);
        lenient().when(gateway.sendToChannel(anyLong(), anyString(), anyBoolean())).thenReturn(done);
        lenient().when(gateway.deleteMessage(anyLong(), anyLong())).thenReturn(done);
        lenient().when(gateway.getMemberRole(anyLong(), anyLong())).thenReturn(CompletableFuture.completedFuture(MemberRole.MEMBER));
    }

    private IncomingMessage text(String body) {
        return text(body, MemberRole.MEMBER);
    }

    private IncomingMessage text(String body, MemberRole role) {
        return new IncomingMessage(GUILD, CHANNEL, nextMessageId++, USER, "ann", "Ann", role, body, false);
    }

    private IncomingMessage video() {
        return new IncomingMessage(GUILD, CHANNEL, nextMessageId++, USER, "ann", "Ann", MemberRole.MEMBER, "", true);
    }

    @Nested
    @DisplayName("video verification")
    class Verification {

        @Test
        @DisplayName("video within 8 seconds verifies, awards 100 points and kicks nobody")
        void fastVideo() {
            service.handleJoin(GUILD, USER, "Ann");
            clock.advance(Duration.ofSeconds(8));

            service.handleMessage(video());

            assertThat(tracker.isVerified(GUILD, USER)).isTrue();
            assertThat(ledger.totalFor(new VerificationKey(GUILD, USER))).isEqualTo(100);
            assertThat(stats.get(StatsCounter.TOTAL_JOINS)).isEqualTo(1);
            assertThat(stats.get(StatsCounter.USERS_VERIFIED)).isEqualTo(1);

            ArgumentCaptor<String> reply = ArgumentCaptor.forClass(String.class);
            verify(gateway).sendToChannel(eq(CHANNEL), reply.capture(), eq(true));
            assertThat(reply.getValue()).contains("8.0 seconds").contains("**100** points");

            timers.fireAll();
            verify(gateway, never()).removeMember(anyLong(), anyLong(), anyString());
        }

        @Test
        @DisplayName("welcome message renders the template with the timer")
        void welcome() {
            settings.setWelcomeTemplate("Hey {name}, {timer}s to post!");

            service.handleJoin(GUILD, USER, "Ann");

            verify(gateway).sendToGroup(GUILD, "Hey Ann, 30s to post!", true);
        }

        @Test
        @DisplayName("while paused the welcome says so and no timer runs")
        void paused() {
            settings.setPaused(true);

            service.handleJoin(GUILD, USER, "Ann");

            ArgumentCaptor<String> msg = ArgumentCaptor.forClass(String.class);
            verify(gateway).sendToGroup(eq(GUILD), msg.capture(), eq(true));
            assertThat(msg.getValue()).contains("paused");
            assertThat(timers.scheduledCount()).isZero();
            assertThat(stats.get(StatsCounter.TOTAL_JOINS)).isEqualTo(1);
        }

        @Test
        @DisplayName("interaction mode: first message arms the timer and sends a reminder")
        void interactionMode() {
            settings.toggleInteractionMode();
            service.handleJoin(GUILD, USER, "Ann");

            service.handleMessage(text("hello there"));
            service.handleMessage(text("anyone?"));

            assertThat(timers.scheduledCount()).isEqualTo(1);
            verify(gateway, times(1)).sendToChannel(eq(CHANNEL), anyString(), eq(true));
        }

        @Test
        @DisplayName("no points are awarded with rewards off")
        void rewardsOff() {
            settings.toggleRewards();
            service.handleJoin(GUILD, USER, "Ann");

            service.handleMessage(video());

            assertThat(ledger.isEmpty()).isTrue();
            assertThat(stats.get(StatsCounter.USERS_VERIFIED)).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("timer expiry")
    class Expiry {

        @Test
        @DisplayName("removes the member once and counts the kick; a late video is ignored")
        void expires() {
            service.handleJoin(GUILD, USER, "Ann");

            timers.last().fire();
            clock.advance(Duration.ofSeconds(31));
            service.handleMessage(video());

            verify(gateway, times(1)).removeMember(eq(GUILD), eq(USER), anyString());
            verify(gateway).sendToGroup(eq(GUILD), contains("was removed"), eq(true));
            assertThat(stats.get(StatsCounter.USERS_KICKED)).isEqualTo(1);
            assertThat(stats.get(StatsCounter.USERS_VERIFIED)).isZero();
            assertThat(tracker.isVerified(GUILD, USER)).isFalse();
        }

        @Test
        @DisplayName("a failed kick keeps the counters and state")
        void gatewayFailure() {
            when(gateway.removeMember(anyLong(), anyLong(), anyString()))
                    .thenReturn(CompletableFuture.failedFuture(new GatewayException("Missing permission")));
            service.handleJoin(GUILD, USER, "Ann");

            assertThatCode(() -> timers.last().fire()).doesNotThrowAnyException();

            assertThat(stats.get(StatsCounter.USERS_KICKED)).isEqualTo(1);
            assertThat(tracker.isPending(GUILD, USER)).isFalse();
            verify(gateway, never()).sendToGroup(eq(GUILD), contains("was removed"), anyBoolean());
        }

        @Test
        @DisplayName("a member who leaves has their timer dropped")
        void memberLeft() {
            service.handleJoin(GUILD, USER, "Ann");

            service.handleMemberLeft(GUILD, USER);
            timers.fireAll();

            assertThat(tracker.isPending(GUILD, USER)).isFalse();
            verify(gateway, never()).removeMember(anyLong(), anyLong(), anyString());
            assertThat(stats.get(StatsCounter.USERS_KICKED)).isZero();
        }
    }

    @Nested
    @DisplayName("spam")
    class Spam {

        @Test
        @DisplayName("a message with a link and a banned word counts as a link only")
        void linkAndBannedWord() {
            service.handleMessage(text("buy now at www.shop.net"));

            assertThat(stats.get(StatsCounter.LINKS_BLOCKED)).isEqualTo(1);
            assertThat(stats.get(StatsCounter.SPAM_BLOCKED)).isZero();
            verify(gateway).deleteMessage(CHANNEL, 1L);
            verify(gateway).removeMember(eq(GUILD), eq(USER), contains("link"));
            verify(gateway).sendToChannel(eq(CHANNEL), contains("posting links"), eq(true));
            verify(gateway, never()).getMemberRole(anyLong(), anyLong());
        }

        @Test
        @DisplayName("removing a pending member for spam cancels the verification timer")
        void pendingSpammer() {
            service.handleJoin(GUILD, USER, "Ann");
            ManualTimerService.Scheduled timer = timers.last();

            service.handleMessage(text("click BUY NOW"));

            assertThat(timer.isCancelled()).isTrue();
            assertThat(tracker.isPending(GUILD, USER)).isFalse();
            assertThat(stats.get(StatsCounter.SPAM_BLOCKED)).isEqualTo(1);
            assertThat(stats.get(StatsCounter.USERS_KICKED)).isZero();
        }

        @Test
        @DisplayName("staff are never removed")
        void staffExempt() {
            service.handleMessage(text("see https://docs.example", MemberRole.ADMIN));

            verify(gateway, never()).removeMember(anyLong(), anyLong(), anyString());
            verify(gateway, never()).deleteMessage(anyLong(), anyLong());
            assertThat(stats.get(StatsCounter.LINKS_BLOCKED)).isZero();
        }

        @Test
        @DisplayName("verified members may post links")
        void verifiedExempt() {
            service.handleJoin(GUILD, USER, "Ann");
            service.handleMessage(video());

            service.handleMessage(text("my clip is also on www.example.net"));

            verify(gateway, never()).removeMember(anyLong(), anyLong(), anyString());
            verify(gateway, never()).getMemberRole(anyLong(), anyLong());
        }

        @Test
        @DisplayName("no spam checks while paused")
        void pausedSkipsSpam() {
            settings.setPaused(true);

            service.handleMessage(text("www.spam.net"));

            verify(gateway, never()).getMemberRole(anyLong(), anyLong());
            assertThat(stats.snapshot().protectionActions()).isZero();
        }

        @Test
        @DisplayName("a suspicious name is removed even with a harmless message")
        void suspiciousIdentity() {
            IncomingMessage msg = new IncomingMessage(GUILD, CHANNEL, 9L, USER, "crypto_deals", "Deals", MemberRole.MEMBER, "hi", false);

            service.handleMessage(msg);

            assertThat(stats.get(StatsCounter.SUSPICIOUS_KICKED)).isEqualTo(1);
            verify(gateway).removeMember(eq(GUILD), eq(USER), anyString());
        }
    }
    @Nested
    @DisplayName("slow gateway")
    class SlowGateway {

        private IncomingMessage withoutRole(String body) {
            return text(body, null);
        }

        @Test
        @DisplayName("a timer firing during the role lookup does not kick the spammer a second time")
        void spamThenTimer() {
            CompletableFuture<MemberRole> role = new CompletableFuture<>();
            when(gateway.getMemberRole(GUILD, USER)).thenReturn(role);
            service.handleJoin(GUILD, USER, "Ann");
            ManualTimerService.Scheduled timer = timers.last();

            service.handleMessage(withoutRole("www.spam.net"));
            assertThat(tracker.isPending(GUILD, USER)).isFalse();
            assertThat(timer.isCancelled()).isTrue();

            timer.fireIgnoringCancel();
            role.complete(MemberRole.MEMBER);

            verify(gateway, times(1)).removeMember(eq(GUILD), eq(USER), anyString());
            assertThat(stats.get(StatsCounter.USERS_KICKED)).isZero();
            assertThat(stats.get(StatsCounter.LINKS_BLOCKED)).isEqualTo(1);
        }

        @Test
        @DisplayName("a video posted during the role lookup neither verifies nor rewards")
        void spamThenVideo() {
            CompletableFuture<MemberRole> role = new CompletableFuture<>();
            when(gateway.getMemberRole(GUILD, USER)).thenReturn(role);
            service.handleJoin(GUILD, USER, "Ann");

            service.handleMessage(withoutRole("www.spam.net"));
            clock.advance(Duration.ofSeconds(5));
            service.handleMessage(video());
            role.complete(MemberRole.MEMBER);

            assertThat(tracker.isVerified(GUILD, USER)).isFalse();
            assertThat(stats.get(StatsCounter.USERS_VERIFIED)).isZero();
            assertThat(ledger.totalFor(new VerificationKey(GUILD, USER))).isZero();
            verify(gateway, times(1)).removeMember(eq(GUILD), eq(USER), anyString());
            assertThat(stats.get(StatsCounter.LINKS_BLOCKED)).isEqualTo(1);
        }

        @Test
        @DisplayName("a lookup resolving to staff leaves the member alone")
        void lookupResolvesToStaff() {
            CompletableFuture<MemberRole> role = new CompletableFuture<>();
            when(gateway.getMemberRole(GUILD, USER)).thenReturn(role);

            service.handleMessage(withoutRole("see https://docs.example"));
            role.complete(MemberRole.ADMIN);

            verify(gateway, never()).removeMember(anyLong(), anyLong(), anyString());
            verify(gateway, never()).deleteMessage(anyLong(), anyLong());
            assertThat(stats.get(StatsCounter.LINKS_BLOCKED)).isZero();
        }

        @Test
        @DisplayName("a failed lookup treats the sender as a regular member")
        void lookupFails() {
            when(gateway.getMemberRole(GUILD, USER))
                    .thenReturn(CompletableFuture.failedFuture(new GatewayException("Unknown member")));

            service.handleMessage(withoutRole("www.spam.net"));

            verify(gateway).removeMember(eq(GUILD), eq(USER), contains("link"));
            assertThat(stats.get(StatsCounter.LINKS_BLOCKED)).isEqualTo(1);
        }

        @Test
        @DisplayName("state is committed before the kick completes and a late failure changes nothing")
        void lateSpamKickFailure() {
            CompletableFuture<Void> kick = new CompletableFuture<>();
            when(gateway.removeMember(eq(GUILD), eq(USER), anyString())).thenReturn(kick);
            service.handleJoin(GUILD, USER, "Ann");

            service.handleMessage(text("www.spam.net"));

            assertThat(tracker.isPending(GUILD, USER)).isFalse();
            assertThat(stats.get(StatsCounter.LINKS_BLOCKED)).isEqualTo(1);

            assertThatCode(() -> kick.completeExceptionally(new GatewayException("Missing permission")))
                    .doesNotThrowAnyException();

            assertThat(stats.get(StatsCounter.LINKS_BLOCKED)).isEqualTo(1);
            assertThat(tracker.isPending(GUILD, USER)).isFalse();
            verify(gateway, never()).sendToChannel(eq(CHANNEL), contains("posting links"), anyBoolean());
        }

        @Test
        @DisplayName("a late timeout kick failure keeps the kick counted")
        void lateExpiryKickFailure() {
            CompletableFuture<Void> kick = new CompletableFuture<>();
            when(gateway.removeMember(eq(GUILD), eq(USER), anyString())).thenReturn(kick);
            service.handleJoin(GUILD, USER, "Ann");

            timers.last().fire();
            assertThat(stats.get(StatsCounter.USERS_KICKED)).isEqualTo(1);

            kick.completeExceptionally(new GatewayException("Missing permission"));

            assertThat(stats.get(StatsCounter.USERS_KICKED)).isEqualTo(1);
            assertThat(tracker.isPending(GUILD, USER)).isFalse();
            verify(gateway, never()).sendToGroup(eq(GUILD), contains("was removed"), anyBoolean());
        }
    }
}
