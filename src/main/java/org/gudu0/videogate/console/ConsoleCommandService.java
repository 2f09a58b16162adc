package org.gudu0.videogate.console;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.stats.ModerationStats;
import org.gudu0.videogate.stats.StatsSnapshot;
import org.gudu0.videogate.util.ConsoleLog;
import org.gudu0.videogate.verification.PendingView;
import org.gudu0.videogate.verification.VerificationTracker;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

public final class ConsoleCommandService {

    private final JDA jda;
    private final Settings settings;
    private final VerificationTracker tracker;
    private final ModerationStats stats;
    private final Clock clock;
    private final Runnable shutdown;

    private volatile boolean running = true;

    public ConsoleCommandService(JDA jda,
                                 Settings settings,
                                 VerificationTracker tracker,
                                 ModerationStats stats,
                                 Clock clock,
                                 Runnable shutdown) {
        this.jda = jda;
        this.settings = settings;
        this.tracker = tracker;
        this.stats = stats;
        this.clock = clock;
        this.shutdown = shutdown;
    }

    public void start() {
        Thread t = new Thread(this::runLoop, "ConsoleCommandService");
        t.setDaemon(true); // don't prevent JVM shutdown
        t.start();

        ConsoleLog.info("Console", "Console commands enabled. Type 'help' for commands.");
    }

    private void runLoop() {
        try (BufferedReader br = new BufferedReader(
                new InputStreamReader(System.in, StandardCharsets.UTF_8))) {

            while (running) {
                String line = br.readLine();
                if (line == null) {
                    ConsoleLog.warn("Console", "STDIN closed; console commands disabled.");
                    return;
                }

                line = line.trim();
                if (line.isEmpty()) continue;

                handle(line);
            }
        } catch (Exception e) {
            ConsoleLog.error("Console", "Console command loop crashed: " + e.getMessage(), e);
        }
    }

    void handle(String raw) {
        String cmd = raw.trim().split("\\s+")[0].toLowerCase(Locale.ROOT);

        switch (cmd) {
            case "help" -> printHelp();
            case "listguilds", "guilds" -> listGuilds();
            case "status" -> status();
            case "pending" -> pending();
            case "pause" -> {
                settings.setPaused(true);
                ConsoleLog.warn("Console", "Verification paused from console.");
            }
            case "resume" -> {
                settings.setPaused(false);
                ConsoleLog.info("Console", "Verification resumed from console.");
            }
            case "shutdown", "exit" -> {
                ConsoleLog.warn("Console", "Shutdown requested from console.");
                running = false;
                shutdown.run();
            }
            default -> ConsoleLog.warn("Console", "Unknown command: " + cmd + " (type 'help')");
        }
    }

    private void printHelp() {
        ConsoleLog.info("Console", """
                Commands:
                  help                    - show this help
                  listguilds|guilds       - list guilds the bot is in
                  status                  - settings and counters
                  pending                 - members waiting to post a video
                  pause | resume          - stop / restart kicking
                  shutdown|exit           - terminate process
                """.trim());
    }

    private void listGuilds() {
        var gs = jda.getGuilds();
        ConsoleLog.info("Console", "Guilds (" + gs.size() + "):");
        for (Guild g : gs) {
            ConsoleLog.info("Console", " - " + g.getName() + " | " + g.getId());
        }
    }

    private void status() {
        StatsSnapshot s = stats.snapshot();
        ConsoleLog.info("Console", "Status: " + (settings.isPaused() ? "PAUSED" : "ACTIVE"));
        ConsoleLog.info("Console", "  timeoutSeconds=" + settings.timeoutSeconds());
        ConsoleLog.info("Console", "  interactionMode=" + settings.isInteractionMode()
                + " antiSpam=" + settings.isAntiSpam()
                + " rewards=" + settings.isRewards());
        ConsoleLog.info("Console", "  scheduledMode=" + settings.isScheduledMode()
                + " activeHours=" + settings.activeHours() + " zone=" + settings.zone());
        ConsoleLog.info("Console", "  pending=" + tracker.pendingCount() + " verified=" + tracker.verifiedCount());
        ConsoleLog.info("Console", "  joins=" + s.totalJoins() + " verified=" + s.usersVerified()
                + " kicked=" + s.usersKicked() + " spam=" + s.spamBlocked()
                + " links=" + s.linksBlocked() + " suspicious=" + s.suspiciousKicked());
    }

    private void pending() {
        List<PendingView> views = tracker.pendingSnapshot();
        ConsoleLog.info("Console", "Pending (" + views.size() + "):");
        for (PendingView v : views) {
            long waited = Duration.between(v.startedAt(), clock.instant()).toSeconds();
            ConsoleLog.info("Console", " - " + v.displayName()
                    + " | guildId=" + v.key().groupId()
                    + " userId=" + v.key().userId()
                    + " | " + v.state()
                    + " | " + waited + "s / " + v.timeoutSeconds() + "s");
        }
    }
}
