package org.gudu0.videogate;

import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import org.gudu0.videogate.commands.ControlCommandsListener;
import org.gudu0.videogate.commands.InfoCommandsListener;
import org.gudu0.videogate.commands.ModerationCommands;
import org.gudu0.videogate.commands.SlashCommands;
import org.gudu0.videogate.config.BotConfig;
import org.gudu0.videogate.config.TypedConfigStore;
import org.gudu0.videogate.console.ConsoleCommandService;
import org.gudu0.videogate.gateway.JdaModerationGateway;
import org.gudu0.videogate.guild.GuildJoinListener;
import org.gudu0.videogate.logging.LogService;
import org.gudu0.videogate.moderation.MemberListener;
import org.gudu0.videogate.moderation.MessageListener;
import org.gudu0.videogate.moderation.ModerationService;
import org.gudu0.videogate.rewards.RewardLedger;
import org.gudu0.videogate.settings.Settings;
import org.gudu0.videogate.spam.SpamClassifier;
import org.gudu0.videogate.stats.ModerationStats;
import org.gudu0.videogate.util.BotPaths;
import org.gudu0.videogate.util.ConsoleLog;
import org.gudu0.videogate.verification.ScheduledTimerService;
import org.gudu0.videogate.verification.VerificationTracker;

import java.time.Clock;

public class Main {

    private static final int TIMER_THREADS = 2;

    public static void main(String[] args) throws Exception {
        ConsoleLog.info("Main", "Starting Bot");
        BotPaths.ensureBaseDirs();

        // 1) Config (data/config.json)
        TypedConfigStore<BotConfig> store = new TypedConfigStore<>(BotPaths.CONFIG_FILE, BotConfig.class, BotConfig::new);
        store.writeDefaultsIfMissing();
        BotConfig cfg = store.cfg();
        ConsoleLog.DEBUG = cfg.debug;

        // 2) Token: env wins over config
        String token = token(cfg);

        // 3) Core state
        Clock clock = Clock.systemUTC();
        Settings settings = Settings.fromConfig(cfg);
        ScheduledTimerService timers = new ScheduledTimerService(TIMER_THREADS);
        VerificationTracker tracker = new VerificationTracker(settings, timers, clock);
        SpamClassifier classifier = new SpamClassifier(settings);
        RewardLedger ledger = new RewardLedger(settings);
        ModerationStats stats = new ModerationStats();

        ConsoleLog.info("Main", "Settings: timeout=" + settings.timeoutSeconds() + "s"
                + " interaction=" + settings.isInteractionMode()
                + " antiSpam=" + settings.isAntiSpam()
                + " rewards=" + settings.isRewards()
                + " scheduled=" + settings.isScheduledMode() + " " + settings.activeHours());

        // 4) Services
        JdaModerationGateway gateway = new JdaModerationGateway(cfg.announceChannelId);
        LogService logs = new LogService(gateway, cfg.logChannelId, cfg.enableLogs, settings.zone());
        ModerationService moderation = new ModerationService(settings, tracker, classifier, ledger, stats, gateway, logs, clock);
        ModerationCommands commands = new ModerationCommands(settings, tracker, ledger, stats, logs);

        long announceChannelId = parseId(cfg.announceChannelId);

        // 5) Build JDA
        ConsoleLog.info("Main", "Building JDA (GUILD_MEMBERS + MESSAGE_CONTENT enabled)");
        JDA jda = JDABuilder.createDefault(token)
                .enableIntents(GatewayIntent.GUILD_MEMBERS, GatewayIntent.MESSAGE_CONTENT)
                .setMemberCachePolicy(MemberCachePolicy.DEFAULT)
                .addEventListeners(
                        new InfoCommandsListener(commands),
                        new ControlCommandsListener(commands),
                        new GuildJoinListener((j, guild) -> setupGuild(j, guild, announceChannelId)),
                        new MemberListener(moderation),
                        new MessageListener(moderation)
                )
                .build();

        // Listeners are live from build(); events during startup need the gateway already.
        gateway.attach(jda);

        jda.awaitReady();
        ConsoleLog.info("Main", "JDA ready as " + jda.getSelfUser().getName());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            ConsoleLog.warn("Main", "Shutting down: cancelling " + tracker.pendingCount() + " pending timer(s)");
            tracker.shutdown();
            timers.shutdown();
            jda.shutdown();
        }, "shutdown-hook"));

        ConsoleCommandService console = new ConsoleCommandService(jda, settings, tracker, stats, clock, () -> System.exit(0));
        console.start();

        // 6) Safety checks + guild-scoped commands, for every guild
        ConsoleLog.info("Main", "Running safety checks and registering commands (all guilds)");
        for (Guild g : jda.getGuilds()) {
            setupGuild(jda, g, announceChannelId);
        }

        ConsoleLog.info("Main", "Startup complete");
    }

    private static void setupGuild(JDA jda, Guild g, long announceChannelId) {
        SafetyChecks.runForGuild(jda, g.getIdLong(), announceChannelId);
        SlashCommands.registerFor(g);
    }

    private static String token(BotConfig cfg) {
        String v = System.getenv("DISCORD_TOKEN");
        if (v != null && !v.isBlank()) return v.trim();
        if (cfg.botToken != null && !cfg.botToken.isBlank()) return cfg.botToken.trim();
        throw new IllegalStateException("Missing bot token: set DISCORD_TOKEN or botToken in " + BotPaths.CONFIG_FILE);
    }

    private static long parseId(String s) {
        if (s == null || s.isBlank()) return 0;
        try { return Long.parseLong(s.trim()); }
        catch (NumberFormatException e) {
            ConsoleLog.warn("Main", "announceChannelId is not a number: " + s);
            return 0;
        }
    }
}
