package org.gudu0.videogate.settings;

import org.gudu0.videogate.config.BotConfig;
import org.gudu0.videogate.errors.ValidationException;
import org.gudu0.videogate.util.ConsoleLog;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runtime policy shared by the tracker, the spam classifier and the reward ledger.
 * <p>
 * Each setter/toggle is atomic on its own; no cross-field transactions.
 */
public final class Settings {

    public static final int MIN_TIMEOUT_SECONDS = 10;
    public static final int MAX_TIMEOUT_SECONDS = 600;

    private volatile int timeoutSeconds = 30;
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicBoolean interactionMode = new AtomicBoolean(false);
    private final AtomicBoolean antiSpam = new AtomicBoolean(true);
    private final AtomicBoolean rewards = new AtomicBoolean(true);
    private final AtomicBoolean scheduledMode = new AtomicBoolean(false);

    private volatile ActiveHours activeHours = new ActiveHours(8, 22);
    private volatile ZoneId zone = ZoneId.systemDefault();
    private volatile String welcomeTemplate = new BotConfig().welcomeTemplate;
    private final CopyOnWriteArrayList<String> bannedWords = new CopyOnWriteArrayList<>();

    public Settings() {}

    /**
     * Builds settings from the config file. Invalid fields are logged and left at their default.
     */
    public static Settings fromConfig(BotConfig cfg) {
        Settings s = new Settings();

        try {
            s.setTimeoutSeconds(cfg.timeoutSeconds);
        } catch (ValidationException e) {
            ConsoleLog.warn("Settings", "Ignoring timeoutSeconds=" + cfg.timeoutSeconds + ": " + e.getMessage());
        }

        try {
            s.setActiveHours(cfg.activeStartHour, cfg.activeEndHour);
        } catch (ValidationException e) {
            ConsoleLog.warn("Settings", "Ignoring active hours: " + e.getMessage());
        }

        if (cfg.zoneId != null && !cfg.zoneId.isBlank()) {
            try {
                s.setZone(ZoneId.of(cfg.zoneId.trim()));
            } catch (DateTimeException e) {
                ConsoleLog.warn("Settings", "Ignoring zoneId=" + cfg.zoneId + ": " + e.getMessage());
            }
        }

        s.interactionMode.set(cfg.interactionMode);
        s.antiSpam.set(cfg.antiSpam);
        s.rewards.set(cfg.rewards);
        s.scheduledMode.set(cfg.scheduledMode);

        if (cfg.welcomeTemplate != null && !cfg.welcomeTemplate.isBlank()) {
            s.welcomeTemplate = cfg.welcomeTemplate;
        }
        if (cfg.bannedWords != null) {
            for (String w : cfg.bannedWords) {
                if (w != null && !w.isBlank()) s.addBannedWord(w);
            }
        }
        return s;
    }

    // ----------------------------
    // Timer
    // ----------------------------

    public int timeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int seconds) {
        if (seconds < MIN_TIMEOUT_SECONDS || seconds > MAX_TIMEOUT_SECONDS) {
            throw new ValidationException("Timer must be between " + MIN_TIMEOUT_SECONDS
                    + " seconds and 10 minutes (" + MAX_TIMEOUT_SECONDS + " seconds).");
        }
        this.timeoutSeconds = seconds;
    }

    // ----------------------------
    // Flags
    // ----------------------------

    public boolean isPaused() { return paused.get(); }

    public void setPaused(boolean value) { paused.set(value); }

    public boolean isInteractionMode() { return interactionMode.get(); }

    public boolean toggleInteractionMode() { return toggle(interactionMode); }

    public boolean isAntiSpam() { return antiSpam.get(); }

    public boolean toggleAntiSpam() { return toggle(antiSpam); }

    public boolean isRewards() { return rewards.get(); }

    public boolean toggleRewards() { return toggle(rewards); }

    public boolean isScheduledMode() { return scheduledMode.get(); }

    public boolean toggleScheduledMode() { return toggle(scheduledMode); }

    // ----------------------------
    // Schedule window
    // ----------------------------

    public ActiveHours activeHours() { return activeHours; }

    public void setActiveHours(int start, int end) {
        this.activeHours = new ActiveHours(start, end);
    }

    public ZoneId zone() { return zone; }

    public void setZone(ZoneId zone) { this.zone = zone; }

    /** True when scheduled mode is off, or the hour of {@code now} falls in the window. */
    public boolean isWithinActiveHours(Instant now) {
        if (!scheduledMode.get()) return true;
        int hour = now.atZone(zone).getHour();
        return activeHours.contains(hour);
    }

    // ----------------------------
    // Welcome template
    // ----------------------------

    public String welcomeTemplate() { return welcomeTemplate; }

    public void setWelcomeTemplate(String template) {
        if (template == null || template.isBlank()) {
            throw new ValidationException("Welcome message can't be empty.");
        }
        this.welcomeTemplate = template.trim();
    }

    public String renderWelcome(String name, int timer) {
        return welcomeTemplate
                .replace("{name}", name)
                .replace("{timer}", Integer.toString(timer));
    }

    // ----------------------------
    // Banned words
    // ----------------------------

    public List<String> bannedWords() {
        return List.copyOf(bannedWords);
    }

    /** @return false if the word was already banned */
    public boolean addBannedWord(String word) {
        return bannedWords.addIfAbsent(normalizeWord(word));
    }

    /** @return false if the word was not banned */
    public boolean removeBannedWord(String word) {
        return bannedWords.remove(normalizeWord(word));
    }

    private static String normalizeWord(String word) {
        if (word == null || word.isBlank()) {
            throw new ValidationException("Banned word can't be empty.");
        }
        return word.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean toggle(AtomicBoolean flag) {
        boolean prev;
        do {
            prev = flag.get();
        } while (!flag.compareAndSet(prev, !prev));
        return !prev;
    }
}
