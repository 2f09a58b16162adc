package org.gudu0.videogate.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup config (one per bot process).
 * <p>
 * Stored at: data/config.json. Admin commands change the runtime {@code Settings}
 * built from this, never the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BotConfig {
    /** Fallback when DISCORD_TOKEN is not set. */
    public String botToken = "";

    /** Seconds a new member has to post a video (10-600). */
    public int timeoutSeconds = 30;

    /** Start the timer on the first message instead of on join. */
    public boolean interactionMode = false;

    public boolean antiSpam = true;

    public boolean rewards = true;

    /** Only enforce between activeStartHour and activeEndHour. */
    public boolean scheduledMode = false;
    public int activeStartHour = 8;
    public int activeEndHour = 22;

    /** Zone for the active-hour window. Blank = system default. */
    public String zoneId = "";

    /** Placeholders: {name}, {timer}. */
    public String welcomeTemplate = "Welcome {name}! Post a video within **{timer}** seconds to stay in the server!";

    @SuppressWarnings("CanBeFinal")
    public List<String> bannedWords = new ArrayList<>(List.of(
            "spam", "promotion", "advertisement", "buy now", "click here"));

    /** Channel for welcome/kick announcements. Blank = guild system channel. */
    public String announceChannelId = "";

    /** Moderation log channel/thread. */
    public String logChannelId = "";

    public boolean enableLogs = false;

    public boolean debug = false;
}
