package com.plugins.youtube;

import com.plugins.youtube.internal.YtDlpResolver;
import com.trackdeck.api.ResolutionService;
import com.trackdeck.api.SessionPlugin;
import com.trackdeck.common.util.ExecutableLocator;
import com.trackdeck.core.Kernel;
import com.trackdeck.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Optional;

/**
 * YouTube lookup plugin using yt-dlp
 * Features:
 * - track search ("ytsearchN:")
 * - playlist search and expansion
 * - no authentication required (public content only)
 */
public class YouTubePlugin implements SessionPlugin {
    private static final Logger logger = LoggerFactory.getLogger(YouTubePlugin.class);
    static final String DEFAULT_TIMEOUT_SECONDS = "60";

    private Kernel kernel;
    private boolean registered = false;

    @Override
    public String getName() {
        return "YouTube";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        Configuration config = kernel.getConfigManager().getConfig();
        writeDefaultSettings(config);

        Optional<String> ytDlp = ExecutableLocator.locate(
                config.getPluginSetting(getName(), "yt_dlp_path", ""), "yt-dlp", new File("tools"));
        if (ytDlp.isEmpty()) {
            logger.error("❌ yt-dlp not found! Please install: pip install yt-dlp");
            logger.error("   Or download from: https://github.com/yt-dlp/yt-dlp/releases");
            return;
        }

        long timeout = timeoutSeconds(config.getPluginSetting(getName(), "timeout_seconds", DEFAULT_TIMEOUT_SECONDS));
        kernel.registerService(ResolutionService.class, new YtDlpResolver(ytDlp.get(), config.searchLimit, timeout));
        registered = true;
        logger.info("✅ YouTube plugin enabled ({}, {} results per search)", ytDlp.get(), config.searchLimit);
    }

    @Override
    public void onDisable() {
        if (registered) {
            kernel.unregisterService(ResolutionService.class);
            registered = false;
        }
    }

    private void writeDefaultSettings(Configuration config) {
        if (!config.getPluginSetting(getName(), "timeout_seconds", "").isEmpty())
            return;
        config.setPluginSetting(getName(), "timeout_seconds", DEFAULT_TIMEOUT_SECONDS);
        config.setPluginSetting(getName(), "yt_dlp_path", "");
        kernel.getConfigManager().saveConfig();
    }

    static long timeoutSeconds(String value) {
        try {
            long seconds = Long.parseLong(value.trim());
            if (seconds > 0)
                return seconds;
        } catch (NumberFormatException e) {
            logger.debug("timeout_seconds not a number: {}", value);
        }
        logger.warn("Invalid timeout_seconds '{}', using {}", value, DEFAULT_TIMEOUT_SECONDS);
        return Long.parseLong(DEFAULT_TIMEOUT_SECONDS);
    }
}
