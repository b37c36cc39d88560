package com.plugins.mpv;

import com.plugins.mpv.internal.MpvPlayer;
import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.SessionPlugin;
import com.trackdeck.common.util.ExecutableLocator;
import com.trackdeck.core.Kernel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Audio playback through mpv.
 * Features:
 * - one mpv process in idle mode, controlled over JSON IPC
 * - configurable binary and socket path
 */
public class MpvPlugin implements SessionPlugin {
    private static final Logger logger = LoggerFactory.getLogger(MpvPlugin.class);
    private Kernel kernel;
    private MpvPlayer player;
    private String mpvPath = null;

    @Override
    public String getName() {
        return "Mpv";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;
        setupDefaults();

        var config = kernel.getConfigManager().getConfig();
        Optional<String> mpv = ExecutableLocator.locate(
                config.getPluginSetting(getName(), "mpv_path", ""), "mpv", new File("tools"));
        if (mpv.isEmpty()) {
            logger.error("❌ mpv not found! Please install mpv or set 'mpv_path' for plugin {}", getName());
            return;
        }
        mpvPath = mpv.get();

        Path socket = Path.of(config.getPluginSetting(getName(), "socket_path", defaultSocketPath()));

        this.player = new MpvPlayer(mpvPath, socket);
        kernel.registerService(ExternalPlayer.class, player);
        logger.info("✅ mpv plugin enabled ({})", mpvPath);
    }

    @Override
    public void onDisable() {
        if (player != null) {
            kernel.unregisterService(ExternalPlayer.class);
            player.close();
            player = null;
        }
    }

    private void setupDefaults() {
        var config = kernel.getConfigManager().getConfig();
        if (config.getPluginSetting(getName(), "socket_path", "").isEmpty()) {
            config.setPluginSetting(getName(), "socket_path", defaultSocketPath());
            config.setPluginSetting(getName(), "mpv_path", "");
            kernel.getConfigManager().saveConfig();
        }
    }

    private static String defaultSocketPath() {
        return Path.of(System.getProperty("java.io.tmpdir"), "trackdeck-mpv.sock").toString();
    }
}
