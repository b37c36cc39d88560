package com.trackdeck.core.config;

import java.util.HashMap;
import java.util.Map;

public class Configuration {
    // --- Haupteinstellungen ---
    // %s = Track-ID
    public String mediaUrlTemplate = "https://youtube.com/watch?v=%s";
    public int pageSize = 20;
    public int historyPageSize = 20;
    public int searchLimit = 40;

    // --- Hintergrund-Tasks (Millisekunden) ---
    public long confirmInitialDelayMillis = 1000;
    public long confirmPollMillis = 1000;
    public int confirmIdleBudget = 10;
    public long endOfTrackPollMillis = 1000;
    public int endOfTrackIdleThreshold = 3;
    public long timeObserverMillis = 500;
    public long listeningTrackerMillis = 1000;

    // --- Plugin Steuerung (Aktivieren/Deaktivieren) ---
    // Key = Plugin Name, Value = Aktiviert (true/false)
    public Map<String, Boolean> plugins = new HashMap<>();

    // --- Plugin-Spezifische Einstellungen ---
    // Key = PluginName, Value = Map mit Settings (z.B. "socket_path" -> "/tmp/...")
    public Map<String, Map<String, String>> pluginConfigs = new HashMap<>();

    public Configuration() {
        // Defaults
        plugins.put("ConsoleCommands", true);
        plugins.put("Mpv", true);
        plugins.put("YouTube", true); // Name muss exakt mit getName() übereinstimmen
    }

    // Helper für Plugins um einfach an ihre Config zu kommen
    public String getPluginSetting(String pluginName, String key, String defaultValue) {
        if (!pluginConfigs.containsKey(pluginName))
            return defaultValue;
        return pluginConfigs.get(pluginName).getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String pluginName, String key, String value) {
        pluginConfigs.computeIfAbsent(pluginName, k -> new HashMap<>()).put(key, value);
    }

    public String mediaUrl(String trackId) {
        return String.format(mediaUrlTemplate, trackId);
    }
}
