package com.trackdeck.core;

import com.trackdeck.api.CommandHandler;
import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.ResolutionService;
import com.trackdeck.core.config.ConfigManager;
import com.trackdeck.core.config.ConfigValidator;
import com.trackdeck.core.playback.PlaybackController;
import com.trackdeck.core.plugin.PluginLoader;
import com.trackdeck.core.signal.SessionSignals;
import com.trackdeck.services.database.LibraryStore;
import com.trackdeck.services.history.HistoryStore;
import com.trackdeck.services.library.BrowseService;
import com.trackdeck.services.playlist.PlaylistStore;
import com.trackdeck.services.profile.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public class Kernel {
    private static final Logger logger = LoggerFactory.getLogger(Kernel.class);
    private static Kernel instance;

    private final Path dataDir;

    // Infrastructure
    private final ConfigManager configManager;
    private final PluginLoader pluginLoader;
    private final SessionSignals signals = new SessionSignals();

    // Durable stores
    private final List<LibraryStore> libraries = new ArrayList<>();
    private final HistoryStore historyStore;
    private final PlaylistStore playlistStore;
    private final ProfileStore profileStore;

    // Erst nach start() vorhanden (brauchen Player/Resolver aus den Plugins)
    private volatile PlaybackController playbackController;
    private volatile BrowseService browseService;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // --- SERVICE REGISTRY ---
    // Hier legen Plugins ihre Instanzen ab (ExternalPlayer, ResolutionService)
    private final Map<Class<?>, Object> services = new ConcurrentHashMap<>();

    private final Map<String, CommandHandler> commandRegistry = new ConcurrentHashMap<>();

    public Kernel(Path dataDir) {
        this.dataDir = dataDir;
        this.configManager = new ConfigManager(dataDir);
        new ConfigValidator().validateAndReport(configManager.getConfig());

        try {
            this.historyStore = new HistoryStore(openLibrary(HistoryStore.STORE_NAME), Clock.systemUTC());
            this.playlistStore = new PlaylistStore(openLibrary(PlaylistStore.STORE_NAME));
            this.profileStore = new ProfileStore(openLibrary(ProfileStore.STORE_NAME));
        } catch (RuntimeException e) {
            closeLibraries();
            throw e;
        }

        this.pluginLoader = new PluginLoader(this, dataDir.resolve("plugins").toFile());
    }

    public static synchronized Kernel getInstance() {
        if (instance == null)
            instance = new Kernel(Path.of(System.getProperty("trackdeck.dataDir", "data")));
        return instance;
    }

    private LibraryStore openLibrary(String name) {
        LibraryStore store = LibraryStore.open(dataDir, name);
        libraries.add(store);
        return store;
    }

    public void start() {
        if (running.getAndSet(true))
            return;
        logger.info("⚛️ Kernel booting...");

        // Plugins laden (Player, Resolver, Konsole)
        this.pluginLoader.loadPlugins();

        ExternalPlayer player = requireService(ExternalPlayer.class);
        ResolutionService resolution = requireService(ResolutionService.class);

        var config = configManager.getConfig();
        this.playbackController = new PlaybackController(player, historyStore, profileStore, signals, config);
        this.browseService = new BrowseService(resolution, playlistStore, playbackController, signals, config.pageSize);
        this.playbackController.start();

        logger.info("✅ Kernel active.");
    }

    public void shutdown() {
        if (closed.getAndSet(true))
            return;
        logger.info("🛑 Kernel shutting down...");
        running.set(false);

        if (playbackController != null)
            playbackController.shutdown();
        pluginLoader.disableAll();
        closeLibraries();

        logger.info("👋 Kernel stopped.");
    }

    private void closeLibraries() {
        for (LibraryStore store : libraries) {
            try {
                store.flush();
            } catch (RuntimeException e) {
                logger.warn("Flush of store {} failed: {}", store.getName(), e.getMessage());
            }
            store.close();
        }
        libraries.clear();
    }

    private <T> T requireService(Class<T> clazz) {
        T service = getService(clazz);
        if (service == null) {
            running.set(false);
            throw new IllegalStateException("No " + clazz.getSimpleName() + " registered - check the plugins in "
                    + configManager.getConfigFile());
        }
        return service;
    }

    // --- SERVICE API ---

    public <T> void registerService(Class<T> clazz, T service) {
        services.put(clazz, service);
        logger.info("Service registered: {}", clazz.getSimpleName());
    }

    public <T> void unregisterService(Class<T> clazz) {
        services.remove(clazz);
        logger.info("Service DEREGISTERED: {}", clazz.getSimpleName());
    }

    public <T> T getService(Class<T> clazz) {
        return clazz.cast(services.get(clazz));
    }

    // --- Command API ---

    public void registerCommand(String cmd, CommandHandler handler) {
        commandRegistry.put(cmd.toLowerCase(), handler);
    }

    public void unregisterCommand(String cmd) {
        commandRegistry.remove(cmd.toLowerCase());
        logger.info("Command DEREGISTERED: {}", cmd);
    }

    public Map<String, CommandHandler> getCommandRegistry() {
        return commandRegistry;
    }

    /**
     * Runs one console line ("command arg1 arg2 ...") and returns the reply.
     */
    public String executeCommand(String line) {
        if (line == null || line.isBlank())
            return "";
        String[] parts = line.trim().split("\\s+");
        String cmd = parts[0].toLowerCase();
        String[] args = Arrays.copyOfRange(parts, 1, parts.length);

        CommandHandler handler = commandRegistry.get(cmd);
        if (handler == null)
            return "❓ Unknown command: " + cmd + " (try 'help')";

        try {
            return handler.handle(cmd, args);
        } catch (RuntimeException e) {
            logger.warn("Command '{}' failed", cmd, e);
            return "❌ " + e.getMessage();
        }
    }

    // --- Getters ---

    public Path getDataDir() {
        return dataDir;
    }

    public boolean isRunning() {
        return running.get();
    }

    public PluginLoader getPluginLoader() {
        return pluginLoader;
    }

    public ConfigManager getConfigManager() {
        return configManager;
    }

    public SessionSignals getSignals() {
        return signals;
    }

    public HistoryStore getHistoryStore() {
        return historyStore;
    }

    public PlaylistStore getPlaylistStore() {
        return playlistStore;
    }

    public ProfileStore getProfileStore() {
        return profileStore;
    }

    public PlaybackController getPlaybackController() {
        return playbackController;
    }

    public BrowseService getBrowseService() {
        return browseService;
    }
}
