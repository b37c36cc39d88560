package com.trackdeck.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Keeps {@code <dataDir>/config.json} and the {@link Configuration} read from it.
 * A missing file is created with defaults; an unreadable one is left on disk and the
 * session runs on defaults.
 */
public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);
    public static final String FILE_NAME = "config.json";

    private final Path configFile;
    private final Gson gson;
    private volatile Configuration configuration;

    public ConfigManager(Path dataDir) {
        this.configFile = dataDir.resolve(FILE_NAME);
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        this.configuration = readOrCreate();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public Path getConfigFile() {
        return configFile;
    }

    private Configuration readOrCreate() {
        if (!Files.exists(configFile)) {
            configuration = new Configuration();
            logger.info("No config file found, writing defaults to {}", configFile);
            saveConfig();
            return configuration;
        }

        try (Reader reader = Files.newBufferedReader(configFile, StandardCharsets.UTF_8)) {
            Configuration loaded = gson.fromJson(reader, Configuration.class);
            logger.info("Configuration loaded from {}", configFile);
            // leere Datei -> null
            return loaded != null ? loaded : new Configuration();
        } catch (IOException | JsonParseException e) {
            logger.error("❌ Failed to read {}, running on defaults: {}", configFile, e.getMessage());
            return new Configuration();
        }
    }

    /**
     * Writes the current configuration. The file is replaced in one move, so a crash
     * mid-write never leaves a truncated config behind.
     */
    public synchronized void saveConfig() {
        Path tmp = configFile.resolveSibling(FILE_NAME + ".tmp");
        try {
            Files.createDirectories(configFile.getParent());
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                gson.toJson(configuration, writer);
            }
            Files.move(tmp, configFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Configuration saved.");
        } catch (IOException e) {
            logger.error("Failed to save config to {}", configFile, e);
        }
    }

    public void updateConfig(Configuration newConfig) {
        this.configuration = newConfig;
        saveConfig();
    }
}
