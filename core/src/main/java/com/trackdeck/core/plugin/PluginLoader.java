package com.trackdeck.core.plugin;

import com.plugins.ConsoleCommandsPlugin;
import com.trackdeck.api.SessionPlugin;
import com.trackdeck.core.Kernel;
import com.trackdeck.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Discovers {@link SessionPlugin}s and enables them in a fixed order: the built-in
 * console plugin, everything on the classpath (via {@link ServiceLoader}), then jars
 * dropped into the plugin directory. The first plugin with a given name wins.
 * Plugins seen for the first time are added to the config as enabled.
 */
public class PluginLoader {
    private static final Logger logger = LoggerFactory.getLogger(PluginLoader.class);

    private final Kernel kernel;
    private final File pluginDir;

    // Aktivierungsreihenfolge; disableAll() geht rückwärts
    private final Map<String, LoadedPlugin> active = Collections.synchronizedMap(new LinkedHashMap<>());
    private final List<URLClassLoader> jarLoaders = new CopyOnWriteArrayList<>();

    private record LoadedPlugin(SessionPlugin plugin, String origin, URLClassLoader classLoader) {
    }

    public PluginLoader(Kernel kernel, File pluginDir) {
        this.kernel = kernel;
        this.pluginDir = pluginDir;
    }

    /**
     * @return number of plugins enabled by this call
     */
    public int loadPlugins() {
        Configuration config = kernel.getConfigManager().getConfig();
        int enabled = 0;

        if (enable(new ConsoleCommandsPlugin(), "built-in", null, config))
            enabled++;

        for (SessionPlugin plugin : ServiceLoader.load(SessionPlugin.class, getClass().getClassLoader())) {
            if (enable(plugin, "classpath", null, config))
                enabled++;
        }

        for (File jar : pluginJars()) {
            try {
                enabled += loadPluginJar(jar, config);
            } catch (IOException | RuntimeException e) {
                logger.error("Failed to load plugin jar {}", jar.getName(), e);
            }
        }

        kernel.getConfigManager().saveConfig();
        logger.info("🔌 {} plugin(s) active: {}", active.size(), String.join(", ", active.keySet()));
        return enabled;
    }

    private List<File> pluginJars() {
        if (!pluginDir.exists() && !pluginDir.mkdirs())
            logger.warn("Could not create plugin directory {}", pluginDir);
        File[] jars = pluginDir.listFiles((dir, name) -> name.endsWith(".jar"));
        if (jars == null)
            return List.of();
        Arrays.sort(jars, Comparator.comparing(File::getName));
        return Arrays.asList(jars);
    }

    /**
     * Enables every plugin in {@code jar}. The jar's class loader stays open while one of
     * its plugins is active.
     *
     * @return number of plugins enabled from the jar
     */
    public int loadPluginJar(File jar, Configuration config) throws IOException {
        URLClassLoader loader = new URLClassLoader(new URL[] { toUrl(jar) }, getClass().getClassLoader());
        int enabled = 0;
        for (SessionPlugin plugin : ServiceLoader.load(SessionPlugin.class, loader)) {
            if (enable(plugin, jar.getName(), loader, config))
                enabled++;
        }
        if (enabled == 0)
            loader.close();
        else
            jarLoaders.add(loader);
        return enabled;
    }

    private static URL toUrl(File jar) throws MalformedURLException {
        return jar.toURI().toURL();
    }

    private boolean enable(SessionPlugin plugin, String origin, URLClassLoader loader, Configuration config) {
        String name = plugin.getName();
        if (active.containsKey(name)) {
            logger.debug("Plugin {} from {} already active, skipping", name, origin);
            return false;
        }

        Boolean flag = config.plugins.get(name);
        if (flag == null) {
            logger.info("✨ New plugin discovered: {} ({})", name, origin);
            config.plugins.put(name, true);
        } else if (!flag) {
            logger.info("Plugin {} is disabled in config.", name);
            return false;
        }

        try {
            logger.info("Loading plugin: {} v{} ({})", name, plugin.getVersion(), origin);
            plugin.onEnable(kernel);
        } catch (RuntimeException e) {
            logger.error("Failed to enable plugin {}", name, e);
            return false;
        }
        active.put(name, new LoadedPlugin(plugin, origin, loader));
        return true;
    }

    public void unloadPlugin(String name) {
        LoadedPlugin loaded = active.remove(name);
        if (loaded == null) {
            logger.warn("Cannot unload unknown plugin: {}", name);
            return;
        }

        logger.info("🔌 Disabling plugin: {}", name);
        try {
            loaded.plugin().onDisable();
        } catch (RuntimeException e) {
            logger.error("Error during onDisable of {}", name, e);
        }

        URLClassLoader loader = loaded.classLoader();
        if (loader != null && active.values().stream().noneMatch(p -> p.classLoader() == loader)) {
            jarLoaders.remove(loader);
            try {
                loader.close();
            } catch (IOException e) {
                logger.warn("Failed to close class loader of {}: {}", name, e.getMessage());
            }
        }
    }

    /**
     * Disables all plugins, most recently enabled first.
     */
    public void disableAll() {
        List<String> names;
        synchronized (active) {
            names = new ArrayList<>(active.keySet());
        }
        Collections.reverse(names);
        names.forEach(this::unloadPlugin);
    }

    public Collection<SessionPlugin> getPlugins() {
        synchronized (active) {
            return active.values().stream().map(LoadedPlugin::plugin).toList();
        }
    }

    public boolean isActive(String name) {
        return active.containsKey(name);
    }
}
