package com.trackdeck.common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Finds the external tools the plugins drive (mpv, yt-dlp): an explicitly configured
 * path, a copy under {@code tools/}, or the command on the system PATH.
 */
public final class ExecutableLocator {
    private static final Logger logger = LoggerFactory.getLogger(ExecutableLocator.class);
    private static final long PROBE_TIMEOUT_SECONDS = 10;

    private ExecutableLocator() {
    }

    /**
     * @param configured path from the plugin settings, may be empty
     * @param command    command name as found on the PATH, e.g. {@code "mpv"}
     * @param toolsDir   directory searched for {@code command} / {@code command.exe}
     * @return what to pass to {@link ProcessBuilder}
     */
    public static Optional<String> locate(String configured, String command, File toolsDir) {
        if (configured != null && !configured.isBlank()) {
            if (new File(configured).canExecute())
                return Optional.of(configured);
            logger.warn("⚠️ Configured {} path is not executable: {}", command, configured);
        }

        for (String candidate : new String[] { command, command + ".exe" }) {
            File local = new File(toolsDir, candidate);
            if (local.canExecute()) {
                logger.info("Found {} at: {}", command, local.getAbsolutePath());
                return Optional.of(local.getAbsolutePath());
            }
        }

        if (answersVersion(command)) {
            logger.info("Found {} in system PATH", command);
            return Optional.of(command);
        }
        return Optional.empty();
    }

    private static boolean answersVersion(String command) {
        Process process;
        try {
            process = new ProcessBuilder(command, "--version")
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            logger.debug("{} not in PATH: {}", command, e.getMessage());
            return false;
        }
        try {
            if (!process.waitFor(PROBE_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return false;
        }
    }
}
