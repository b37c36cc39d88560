package com.plugins.mpv.internal;

import com.google.gson.JsonElement;
import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.PlayerException;
import com.trackdeck.common.util.TimeFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@link ExternalPlayer} backed by an {@code mpv --idle} process. The process is started
 * on the first command and restarted if it died.
 */
public class MpvPlayer implements ExternalPlayer {
    private static final Logger logger = LoggerFactory.getLogger(MpvPlayer.class);
    private static final long STARTUP_TIMEOUT_MS = 5000;

    private final String mpvPath;
    private final Path socketPath;
    private final MpvIpcClient client;
    private final boolean managedProcess;
    private Process process;

    public MpvPlayer(String mpvPath, Path socketPath) {
        this.mpvPath = mpvPath;
        this.socketPath = socketPath;
        this.client = new MpvIpcClient(socketPath);
        this.managedProcess = true;
    }

    // Für Tests: mit einem schon laufenden mpv (oder Fake) verbinden
    MpvPlayer(MpvIpcClient client) {
        this.mpvPath = null;
        this.socketPath = null;
        this.client = client;
        this.managedProcess = false;
    }

    @Override
    public void play(String url) throws PlayerException {
        ipc().command("loadfile", url, "replace");
    }

    @Override
    public void pauseResume() throws PlayerException {
        ipc().command("cycle", "pause");
    }

    @Override
    public void seek(long seconds) throws PlayerException {
        ipc().command("seek", seconds, "relative");
    }

    @Override
    public void changeVolume(long delta) throws PlayerException {
        ipc().command("add", "volume", delta);
    }

    @Override
    public void setLoop(boolean loop) throws PlayerException {
        ipc().command("set_property", "loop-file", loop ? "inf" : "no");
    }

    /**
     * mpv's {@code core-idle} is also true while paused.
     */
    @Override
    public boolean isPlaying() throws PlayerException {
        JsonElement idle = ipc().command("get_property", "core-idle");
        if (!idle.isJsonPrimitive() || !idle.getAsJsonPrimitive().isBoolean())
            throw new PlayerException("Unexpected core-idle value: " + idle);
        return !idle.getAsBoolean();
    }

    @Override
    public String duration() {
        try {
            return TimeFormat.minutesSeconds(longProperty("duration"));
        } catch (PlayerException e) {
            logger.debug("Duration unknown: {}", e.getMessage());
            return TimeFormat.UNKNOWN;
        }
    }

    @Override
    public long timePosition() throws PlayerException {
        return longProperty("time-pos");
    }

    @Override
    public long currentVolume() throws PlayerException {
        return longProperty("volume");
    }

    private long longProperty(String name) throws PlayerException {
        JsonElement value = ipc().command("get_property", name);
        if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber())
            throw new PlayerException("Property " + name + " unavailable");
        return (long) value.getAsDouble();
    }

    private synchronized MpvIpcClient ipc() throws PlayerException {
        if (managedProcess && (process == null || !process.isAlive()))
            startProcess();
        return client;
    }

    private void startProcess() throws PlayerException {
        client.close();
        try {
            Files.deleteIfExists(socketPath);
            ProcessBuilder pb = new ProcessBuilder(
                    mpvPath,
                    "--idle=yes",
                    "--no-video",
                    "--no-terminal",
                    "--input-ipc-server=" + socketPath);
            pb.redirectErrorStream(true);
            pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
            process = pb.start();
            logger.info("🎶 mpv started (pid {}), IPC at {}", process.pid(), socketPath);
        } catch (IOException e) {
            throw new PlayerException("Cannot start mpv (" + mpvPath + "): " + e.getMessage(), e);
        }

        long deadline = System.currentTimeMillis() + STARTUP_TIMEOUT_MS;
        while (!Files.exists(socketPath)) {
            if (!process.isAlive())
                throw new PlayerException("mpv exited with code " + process.exitValue());
            if (System.currentTimeMillis() > deadline)
                throw new PlayerException("mpv did not open its IPC socket within " + STARTUP_TIMEOUT_MS + " ms");
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PlayerException("Interrupted while waiting for mpv", e);
            }
        }
    }

    @Override
    public synchronized void close() {
        if (client.isConnected()) {
            try {
                client.command("quit");
            } catch (PlayerException e) {
                logger.debug("mpv quit failed: {}", e.getMessage());
            }
        }
        client.close();

        if (managedProcess && process != null) {
            process.destroy();
            process = null;
            try {
                Files.deleteIfExists(socketPath);
            } catch (IOException e) {
                logger.warn("Could not delete mpv socket {}: {}", socketPath, e.getMessage());
            }
        }
    }
}
