package com.plugins.mpv.internal;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.trackdeck.api.PlayerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Line based JSON IPC with mpv over its {@code --input-ipc-server} Unix socket.
 * One request at a time; asynchronous events between request and reply are skipped.
 * A reader thread per connection feeds incoming lines into a queue, so a reply that
 * does not arrive in time fails the request instead of blocking the caller.
 */
public class MpvIpcClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MpvIpcClient.class);
    // URLs unverändert senden, ohne HTML-Escaping
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
    public static final Duration DEFAULT_REPLY_TIMEOUT = Duration.ofSeconds(5);

    private final Path socketPath;
    private final Duration replyTimeout;
    private final AtomicLong requestIds = new AtomicLong();

    private SocketChannel channel;
    // leeres Optional = Verbindung zu
    private BlockingQueue<Optional<String>> lines;
    private Writer writer;

    public MpvIpcClient(Path socketPath) {
        this(socketPath, DEFAULT_REPLY_TIMEOUT);
    }

    public MpvIpcClient(Path socketPath, Duration replyTimeout) {
        this.socketPath = socketPath;
        this.replyTimeout = replyTimeout;
    }

    /**
     * Sends {@code args} as one mpv command and waits for its reply.
     *
     * @return the reply's {@code data}, {@link JsonNull} if there is none
     * @throws PlayerException if the socket fails, mpv reports an error or no reply
     *                         arrives within the reply timeout
     */
    public synchronized JsonElement command(Object... args) throws PlayerException {
        connect();
        long id = requestIds.incrementAndGet();
        long deadline = System.nanoTime() + replyTimeout.toNanos();
        try {
            writer.write(encodeCommand(id, args));
            writer.write('\n');
            writer.flush();

            while (true) {
                Optional<String> line = lines.poll(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
                if (line == null) {
                    disconnect();
                    throw new PlayerException("mpv did not answer " + (args.length > 0 ? args[0] : "?")
                            + " within " + replyTimeout.toMillis() + " ms");
                }
                if (line.isEmpty()) {
                    disconnect();
                    throw new PlayerException("mpv closed the IPC connection");
                }
                Optional<JsonObject> reply = parseReply(line.get(), id);
                if (reply.isPresent())
                    return unwrap(reply.get(), args);
            }
        } catch (IOException e) {
            disconnect();
            throw new PlayerException("mpv IPC failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            disconnect();
            throw new PlayerException("Interrupted while waiting for mpv", e);
        }
    }

    static String encodeCommand(long requestId, Object... args) {
        JsonArray command = new JsonArray();
        for (Object arg : args) {
            if (arg instanceof Number)
                command.add((Number) arg);
            else if (arg instanceof Boolean)
                command.add((Boolean) arg);
            else
                command.add(String.valueOf(arg));
        }
        JsonObject root = new JsonObject();
        root.add("command", command);
        root.addProperty("request_id", requestId);
        return gson.toJson(root);
    }

    /**
     * @return the reply object if {@code line} answers {@code requestId}; empty for
     * events, replies to other requests and garbage
     */
    static Optional<JsonObject> parseReply(String line, long requestId) {
        JsonElement parsed;
        try {
            parsed = JsonParser.parseString(line);
        } catch (JsonParseException e) {
            logger.debug("Ignoring unparseable mpv line: {}", line);
            return Optional.empty();
        }
        if (!parsed.isJsonObject())
            return Optional.empty();
        JsonObject obj = parsed.getAsJsonObject();
        if (obj.has("event") || !obj.has("request_id"))
            return Optional.empty();
        JsonElement id = obj.get("request_id");
        if (!id.isJsonPrimitive() || !id.getAsJsonPrimitive().isNumber() || id.getAsLong() != requestId)
            return Optional.empty();
        return Optional.of(obj);
    }

    private static JsonElement unwrap(JsonObject reply, Object[] args) throws PlayerException {
        String error = reply.has("error") ? reply.get("error").getAsString() : "success";
        if (!"success".equals(error))
            throw new PlayerException("mpv: " + error + " (" + (args.length > 0 ? args[0] : "?") + ")");
        JsonElement data = reply.get("data");
        return data != null ? data : JsonNull.INSTANCE;
    }

    private void connect() throws PlayerException {
        if (channel != null && channel.isOpen())
            return;
        try {
            channel = SocketChannel.open(UnixDomainSocketAddress.of(socketPath));
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(Channels.newInputStream(channel), StandardCharsets.UTF_8));
            writer = new OutputStreamWriter(Channels.newOutputStream(channel), StandardCharsets.UTF_8);
            lines = new LinkedBlockingQueue<>();

            BlockingQueue<Optional<String>> sink = lines;
            Thread pump = new Thread(() -> pump(reader, sink), "mpv-ipc-reader");
            pump.setDaemon(true);
            pump.start();
            logger.debug("Connected to mpv at {}", socketPath);
        } catch (IOException e) {
            disconnect();
            throw new PlayerException("Cannot connect to mpv at " + socketPath + ": " + e.getMessage(), e);
        }
    }

    private static void pump(BufferedReader reader, BlockingQueue<Optional<String>> sink) {
        try {
            String line;
            while ((line = reader.readLine()) != null)
                sink.add(Optional.of(line));
        } catch (IOException e) {
            logger.debug("mpv IPC read ended: {}", e.getMessage());
        } finally {
            sink.add(Optional.empty());
        }
    }

    public synchronized boolean isConnected() {
        return channel != null && channel.isOpen();
    }

    private void disconnect() {
        if (channel != null) {
            try {
                channel.close();
            } catch (IOException e) {
                logger.debug("Closing mpv socket failed: {}", e.getMessage());
            }
        }
        channel = null;
        lines = null;
        writer = null;
    }

    @Override
    public synchronized void close() {
        disconnect();
    }
}
