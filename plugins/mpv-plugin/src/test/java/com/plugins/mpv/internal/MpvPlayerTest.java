package com.plugins.mpv.internal;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.trackdeck.api.PlayerException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.Channels;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the player against a tiny fake mpv that answers on a Unix socket.
 */
class MpvPlayerTest {

    @TempDir
    Path tempDir;

    private Path socket;
    private FakeMpv mpv;
    private MpvPlayer player;

    @BeforeEach
    void setUp() throws IOException {
        socket = tempDir.resolve("mpv.sock");
        mpv = new FakeMpv(socket);
        mpv.start();
        player = new MpvPlayer(new MpvIpcClient(socket));
    }

    @AfterEach
    void tearDown() throws IOException {
        player.close();
        mpv.stop();
    }

    @Test
    void testCommandsMapToMpv() throws PlayerException {
        player.play("https://youtube.com/watch?v=abc");
        player.setLoop(true);
        player.setLoop(false);
        player.seek(-10);
        player.changeVolume(5);
        player.pauseResume();

        assertEquals(List.of(
                "[\"loadfile\",\"https://youtube.com/watch?v=abc\",\"replace\"]",
                "[\"set_property\",\"loop-file\",\"inf\"]",
                "[\"set_property\",\"loop-file\",\"no\"]",
                "[\"seek\",-10,\"relative\"]",
                "[\"add\",\"volume\",5]",
                "[\"cycle\",\"pause\"]"), mpv.commands);
    }

    @Test
    void testIsPlayingFollowsCoreIdle() throws PlayerException {
        mpv.properties.put("core-idle", new JsonPrimitive(true));
        assertFalse(player.isPlaying());

        mpv.properties.put("core-idle", new JsonPrimitive(false));
        assertTrue(player.isPlaying());
    }

    @Test
    void testDurationFormatting() {
        mpv.properties.put("duration", new JsonPrimitive(185.4));
        assertEquals("03:05", player.duration());

        mpv.properties.remove("duration");
        assertEquals("00:00", player.duration(), "unknown duration while loading");
    }

    @Test
    void testNumericProperties() throws PlayerException {
        mpv.properties.put("time-pos", new JsonPrimitive(42.9));
        mpv.properties.put("volume", new JsonPrimitive(70.0));

        assertEquals(42, player.timePosition());
        assertEquals(70, player.currentVolume());
    }

    @Test
    void testErrorReplyBecomesException() {
        PlayerException e = assertThrows(PlayerException.class, player::timePosition);
        assertTrue(e.getMessage().contains("property unavailable"), e.getMessage());
    }

    @Test
    void testEventsBetweenRequestAndReplyAreSkipped() throws PlayerException {
        mpv.sendEventBeforeReply = true;
        mpv.properties.put("core-idle", new JsonPrimitive(false));
        assertTrue(player.isPlaying());
    }

    @Test
    void testHungMpvFailsTheRequest() {
        mpv.silent = true;
        MpvIpcClient client = new MpvIpcClient(socket, Duration.ofMillis(300));
        try {
            long start = System.nanoTime();
            PlayerException e = assertThrows(PlayerException.class, () -> client.command("get_property", "core-idle"));

            assertTrue(e.getMessage().contains("did not answer"), e.getMessage());
            assertTrue(System.nanoTime() - start < Duration.ofSeconds(5).toNanos(), "request gave up at its deadline");
            assertFalse(client.isConnected(), "a connection without replies is dropped");
        } finally {
            client.close();
        }
    }

    @Test
    void testCloseSendsQuit() throws PlayerException {
        player.pauseResume();
        player.close();
        assertEquals("[\"quit\"]", mpv.commands.get(mpv.commands.size() - 1));
    }

    /**
     * Single-connection stand-in for mpv's JSON IPC.
     */
    static class FakeMpv {
        final Map<String, JsonElement> properties = new ConcurrentHashMap<>();
        final List<String> commands = new CopyOnWriteArrayList<>();
        volatile boolean sendEventBeforeReply = false;
        volatile boolean silent = false;

        private final ServerSocketChannel server;
        private Thread thread;

        FakeMpv(Path socket) throws IOException {
            server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
            server.bind(UnixDomainSocketAddress.of(socket));
        }

        void start() {
            thread = new Thread(this::serve, "fake-mpv");
            thread.setDaemon(true);
            thread.start();
        }

        void stop() throws IOException {
            server.close();
            thread.interrupt();
        }

        private void serve() {
            try (SocketChannel client = server.accept();
                 BufferedReader in = new BufferedReader(new InputStreamReader(Channels.newInputStream(client), StandardCharsets.UTF_8));
                 Writer out = new OutputStreamWriter(Channels.newOutputStream(client), StandardCharsets.UTF_8)) {
                String line;
                while ((line = in.readLine()) != null) {
                    JsonObject request = JsonParser.parseString(line).getAsJsonObject();
                    JsonArray command = request.getAsJsonArray("command");
                    commands.add(command.toString());
                    if (silent)
                        continue;

                    if (sendEventBeforeReply)
                        out.write("{\"event\":\"playback-restart\"}\n");
                    out.write(answer(command, request.get("request_id").getAsLong()).toString());
                    out.write('\n');
                    out.flush();
                }
            } catch (IOException e) {
                // Server wurde im Teardown geschlossen
            }
        }

        private JsonObject answer(JsonArray command, long requestId) {
            JsonObject reply = new JsonObject();
            reply.addProperty("request_id", requestId);
            if ("get_property".equals(command.get(0).getAsString())) {
                JsonElement value = properties.get(command.get(1).getAsString());
                if (value == null) {
                    reply.addProperty("error", "property unavailable");
                    return reply;
                }
                reply.add("data", value);
            }
            reply.addProperty("error", "success");
            return reply;
        }
    }
}
