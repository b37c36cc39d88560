package com.trackdeck.core.signal;

import com.trackdeck.test.TestBase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SignalChannelTest extends TestBase {

    @Test
    void testFifoDelivery() {
        SignalChannel<String> channel = new SignalChannel<>("test", 4);
        channel.publish("a");
        channel.publish("b");

        assertEquals(Optional.of("a"), channel.tryReceive());
        assertEquals(Optional.of("b"), channel.tryReceive());
        assertEquals(Optional.empty(), channel.tryReceive(), "receiving never blocks");
    }

    @Test
    void testFullChannelDropsOldest() {
        SignalChannel<Integer> channel = new SignalChannel<>("test", 2);
        assertFalse(channel.publish(1));
        assertFalse(channel.publish(2));
        assertTrue(channel.publish(3), "publishing into a full channel drops a value");

        assertEquals(List.of(2, 3), channel.drain());
        assertTrue(channel.isEmpty());
    }

    @Test
    void testNullRejected() {
        SignalChannel<String> channel = new SignalChannel<>("test", 1);
        assertThrows(IllegalArgumentException.class, () -> channel.publish(null));
    }

    @Test
    void testSessionSignalsAreSeparate() {
        SessionSignals signals = new SessionSignals();
        signals.playlistEnded().publish(7L);

        assertTrue(signals.nowPlayingChanged().isEmpty());
        assertTrue(signals.addToPlaylistCompleted().isEmpty());
        assertEquals(Optional.of(7L), signals.playlistEnded().tryReceive());
    }
}
