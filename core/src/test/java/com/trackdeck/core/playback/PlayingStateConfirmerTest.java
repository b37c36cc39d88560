package com.trackdeck.core.playback;

import com.trackdeck.api.PlayerException;
import com.trackdeck.core.config.Configuration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.trackdeck.test.Tracks.track;
import static org.junit.jupiter.api.Assertions.*;

class PlayingStateConfirmerTest extends PlaybackTestBase {

    @BeforeEach
    void loading() throws PlayerException {
        // Der eingeplante Confirmer läuft im Test nie an
        Configuration config = fastConfig();
        config.confirmInitialDelayMillis = 60_000;
        newController(config);
        controller.playTrack(track("a"), false);
    }

    @Test
    void testConfirmsOnceThePlayerPlays() {
        PlayingStateConfirmer confirmer = new PlayingStateConfirmer(controller, player, controller.currentToken(), 5);
        player.queueIsPlaying(false, false, true);

        confirmer.run();
        confirmer.run();
        assertEquals(SessionState.LOADING, controller.snapshot().state());

        confirmer.run();
        assertEquals(SessionState.PLAYING, controller.snapshot().state());
        assertTrue(confirmer.isFinished());
        assertEquals("a", controller.snapshot().nowPlaying().track().getId());
    }

    @Test
    void testGivesUpAfterBudget() {
        PlayingStateConfirmer confirmer = new PlayingStateConfirmer(controller, player, controller.currentToken(), 3);

        for (int i = 0; i < 5; i++)
            confirmer.run();

        assertEquals(3, confirmer.getIdlePolls());
        assertTrue(confirmer.isFinished());
        assertEquals(SessionState.IDLE, controller.snapshot().state());
    }

    @Test
    void testQueryFailureCountsAsIdle() {
        PlayingStateConfirmer confirmer = new PlayingStateConfirmer(controller, player, controller.currentToken(), 2);
        player.setFailQueries(true);

        confirmer.run();
        confirmer.run();

        assertTrue(confirmer.isFinished());
        assertEquals(SessionState.IDLE, controller.snapshot().state());
    }

    @Test
    void testSupersededConfirmerRetires() throws PlayerException {
        PlayingStateConfirmer stale = new PlayingStateConfirmer(controller, player, controller.currentToken(), 5);
        controller.playTrack(track("b"), false);
        player.setPlaying(true);
        int calls = player.getIsPlayingCalls();

        stale.run();

        assertTrue(stale.isFinished());
        assertEquals(calls, player.getIsPlayingCalls(), "a retired confirmer does not query the player");
        assertEquals(SessionState.LOADING, controller.snapshot().state());
    }
}
