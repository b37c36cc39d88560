package com.trackdeck.core.playback;

import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.PlayerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies the player's position into {@link NowPlaying} while a track is playing.
 */
public class TimeObserver extends PollingTask {
    private static final Logger logger = LoggerFactory.getLogger(TimeObserver.class);

    private final PlaybackController controller;
    private final ExternalPlayer player;

    public TimeObserver(PlaybackController controller, ExternalPlayer player) {
        super("TimeObserver", null);
        this.controller = controller;
        this.player = player;
    }

    @Override
    protected boolean poll() {
        SessionSnapshot session = controller.snapshot();
        if (session.state() != SessionState.PLAYING)
            return true;
        try {
            controller.updateElapsed(session.generation(), player.timePosition());
        } catch (PlayerException e) {
            // Player noch nicht bereit, nächster Tick
            logger.trace("time-pos unavailable: {}", e.getMessage());
        }
        return true;
    }
}
