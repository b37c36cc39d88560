package com.trackdeck.core.playback;

import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.PlayerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-lived watcher that detects the natural end of a track.
 * <p>
 * Debounce: a negative poll only counts after the player has been seen playing in the
 * current generation, and never while the user has paused. {@code threshold}
 * consecutive negative polls report the end of the track to the controller, which
 * advances the playlist or goes idle. A new generation resets all counters.
 */
public class EndOfTrackWatcher extends PollingTask {
    private static final Logger logger = LoggerFactory.getLogger(EndOfTrackWatcher.class);

    private final PlaybackController controller;
    private final ExternalPlayer player;
    private final int threshold;

    private long watchedGeneration = -1;
    private boolean sawPlaying = false;
    private int idleCount = 0;

    public EndOfTrackWatcher(PlaybackController controller, ExternalPlayer player, int threshold) {
        super("EndOfTrackWatcher", null);
        if (threshold < 1)
            throw new IllegalArgumentException("threshold must be >= 1");
        this.controller = controller;
        this.player = player;
        this.threshold = threshold;
    }

    @Override
    protected boolean poll() {
        SessionSnapshot session = controller.snapshot();
        if (session.generation() != watchedGeneration) {
            watchedGeneration = session.generation();
            sawPlaying = false;
            idleCount = 0;
        }

        SessionState state = session.state();
        if (state != SessionState.PLAYING && state != SessionState.LOADING)
            return true;
        if (session.isPaused()) {
            idleCount = 0;
            return true;
        }

        boolean playing;
        try {
            playing = player.isPlaying();
        } catch (PlayerException e) {
            logger.trace("isPlaying failed, no new information: {}", e.getMessage());
            return true;
        }

        if (playing) {
            sawPlaying = true;
            idleCount = 0;
            return true;
        }
        if (!sawPlaying)
            return true;

        idleCount++;
        if (idleCount >= threshold) {
            logger.debug("Track ended in generation {} after {} idle polls", watchedGeneration, idleCount);
            sawPlaying = false;
            idleCount = 0;
            controller.trackEnded(watchedGeneration);
        }
        return true;
    }

    int getIdleCount() {
        return idleCount;
    }
}
