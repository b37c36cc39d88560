package com.trackdeck.core.playback;

import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.PlayerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Started once per play request. Polls the player until it reports playing
 * ({@code LOADING -> PLAYING}) or the idle budget is spent ({@code LOADING -> IDLE}),
 * then exits.
 */
public class PlayingStateConfirmer extends PollingTask {
    private static final Logger logger = LoggerFactory.getLogger(PlayingStateConfirmer.class);

    private final PlaybackController controller;
    private final ExternalPlayer player;
    private final SessionToken token;
    private final int idleBudget;
    private int idlePolls = 0;

    public PlayingStateConfirmer(PlaybackController controller, ExternalPlayer player, SessionToken token, int idleBudget) {
        super("PlayingStateConfirmer#" + token.getGeneration(), token);
        this.controller = controller;
        this.player = player;
        this.token = token;
        this.idleBudget = idleBudget;
    }

    @Override
    protected boolean poll() {
        boolean playing;
        try {
            playing = player.isPlaying();
        } catch (PlayerException e) {
            logger.debug("Player not ready yet: {}", e.getMessage());
            playing = false;
        }

        if (playing) {
            controller.confirmPlaying(token);
            return false;
        }

        idlePolls++;
        if (idlePolls >= idleBudget) {
            logger.info("⏹️ Player never started for {} after {} polls", token, idlePolls);
            controller.confirmIdle(token);
            return false;
        }
        return true;
    }

    int getIdlePolls() {
        return idlePolls;
    }
}
