package com.trackdeck.core.playback;

import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.PlayerException;
import com.trackdeck.services.profile.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Adds one tick of listening time to the profile whenever the player reports playing.
 */
public class ListeningTimeTracker extends PollingTask {
    private static final Logger logger = LoggerFactory.getLogger(ListeningTimeTracker.class);

    private final ExternalPlayer player;
    private final ProfileStore profile;
    private final long millisPerTick;

    public ListeningTimeTracker(ExternalPlayer player, ProfileStore profile, long millisPerTick) {
        super("ListeningTimeTracker", null);
        this.player = player;
        this.profile = profile;
        this.millisPerTick = millisPerTick;
    }

    @Override
    protected boolean poll() {
        boolean playing;
        try {
            playing = player.isPlaying();
        } catch (PlayerException e) {
            logger.trace("isPlaying failed: {}", e.getMessage());
            return true;
        }
        if (playing)
            profile.addListeningTime(millisPerTick);
        return true;
    }
}
