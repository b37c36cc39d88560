package com.trackdeck.core.playback;

import com.trackdeck.common.model.Track;
import com.trackdeck.common.util.TimeFormat;

/**
 * What the player reported about the current track.
 *
 * @param totalDuration "MM:SS"
 */
public record NowPlaying(Track track, long elapsedSeconds, String totalDuration, long volume, boolean paused) {

    public NowPlaying withElapsed(long seconds) {
        return new NowPlaying(track, seconds, totalDuration, volume, paused);
    }

    public NowPlaying withVolume(long newVolume) {
        return new NowPlaying(track, elapsedSeconds, totalDuration, newVolume, paused);
    }

    public NowPlaying withPaused(boolean newPaused) {
        return new NowPlaying(track, elapsedSeconds, totalDuration, volume, newPaused);
    }

    public String elapsed() {
        return TimeFormat.minutesSeconds(elapsedSeconds);
    }
}
