package com.trackdeck.core.playback;

import com.trackdeck.common.model.Track;

import java.util.Optional;

/**
 * Immutable, consistent view of the playback session at one point in time.
 *
 * @param playlistIndex  position in the active playlist, -1 outside playlist mode
 * @param playlistLength length of the active playlist, 0 outside playlist mode
 * @param generation     number of the session token the state belongs to
 */
public record SessionSnapshot(
        SessionState state,
        Track currentTrack,
        boolean playlistMode,
        int playlistIndex,
        int playlistLength,
        NowPlaying nowPlaying,
        long generation,
        String lastError) {

    public Optional<Track> track() {
        return Optional.ofNullable(currentTrack);
    }

    public Optional<NowPlaying> playing() {
        return Optional.ofNullable(nowPlaying);
    }

    public Optional<String> error() {
        return Optional.ofNullable(lastError);
    }

    public boolean isPaused() {
        return nowPlaying != null && nowPlaying.paused();
    }
}
