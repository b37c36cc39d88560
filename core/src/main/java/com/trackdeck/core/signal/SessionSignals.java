package com.trackdeck.core.signal;

/**
 * The notifications the session publishes for the UI.
 */
public class SessionSignals {
    private static final int CAPACITY = 4;

    // true = Playlist-Modus
    private final SignalChannel<Boolean> nowPlayingChanged = new SignalChannel<>("now-playing-changed", CAPACITY);
    // Generation, in der die Playlist beendet wurde
    private final SignalChannel<Long> playlistEnded = new SignalChannel<>("playlist-ended", CAPACITY);
    // Name der Playlist
    private final SignalChannel<String> addToPlaylistCompleted = new SignalChannel<>("add-to-playlist-completed", CAPACITY);

    public SignalChannel<Boolean> nowPlayingChanged() {
        return nowPlayingChanged;
    }

    public SignalChannel<Long> playlistEnded() {
        return playlistEnded;
    }

    public SignalChannel<String> addToPlaylistCompleted() {
        return addToPlaylistCompleted;
    }
}
