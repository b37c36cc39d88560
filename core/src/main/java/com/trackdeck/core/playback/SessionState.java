package com.trackdeck.core.playback;

public enum SessionState {
    IDLE,
    LOADING,
    PLAYING,
    ERROR
}
