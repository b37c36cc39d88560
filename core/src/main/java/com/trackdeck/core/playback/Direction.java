package com.trackdeck.core.playback;

public enum Direction {
    NEXT,
    PREVIOUS
}
