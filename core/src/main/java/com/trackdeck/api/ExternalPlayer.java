package com.trackdeck.api;

/**
 * The process that actually plays audio. All calls block the caller and may fail at
 * any time (process crash, no file loaded).
 */
public interface ExternalPlayer extends AutoCloseable {

    /**
     * Replaces whatever is playing with {@code url}.
     */
    void play(String url) throws PlayerException;

    void pauseResume() throws PlayerException;

    /**
     * Relative seek, negative values go back.
     */
    void seek(long seconds) throws PlayerException;

    /**
     * Relative volume change.
     */
    void changeVolume(long delta) throws PlayerException;

    /**
     * Loop the current file ({@code true}) or let it end naturally.
     */
    void setLoop(boolean loop) throws PlayerException;

    boolean isPlaying() throws PlayerException;

    /**
     * Total duration as "MM:SS", "00:00" while unknown.
     */
    String duration();

    /**
     * Position in the current file in seconds.
     */
    long timePosition() throws PlayerException;

    long currentVolume() throws PlayerException;

    @Override
    void close();
}
