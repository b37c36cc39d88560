package com.trackdeck.test;

import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.PlayerException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted stand-in for the external player. {@code isPlaying()} answers from the
 * queued script first, then from the current {@code playing} flag.
 */
public class FakePlayer implements ExternalPlayer {
    private final List<String> playedUrls = new CopyOnWriteArrayList<>();
    private final List<Boolean> loopCalls = new CopyOnWriteArrayList<>();
    private final Deque<Boolean> script = new ArrayDeque<>();
    private final AtomicInteger isPlayingCalls = new AtomicInteger();

    private volatile boolean playing = false;
    private volatile boolean failPlay = false;
    private volatile boolean failQueries = false;
    private volatile boolean closed = false;
    private volatile long position = 0;
    private volatile long volume = 50;
    private volatile String duration = "03:05";

    @Override
    public void play(String url) throws PlayerException {
        if (failPlay)
            throw new PlayerException("scripted play failure");
        playedUrls.add(url);
        position = 0;
    }

    @Override
    public void pauseResume() {
        playing = !playing;
    }

    @Override
    public void seek(long seconds) {
        position = Math.max(0, position + seconds);
    }

    @Override
    public void changeVolume(long delta) {
        volume = Math.max(0, Math.min(130, volume + delta));
    }

    @Override
    public void setLoop(boolean loop) {
        loopCalls.add(loop);
    }

    @Override
    public boolean isPlaying() throws PlayerException {
        isPlayingCalls.incrementAndGet();
        if (failQueries)
            throw new PlayerException("scripted query failure");
        synchronized (script) {
            Boolean next = script.pollFirst();
            if (next != null)
                return next;
        }
        return playing;
    }

    @Override
    public String duration() {
        return duration;
    }

    @Override
    public long timePosition() throws PlayerException {
        if (failQueries)
            throw new PlayerException("scripted query failure");
        return position;
    }

    @Override
    public long currentVolume() throws PlayerException {
        if (failQueries)
            throw new PlayerException("scripted query failure");
        return volume;
    }

    @Override
    public void close() {
        closed = true;
    }

    // --- scripting ---

    public void setPlaying(boolean playing) {
        this.playing = playing;
    }

    public void queueIsPlaying(Boolean... answers) {
        synchronized (script) {
            script.addAll(List.of(answers));
        }
    }

    public void setFailPlay(boolean failPlay) {
        this.failPlay = failPlay;
    }

    public void setFailQueries(boolean failQueries) {
        this.failQueries = failQueries;
    }

    public void setPosition(long position) {
        this.position = position;
    }

    public void setDuration(String duration) {
        this.duration = duration;
    }

    public List<String> getPlayedUrls() {
        return playedUrls;
    }

    public String lastPlayedUrl() {
        return playedUrls.isEmpty() ? null : playedUrls.get(playedUrls.size() - 1);
    }

    public List<Boolean> getLoopCalls() {
        return loopCalls;
    }

    public int getIsPlayingCalls() {
        return isPlayingCalls.get();
    }

    public boolean isClosed() {
        return closed;
    }
}
