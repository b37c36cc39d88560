package com.trackdeck.core.playback;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle for one play request. Cancelled as soon as the next request arrives; tasks
 * bound to it retire on their next tick and their results are dropped.
 */
public final class SessionToken {
    private final long generation;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    SessionToken(long generation) {
        this.generation = generation;
    }

    public long getGeneration() {
        return generation;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    void cancel() {
        cancelled.set(true);
    }

    @Override
    public String toString() {
        return "SessionToken#" + generation + (isCancelled() ? " (cancelled)" : "");
    }
}
