package com.trackdeck.core.playback;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A fixed-cadence poll against the external player. Subclasses implement
 * {@link #poll()}; returning {@code false} retires the task. A task bound to a
 * {@link SessionToken} also retires once that token is cancelled.
 * <p>
 * Exceptions from a tick are logged and the task keeps running, so one failed poll
 * never kills the scheduler thread.
 */
public abstract class PollingTask implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(PollingTask.class);

    private final String name;
    private final SessionToken token;
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> future;

    protected PollingTask(String name, SessionToken token) {
        this.name = name;
        this.token = token;
    }

    /**
     * One tick.
     *
     * @return whether the task wants to keep running
     */
    protected abstract boolean poll();

    @Override
    public final void run() {
        if (finished.get())
            return;
        if (token != null && token.isCancelled()) {
            logger.debug("{} retired, {} superseded", name, token);
            retire();
            return;
        }
        try {
            if (!poll())
                retire();
        } catch (RuntimeException e) {
            logger.warn("{} tick failed: {}", name, e.getMessage(), e);
        }
    }

    void attach(ScheduledFuture<?> future) {
        this.future = future;
        if (finished.get())
            future.cancel(false);
    }

    public void retire() {
        finished.set(true);
        ScheduledFuture<?> f = future;
        if (f != null)
            f.cancel(false);
    }

    public boolean isFinished() {
        return finished.get();
    }

    public String getName() {
        return name;
    }
}
