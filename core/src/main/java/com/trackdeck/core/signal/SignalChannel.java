package com.trackdeck.core.signal;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Small bounded channel between background work and the UI. Publishing never blocks:
 * when the channel is full the oldest value is dropped. Receivers poll without
 * blocking, usually once per render/input cycle.
 */
public class SignalChannel<T> {
    private final String name;
    private final int capacity;
    private final Deque<T> values;

    public SignalChannel(String name, int capacity) {
        if (capacity < 1)
            throw new IllegalArgumentException("capacity must be >= 1");
        this.name = name;
        this.capacity = capacity;
        this.values = new ArrayDeque<>(capacity);
    }

    /**
     * @return whether an older value had to be dropped
     */
    public synchronized boolean publish(T value) {
        if (value == null)
            throw new IllegalArgumentException("Signal '" + name + "' does not carry null");
        boolean dropped = false;
        if (values.size() >= capacity) {
            values.pollFirst();
            dropped = true;
        }
        values.offerLast(value);
        return dropped;
    }

    public synchronized Optional<T> tryReceive() {
        return Optional.ofNullable(values.pollFirst());
    }

    /**
     * Takes everything currently queued, oldest first.
     */
    public synchronized List<T> drain() {
        List<T> all = new ArrayList<>(values);
        values.clear();
        return all;
    }

    public synchronized boolean isEmpty() {
        return values.isEmpty();
    }

    public String getName() {
        return name;
    }
}
