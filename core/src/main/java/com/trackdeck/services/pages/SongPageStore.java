package com.trackdeck.services.pages;

import com.trackdeck.common.model.Track;
import com.trackdeck.services.database.NotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Transient, position-indexed list of tracks (search results, a playlist's content)
 * with fixed-size page access. Lives in memory only and is thrown away on the next
 * browse action.
 */
public class SongPageStore implements AutoCloseable {
    public static final int PAGE_SIZE = 20;

    private final NavigableMap<Integer, Track> tracks = new TreeMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int pageSize;
    private int nextPosition = 0;
    private boolean closed = false;

    public SongPageStore() {
        this(PAGE_SIZE);
    }

    public SongPageStore(int pageSize) {
        if (pageSize < 1)
            throw new IllegalArgumentException("pageSize must be >= 1");
        this.pageSize = pageSize;
    }

    public static SongPageStore of(List<Track> tracks, int pageSize) {
        SongPageStore store = new SongPageStore(pageSize);
        tracks.forEach(store::append);
        return store;
    }

    public static SongPageStore of(List<Track> tracks) {
        return of(tracks, PAGE_SIZE);
    }

    /**
     * Stores {@code track} at the next position and returns that position.
     */
    public int append(Track track) {
        lock.writeLock().lock();
        try {
            ensureOpen();
            int position = nextPosition++;
            tracks.put(position, track);
            return position;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws NotFoundException if no track sits at {@code position}
     */
    public Track getByPosition(int position) {
        lock.readLock().lock();
        try {
            ensureOpen();
            Track track = tracks.get(position);
            if (track == null)
                throw new NotFoundException("No track at position " + position);
            return track;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Tracks whose position is in {@code [offset, offset + pageSize)}, by position.
     */
    public List<Track> page(int offset) {
        lock.readLock().lock();
        try {
            ensureOpen();
            if (offset < 0)
                offset = 0;
            long end = (long) offset + pageSize;
            int toKey = (int) Math.min(end, Integer.MAX_VALUE);
            return new ArrayList<>(tracks.subMap(offset, true, toKey, false).values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int length() {
        lock.readLock().lock();
        try {
            ensureOpen();
            return tracks.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * Detached copy with the same positions.
     */
    public SongPageStore copy() {
        lock.readLock().lock();
        try {
            ensureOpen();
            SongPageStore copy = new SongPageStore(pageSize);
            copy.tracks.putAll(tracks);
            copy.nextPosition = nextPosition;
            return copy;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops all content. The store cannot be used afterwards.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            tracks.clear();
            closed = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void ensureOpen() {
        if (closed)
            throw new IllegalStateException("SongPageStore already closed");
    }
}
