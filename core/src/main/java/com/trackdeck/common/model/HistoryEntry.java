package com.trackdeck.common.model;

/**
 * One row of the listening history. Stored under the track id.
 */
public class HistoryEntry {
    public static final int SCHEMA_VERSION = 2;

    private int schemaVersion = SCHEMA_VERSION;
    private Track track;
    private long lastPlayedAt;
    private long playCount;

    // Gson
    HistoryEntry() {
    }

    public HistoryEntry(Track track, long lastPlayedAt, long playCount) {
        if (playCount < 1)
            throw new IllegalArgumentException("playCount must be >= 1");
        this.track = track;
        this.lastPlayedAt = lastPlayedAt;
        this.playCount = playCount;
    }

    /**
     * Returns the entry after one more play at {@code now}, carrying the latest metadata.
     */
    public HistoryEntry replayedAt(Track latest, long now) {
        return new HistoryEntry(latest != null ? latest : track, now, playCount + 1);
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }

    public Track getTrack() {
        return track;
    }

    public long getLastPlayedAt() {
        return lastPlayedAt;
    }

    public long getPlayCount() {
        return playCount;
    }

    @Override
    public String toString() {
        return String.format("%s (x%d, last %d)", track, playCount, lastPlayedAt);
    }
}
