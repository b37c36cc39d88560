package com.trackdeck.services.playlist;

import com.trackdeck.common.model.PlaylistEntry;

import java.util.List;

/**
 * Header record of a user playlist. The tracks live under their own keys (see
 * {@link PlaylistStore}); the header only holds {@code nextIndex}, the next free slot.
 * Slot indices only ever grow.
 */
public class UserPlaylist {
    public static final int SCHEMA_VERSION = 2;

    private int schemaVersion = SCHEMA_VERSION;
    private String name;
    private long nextIndex;
    // nur in Version 1, dort lagen alle Einträge im Header
    private List<PlaylistEntry> entries;

    // Gson
    UserPlaylist() {
    }

    public UserPlaylist(String name) {
        this.name = name;
        this.nextIndex = 0;
    }

    /**
     * Hands out the next slot index.
     */
    long claimIndex() {
        return nextIndex++;
    }

    /**
     * Entries embedded by the first record format; empty for current headers.
     */
    List<PlaylistEntry> legacyEntries() {
        return entries != null ? entries : List.of();
    }

    void upgraded() {
        for (PlaylistEntry entry : legacyEntries())
            nextIndex = Math.max(nextIndex, entry.index() + 1);
        entries = null;
        schemaVersion = SCHEMA_VERSION;
    }

    public String getName() {
        return name;
    }

    public long getNextIndex() {
        return nextIndex;
    }

    public int getSchemaVersion() {
        return schemaVersion;
    }
}
