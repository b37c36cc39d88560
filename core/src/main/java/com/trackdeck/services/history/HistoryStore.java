package com.trackdeck.services.history;

import com.trackdeck.common.model.HistoryEntry;
import com.trackdeck.common.model.Track;
import com.trackdeck.services.database.HistoryMigration;
import com.trackdeck.services.database.LibraryStore;
import com.trackdeck.services.database.RecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * HistoryStore - listening history with play counts, keyed by track id.
 * No cap on the number of entries; callers page through sorted views.
 */
public class HistoryStore {
    private static final Logger logger = LoggerFactory.getLogger(HistoryStore.class);

    public static final String STORE_NAME = "history";
    /** Keys with this prefix are bookkeeping (migration marker, backups), not entries. */
    public static final String RESERVED_PREFIX = "__";

    private static final Comparator<HistoryEntry> MOST_RECENT = Comparator
            .comparingLong(HistoryEntry::getLastPlayedAt).reversed()
            .thenComparing(e -> e.getTrack().getId());

    private static final Comparator<HistoryEntry> MOST_PLAYED = Comparator
            .comparingLong(HistoryEntry::getPlayCount).reversed()
            .thenComparing(Comparator.comparingLong(HistoryEntry::getLastPlayedAt).reversed())
            .thenComparing(e -> e.getTrack().getId());

    private final LibraryStore store;
    private final RecordCodec codec;
    private final Clock clock;

    public HistoryStore(LibraryStore store, Clock clock) {
        this.store = store;
        this.codec = new RecordCodec();
        this.clock = clock;
        migrateOnce();
        logger.debug("HistoryStore initialized with {} entries", size());
    }

    /**
     * Runs the play-count migration if it has not run yet for this store.
     */
    public int migrateOnce() {
        return HistoryMigration.migrate(store, codec, clock);
    }

    /**
     * Records one play of {@code track}: a new entry starts at play count 1, an existing
     * one is incremented and gets the current time.
     */
    public HistoryEntry recordPlay(Track track) {
        String id = track.getId();
        if (id.startsWith(RESERVED_PREFIX))
            throw new IllegalArgumentException("Track id uses reserved prefix: " + id);

        long now = clock.instant().getEpochSecond();
        String json = store.compute(id, current -> {
            HistoryEntry next = current
                    .map(raw -> codec.decode(id, raw, HistoryEntry.class).replayedAt(track, now))
                    .orElseGet(() -> new HistoryEntry(track, now, 1));
            return codec.encode(next);
        }).orElseThrow();

        HistoryEntry entry = codec.decode(id, json, HistoryEntry.class);
        logger.debug("Recorded play: {} (x{})", track.getTitle(), entry.getPlayCount());
        return entry;
    }

    /**
     * Entries by most recent play, then {@code skip(offset).take(pageSize)}.
     */
    public List<HistoryEntry> recent(int offset, int pageSize) {
        if (offset < 0 || pageSize < 0)
            throw new IllegalArgumentException("offset and pageSize must be >= 0");
        return entries()
                .sorted(MOST_RECENT)
                .skip(offset)
                .limit(pageSize)
                .collect(Collectors.toList());
    }

    public List<HistoryEntry> mostPlayed(int limit) {
        if (limit < 0)
            throw new IllegalArgumentException("limit must be >= 0");
        return entries()
                .sorted(MOST_PLAYED)
                .limit(limit)
                .collect(Collectors.toList());
    }

    public Optional<HistoryEntry> lastPlayed() {
        return entries().min(MOST_RECENT);
    }

    public Optional<HistoryEntry> find(String trackId) {
        return store.get(trackId).map(raw -> codec.decode(trackId, raw, HistoryEntry.class));
    }

    public boolean delete(String trackId) {
        if (trackId.startsWith(RESERVED_PREFIX))
            return false;
        boolean removed = store.remove(trackId).isPresent();
        if (removed)
            logger.info("Deleted history entry: {}", trackId);
        return removed;
    }

    /**
     * Removes every entry. The migration marker stays, so the upgrade never re-runs.
     */
    public int clearAll() {
        int removed = store.clearExceptPrefix(RESERVED_PREFIX);
        logger.info("History cleared ({} entries)", removed);
        return removed;
    }

    public int size() {
        return (int) entries().count();
    }

    private Stream<HistoryEntry> entries() {
        return store.scan().stream()
                .filter(e -> !e.getKey().startsWith(RESERVED_PREFIX))
                .map(e -> codec.tryDecode(e.getKey(), e.getValue(), HistoryEntry.class))
                .flatMap(Optional::stream)
                .filter(HistoryStore::isUsable);
    }

    // Gson umgeht den Track-Konstruktor, also kann die id fehlen
    private static boolean isUsable(HistoryEntry entry) {
        Track track = entry.getTrack();
        return track != null
                && track.getId() != null
                && !track.getId().isBlank()
                && entry.getPlayCount() >= 1;
    }
}
