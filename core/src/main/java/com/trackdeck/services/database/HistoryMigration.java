package com.trackdeck.services.database;

import com.google.gson.annotations.SerializedName;
import com.trackdeck.common.model.HistoryEntry;
import com.trackdeck.common.model.Track;
import com.trackdeck.services.history.HistoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * One-time migration of legacy history records (no play count) into the current
 * {@link HistoryEntry} shape. Guarded by a marker key, so it is safe to run on every
 * startup. All entries are copied to backup keys before anything is rewritten.
 */
public class HistoryMigration {
    private static final Logger logger = LoggerFactory.getLogger(HistoryMigration.class);

    public static final String MARKER_KEY = HistoryStore.RESERVED_PREFIX + "migration:play_count";
    public static final String BACKUP_PREFIX = HistoryStore.RESERVED_PREFIX + "backup:";

    /**
     * Shape written by the first history format.
     */
    static class LegacyRecord {
        @SerializedName("song_name")
        String songName;
        @SerializedName("song_id")
        String songId;
        @SerializedName("artist_name")
        List<String> artistName;
        @SerializedName("time_stamp")
        long timeStamp;
    }

    private record Marker(int schemaVersion, long migratedAt, int rewritten) {
    }

    /**
     * Runs the migration unless the marker key is present.
     *
     * @return number of rewritten records, 0 when the marker short-circuits
     */
    public static int migrate(LibraryStore store, RecordCodec codec, Clock clock) {
        if (store.containsKey(MARKER_KEY)) {
            logger.debug("History already migrated. Skipping.");
            return 0;
        }

        List<Map.Entry<String, String>> records = store.scan().stream()
                .filter(e -> !e.getKey().startsWith(HistoryStore.RESERVED_PREFIX))
                .collect(Collectors.toList());

        logger.info("🔄 Starting history migration ({} records)...", records.size());

        // Backup first, rewrite afterwards. A backup left by an interrupted run holds the
        // original record and is never overwritten.
        for (Map.Entry<String, String> record : records) {
            store.compute(BACKUP_PREFIX + record.getKey(), existing -> existing.orElse(record.getValue()));
        }

        AtomicInteger rewritten = new AtomicInteger(0);
        AtomicInteger current = new AtomicInteger(0);
        AtomicInteger failed = new AtomicInteger(0);

        for (Map.Entry<String, String> record : records) {
            String key = record.getKey();
            try {
                if (codec.schemaVersionOf(key, record.getValue()) >= HistoryEntry.SCHEMA_VERSION) {
                    current.incrementAndGet();
                    continue;
                }

                LegacyRecord legacy = codec.decode(key, record.getValue(), LegacyRecord.class);
                String id = legacy.songId != null && !legacy.songId.isBlank() ? legacy.songId : key;
                HistoryEntry upgraded = new HistoryEntry(
                        new Track(id, legacy.songName, legacy.artistName), legacy.timeStamp, 1);

                if (!id.equals(key)) {
                    store.remove(key);
                }
                store.put(id, codec.encode(upgraded));
                rewritten.incrementAndGet();
            } catch (SerializationException | IllegalArgumentException e) {
                logger.warn("Could not migrate history record {} (kept in backup): {}", key, e.getMessage());
                failed.incrementAndGet();
            }
        }

        store.put(MARKER_KEY, codec.encode(new Marker(
                HistoryEntry.SCHEMA_VERSION, clock.instant().getEpochSecond(), rewritten.get())));
        store.flush();

        logger.info("🎉 History migration complete! {} rewritten, {} already current, {} failed",
                rewritten.get(), current.get(), failed.get());
        return rewritten.get();
    }

    /**
     * Standalone migration tool - can be run from command line against a data directory.
     */
    public static void main(String[] args) {
        Path dataDir = Path.of(args.length > 0 ? args[0] : "data");
        System.out.println("Starting history migration in " + dataDir.toAbsolutePath());
        try (LibraryStore store = LibraryStore.open(dataDir, HistoryStore.STORE_NAME)) {
            int count = migrate(store, new RecordCodec(), Clock.systemUTC());
            System.out.println("Migration finished: " + count + " records rewritten.");
        }
    }
}
