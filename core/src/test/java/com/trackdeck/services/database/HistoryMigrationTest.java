package com.trackdeck.services.database;

import com.trackdeck.common.model.HistoryEntry;
import com.trackdeck.services.history.HistoryStore;
import com.trackdeck.test.MutableClock;
import com.trackdeck.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HistoryMigrationTest extends TestBase {
    private LibraryStore library;
    private final RecordCodec codec = new RecordCodec();
    private final MutableClock clock = new MutableClock(1_800_000_000L);

    @BeforeEach
    void openStore() {
        library = LibraryStore.open(dataDir, HistoryStore.STORE_NAME);
    }

    @AfterEach
    void closeStore() {
        library.close();
    }

    @Test
    void testLegacyRecordsAreRewrittenWithPlayCountOne() {
        library.put("abc", legacy("abc", "Song", 1_600_000_000L));

        int rewritten = HistoryMigration.migrate(library, codec, clock);

        assertEquals(1, rewritten);
        HistoryEntry entry = codec.decode("abc", library.get("abc").orElseThrow(), HistoryEntry.class);
        assertEquals(1, entry.getPlayCount());
        assertEquals(1_600_000_000L, entry.getLastPlayedAt(), "time_stamp becomes lastPlayedAt");
        assertEquals("Song", entry.getTrack().getTitle());
        assertEquals(List.of("Artist"), entry.getTrack().getArtists());
        assertEquals(HistoryEntry.SCHEMA_VERSION, entry.getSchemaVersion());
    }

    @Test
    void testBackupIsWrittenBeforeRewrite() {
        String raw = legacy("abc", "Song", 1L);
        library.put("abc", raw);

        HistoryMigration.migrate(library, codec, clock);

        assertEquals(raw, library.get(HistoryMigration.BACKUP_PREFIX + "abc").orElseThrow(),
                "original record must be kept under the backup key");
    }

    @Test
    void testRerunAfterInterruptionKeepsOriginalBackup() {
        String raw = legacy("abc", "Song", 1L);
        library.put("abc", raw);
        HistoryMigration.migrate(library, codec, clock);
        // Abbruch vor dem Marker nachstellen
        library.remove(HistoryMigration.MARKER_KEY);

        HistoryMigration.migrate(library, codec, clock);

        assertEquals(raw, library.get(HistoryMigration.BACKUP_PREFIX + "abc").orElseThrow(),
                "second run must not replace the backup with the rewritten record");
        assertEquals(1, codec.decode("abc", library.get("abc").orElseThrow(), HistoryEntry.class).getPlayCount());
    }

    @Test
    void testMarkerMakesSecondRunANoOp() {
        library.put("abc", legacy("abc", "Song", 1L));
        assertEquals(1, HistoryMigration.migrate(library, codec, clock));
        assertTrue(library.containsKey(HistoryMigration.MARKER_KEY));

        // a legacy record appearing later must not be touched again
        String late = legacy("late", "Late", 2L);
        library.put("late", late);
        assertEquals(0, HistoryMigration.migrate(library, codec, clock));
        assertEquals(late, library.get("late").orElseThrow());
    }

    @Test
    void testCurrentRecordsAreLeftAlone() {
        String current = codec.encode(new HistoryEntry(
                new com.trackdeck.common.model.Track("x", "X", List.of()), 5L, 7));
        library.put("x", current);

        assertEquals(0, HistoryMigration.migrate(library, codec, clock));
        assertEquals(7, codec.decode("x", library.get("x").orElseThrow(), HistoryEntry.class).getPlayCount());
    }

    @Test
    void testUndecodableRecordIsSkippedButBackedUp() {
        library.put("junk", "[1,2,3]");
        library.put("ok", legacy("ok", "Fine", 3L));

        assertEquals(1, HistoryMigration.migrate(library, codec, clock));
        assertTrue(library.containsKey(HistoryMigration.BACKUP_PREFIX + "junk"));
        assertTrue(library.containsKey(HistoryMigration.MARKER_KEY), "failures do not block the marker");
    }

    @Test
    void testHistoryStoreMigratesOnConstruction() {
        library.put("abc", legacy("abc", "Song", 10L));

        HistoryStore history = new HistoryStore(library, clock);

        assertEquals(1, history.size());
        assertEquals(1, history.mostPlayed(1).get(0).getPlayCount());
    }

    private static String legacy(String id, String name, long timeStamp) {
        return "{\"song_name\":\"" + name + "\",\"song_id\":\"" + id + "\",\"artist_name\":[\"Artist\"],\"time_stamp\":" + timeStamp + "}";
    }
}
