package com.trackdeck.services.database;

import com.trackdeck.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LibraryStoreTest extends TestBase {
    private LibraryStore store;

    @BeforeEach
    void openStore() {
        store = LibraryStore.open(dataDir, "kv");
    }

    @AfterEach
    void closeStore() {
        store.close();
    }

    @Test
    void testPutGetRemove() {
        store.put("a", "{\"v\":1}");
        assertEquals(Optional.of("{\"v\":1}"), store.get("a"));
        assertTrue(store.containsKey("a"));

        store.put("a", "{\"v\":2}");
        assertEquals(Optional.of("{\"v\":2}"), store.get("a"), "put should overwrite");

        assertEquals(Optional.of("{\"v\":2}"), store.remove("a"), "remove returns the previous value");
        assertTrue(store.get("a").isEmpty());
        assertTrue(store.remove("a").isEmpty(), "second remove finds nothing");
    }

    @Test
    void testScanIsOrderedByKey() {
        store.put("c", "3");
        store.put("a", "1");
        store.put("b", "2");

        List<String> keys = store.scan().stream().map(Map.Entry::getKey).collect(Collectors.toList());
        assertEquals(List.of("a", "b", "c"), keys);
        assertEquals(3, store.size());
    }

    @Test
    void testScanPrefixEscapesWildcards() {
        store.put("__backup:x", "1");
        store.put("__migration", "2");
        store.put("_a", "3");
        store.put("plain", "4");

        List<String> keys = store.scanPrefix("__backup:").stream().map(Map.Entry::getKey).collect(Collectors.toList());
        assertEquals(List.of("__backup:x"), keys, "underscore must not act as LIKE wildcard");
    }

    @Test
    void testClearExceptPrefixKeepsReservedKeys() {
        store.put("__marker", "m");
        store.put("a", "1");
        store.put("b", "2");

        assertEquals(2, store.clearExceptPrefix("__"));
        assertEquals(List.of("__marker"),
                store.scan().stream().map(Map.Entry::getKey).collect(Collectors.toList()));
    }

    @Test
    void testComputeReturningNullDeletes() {
        store.put("k", "v");
        assertTrue(store.compute("k", current -> null).isEmpty());
        assertFalse(store.containsKey("k"));
    }

    @Test
    void testComputeRollsBackOnException() {
        store.put("k", "before");
        assertThrows(IllegalStateException.class, () -> store.compute("k", current -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(Optional.of("before"), store.get("k"), "failed compute must not change the value");
    }

    @Test
    void testConcurrentComputeLosesNoUpdates() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 100; i++) {
            pool.submit(() -> store.compute("counter",
                    current -> String.valueOf(current.map(Integer::parseInt).orElse(0) + 1)));
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));

        assertEquals(Optional.of("100"), store.get("counter"), "per-key compute must be atomic");
    }

    @Test
    void testConcurrentComputeOnManyKeys() throws Exception {
        // mehr Keys als Lock-Streifen
        ExecutorService pool = Executors.newFixedThreadPool(4);
        for (int round = 0; round < 3; round++) {
            for (int i = 0; i < 200; i++) {
                String key = "n" + i;
                pool.submit(() -> store.compute(key,
                        current -> String.valueOf(current.map(Integer::parseInt).orElse(0) + 1)));
            }
        }
        pool.shutdown();
        assertTrue(pool.awaitTermination(60, TimeUnit.SECONDS));

        assertEquals(200, store.size());
        assertTrue(store.scan().stream().allMatch(e -> e.getValue().equals("3")), "every key got all three updates");
    }

    @Test
    void testAtomicallyWritesSeveralKeys() {
        store.put("p", "head");
        store.put("p/1", "one");
        store.put("q/1", "other");

        int removed = store.atomically("p", tx -> {
            assertEquals(Optional.of("head"), tx.get("p"));
            tx.put("p/2", "two");
            assertEquals(2, tx.scanPrefix("p/").size(), "own writes are visible inside the transaction");
            return tx.removePrefix("p/");
        });

        assertEquals(2, removed);
        assertTrue(store.scanPrefix("p/").isEmpty());
        assertEquals(Optional.of("other"), store.get("q/1"));
    }

    @Test
    void testAtomicallyRollsBackAllKeys() {
        store.put("p", "head");
        assertThrows(IllegalStateException.class, () -> store.atomically("p", tx -> {
            tx.put("p/1", "one");
            tx.remove("p");
            throw new IllegalStateException("boom");
        }));

        assertEquals(Optional.of("head"), store.get("p"));
        assertTrue(store.get("p/1").isEmpty(), "no partial write survives");
    }

    @Test
    void testDataSurvivesReopen() {
        store.put("persist", "yes");
        store.flush();
        store.close();

        store = LibraryStore.open(dataDir, "kv");
        assertEquals(Optional.of("yes"), store.get("persist"));
    }

    @Test
    void testSecondOpenOfSamePathFails() {
        assertThrows(StorageException.class, () -> LibraryStore.open(dataDir, "kv"));
    }

    @Test
    void testUseAfterCloseFails() {
        store.close();
        assertTrue(store.isClosed());
        assertThrows(StorageException.class, () -> store.get("a"));
    }
}
