package com.trackdeck.services.database;

import org.jdbi.v3.core.Handle;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * LibraryStore - durable, ordered key/value store on top of an embedded H2 file.
 * One instance per logical store (history, playlists, profile). Keys are kept in
 * ascending order, values are serialized records (see {@link RecordCodec}).
 * <p>
 * A store path can only be opened once per JVM; H2's file lock keeps other
 * processes out.
 */
public class LibraryStore implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LibraryStore.class);
    private static final Set<Path> OPEN_PATHS = ConcurrentHashMap.newKeySet();
    private static final int LOCK_STRIPES = 64;

    private final String name;
    private final Path dbPath;
    private final Jdbi jdbi;
    private final Object[] keyLocks = new Object[LOCK_STRIPES];
    private volatile boolean closed = false;

    private LibraryStore(String name, Path dbPath, Jdbi jdbi) {
        this.name = name;
        this.dbPath = dbPath;
        this.jdbi = jdbi;
        for (int i = 0; i < keyLocks.length; i++)
            keyLocks[i] = new Object();
    }

    /**
     * Opens (or creates) the store {@code name} inside {@code dir}.
     *
     * @throws StorageException if the directory cannot be created, the database cannot
     *                          be opened or the store is already open
     */
    public static LibraryStore open(Path dir, String name) {
        Path dbPath = dir.resolve(name).toAbsolutePath().normalize();
        if (!OPEN_PATHS.add(dbPath)) {
            throw new StorageException("Store already open: " + dbPath);
        }

        try {
            Files.createDirectories(dir);

            String url = "jdbc:h2:file:" + dbPath +
                    ";DB_CLOSE_DELAY=-1" + // bis SHUTDOWN offen halten
                    ";CACHE_SIZE=4096";

            Jdbi jdbi = Jdbi.create(url);
            LibraryStore store = new LibraryStore(name, dbPath, jdbi);
            store.initializeSchema();
            logger.info("🗄️ Library store opened: {} ({})", name, dbPath);
            return store;
        } catch (IOException | JdbiException e) {
            OPEN_PATHS.remove(dbPath);
            throw new StorageException("Failed to open store '" + name + "' at " + dbPath, e);
        }
    }

    private void initializeSchema() {
        jdbi.useHandle(handle -> handle.execute("""
                    CREATE TABLE IF NOT EXISTS entries (
                        entry_key VARCHAR(512) PRIMARY KEY,
                        entry_value VARCHAR(1000000) NOT NULL
                    )
                """));
    }

    public String getName() {
        return name;
    }

    public Optional<String> get(String key) {
        return withHandle("get " + key, handle -> handle
                .createQuery("SELECT entry_value FROM entries WHERE entry_key = ?")
                .bind(0, key)
                .mapTo(String.class)
                .findOne());
    }

    public boolean containsKey(String key) {
        return get(key).isPresent();
    }

    public void put(String key, String value) {
        synchronized (lockFor(key)) {
            withHandle("put " + key, handle -> {
                merge(handle, key, value);
                return null;
            });
        }
    }

    /**
     * Removes {@code key} and returns the value it had, if any.
     */
    public Optional<String> remove(String key) {
        synchronized (lockFor(key)) {
            return inTransaction("remove " + key, handle -> {
                Optional<String> previous = select(handle, key);
                previous.ifPresent(v -> delete(handle, key));
                return previous;
            });
        }
    }

    /**
     * Atomic read-modify-write of a single key. The function receives the current value
     * and returns the new one; returning {@code null} removes the key. Exceptions thrown
     * by the function roll the change back and propagate unchanged.
     */
    public Optional<String> compute(String key, Function<Optional<String>, String> remapping) {
        synchronized (lockFor(key)) {
            return inTransaction("compute " + key, handle -> {
                String updated = remapping.apply(select(handle, key));
                if (updated == null) {
                    delete(handle, key);
                    return Optional.empty();
                }
                merge(handle, key, updated);
                return Optional.of(updated);
            });
        }
    }

    /**
     * Runs {@code work} in one transaction that may touch several keys. Callers that
     * group keys under a common owner pass the owner as {@code lockKey}; concurrent
     * calls with the same lock key run one after another. Exceptions thrown by
     * {@code work} roll everything back and propagate unchanged.
     */
    public <T> T atomically(String lockKey, Function<Transaction, T> work) {
        synchronized (lockFor(lockKey)) {
            return inTransaction("transaction " + lockKey, handle -> work.apply(new Transaction(handle)));
        }
    }

    /**
     * Key access bound to the handle of an {@link #atomically} call.
     */
    public static final class Transaction {
        private final Handle handle;

        private Transaction(Handle handle) {
            this.handle = handle;
        }

        public Optional<String> get(String key) {
            return select(handle, key);
        }

        public boolean containsKey(String key) {
            return select(handle, key).isPresent();
        }

        public void put(String key, String value) {
            merge(handle, key, value);
        }

        public boolean remove(String key) {
            return delete(handle, key) > 0;
        }

        public int removePrefix(String prefix) {
            return handle.createUpdate("DELETE FROM entries WHERE entry_key LIKE ? ESCAPE '\\'")
                    .bind(0, likePrefix(prefix))
                    .execute();
        }

        public List<Map.Entry<String, String>> scanPrefix(String prefix) {
            return selectPrefix(handle, prefix);
        }
    }

    /**
     * Full scan in ascending key order.
     */
    public List<Map.Entry<String, String>> scan() {
        return withHandle("scan", handle -> handle
                .createQuery("SELECT entry_key, entry_value FROM entries ORDER BY entry_key")
                .map((rs, ctx) -> (Map.Entry<String, String>) new AbstractMap.SimpleImmutableEntry<>(
                        rs.getString("entry_key"), rs.getString("entry_value")))
                .list());
    }

    /**
     * Scan restricted to keys starting with {@code prefix}, in ascending key order.
     */
    public List<Map.Entry<String, String>> scanPrefix(String prefix) {
        return withHandle("scan " + prefix, handle -> selectPrefix(handle, prefix));
    }

    public long size() {
        return withHandle("size", handle -> handle
                .createQuery("SELECT COUNT(*) FROM entries")
                .mapTo(Long.class)
                .one());
    }

    public void clear() {
        withHandle("clear", handle -> handle.execute("DELETE FROM entries"));
    }

    /**
     * Deletes every key that does not start with {@code prefix}.
     *
     * @return number of removed keys
     */
    public int clearExceptPrefix(String prefix) {
        return withHandle("clear", handle -> handle
                .createUpdate("DELETE FROM entries WHERE entry_key NOT LIKE ? ESCAPE '\\'")
                .bind(0, likePrefix(prefix))
                .execute());
    }

    /**
     * Forces committed data to disk.
     */
    public void flush() {
        withHandle("flush", handle -> handle.execute("CHECKPOINT"));
    }

    @Override
    public synchronized void close() {
        if (closed)
            return;
        try {
            jdbi.useHandle(handle -> handle.execute("SHUTDOWN"));
            logger.info("✅ Library store closed: {}", name);
        } catch (JdbiException e) {
            logger.warn("Error shutting down store {}: {}", name, e.getMessage());
        } finally {
            closed = true;
            OPEN_PATHS.remove(dbPath);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // --- internals ---

    // feste Lock-Streifen statt einem Objekt pro Key
    private Object lockFor(String key) {
        return keyLocks[Math.floorMod(key.hashCode(), keyLocks.length)];
    }

    private static Optional<String> select(Handle handle, String key) {
        return handle.createQuery("SELECT entry_value FROM entries WHERE entry_key = ?")
                .bind(0, key)
                .mapTo(String.class)
                .findOne();
    }

    private static List<Map.Entry<String, String>> selectPrefix(Handle handle, String prefix) {
        return handle.createQuery("""
                            SELECT entry_key, entry_value FROM entries
                            WHERE entry_key LIKE ? ESCAPE '\\'
                            ORDER BY entry_key
                        """)
                .bind(0, likePrefix(prefix))
                .map((rs, ctx) -> (Map.Entry<String, String>) new AbstractMap.SimpleImmutableEntry<>(
                        rs.getString("entry_key"), rs.getString("entry_value")))
                .list();
    }

    private static void merge(Handle handle, String key, String value) {
        handle.createUpdate("MERGE INTO entries (entry_key, entry_value) KEY(entry_key) VALUES (?, ?)")
                .bind(0, key)
                .bind(1, value)
                .execute();
    }

    private static int delete(Handle handle, String key) {
        return handle.createUpdate("DELETE FROM entries WHERE entry_key = ?")
                .bind(0, key)
                .execute();
    }

    private static String likePrefix(String prefix) {
        return prefix.replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_") + "%";
    }

    private <T> T withHandle(String operation, Function<Handle, T> callback) {
        ensureOpen();
        try {
            return jdbi.withHandle(callback::apply);
        } catch (JdbiException e) {
            throw new StorageException("Store '" + name + "': " + operation + " failed", e);
        }
    }

    private <T> T inTransaction(String operation, Function<Handle, T> callback) {
        ensureOpen();
        try {
            return jdbi.inTransaction(callback::apply);
        } catch (JdbiException e) {
            throw new StorageException("Store '" + name + "': " + operation + " failed", e);
        }
    }

    private void ensureOpen() {
        if (closed)
            throw new StorageException("Store '" + name + "' is closed");
    }
}
