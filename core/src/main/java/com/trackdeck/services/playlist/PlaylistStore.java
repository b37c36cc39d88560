package com.trackdeck.services.playlist;

import com.trackdeck.common.model.PlaylistEntry;
import com.trackdeck.common.model.Track;
import com.trackdeck.services.database.DuplicateNameException;
import com.trackdeck.services.database.LibraryStore;
import com.trackdeck.services.database.NotFoundException;
import com.trackdeck.services.database.RecordCodec;
import com.trackdeck.services.pages.SongPageStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * PlaylistStore - named user playlists.
 * <p>
 * Layout: the key {@code name} holds a {@link UserPlaylist} header, every track sits
 * under {@code name + SEPARATOR + trackId} with its slot index. Adding a track touches
 * two small records no matter how long the playlist is. Every operation runs as one
 * transaction of the underlying store.
 */
public class PlaylistStore {
    private static final Logger logger = LoggerFactory.getLogger(PlaylistStore.class);

    public static final String STORE_NAME = "playlists";
    /** Separates playlist name and track id in entry keys; not allowed in names. */
    public static final String SEPARATOR = "\u001F";

    private record StoredEntry(int schemaVersion, long index, Track track) {
        StoredEntry(long index, Track track) {
            this(UserPlaylist.SCHEMA_VERSION, index, track);
        }
    }

    private final LibraryStore store;
    private final RecordCodec codec;

    public PlaylistStore(LibraryStore store) {
        this.store = store;
        this.codec = new RecordCodec();
    }

    /**
     * @throws DuplicateNameException if a playlist called {@code name} exists
     */
    public void create(String name) {
        validateName(name);
        store.atomically(name, tx -> {
            if (tx.containsKey(name))
                throw new DuplicateNameException(name);
            tx.put(name, codec.encode(new UserPlaylist(name)));
            return null;
        });
        logger.info("Playlist created: {}", name);
    }

    /**
     * Appends {@code track} at a fresh slot; an already contained track moves to the end.
     *
     * @throws NotFoundException if the playlist does not exist
     */
    public void addTrack(String name, Track track) {
        validateName(name);
        store.atomically(name, tx -> {
            UserPlaylist playlist = header(tx, name);
            tx.put(entryKey(name, track.getId()), codec.encode(new StoredEntry(playlist.claimIndex(), track)));
            tx.put(name, codec.encode(playlist));
            return null;
        });
        logger.debug("Added {} to playlist {}", track.getId(), name);
    }

    /**
     * Removes the entry for {@code trackId}. Missing tracks are not an error.
     *
     * @return whether an entry was removed
     * @throws NotFoundException if the playlist does not exist
     */
    public boolean removeTrack(String name, String trackId) {
        validateName(name);
        return store.atomically(name, tx -> {
            header(tx, name);
            return tx.remove(entryKey(name, trackId));
        });
    }

    /**
     * Snapshot of all playlist names. Unreadable headers are skipped.
     */
    public List<String> listNames() {
        return store.scan().stream()
                .filter(e -> !e.getKey().contains(SEPARATOR))
                .map(e -> codec.tryDecode(e.getKey(), e.getValue(), UserPlaylist.class))
                .flatMap(Optional::stream)
                .map(UserPlaylist::getName)
                .collect(Collectors.toList());
    }

    public boolean exists(String name) {
        return name != null && !name.contains(SEPARATOR) && store.containsKey(name);
    }

    /**
     * Tracks in slot order.
     *
     * @throws NotFoundException if the playlist does not exist
     */
    public List<Track> getTracks(String name) {
        return getEntries(name).stream().map(PlaylistEntry::track).collect(Collectors.toList());
    }

    /**
     * Entries in slot order. Unreadable entries are skipped.
     *
     * @throws NotFoundException if the playlist does not exist
     */
    public List<PlaylistEntry> getEntries(String name) {
        validateName(name);
        return store.atomically(name, tx -> {
            header(tx, name);
            return tx.scanPrefix(name + SEPARATOR).stream()
                    .map(e -> codec.tryDecode(e.getKey(), e.getValue(), StoredEntry.class))
                    .flatMap(Optional::stream)
                    .filter(e -> e.track() != null && e.track().getId() != null)
                    .map(e -> new PlaylistEntry(e.index(), e.track()))
                    .sorted(Comparator.comparingLong(PlaylistEntry::index))
                    .collect(Collectors.toList());
        });
    }

    /**
     * Number of tracks in the playlist.
     *
     * @throws NotFoundException if the playlist does not exist
     */
    public int size(String name) {
        return getEntries(name).size();
    }

    /**
     * Copies the playlist into a fresh {@link SongPageStore}. Later edits to the
     * playlist do not show up in the returned store.
     */
    public SongPageStore materialize(String name, int pageSize) {
        return SongPageStore.of(getTracks(name), pageSize);
    }

    public SongPageStore materialize(String name) {
        return materialize(name, SongPageStore.PAGE_SIZE);
    }

    /**
     * Deletes the playlist together with all of its entries.
     *
     * @return whether the playlist existed
     */
    public boolean delete(String name) {
        if (!exists(name))
            return false;
        boolean removed = store.atomically(name, tx -> {
            boolean existed = tx.remove(name);
            tx.removePrefix(name + SEPARATOR);
            return existed;
        });
        if (removed)
            logger.info("Playlist deleted: {}", name);
        return removed;
    }

    /**
     * Reads the header of {@code name}, splitting a first-format record (all entries
     * inside the header) into per-track keys on the way.
     */
    private UserPlaylist header(LibraryStore.Transaction tx, String name) {
        UserPlaylist playlist = tx.get(name)
                .map(json -> codec.decode(name, json, UserPlaylist.class))
                .orElseThrow(() -> new NotFoundException("Playlist '" + name + "' not found"));

        if (playlist.getSchemaVersion() < UserPlaylist.SCHEMA_VERSION) {
            List<PlaylistEntry> legacy = playlist.legacyEntries();
            for (PlaylistEntry entry : legacy)
                tx.put(entryKey(name, entry.track().getId()), codec.encode(new StoredEntry(entry.index(), entry.track())));
            playlist.upgraded();
            tx.put(name, codec.encode(playlist));
            logger.info("🔄 Playlist {} upgraded to per-track records ({} tracks)", name, legacy.size());
        }
        return playlist;
    }

    private static String entryKey(String name, String trackId) {
        return name + SEPARATOR + trackId;
    }

    private static void validateName(String name) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Playlist name must not be blank");
        if (name.contains(SEPARATOR))
            throw new IllegalArgumentException("Playlist name contains a control character");
    }
}
