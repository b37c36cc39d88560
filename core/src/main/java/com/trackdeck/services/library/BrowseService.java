package com.trackdeck.services.library;

import com.trackdeck.api.PlayerException;
import com.trackdeck.api.ResolutionException;
import com.trackdeck.api.ResolutionService;
import com.trackdeck.common.model.SearchResult;
import com.trackdeck.common.model.Track;
import com.trackdeck.core.playback.PlaybackController;
import com.trackdeck.core.signal.SessionSignals;
import com.trackdeck.services.pages.SongPageStore;
import com.trackdeck.services.playlist.PlaylistStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * BrowseService - the list the user is currently looking at (search results, a remote
 * playlist, a user playlist). Each browse action replaces the previous list.
 */
public class BrowseService {
    private static final Logger logger = LoggerFactory.getLogger(BrowseService.class);

    private final ResolutionService resolution;
    private final PlaylistStore playlists;
    private final PlaybackController controller;
    private final SessionSignals signals;
    private final int pageSize;

    private SongPageStore current;
    private String currentSource = "empty";

    public BrowseService(ResolutionService resolution, PlaylistStore playlists, PlaybackController controller,
                         SessionSignals signals, int pageSize) {
        this.resolution = resolution;
        this.playlists = playlists;
        this.controller = controller;
        this.signals = signals;
        this.pageSize = pageSize;
        this.current = new SongPageStore(pageSize);
    }

    /**
     * @return number of results
     */
    public int search(String query) throws ResolutionException {
        List<Track> tracks = toTracks(resolution.search(query));
        replace(tracks, "search: " + query);
        logger.info("🔎 Search '{}' -> {} results", query, tracks.size());
        return tracks.size();
    }

    /**
     * Remote playlists matching {@code query}. Does not touch the current list.
     */
    public List<SearchResult> searchPlaylists(String query) throws ResolutionException {
        return resolution.resolvePlaylist(query);
    }

    public int openRemotePlaylist(String playlistId) throws ResolutionException {
        List<Track> tracks = toTracks(resolution.expandPlaylist(playlistId));
        replace(tracks, "remote playlist: " + playlistId);
        return tracks.size();
    }

    /**
     * @throws com.trackdeck.services.database.NotFoundException if there is no such playlist
     */
    public int openUserPlaylist(String name) {
        SongPageStore pages = playlists.materialize(name, pageSize);
        synchronized (this) {
            current.close();
            current = pages;
            currentSource = "playlist: " + name;
        }
        return pages.length();
    }

    public synchronized List<Track> page(int offset) {
        return current.page(offset);
    }

    public synchronized SongPageStore current() {
        return current;
    }

    public synchronized String currentSource() {
        return currentSource;
    }

    /**
     * Plays the track at {@code position} on its own (loops, no playlist mode).
     */
    public Track playSelected(int position) throws PlayerException {
        Track track = current().getByPosition(position);
        controller.playTrack(track, false);
        return track;
    }

    /**
     * Plays the current list as a playlist, starting at {@code position}.
     */
    public void playFrom(int position) throws PlayerException {
        controller.playPlaylist(current(), position);
    }

    public Track trackAt(int position) {
        return current().getByPosition(position);
    }

    public void addToPlaylist(String name, Track track) {
        playlists.addTrack(name, track);
        signals.addToPlaylistCompleted().publish(name);
    }

    private synchronized void replace(List<Track> tracks, String source) {
        current.close();
        current = SongPageStore.of(tracks, pageSize);
        currentSource = source;
    }

    private static List<Track> toTracks(List<SearchResult> results) {
        return results.stream()
                .filter(r -> r.id() != null && !r.id().isBlank())
                .map(SearchResult::toTrack)
                .collect(Collectors.toList());
    }
}
