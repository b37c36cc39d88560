package com.trackdeck.api;

import com.trackdeck.common.model.SearchResult;

import java.util.List;

/**
 * Remote catalogue lookup (search, playlists).
 */
public interface ResolutionService {

    /**
     * Tracks matching {@code query}.
     */
    List<SearchResult> search(String query) throws ResolutionException;

    /**
     * Remote playlists matching {@code query}; the result ids are playlist ids.
     */
    List<SearchResult> resolvePlaylist(String query) throws ResolutionException;

    /**
     * Tracks of the remote playlist {@code playlistId}, in playlist order.
     */
    List<SearchResult> expandPlaylist(String playlistId) throws ResolutionException;
}
