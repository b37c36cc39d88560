package com.trackdeck.common.model;

import java.util.List;

/**
 * Title/id/artists tuple as returned by the remote resolution service.
 * For playlist lookups the id is the remote playlist id.
 */
public record SearchResult(String title, String id, List<String> artists) {

    public SearchResult {
        artists = artists != null ? List.copyOf(artists) : List.of();
    }

    public Track toTrack() {
        return new Track(id, title, artists);
    }
}
