package com.trackdeck.common.model;

import java.util.List;
import java.util.Objects;

/**
 * A playable unit. Identity is the remote id only, title and artists are metadata.
 */
public final class Track {
    private final String id;
    private final String title;
    private final List<String> artists;

    public Track(String id, String title, List<String> artists) {
        if (id == null || id.isBlank())
            throw new IllegalArgumentException("Track id must not be blank");
        this.id = id;
        this.title = title != null ? title : "";
        this.artists = artists != null ? List.copyOf(artists) : List.of();
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public List<String> getArtists() {
        // Gson may leave the field null when a record omits it
        return artists != null ? artists : List.of();
    }

    public String getArtistLine() {
        return String.join(", ", getArtists());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Track))
            return false;
        return id.equals(((Track) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return title + " - " + getArtistLine() + " [" + id + "]";
    }
}
