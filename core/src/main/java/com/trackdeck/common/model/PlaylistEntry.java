package com.trackdeck.common.model;

/**
 * A track inside a user playlist together with its stable slot index.
 */
public record PlaylistEntry(long index, Track track) {
}
