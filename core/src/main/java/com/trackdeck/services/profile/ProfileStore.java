package com.trackdeck.services.profile;

import com.trackdeck.common.util.TimeFormat;
import com.trackdeck.services.database.LibraryStore;
import com.trackdeck.services.database.RecordCodec;

/**
 * ProfileStore - durable user profile. Currently holds the total listening time.
 */
public class ProfileStore {
    public static final String STORE_NAME = "profile";
    static final String PROFILE_KEY = "user";

    private final LibraryStore store;
    private final RecordCodec codec;

    public ProfileStore(LibraryStore store) {
        this.store = store;
        this.codec = new RecordCodec();
    }

    /**
     * Adds {@code millis} of listening time. Negative values are rejected.
     */
    public long addListeningTime(long millis) {
        if (millis < 0)
            throw new IllegalArgumentException("millis must be >= 0");
        String json = store.compute(PROFILE_KEY, current -> {
            Profile profile = current
                    .map(raw -> codec.decode(PROFILE_KEY, raw, Profile.class))
                    .orElseGet(Profile::new);
            profile.listeningMillis += millis;
            return codec.encode(profile);
        }).orElseThrow();
        return codec.decode(PROFILE_KEY, json, Profile.class).listeningMillis;
    }

    public long totalListeningMillis() {
        return store.get(PROFILE_KEY)
                .map(raw -> codec.decode(PROFILE_KEY, raw, Profile.class).listeningMillis)
                .orElse(0L);
    }

    /**
     * Total listening time as HH:MM:SS.
     */
    public String formattedListeningTime() {
        return TimeFormat.hoursMinutesSeconds(totalListeningMillis() / 1000);
    }

    static class Profile {
        int schemaVersion = 1;
        long listeningMillis;
    }
}
