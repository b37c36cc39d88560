package com.trackdeck.services.profile;

import com.trackdeck.services.database.LibraryStore;
import com.trackdeck.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProfileStoreTest extends TestBase {
    private LibraryStore library;
    private ProfileStore profile;

    @BeforeEach
    void openStore() {
        library = LibraryStore.open(dataDir, ProfileStore.STORE_NAME);
        profile = new ProfileStore(library);
    }

    @AfterEach
    void closeStore() {
        library.close();
    }

    @Test
    void testListeningTimeAccumulates() {
        assertEquals(0, profile.totalListeningMillis());
        profile.addListeningTime(1000);
        assertEquals(3500, profile.addListeningTime(2500));
        assertEquals(3500, profile.totalListeningMillis());
    }

    @Test
    void testFormattedListeningTime() {
        profile.addListeningTime((3600 + 2 * 60 + 5) * 1000L);
        assertEquals("01:02:05", profile.formattedListeningTime());
    }

    @Test
    void testListeningTimeSurvivesReopen() {
        profile.addListeningTime(42_000);
        library.close();

        library = LibraryStore.open(dataDir, ProfileStore.STORE_NAME);
        profile = new ProfileStore(library);
        assertEquals(42_000, profile.totalListeningMillis());
    }

    @Test
    void testNegativeTimeRejected() {
        assertThrows(IllegalArgumentException.class, () -> profile.addListeningTime(-1));
    }
}
