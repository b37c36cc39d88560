package com.trackdeck.services.library;

import com.trackdeck.api.PlayerException;
import com.trackdeck.api.ResolutionException;
import com.trackdeck.common.model.Track;
import com.trackdeck.core.config.Configuration;
import com.trackdeck.core.playback.PlaybackController;
import com.trackdeck.core.playback.SessionSnapshot;
import com.trackdeck.core.signal.SessionSignals;
import com.trackdeck.services.database.LibraryStore;
import com.trackdeck.services.database.NotFoundException;
import com.trackdeck.services.history.HistoryStore;
import com.trackdeck.services.pages.SongPageStore;
import com.trackdeck.services.playlist.PlaylistStore;
import com.trackdeck.test.FakePlayer;
import com.trackdeck.test.FakeResolutionService;
import com.trackdeck.test.MutableClock;
import com.trackdeck.test.TestBase;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.trackdeck.test.FakeResolutionService.result;
import static com.trackdeck.test.Tracks.track;
import static org.junit.jupiter.api.Assertions.*;

class BrowseServiceTest extends TestBase {
    private LibraryStore historyLibrary;
    private LibraryStore playlistLibrary;
    private PlaylistStore playlists;
    private FakeResolutionService resolution;
    private FakePlayer player;
    private SessionSignals signals;
    private PlaybackController controller;
    private BrowseService browse;

    @BeforeEach
    void setUp() {
        historyLibrary = LibraryStore.open(dataDir, HistoryStore.STORE_NAME);
        playlistLibrary = LibraryStore.open(dataDir, PlaylistStore.STORE_NAME);
        playlists = new PlaylistStore(playlistLibrary);
        resolution = new FakeResolutionService();
        player = new FakePlayer();
        signals = new SessionSignals();

        Configuration config = new Configuration();
        config.confirmInitialDelayMillis = 60_000;
        controller = new PlaybackController(player, new HistoryStore(historyLibrary, new MutableClock(1_700_000_000L)),
                null, signals, config);
        browse = new BrowseService(resolution, playlists, controller, signals, 2);
    }

    @AfterEach
    void tearDown() {
        controller.shutdown();
        historyLibrary.close();
        playlistLibrary.close();
    }

    @Test
    void testSearchReplacesCurrentList() throws ResolutionException {
        resolution.onSearch("daft", result("d1", "One More Time", "Daft Punk"), result("d2", "Aerodynamic", "Daft Punk"),
                result("d3", "Digital Love", "Daft Punk"));
        resolution.onSearch("air", result("a1", "La Femme d'Argent", "Air"));

        assertEquals(3, browse.search("daft"));
        SongPageStore first = browse.current();
        assertEquals(List.of("d1", "d2"), ids(browse.page(0)));
        assertEquals(List.of("d3"), ids(browse.page(2)));

        assertEquals(1, browse.search("air"));
        assertTrue(first.isClosed(), "the previous list is discarded");
        assertEquals("search: air", browse.currentSource());
        assertEquals("a1", browse.trackAt(0).getId());
    }

    @Test
    void testResultsWithoutIdAreSkipped() throws ResolutionException {
        resolution.onSearch("q", result("", "broken"), result("ok", "fine"));

        browse.search("q");
        assertEquals(1, browse.current().length());
    }

    @Test
    void testFailedSearchKeepsCurrentList() throws ResolutionException {
        resolution.onSearch("daft", result("d1", "One More Time", "Daft Punk"));
        browse.search("daft");

        resolution.failWith("yt-dlp exited with 1");
        assertThrows(ResolutionException.class, () -> browse.search("other"));
        assertEquals("d1", browse.trackAt(0).getId());
    }

    @Test
    void testSearchPlaylistsLeavesCurrentList() throws ResolutionException {
        resolution.onPlaylistSearch("focus", result("PL1", "Deep Focus"));

        assertEquals(1, browse.searchPlaylists("focus").size());
        assertEquals("empty", browse.currentSource());
    }

    @Test
    void testOpenRemotePlaylist() throws ResolutionException {
        resolution.onPlaylist("PL1", result("x", "X"), result("y", "Y"));

        assertEquals(2, browse.openRemotePlaylist("PL1"));
        assertEquals(List.of("expand:PL1"), resolution.getCalls());
        assertEquals("remote playlist: PL1", browse.currentSource());
    }

    @Test
    void testOpenUserPlaylist() {
        playlists.create("mix");
        playlists.addTrack("mix", track("a"));

        assertEquals(1, browse.openUserPlaylist("mix"));
        assertEquals("a", browse.trackAt(0).getId());
        assertThrows(NotFoundException.class, () -> browse.openUserPlaylist("nope"));
    }

    @Test
    void testPlaySelectedAndPlayFrom() throws ResolutionException, PlayerException {
        resolution.onSearch("q", result("a", "A"), result("b", "B"), result("c", "C"));
        browse.search("q");

        Track played = browse.playSelected(1);
        assertEquals("b", played.getId());
        assertFalse(controller.snapshot().playlistMode());

        browse.playFrom(2);
        SessionSnapshot session = controller.snapshot();
        assertTrue(session.playlistMode());
        assertEquals(2, session.playlistIndex());
        assertEquals(3, session.playlistLength());
        assertEquals("https://youtube.com/watch?v=c", player.lastPlayedUrl());

        assertThrows(NotFoundException.class, () -> browse.playSelected(9));
    }

    @Test
    void testAddToPlaylistSignals() {
        playlists.create("mix");

        browse.addToPlaylist("mix", track("a"));

        assertEquals(List.of(track("a")), playlists.getTracks("mix"));
        assertEquals(Optional.of("mix"), signals.addToPlaylistCompleted().tryReceive());
        assertThrows(NotFoundException.class, () -> browse.addToPlaylist("nope", track("a")));
        assertTrue(signals.addToPlaylistCompleted().isEmpty(), "no signal for a failed add");
    }

    private static List<String> ids(List<Track> tracks) {
        return tracks.stream().map(Track::getId).collect(Collectors.toList());
    }
}
