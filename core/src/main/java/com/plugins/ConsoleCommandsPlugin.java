package com.plugins;

import com.trackdeck.api.PlayerException;
import com.trackdeck.api.ResolutionException;
import com.trackdeck.api.SessionPlugin;
import com.trackdeck.common.model.HistoryEntry;
import com.trackdeck.common.model.SearchResult;
import com.trackdeck.common.model.Track;
import com.trackdeck.core.Kernel;
import com.trackdeck.core.playback.Direction;
import com.trackdeck.core.playback.NowPlaying;
import com.trackdeck.core.playback.PlaybackController;
import com.trackdeck.core.playback.SessionSnapshot;
import com.trackdeck.services.database.DuplicateNameException;
import com.trackdeck.services.database.LibraryException;
import com.trackdeck.services.database.NotFoundException;
import com.trackdeck.services.history.HistoryStore;
import com.trackdeck.services.library.BrowseService;
import com.trackdeck.services.playlist.PlaylistStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;

/**
 * Built-in console commands: browsing, playback control, history and playlists.
 */
public class ConsoleCommandsPlugin implements SessionPlugin {
    private static final Logger logger = LoggerFactory.getLogger(ConsoleCommandsPlugin.class);
    private static final DateTimeFormatter PLAYED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneId.systemDefault());

    private Kernel kernel;
    private List<SearchResult> lastPlaylistResults = List.of();

    @Override
    public String getName() {
        return "ConsoleCommands";
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public void onEnable(Kernel kernel) {
        this.kernel = kernel;

        kernel.registerCommand("help", (c, a) -> getHelpText());

        // Browse
        kernel.registerCommand("search", this::handleSearch);
        kernel.registerCommand("playlists", this::handlePlaylistSearch);
        kernel.registerCommand("open", this::handleOpen);
        kernel.registerCommand("page", this::handlePage);

        // Playback
        kernel.registerCommand("play", this::handlePlay);
        kernel.registerCommand("playall", this::handlePlayAll);
        kernel.registerCommand("next", (c, a) -> handleAdvance(Direction.NEXT));
        kernel.registerCommand("prev", (c, a) -> handleAdvance(Direction.PREVIOUS));
        kernel.registerCommand("pause", this::handlePause);
        kernel.registerCommand("seek", this::handleSeek);
        kernel.registerCommand("vol", this::handleVolume);
        kernel.registerCommand("status", (c, a) -> getStatusText());
        kernel.registerCommand("stop-playlist", this::handleStopPlaylist);

        // History
        kernel.registerCommand("history", this::handleHistory);
        kernel.registerCommand("top", this::handleTop);
        kernel.registerCommand("forget", this::handleForget);
        kernel.registerCommand("clear-history", this::handleClearHistory);

        // Playlists
        kernel.registerCommand("pl-create", this::handlePlaylistCreate);
        kernel.registerCommand("pl-add", this::handlePlaylistAdd);
        kernel.registerCommand("pl-remove", this::handlePlaylistRemove);
        kernel.registerCommand("pl-list", this::handlePlaylistList);
        kernel.registerCommand("pl-open", this::handlePlaylistOpen);
        kernel.registerCommand("pl-delete", this::handlePlaylistDelete);

        kernel.registerCommand("time", (c, a) -> "⏱️ Listening time: " + kernel.getProfileStore().formattedListeningTime());
        kernel.registerCommand("quit", (c, a) -> "👋 Bye.");

        // Info für Settings
        kernel.getConfigManager().getConfig().setPluginSetting(
                getName(),
                "commands_info",
                "help, search, playlists, open, page, play, playall, next, prev, pause, seek, vol, status, "
                        + "history, top, forget, clear-history, pl-*, stop-playlist, time, quit");
    }

    @Override
    public void onDisable() {
    }

    // =================================================================================
    // PUBLIC API (String Rückgabe für die Konsole)
    // =================================================================================

    public String getHelpText() {
        return String.join("\n",
                "🎵 TrackDeck commands",
                "  search <query>          search tracks",
                "  playlists <query>       search remote playlists",
                "  open <n|playlistId>     open a remote playlist",
                "  page <n>                show page n of the current list",
                "  play <pos>              play one track (loops)",
                "  playall [pos]           play the current list as playlist",
                "  next | prev             move through the playlist",
                "  pause | seek <±s> | vol <±d>",
                "  status                  what is playing",
                "  history [page] | top [n] | forget <id> | clear-history",
                "  pl-create <name> | pl-add <name> <pos> | pl-remove <name> <id>",
                "  pl-list | pl-open <name> | pl-delete <name>",
                "  stop-playlist | time | quit");
    }

    public String getStatusText() {
        PlaybackController controller = kernel.getPlaybackController();
        if (controller == null)
            return "ℹ️ Session not started.";

        SessionSnapshot s = controller.snapshot();
        StringBuilder sb = new StringBuilder("📊 ").append(s.state());
        s.track().ifPresent(t -> sb.append("\n🎵 ").append(describe(t)));
        s.playing().ifPresent(p -> sb.append("\n⏱ ").append(p.elapsed()).append(" / ").append(p.totalDuration())
                .append("   🔊 ").append(p.volume())
                .append(p.paused() ? "   ⏸️" : ""));
        if (s.playlistMode())
            sb.append("\n📜 Playlist ").append(s.playlistIndex() + 1).append("/").append(s.playlistLength());
        s.error().ifPresent(e -> sb.append("\n❌ ").append(e));
        return sb.toString();
    }

    // =================================================================================
    // Browse
    // =================================================================================

    private String handleSearch(String command, String[] args) {
        if (args.length == 0)
            return "❌ Usage: search <query>";
        try {
            int count = browse().search(String.join(" ", args));
            return count == 0 ? "📭 No results." : renderPage(0);
        } catch (ResolutionException e) {
            return "❌ Search failed: " + e.getMessage();
        }
    }

    private String handlePlaylistSearch(String command, String[] args) {
        if (args.length == 0)
            return "❌ Usage: playlists <query>";
        try {
            lastPlaylistResults = browse().searchPlaylists(String.join(" ", args));
        } catch (ResolutionException e) {
            return "❌ Playlist search failed: " + e.getMessage();
        }
        if (lastPlaylistResults.isEmpty())
            return "📭 No playlists found.";

        StringBuilder sb = new StringBuilder("📜 Playlists\n");
        for (int i = 0; i < lastPlaylistResults.size(); i++) {
            SearchResult r = lastPlaylistResults.get(i);
            sb.append(String.format("%3d. %s - %s [%s]%n", i, r.title(), String.join(", ", r.artists()), r.id()));
        }
        return sb.toString().trim();
    }

    private String handleOpen(String command, String[] args) {
        if (args.length == 0)
            return "❌ Usage: open <n|playlistId>";
        String id = args[0];
        Integer n = parseInt(id);
        if (n != null && n >= 0 && n < lastPlaylistResults.size())
            id = lastPlaylistResults.get(n).id();
        try {
            int count = browse().openRemotePlaylist(id);
            return count == 0 ? "📭 Playlist is empty." : renderPage(0);
        } catch (ResolutionException e) {
            return "❌ Could not open playlist: " + e.getMessage();
        }
    }

    private String handlePage(String command, String[] args) {
        Integer n = args.length == 0 ? Integer.valueOf(0) : parseInt(args[0]);
        if (n == null || n < 0)
            return "❌ Usage: page <n>";
        return renderPage(n);
    }

    private String renderPage(int pageNumber) {
        BrowseService browse = browse();
        int pageSize = browse.current().getPageSize();
        int offset = pageNumber * pageSize;
        List<Track> tracks = browse.page(offset);
        if (tracks.isEmpty())
            return "📭 Nothing on page " + pageNumber + ".";

        int total = browse.current().length();
        StringBuilder sb = new StringBuilder(String.format("📄 %s (page %d/%d)%n",
                browse.currentSource(), pageNumber, (total - 1) / pageSize));
        for (int i = 0; i < tracks.size(); i++)
            sb.append(String.format("%3d. %s%n", offset + i, describe(tracks.get(i))));
        return sb.toString().trim();
    }

    // =================================================================================
    // Playback
    // =================================================================================

    private String handlePlay(String command, String[] args) {
        Integer pos = args.length == 0 ? null : parseInt(args[0]);
        if (pos == null)
            return "❌ Usage: play <pos>";
        try {
            Track track = browse().playSelected(pos);
            return "▶️ " + describe(track);
        } catch (NotFoundException e) {
            return "❌ " + e.getMessage();
        } catch (PlayerException e) {
            return "❌ Player: " + e.getMessage();
        }
    }

    private String handlePlayAll(String command, String[] args) {
        Integer pos = args.length == 0 ? Integer.valueOf(0) : parseInt(args[0]);
        if (pos == null)
            return "❌ Usage: playall [pos]";
        if (browse().current().isEmpty())
            return "📭 Nothing to play - search or open a playlist first.";
        try {
            browse().playFrom(pos);
            return "📜 Playing list from " + pos + ".";
        } catch (NotFoundException e) {
            return "❌ " + e.getMessage();
        } catch (PlayerException e) {
            return "❌ Player: " + e.getMessage();
        }
    }

    private String handleAdvance(Direction direction) {
        try {
            if (!controller().advance(direction))
                return "ℹ️ No playlist active.";
            return getStatusText();
        } catch (PlayerException e) {
            return "❌ Player: " + e.getMessage();
        }
    }

    private String handlePause(String command, String[] args) {
        try {
            return controller().togglePause() ? "⏯️ Toggled." : "ℹ️ Nothing playing.";
        } catch (PlayerException e) {
            return "❌ Player: " + e.getMessage();
        }
    }

    private String handleSeek(String command, String[] args) {
        Integer seconds = args.length == 0 ? null : parseInt(args[0]);
        if (seconds == null)
            return "❌ Usage: seek <±seconds>";
        try {
            if (!controller().seek(seconds))
                return "ℹ️ Nothing playing.";
            return controller().snapshot().playing()
                    .map(NowPlaying::elapsed)
                    .map(t -> "⏩ " + t)
                    .orElse("⏩ Seeked.");
        } catch (PlayerException e) {
            return "❌ Player: " + e.getMessage();
        }
    }

    private String handleVolume(String command, String[] args) {
        Integer delta = args.length == 0 ? null : parseInt(args[0]);
        if (delta == null)
            return "❌ Usage: vol <±delta>";
        try {
            if (!controller().changeVolume(delta))
                return "ℹ️ Nothing playing.";
            return controller().snapshot().playing()
                    .map(p -> "🔊 " + p.volume())
                    .orElse("🔊 Changed.");
        } catch (PlayerException e) {
            return "❌ Player: " + e.getMessage();
        }
    }

    private String handleStopPlaylist(String command, String[] args) {
        controller().stopPlaylistMode();
        return "⏹️ Playlist mode off.";
    }

    // =================================================================================
    // History
    // =================================================================================

    private String handleHistory(String command, String[] args) {
        Integer page = args.length == 0 ? Integer.valueOf(0) : parseInt(args[0]);
        if (page == null || page < 0)
            return "❌ Usage: history [page]";
        int size = kernel.getConfigManager().getConfig().historyPageSize;
        List<HistoryEntry> entries = history().recent(page * size, size);
        if (entries.isEmpty())
            return "📭 No history" + (page > 0 ? " on page " + page : "") + ".";

        StringBuilder sb = new StringBuilder("🕘 History (page " + page + ")\n");
        for (HistoryEntry e : entries)
            sb.append(String.format("  %s  x%-3d %s [%s]%n",
                    PLAYED_AT.format(Instant.ofEpochSecond(e.getLastPlayedAt())),
                    e.getPlayCount(), describe(e.getTrack()), e.getTrack().getId()));
        return sb.toString().trim();
    }

    private String handleTop(String command, String[] args) {
        Integer n = args.length == 0 ? Integer.valueOf(10) : parseInt(args[0]);
        if (n == null || n < 1)
            return "❌ Usage: top [n]";
        List<HistoryEntry> entries = history().mostPlayed(n);
        if (entries.isEmpty())
            return "📭 No history yet.";

        StringBuilder sb = new StringBuilder("🏆 Most played\n");
        int rank = 0;
        for (HistoryEntry e : entries)
            sb.append(String.format("%3d. x%-3d %s%n", ++rank, e.getPlayCount(), describe(e.getTrack())));
        return sb.toString().trim();
    }

    private String handleForget(String command, String[] args) {
        if (args.length == 0)
            return "❌ Usage: forget <trackId>";
        return history().delete(args[0]) ? "🗑️ Removed from history." : "ℹ️ Not in history.";
    }

    private String handleClearHistory(String command, String[] args) {
        int removed = history().clearAll();
        logger.info("History cleared by user ({} entries)", removed);
        return "🗑️ History cleared (" + removed + " entries).";
    }

    // =================================================================================
    // Playlists
    // =================================================================================

    private String handlePlaylistCreate(String command, String[] args) {
        if (args.length == 0)
            return "❌ Usage: pl-create <name>";
        String name = String.join(" ", args);
        try {
            playlists().create(name);
            return "✅ Playlist '" + name + "' created.";
        } catch (DuplicateNameException e) {
            return "❌ Playlist '" + name + "' already exists.";
        }
    }

    private String handlePlaylistAdd(String command, String[] args) {
        Integer pos = args.length < 2 ? null : parseInt(args[args.length - 1]);
        if (pos == null)
            return "❌ Usage: pl-add <name> <pos>";
        String name = String.join(" ", Arrays.copyOf(args, args.length - 1));
        try {
            Track track = browse().trackAt(pos);
            browse().addToPlaylist(name, track);
            return "➕ Added " + describe(track) + " to '" + name + "'.";
        } catch (NotFoundException e) {
            return "❌ " + e.getMessage();
        }
    }

    private String handlePlaylistRemove(String command, String[] args) {
        if (args.length < 2)
            return "❌ Usage: pl-remove <name> <trackId>";
        String name = String.join(" ", Arrays.copyOf(args, args.length - 1));
        String trackId = args[args.length - 1];
        try {
            return playlists().removeTrack(name, trackId)
                    ? "➖ Removed " + trackId + " from '" + name + "'."
                    : "ℹ️ " + trackId + " is not in '" + name + "'.";
        } catch (NotFoundException e) {
            return "❌ " + e.getMessage();
        }
    }

    private String handlePlaylistList(String command, String[] args) {
        List<String> names = playlists().listNames();
        if (names.isEmpty())
            return "📭 No playlists yet.";
        return "📚 Playlists\n  " + String.join("\n  ", names);
    }

    private String handlePlaylistOpen(String command, String[] args) {
        if (args.length == 0)
            return "❌ Usage: pl-open <name>";
        String name = String.join(" ", args);
        try {
            int count = browse().openUserPlaylist(name);
            return count == 0 ? "📭 '" + name + "' is empty." : renderPage(0);
        } catch (NotFoundException e) {
            return "❌ " + e.getMessage();
        }
    }

    private String handlePlaylistDelete(String command, String[] args) {
        if (args.length == 0)
            return "❌ Usage: pl-delete <name>";
        String name = String.join(" ", args);
        try {
            return playlists().delete(name) ? "🗑️ Playlist '" + name + "' deleted." : "ℹ️ No playlist '" + name + "'.";
        } catch (LibraryException e) {
            return "❌ " + e.getMessage();
        }
    }

    // =================================================================================
    // Helpers
    // =================================================================================

    private BrowseService browse() {
        BrowseService browse = kernel.getBrowseService();
        if (browse == null)
            throw new IllegalStateException("Session not started");
        return browse;
    }

    private PlaybackController controller() {
        PlaybackController controller = kernel.getPlaybackController();
        if (controller == null)
            throw new IllegalStateException("Session not started");
        return controller;
    }

    private HistoryStore history() {
        return kernel.getHistoryStore();
    }

    private PlaylistStore playlists() {
        return kernel.getPlaylistStore();
    }

    private static String describe(Track track) {
        String artists = track.getArtistLine();
        return artists.isEmpty() ? track.getTitle() : track.getTitle() + " - " + artists;
    }

    private static Integer parseInt(String s) {
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
