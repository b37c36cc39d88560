package com.trackdeck.core.playback;

import com.trackdeck.api.ExternalPlayer;
import com.trackdeck.api.PlayerException;
import com.trackdeck.common.model.Track;
import com.trackdeck.core.config.Configuration;
import com.trackdeck.core.signal.SessionSignals;
import com.trackdeck.services.database.LibraryException;
import com.trackdeck.services.history.HistoryStore;
import com.trackdeck.services.pages.SongPageStore;
import com.trackdeck.services.profile.ProfileStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * PlaybackController - owns the playback session and is the only place that changes it.
 * <p>
 * State machine: {@code IDLE -> LOADING} on every play request, {@code LOADING -> PLAYING}
 * once the confirmer sees the player playing, {@code PLAYING -> IDLE} when the track ends
 * and there is nothing to advance to, any state {@code -> ERROR} when a player command
 * fails. All session fields are guarded by {@code lock}; readers get a {@link SessionSnapshot}.
 * <p>
 * Every play request gets a new {@link SessionToken}. The previous token is cancelled, so
 * its confirmer retires and late results from it are ignored. The latest request wins.
 */
public class PlaybackController {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackController.class);

    private final ExternalPlayer player;
    private final HistoryStore history;
    private final ProfileStore profile;
    private final SessionSignals signals;
    private final Configuration config;
    private final ScheduledExecutorService scheduler;

    private final ReentrantLock lock = new ReentrantLock();
    // Player-Befehle nacheinander, damit der letzte Request auch zuletzt beim Player ankommt
    private final ReentrantLock commandLock = new ReentrantLock(true);
    private final List<PollingTask> backgroundTasks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    // --- Session (guarded by lock) ---
    private SessionState state = SessionState.IDLE;
    private Track currentTrack;
    private boolean playlistMode = false;
    private SongPageStore activePlaylist;
    private int playlistIndex = -1;
    private NowPlaying nowPlaying;
    private SessionToken token = new SessionToken(0);
    private String lastError;

    public PlaybackController(ExternalPlayer player, HistoryStore history, ProfileStore profile,
                              SessionSignals signals, Configuration config) {
        this.player = player;
        this.history = history;
        this.profile = profile;
        this.signals = signals;
        this.config = config;
        this.scheduler = newScheduler();
    }

    private static ScheduledExecutorService newScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "Session-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // =================================================================================
    // Lifecycle
    // =================================================================================

    /**
     * Starts the long-lived background tasks (end-of-track watcher, time observer,
     * listening-time tracker).
     */
    public void start() {
        if (running.getAndSet(true))
            return;
        schedule(new EndOfTrackWatcher(this, player, config.endOfTrackIdleThreshold),
                config.endOfTrackPollMillis, config.endOfTrackPollMillis);
        schedule(new TimeObserver(this, player), config.timeObserverMillis, config.timeObserverMillis);
        if (profile != null) {
            schedule(new ListeningTimeTracker(player, profile, config.listeningTrackerMillis),
                    config.listeningTrackerMillis, config.listeningTrackerMillis);
        }
        logger.info("🎧 Playback session started ({} background tasks)", backgroundTasks.size());
    }

    public void shutdown() {
        running.set(false);
        for (PollingTask task : backgroundTasks)
            task.retire();
        backgroundTasks.clear();

        lock.lock();
        try {
            token.cancel();
            closeActivePlaylist();
        } finally {
            lock.unlock();
        }

        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS))
                logger.warn("Session scheduler did not terminate in time");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("🛑 Playback session stopped.");
    }

    public boolean isRunning() {
        return running.get();
    }

    // =================================================================================
    // Play requests
    // =================================================================================

    /**
     * Plays {@code track}. In playlist mode the track is not looped so its natural end
     * can advance the playlist; a single track loops and leaves playlist mode.
     *
     * @throws PlayerException if the player rejects the command; the session is then
     *                         in {@code ERROR}
     */
    public void playTrack(Track track, boolean playlistMode) throws PlayerException {
        SessionToken request = beginRequest(playlistMode);
        String url = config.mediaUrl(track.getId());

        commandLock.lock();
        try {
            if (request.isCancelled()) {
                logger.debug("Play of {} superseded before reaching the player", track.getId());
                return;
            }

            try {
                player.play(url);
            } catch (PlayerException e) {
                fail(request, "play", e);
                throw e;
            }

            lock.lock();
            try {
                if (!isCurrent(request))
                    return;
                currentTrack = track;
            } finally {
                lock.unlock();
            }

            recordHistory(request, track);

            try {
                player.setLoop(!playlistMode);
            } catch (PlayerException e) {
                fail(request, "set loop", e);
                throw e;
            }
        } finally {
            commandLock.unlock();
        }

        signals.nowPlayingChanged().publish(playlistMode);
        startConfirmer(request);
        logger.info("▶️ Playing: {} - {}{}", track.getTitle(), track.getArtistLine(), playlistMode ? " (playlist)" : "");
    }

    /**
     * Starts playlist mode on a private copy of {@code pages} at {@code startIndex}.
     *
     * @throws com.trackdeck.services.database.NotFoundException if there is no track at
     *                                                           {@code startIndex}
     */
    public void playPlaylist(SongPageStore pages, int startIndex) throws PlayerException {
        SongPageStore copy = pages.copy();
        Track track = copy.getByPosition(startIndex);

        lock.lock();
        try {
            closeActivePlaylist();
            activePlaylist = copy;
            playlistIndex = startIndex;
            playlistMode = true;
        } finally {
            lock.unlock();
        }

        logger.info("📜 Playlist mode: {} tracks, starting at {}", copy.length(), startIndex);
        playTrack(track, true);
    }

    /**
     * Moves through the active playlist: NEXT wraps around, PREVIOUS stops at the first
     * track.
     *
     * @return false if there is no (non-empty) active playlist
     */
    public boolean advance(Direction direction) throws PlayerException {
        return advance(direction, -1);
    }

    private boolean advance(Direction direction, long expectedGeneration) throws PlayerException {
        Track next;
        lock.lock();
        try {
            if (expectedGeneration >= 0 && token.getGeneration() != expectedGeneration)
                return false;
            if (!playlistMode || activePlaylist == null || activePlaylist.isEmpty())
                return false;

            int length = activePlaylist.length();
            int target = direction == Direction.NEXT
                    ? (playlistIndex + 1) % length
                    : Math.max(playlistIndex - 1, 0);
            next = activePlaylist.getByPosition(target);
            playlistIndex = target;
        } finally {
            lock.unlock();
        }

        logger.debug("Advance {} -> {}", direction, next.getId());
        playTrack(next, true);
        return true;
    }

    /**
     * Leaves playlist mode. The current track keeps playing.
     */
    public void stopPlaylistMode() {
        long generation;
        lock.lock();
        try {
            closeActivePlaylist();
            playlistMode = false;
            playlistIndex = -1;
            generation = token.getGeneration();
        } finally {
            lock.unlock();
        }
        signals.playlistEnded().publish(generation);
        logger.info("📜 Playlist mode ended.");
    }

    // =================================================================================
    // Player controls
    // =================================================================================

    /**
     * @return false if nothing is playing
     */
    public boolean togglePause() throws PlayerException {
        SessionToken current = currentTokenIfPlaying();
        if (current == null)
            return false;

        commandLock.lock();
        try {
            player.pauseResume();
        } catch (PlayerException e) {
            fail(current, "pause", e);
            throw e;
        } finally {
            commandLock.unlock();
        }

        lock.lock();
        try {
            if (isCurrent(current) && nowPlaying != null)
                nowPlaying = nowPlaying.withPaused(!nowPlaying.paused());
        } finally {
            lock.unlock();
        }
        return true;
    }

    /**
     * Relative seek in the current track.
     *
     * @return false if nothing is playing
     */
    public boolean seek(long seconds) throws PlayerException {
        SessionToken current = currentTokenIfPlaying();
        if (current == null)
            return false;

        commandLock.lock();
        try {
            player.seek(seconds);
        } catch (PlayerException e) {
            fail(current, "seek", e);
            throw e;
        } finally {
            commandLock.unlock();
        }

        try {
            updateElapsed(current.getGeneration(), player.timePosition());
        } catch (PlayerException e) {
            logger.debug("Position after seek unavailable: {}", e.getMessage());
        }
        return true;
    }

    /**
     * Relative volume change.
     *
     * @return false if nothing is playing
     */
    public boolean changeVolume(long delta) throws PlayerException {
        SessionToken current = currentTokenIfPlaying();
        if (current == null)
            return false;

        commandLock.lock();
        try {
            player.changeVolume(delta);
        } catch (PlayerException e) {
            fail(current, "volume", e);
            throw e;
        } finally {
            commandLock.unlock();
        }

        try {
            long volume = player.currentVolume();
            lock.lock();
            try {
                if (isCurrent(current) && nowPlaying != null)
                    nowPlaying = nowPlaying.withVolume(volume);
            } finally {
                lock.unlock();
            }
        } catch (PlayerException e) {
            logger.debug("Volume after change unavailable: {}", e.getMessage());
        }
        return true;
    }

    // =================================================================================
    // Readers
    // =================================================================================

    public SessionSnapshot snapshot() {
        lock.lock();
        try {
            return new SessionSnapshot(
                    state,
                    currentTrack,
                    playlistMode,
                    playlistIndex,
                    activePlaylist == null ? 0 : activePlaylist.length(),
                    nowPlaying,
                    token.getGeneration(),
                    lastError);
        } finally {
            lock.unlock();
        }
    }

    // =================================================================================
    // Callbacks from the background tasks
    // =================================================================================

    void confirmPlaying(SessionToken request) {
        String duration = player.duration();
        long volume = 0;
        try {
            volume = player.currentVolume();
        } catch (PlayerException e) {
            logger.debug("Volume unavailable: {}", e.getMessage());
        }

        lock.lock();
        try {
            if (!isCurrent(request) || state != SessionState.LOADING)
                return;
            state = SessionState.PLAYING;
            nowPlaying = new NowPlaying(currentTrack, 0, duration, volume, false);
        } finally {
            lock.unlock();
        }
        logger.debug("Playback confirmed for {}", request);
    }

    void confirmIdle(SessionToken request) {
        lock.lock();
        try {
            if (!isCurrent(request) || state != SessionState.LOADING)
                return;
            state = SessionState.IDLE;
            nowPlaying = null;
        } finally {
            lock.unlock();
        }
    }

    void updateElapsed(long generation, long seconds) {
        lock.lock();
        try {
            if (generation == token.getGeneration() && nowPlaying != null)
                nowPlaying = nowPlaying.withElapsed(seconds);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The track of {@code generation} stopped on its own. Advances in playlist mode,
     * otherwise the session goes idle.
     */
    void trackEnded(long generation) {
        boolean advanceable;
        lock.lock();
        try {
            if (generation != token.getGeneration()) {
                logger.debug("Ignoring end of stale generation {}", generation);
                return;
            }
            advanceable = playlistMode && activePlaylist != null && !activePlaylist.isEmpty();
            if (!advanceable) {
                state = SessionState.IDLE;
                nowPlaying = null;
            }
        } finally {
            lock.unlock();
        }

        if (advanceable) {
            try {
                advance(Direction.NEXT, generation);
            } catch (PlayerException e) {
                logger.error("❌ Auto-advance failed: {}", e.getMessage());
            }
        } else {
            logger.info("⏹️ Track finished, session idle.");
        }
    }

    // =================================================================================
    // Internals
    // =================================================================================

    private SessionToken beginRequest(boolean playlistRequest) {
        SessionToken request;
        boolean leftPlaylist = false;
        lock.lock();
        try {
            token.cancel();
            token = new SessionToken(token.getGeneration() + 1);
            request = token;
            state = SessionState.LOADING;
            nowPlaying = null;
            lastError = null;
            if (playlistRequest) {
                playlistMode = true;
            } else if (playlistMode) {
                closeActivePlaylist();
                playlistMode = false;
                playlistIndex = -1;
                leftPlaylist = true;
            }
        } finally {
            lock.unlock();
        }
        if (leftPlaylist)
            signals.playlistEnded().publish(request.getGeneration());
        return request;
    }

    private void recordHistory(SessionToken request, Track track) {
        try {
            history.recordPlay(track);
        } catch (LibraryException e) {
            logger.error("Failed to record play of {}", track.getId(), e);
            lock.lock();
            try {
                if (isCurrent(request))
                    lastError = "History: " + e.getMessage();
            } finally {
                lock.unlock();
            }
        }
    }

    private void startConfirmer(SessionToken request) {
        if (scheduler.isShutdown())
            return;
        PlayingStateConfirmer confirmer = new PlayingStateConfirmer(this, player, request, config.confirmIdleBudget);
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(confirmer,
                config.confirmInitialDelayMillis, config.confirmPollMillis, TimeUnit.MILLISECONDS);
        confirmer.attach(future);
    }

    private void schedule(PollingTask task, long initialDelayMillis, long periodMillis) {
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(task, initialDelayMillis, periodMillis,
                TimeUnit.MILLISECONDS);
        task.attach(future);
        backgroundTasks.add(task);
    }

    SessionToken currentToken() {
        lock.lock();
        try {
            return token;
        } finally {
            lock.unlock();
        }
    }

    private SessionToken currentTokenIfPlaying() {
        lock.lock();
        try {
            return state == SessionState.PLAYING ? token : null;
        } finally {
            lock.unlock();
        }
    }

    private void fail(SessionToken request, String command, PlayerException e) {
        logger.error("❌ Player command '{}' failed: {}", command, e.getMessage());
        lock.lock();
        try {
            if (!isCurrent(request))
                return;
            state = SessionState.ERROR;
            nowPlaying = null;
            lastError = command + " failed: " + e.getMessage();
        } finally {
            lock.unlock();
        }
    }

    // caller holds lock
    private boolean isCurrent(SessionToken request) {
        return request == token && !request.isCancelled();
    }

    // caller holds lock
    private void closeActivePlaylist() {
        if (activePlaylist != null) {
            activePlaylist.close();
            activePlaylist = null;
        }
    }
}
