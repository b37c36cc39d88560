package com.plugins.youtube.internal;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.trackdeck.api.ResolutionException;
import com.trackdeck.api.ResolutionService;
import com.trackdeck.common.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link ResolutionService} on top of yt-dlp: every lookup is one
 * {@code yt-dlp --flat-playlist -J <target>} call whose JSON lists the entries.
 */
public class YtDlpResolver implements ResolutionService {
    private static final Logger logger = LoggerFactory.getLogger(YtDlpResolver.class);

    // sp=EgIQAw%3D%3D = nur Playlists
    private static final String PLAYLIST_SEARCH_URL = "https://www.youtube.com/results?sp=EgIQAw%%3D%%3D&search_query=%s";
    private static final String PLAYLIST_URL = "https://www.youtube.com/playlist?list=%s";

    private final String ytDlpPath;
    private final int searchLimit;
    private final long timeoutSeconds;

    public YtDlpResolver(String ytDlpPath, int searchLimit, long timeoutSeconds) {
        this.ytDlpPath = ytDlpPath;
        this.searchLimit = searchLimit;
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public List<SearchResult> search(String query) throws ResolutionException {
        return parseEntries(run("ytsearch" + searchLimit + ":" + query));
    }

    @Override
    public List<SearchResult> resolvePlaylist(String query) throws ResolutionException {
        String url = String.format(PLAYLIST_SEARCH_URL, URLEncoder.encode(query, StandardCharsets.UTF_8));
        return parseEntries(run("--playlist-end", String.valueOf(searchLimit), url));
    }

    @Override
    public List<SearchResult> expandPlaylist(String playlistId) throws ResolutionException {
        String target = playlistId.startsWith("http") ? playlistId : String.format(PLAYLIST_URL, playlistId);
        return parseEntries(run(target));
    }

    private String run(String... target) throws ResolutionException {
        List<String> cmd = new ArrayList<>();
        cmd.add(ytDlpPath);
        cmd.add("--flat-playlist");
        cmd.add("-J");
        cmd.add("--no-warnings");
        cmd.addAll(List.of(target));

        Process process;
        try {
            process = new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            throw new ResolutionException("Cannot run yt-dlp: " + e.getMessage(), e);
        }

        // beide Streams parallel lesen, sonst blockiert der Prozess bei vollem Puffer
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readFully(process.getErrorStream()));

        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ResolutionException("yt-dlp timed out after " + timeoutSeconds + "s");
            }
            if (process.exitValue() != 0) {
                String err = stderr.get(5, TimeUnit.SECONDS).trim();
                logger.warn("yt-dlp exited with {}: {}", process.exitValue(), err);
                throw new ResolutionException(err.isEmpty() ? "yt-dlp failed with exit code " + process.exitValue() : lastLine(err));
            }
            return stdout.get(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ResolutionException("Interrupted while waiting for yt-dlp", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ResolutionException("Reading yt-dlp output failed: " + e.getMessage(), e);
        }
    }

    /**
     * Maps the {@code entries} of a yt-dlp JSON document to search results. Entries
     * without an id are dropped. Artists come from {@code artists}/{@code artist}, then
     * {@code channel}/{@code uploader}.
     */
    static List<SearchResult> parseEntries(String json) throws ResolutionException {
        JsonObject root;
        try {
            JsonElement parsed = JsonParser.parseString(json);
            if (!parsed.isJsonObject())
                throw new ResolutionException("Unexpected yt-dlp output");
            root = parsed.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new ResolutionException("Unreadable yt-dlp output: " + e.getMessage(), e);
        }

        List<SearchResult> results = new ArrayList<>();
        if (!root.has("entries") || !root.get("entries").isJsonArray())
            return results;

        for (JsonElement element : root.getAsJsonArray("entries")) {
            if (!element.isJsonObject())
                continue;
            JsonObject entry = element.getAsJsonObject();
            String id = string(entry, "id");
            if (id == null || id.isBlank())
                continue;
            String title = string(entry, "title");
            results.add(new SearchResult(title != null ? title : id, id, artists(entry)));
        }
        return results;
    }

    private static List<String> artists(JsonObject entry) {
        List<String> artists = new ArrayList<>();
        if (entry.has("artists") && entry.get("artists").isJsonArray()) {
            JsonArray array = entry.getAsJsonArray("artists");
            for (JsonElement a : array) {
                if (a.isJsonPrimitive())
                    artists.add(a.getAsString());
            }
        }
        if (artists.isEmpty()) {
            for (String key : new String[] { "artist", "channel", "uploader" }) {
                String value = string(entry, key);
                if (value != null && !value.isBlank()) {
                    artists.add(value);
                    break;
                }
            }
        }
        return artists;
    }

    private static String string(JsonObject obj, String key) {
        JsonElement value = obj.get(key);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private static String lastLine(String text) {
        String[] lines = text.split("\\R");
        return lines[lines.length - 1];
    }

    private static String readFully(InputStream in) {
        try (InputStream stream = in) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            stream.transferTo(out);
            return out.toString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            logger.debug("Reading yt-dlp output failed: {}", e.getMessage());
            return "";
        }
    }
}
