package com.trackdeck.services.database;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Gson based (de)serialization of the records kept in a {@link LibraryStore}.
 * Every current record carries a {@code schemaVersion} field.
 */
public class RecordCodec {
    private static final Logger logger = LoggerFactory.getLogger(RecordCodec.class);
    private final Gson gson;

    public RecordCodec() {
        this.gson = new GsonBuilder().disableHtmlEscaping().create();
    }

    public String encode(Object record) {
        return gson.toJson(record);
    }

    /**
     * Strict decode, used for single-key reads.
     */
    public <T> T decode(String key, String json, Class<T> type) {
        try {
            T value = gson.fromJson(json, type);
            if (value == null)
                throw new SerializationException(key, "empty record", null);
            return value;
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new SerializationException(key, e.getMessage(), e);
        }
    }

    /**
     * Lenient decode, used during full scans. Broken records are logged and skipped.
     */
    public <T> Optional<T> tryDecode(String key, String json, Class<T> type) {
        try {
            return Optional.of(decode(key, json, type));
        } catch (SerializationException e) {
            logger.warn("Skipping unreadable record {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads the schema version of a raw record; records without one are version 1.
     */
    public int schemaVersionOf(String key, String json) {
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject())
                throw new SerializationException(key, "not a JSON object", null);
            JsonObject obj = element.getAsJsonObject();
            return obj.has("schemaVersion") ? obj.get("schemaVersion").getAsInt() : 1;
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            throw new SerializationException(key, e.getMessage(), e);
        }
    }
}
