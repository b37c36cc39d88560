package com.trackdeck.services.database;

/**
 * A persisted record could not be decoded (or encoded).
 */
public class SerializationException extends LibraryException {
    private final String key;

    public SerializationException(String key, String message, Throwable cause) {
        super("Record '" + key + "': " + message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
