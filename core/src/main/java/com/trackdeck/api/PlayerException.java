package com.trackdeck.api;

/**
 * A command sent to the external player failed (process gone, nothing loaded, IPC error).
 */
public class PlayerException extends Exception {
    public PlayerException(String message) {
        super(message);
    }

    public PlayerException(String message, Throwable cause) {
        super(message, cause);
    }
}
