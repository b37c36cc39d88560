package com.trackdeck.services.database;

/**
 * Base class for everything that can go wrong in the persistence layer.
 */
public class LibraryException extends RuntimeException {
    public LibraryException(String message) {
        super(message);
    }

    public LibraryException(String message, Throwable cause) {
        super(message, cause);
    }
}
