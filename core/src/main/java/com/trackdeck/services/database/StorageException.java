package com.trackdeck.services.database;

/**
 * Open, read, write or flush failure of a {@link LibraryStore}.
 */
public class StorageException extends LibraryException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
