package com.trackdeck.services.database;

public class NotFoundException extends LibraryException {
    public NotFoundException(String message) {
        super(message);
    }
}
