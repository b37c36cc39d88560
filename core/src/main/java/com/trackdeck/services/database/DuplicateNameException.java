package com.trackdeck.services.database;

public class DuplicateNameException extends LibraryException {
    private final String name;

    public DuplicateNameException(String name) {
        super("Duplicate playlist name: '" + name + "'");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
