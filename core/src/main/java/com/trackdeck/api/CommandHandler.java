package com.trackdeck.api;

/**
 * Console command (plugins can register their own). Returns the text shown to the user.
 */
public interface CommandHandler {
    String handle(String command, String[] args);
}
