package com.trackdeck.api;

/**
 * Remote search or playlist expansion failed. The message is shown to the user as is.
 */
public class ResolutionException extends Exception {
    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
