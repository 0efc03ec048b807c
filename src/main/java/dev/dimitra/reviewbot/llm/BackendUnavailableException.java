package dev.dimitra.reviewbot.llm;

import java.io.IOException;

/**
 * Connection, authentication or non-2xx failure talking to a text-generation backend.
 */
public class BackendUnavailableException extends IOException {
    private final int statusCode;

    public BackendUnavailableException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status of the failed call, or -1 when no response was received. */
    public int statusCode() {
        return statusCode;
    }
}
