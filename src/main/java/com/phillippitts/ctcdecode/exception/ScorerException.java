package com.phillippitts.ctcdecode.exception;

import java.util.Objects;

/**
 * Thrown when a scorer package cannot be loaded or persisted, or when decoding setup
 * detects an inconsistency. Carries a {@link ScorerError} code alongside the diagnostic.
 *
 * <p>Load failures are terminal for that load attempt; nothing retries them.
 */
public class ScorerException extends CtcDecodeException {

    private final ScorerError error;
    private final String path;

    public ScorerException(ScorerError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
        this.path = null;
    }

    public ScorerException(ScorerError error, String message, String path) {
        super(message + " (path: " + path + ")");
        this.error = Objects.requireNonNull(error, "error");
        this.path = path;
    }

    public ScorerException(ScorerError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
        this.path = null;
    }

    public ScorerException(ScorerError error, String message, String path, Throwable cause) {
        super(message + " (path: " + path + ")", cause);
        this.error = Objects.requireNonNull(error, "error");
        this.path = path;
    }

    public ScorerError getError() {
        return error;
    }

    public int getCode() {
        return error.code();
    }

    /**
     * @return the file involved, or {@code null} when the failure is not tied to a file
     */
    public String getPath() {
        return path;
    }
}
