package com.phillippitts.ctcdecode.exception;

/**
 * Error codes surfaced by scorer loading, persistence and decoding setup.
 *
 * <p>Codes are stable integers so callers outside the JVM (bindings, exit codes) can map them.
 */
public enum ScorerError {

    INVALID_ALPHABET_SIZE(0x2000, "Alphabet size does not match the acoustic model output"),
    FILE_UNREADABLE(0x2002, "Scorer file is not readable"),
    INVALID_FORMAT(0x2003, "Scorer file does not start with a recognized language model"),
    MISSING_PACKAGE(0x2004, "Scorer file ends without a dictionary package"),
    CORRUPT_PACKAGE_HEADER(0x2005, "Scorer package header is invalid"),
    VERSION_MISMATCH(0x2006, "Scorer package version does not match"),
    INTERNAL_INCONSISTENCY(0x2007, "Internal consistency check failed"),
    PERSIST_FAILURE(0x2008, "Failed to write scorer package");

    private final int code;
    private final String description;

    ScorerError(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }

    /**
     * Formats the code the way native error codes are usually printed (e.g. {@code 0x2004}).
     */
    public String hexCode() {
        return "0x" + Integer.toHexString(code);
    }
}
