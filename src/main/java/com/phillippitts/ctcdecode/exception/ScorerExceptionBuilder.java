package com.phillippitts.ctcdecode.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing ScorerException with rich contextual information.
 *
 * <p>Keeps load, save and setup failures consistent: every diagnostic carries the error code
 * plus whatever offsets, versions or sizes explain the failure.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Simple exception
 * throw ScorerExceptionBuilder.create(ScorerError.MISSING_PACKAGE, "File ends without a trie structure")
 *         .path(path)
 *         .build();
 *
 * // With cause and metadata
 * throw ScorerExceptionBuilder.create(ScorerError.VERSION_MISMATCH, "Scorer file version mismatch")
 *         .path(path)
 *         .metadata("found", version)
 *         .metadata("expected", FILE_VERSION)
 *         .build();
 * </pre>
 */
public final class ScorerExceptionBuilder {

    private final ScorerError error;
    private final String message;
    private String path;
    private Throwable cause;
    private String hint;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ScorerExceptionBuilder(ScorerError error, String message) {
        this.error = error;
        this.message = message;
    }

    /**
     * Creates a new builder with the error code and base error message.
     *
     * @param error error code (must not be null)
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ScorerExceptionBuilder create(ScorerError error, String message) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ScorerExceptionBuilder(error, message);
    }

    /**
     * Sets the file involved in the failure.
     *
     * @param path scorer file path
     * @return this builder for chaining
     */
    public ScorerExceptionBuilder path(Object path) {
        this.path = path == null ? null : String.valueOf(path);
        return this;
    }

    /**
     * Sets the root cause of the exception.
     *
     * @param cause underlying exception
     * @return this builder for chaining
     */
    public ScorerExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Appends an actionable suggestion to the message (e.g. "Update your scorer file.").
     *
     * @param hint sentence telling the user how to recover
     * @return this builder for chaining
     */
    public ScorerExceptionBuilder hint(String hint) {
        this.hint = hint;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ScorerExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the ScorerException with the configured properties.
     *
     * <p>The final message format is:
     * <pre>
     * {message} (code={hex}, {key1}={val1}, ...). {hint}
     * </pre>
     *
     * @return constructed ScorerException
     */
    public ScorerException build() {
        String detailedMessage = buildDetailedMessage();
        if (path != null) {
            return cause != null
                    ? new ScorerException(error, detailedMessage, path, cause)
                    : new ScorerException(error, detailedMessage, path);
        }
        return cause != null
                ? new ScorerException(error, detailedMessage, cause)
                : new ScorerException(error, detailedMessage);
    }

    private String buildDetailedMessage() {
        StringBuilder sb = new StringBuilder(message);
        sb.append(" (code=").append(error.hexCode());
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(", ").append(entry.getKey()).append("=").append(entry.getValue());
        }
        sb.append(")");
        if (hint != null && !hint.isBlank()) {
            sb.append(". ").append(hint);
        }
        return sb.toString();
    }
}
