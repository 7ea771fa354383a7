package com.phillippitts.ctcdecode.exception;

/**
 * Base exception for all ctc-decode application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class CtcDecodeException extends RuntimeException {

    public CtcDecodeException(String message) {
        super(message);
    }

    public CtcDecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    public CtcDecodeException(Throwable cause) {
        super(cause);
    }
}
