package com.fourinarow.protocol;

/**
 * A malformed inbound message: unparseable JSON, an unknown or outbound-only
 * type, or a missing or mistyped payload field. Always raised before any
 * state is touched.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
