package com.autolike.domain.exception;

/**
 * A stream line did not match the expected post shape.
 */
public class StreamEventValidationException extends AutoLikeException {

    public StreamEventValidationException(String message) {
        super(message);
    }

    public StreamEventValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
