package com.autolike.domain.exception;

/**
 * Base type for failures raised by the like pipeline.
 */
public class AutoLikeException extends RuntimeException {

    public AutoLikeException(String message) {
        super(message);
    }

    public AutoLikeException(String message, Throwable cause) {
        super(message, cause);
    }
}
