package com.autolike.domain.exception;

/**
 * Upstream refused the stream connection outright (bad bearer token, forbidden).
 * Not retried.
 */
public class StreamRejectedException extends AutoLikeException {

    private final int status;

    public StreamRejectedException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
