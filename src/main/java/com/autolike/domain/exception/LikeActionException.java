package com.autolike.domain.exception;

public class LikeActionException extends AutoLikeException {

    public LikeActionException(String message, Throwable cause) {
        super(message, cause);
    }
}
