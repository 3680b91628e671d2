package com.autolike.domain.exception;

/**
 * A stored credential record could not be read or written.
 */
public class CredentialCodecException extends AutoLikeException {

    public CredentialCodecException(String message) {
        super(message);
    }

    public CredentialCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
