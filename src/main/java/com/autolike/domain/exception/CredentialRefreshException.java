package com.autolike.domain.exception;

/**
 * Refreshing one subscriber's credential failed. The stored record is left as it was.
 */
public class CredentialRefreshException extends AutoLikeException {

    private final String subjectId;

    public CredentialRefreshException(String subjectId, String message, Throwable cause) {
        super(message, cause);
        this.subjectId = subjectId;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
