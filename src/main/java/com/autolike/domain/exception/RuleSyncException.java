package com.autolike.domain.exception;

/**
 * Upstream refused to delete or install a filter rule. The feed must not be opened.
 */
public class RuleSyncException extends AutoLikeException {

    public RuleSyncException(String message) {
        super(message);
    }

    public RuleSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
