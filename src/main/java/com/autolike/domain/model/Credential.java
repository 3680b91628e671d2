package com.autolike.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Stored access credential of one subscriber.
 *
 * Written by the registration flow on first login, rewritten by the refresher
 * whenever the access token has expired and a refresh token is available.
 * A credential without refresh token is used as-is until the upstream rejects it.
 */
@Value
@Builder(toBuilder = true)
public class Credential {

    String subjectId;
    String accessToken;
    String refreshToken;
    Instant expiresAt;

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /**
     * The access token is valid strictly before {@code expiresAt}.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Credential(subjectId=" + subjectId + ", expiresAt=" + expiresAt
                + ", refreshable=" + hasRefreshToken() + ")";
    }
}
