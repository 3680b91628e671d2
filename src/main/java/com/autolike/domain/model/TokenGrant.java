package com.autolike.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Token pair issued by the OAuth2 token endpoint.
 */
@Value
@Builder
public class TokenGrant {

    String accessToken;
    String refreshToken;
    long expiresInSeconds;

    @Override
    public String toString() {
        return "TokenGrant(expiresInSeconds=" + expiresInSeconds
                + ", refreshable=" + (refreshToken != null) + ")";
    }
}
