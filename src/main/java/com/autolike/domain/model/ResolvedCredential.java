package com.autolike.domain.model;

import lombok.Value;

/**
 * Credential ready for the like call, and whether it was refreshed to get there.
 */
@Value
public class ResolvedCredential {

    Credential credential;
    boolean updated;

    public static ResolvedCredential unchanged(Credential credential) {
        return new ResolvedCredential(credential, false);
    }

    public static ResolvedCredential refreshed(Credential credential) {
        return new ResolvedCredential(credential, true);
    }

    public String accessToken() {
        return credential.getAccessToken();
    }
}
