package com.autolike.domain.service;

import com.autolike.domain.model.Credential;
import com.autolike.domain.model.TokenGrant;
import com.autolike.infrastructure.persistence.CredentialStore;
import com.autolike.infrastructure.twitter.TwitterOAuth2Client;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Writes the first credential of a subscriber, in the same record shape the
 * refresher reads. Entry point for a registration front end.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialRegistrar {

    private final TwitterOAuth2Client oauthClient;
    private final CredentialStore credentialStore;
    private final Clock clock;

    public Credential register(String subjectId, String code, String redirectUri, String codeVerifier) {
        return register(subjectId, oauthClient.exchangeCode(code, redirectUri, codeVerifier));
    }

    public Credential register(String subjectId, TokenGrant grant) {
        Credential credential = Credential.builder()
                .subjectId(subjectId)
                .accessToken(grant.getAccessToken())
                .refreshToken(grant.getRefreshToken())
                .expiresAt(clock.instant().plusSeconds(grant.getExpiresInSeconds()))
                .build();

        credentialStore.put(subjectId, credential);
        log.info("Registered subscriber {}", subjectId);
        return credential;
    }
}
