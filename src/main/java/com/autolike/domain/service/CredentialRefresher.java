package com.autolike.domain.service;

import com.autolike.domain.exception.CredentialRefreshException;
import com.autolike.domain.model.Credential;
import com.autolike.domain.model.ResolvedCredential;
import com.autolike.domain.model.TokenGrant;
import com.autolike.infrastructure.persistence.CredentialStore;
import com.autolike.infrastructure.twitter.TwitterOAuth2Client;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns a stored credential into one that can be used for the like call.
 *
 * Resolution:
 * 1. Not yet expired: returned as-is, no upstream or store call
 * 2. Expired without refresh token: returned as-is, the like is attempted anyway
 * 3. Expired with refresh token: exchanged upstream, persisted, then returned
 *
 * The refreshed record is written before it is handed back, so a token is never
 * used without having been stored. On failure the stored record is not touched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialRefresher {

    private final TwitterOAuth2Client oauthClient;
    private final CredentialStore credentialStore;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ResolvedCredential resolve(String subjectId, Credential credential) {
        Instant now = clock.instant();

        if (!credential.isExpiredAt(now)) {
            return ResolvedCredential.unchanged(credential);
        }

        if (!credential.hasRefreshToken()) {
            log.debug("Credential of {} expired at {} and cannot be refreshed", subjectId, credential.getExpiresAt());
            return ResolvedCredential.unchanged(credential);
        }

        TokenGrant grant;
        try {
            grant = oauthClient.refresh(credential.getRefreshToken());
        } catch (RuntimeException e) {
            meterRegistry.counter("autolike.credential.refresh", "result", "failed").increment();
            throw new CredentialRefreshException(subjectId, "Token refresh rejected for " + subjectId, e);
        }

        Credential refreshed = Credential.builder()
                .subjectId(subjectId)
                .accessToken(grant.getAccessToken())
                .refreshToken(grant.getRefreshToken() != null ? grant.getRefreshToken() : credential.getRefreshToken())
                .expiresAt(clock.instant().plusSeconds(grant.getExpiresInSeconds()))
                .build();

        try {
            credentialStore.put(subjectId, refreshed);
        } catch (RuntimeException e) {
            // Upstream may already have rotated the refresh token; nothing left to roll back
            meterRegistry.counter("autolike.credential.refresh", "result", "failed").increment();
            throw new CredentialRefreshException(subjectId, "Refreshed credential of " + subjectId + " could not be stored", e);
        }

        meterRegistry.counter("autolike.credential.refresh", "result", "success").increment();
        log.info("Refreshed credential of {} (expires at {})", subjectId, refreshed.getExpiresAt());

        return ResolvedCredential.refreshed(refreshed);
    }
}
