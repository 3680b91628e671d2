package com.autolike.domain.service;

import com.autolike.domain.model.Credential;
import com.autolike.domain.model.TokenGrant;
import com.autolike.infrastructure.persistence.CredentialStore;
import com.autolike.infrastructure.twitter.TwitterOAuth2Client;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialRegistrarTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock private TwitterOAuth2Client oauthClient;
    @Mock private CredentialStore credentialStore;

    private CredentialRegistrar credentialRegistrar;

    @BeforeEach
    void setUp() {
        credentialRegistrar = new CredentialRegistrar(oauthClient, credentialStore, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void register_exchangesCode_andStoresCredential() {
        when(oauthClient.exchangeCode("code-1", "https://host/callback", "verifier"))
                .thenReturn(TokenGrant.builder()
                        .accessToken("A1")
                        .refreshToken("R1")
                        .expiresInSeconds(7200)
                        .build());

        Credential credential = credentialRegistrar.register("U1", "code-1", "https://host/callback", "verifier");

        assertEquals("U1", credential.getSubjectId());
        assertEquals("A1", credential.getAccessToken());
        assertEquals("R1", credential.getRefreshToken());
        assertEquals(NOW.plusSeconds(7200), credential.getExpiresAt());
        verify(credentialStore).put("U1", credential);
    }

    @Test
    void register_grantWithoutRefreshToken_storesNonRefreshableCredential() {
        Credential credential = credentialRegistrar.register("U1", TokenGrant.builder()
                .accessToken("A1")
                .expiresInSeconds(60)
                .build());

        assertFalse(credential.hasRefreshToken());
        verify(credentialStore).put("U1", credential);
        verifyNoInteractions(oauthClient);
    }
}
