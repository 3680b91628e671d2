package com.autolike.domain.service;

import com.autolike.domain.exception.CredentialRefreshException;
import com.autolike.domain.model.Credential;
import com.autolike.domain.model.ResolvedCredential;
import com.autolike.domain.model.TokenGrant;
import com.autolike.infrastructure.persistence.CredentialStore;
import com.autolike.infrastructure.twitter.TwitterOAuth2Client;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialRefresherTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock private TwitterOAuth2Client oauthClient;
    @Mock private CredentialStore credentialStore;

    private MeterRegistry meterRegistry;
    private CredentialRefresher credentialRefresher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        credentialRefresher = new CredentialRefresher(
                oauthClient,
                credentialStore,
                meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
    }

    @Test
    void resolve_notExpired_returnsUnchanged_withoutUpstreamOrStoreCalls() {
        Credential credential = credential("U1", "A1", "R1", NOW.plusSeconds(60));

        ResolvedCredential result = credentialRefresher.resolve("U1", credential);

        assertFalse(result.isUpdated());
        assertSame(credential, result.getCredential());
        verifyNoInteractions(oauthClient, credentialStore);
    }

    @Test
    void resolve_expiredWithRefreshToken_refreshesAndStoresBeforeReturning() {
        Credential stale = credential("U1", "A1", "R1", NOW.minus(Duration.ofHours(1)));
        when(oauthClient.refresh("R1")).thenReturn(TokenGrant.builder()
                .accessToken("A2")
                .refreshToken("R2")
                .expiresInSeconds(7200)
                .build());

        ResolvedCredential result = credentialRefresher.resolve("U1", stale);

        assertTrue(result.isUpdated());
        assertEquals("A2", result.accessToken());

        ArgumentCaptor<Credential> stored = ArgumentCaptor.forClass(Credential.class);
        InOrder inOrder = inOrder(oauthClient, credentialStore);
        inOrder.verify(oauthClient, times(1)).refresh("R1");
        inOrder.verify(credentialStore).put(eq("U1"), stored.capture());

        assertEquals("A2", stored.getValue().getAccessToken());
        assertEquals("R2", stored.getValue().getRefreshToken());
        assertEquals(NOW.plusSeconds(7200), stored.getValue().getExpiresAt());
        assertEquals(stored.getValue(), result.getCredential());
        assertEquals(1.0, meterRegistry.counter("autolike.credential.refresh", "result", "success").count());
    }

    @Test
    void resolve_expiredExactlyNow_isRefreshed() {
        Credential stale = credential("U1", "A1", "R1", NOW);
        when(oauthClient.refresh("R1")).thenReturn(TokenGrant.builder()
                .accessToken("A2")
                .refreshToken("R2")
                .expiresInSeconds(60)
                .build());

        ResolvedCredential result = credentialRefresher.resolve("U1", stale);

        assertTrue(result.isUpdated());
        verify(credentialStore).put(eq("U1"), any(Credential.class));
    }

    @Test
    void resolve_grantWithoutRefreshToken_keepsPreviousRefreshToken() {
        Credential stale = credential("U1", "A1", "R1", NOW.minus(Duration.ofHours(1)));
        when(oauthClient.refresh("R1")).thenReturn(TokenGrant.builder()
                .accessToken("A2")
                .expiresInSeconds(7200)
                .build());

        ResolvedCredential result = credentialRefresher.resolve("U1", stale);

        ArgumentCaptor<Credential> stored = ArgumentCaptor.forClass(Credential.class);
        verify(credentialStore).put(eq("U1"), stored.capture());
        assertEquals("A2", stored.getValue().getAccessToken());
        assertEquals("R1", stored.getValue().getRefreshToken());
        assertTrue(result.getCredential().hasRefreshToken());
    }

    @Test
    void resolve_expiredWithoutRefreshToken_returnsStaleCredential() {
        Credential stale = credential("U1", "A1", null, NOW.minusSeconds(10));

        ResolvedCredential result = credentialRefresher.resolve("U1", stale);

        assertFalse(result.isUpdated());
        assertEquals("A1", result.accessToken());
        verifyNoInteractions(oauthClient, credentialStore);
    }

    @Test
    void resolve_refreshRejected_throws_andLeavesStoreUntouched() {
        Credential stale = credential("U1", "A1", "revoked", NOW.minusSeconds(10));
        when(oauthClient.refresh("revoked"))
                .thenThrow(WebClientResponseException.create(400, "Bad Request", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8));

        CredentialRefreshException ex = assertThrows(CredentialRefreshException.class,
                () -> credentialRefresher.resolve("U1", stale));

        assertEquals("U1", ex.getSubjectId());
        verify(credentialStore, never()).put(anyString(), any());
        assertEquals(1.0, meterRegistry.counter("autolike.credential.refresh", "result", "failed").count());
    }

    @Test
    void resolve_refreshedButNotStored_throws() {
        Credential stale = credential("U1", "A1", "R1", NOW.minusSeconds(10));
        when(oauthClient.refresh("R1")).thenReturn(TokenGrant.builder()
                .accessToken("A2")
                .refreshToken("R2")
                .expiresInSeconds(7200)
                .build());
        doThrow(new IllegalStateException("redis down")).when(credentialStore).put(eq("U1"), any());

        assertThrows(CredentialRefreshException.class, () -> credentialRefresher.resolve("U1", stale));
    }

    private static Credential credential(String subjectId, String accessToken, String refreshToken, Instant expiresAt) {
        return Credential.builder()
                .subjectId(subjectId)
                .accessToken(accessToken)
                .refreshToken(refreshToken)
                .expiresAt(expiresAt)
                .build();
    }
}
