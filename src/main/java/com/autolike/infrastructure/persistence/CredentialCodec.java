package com.autolike.infrastructure.persistence;

import com.autolike.domain.exception.CredentialCodecException;
import com.autolike.domain.model.Credential;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * JSON shape of a stored credential.
 *
 * Version 1: {"version":1,"accessToken":"..","refreshToken":"..","expiresAt":epochMillis}.
 * Records without a version were written before versioning and share the v1 layout.
 * Unknown properties are ignored, unknown versions are rejected.
 */
@Component
@RequiredArgsConstructor
public class CredentialCodec {

    public static final int CURRENT_VERSION = 1;

    private final ObjectMapper objectMapper;

    public String encode(Credential credential) {
        StoredCredential stored = new StoredCredential(
                CURRENT_VERSION,
                credential.getAccessToken(),
                credential.getRefreshToken(),
                credential.getExpiresAt().toEpochMilli());
        try {
            return objectMapper.writeValueAsString(stored);
        } catch (JsonProcessingException e) {
            throw new CredentialCodecException("Cannot encode credential of " + credential.getSubjectId(), e);
        }
    }

    public Credential decode(String subjectId, String json) {
        StoredCredential stored;
        try {
            stored = objectMapper.readValue(json, StoredCredential.class);
        } catch (JsonProcessingException e) {
            throw new CredentialCodecException("Malformed credential record for " + subjectId, e);
        }
        if (stored == null) {
            throw new CredentialCodecException("Empty credential record for " + subjectId);
        }

        int version = stored.getVersion() == null ? CURRENT_VERSION : stored.getVersion();
        if (version != CURRENT_VERSION) {
            throw new CredentialCodecException(
                    "Unsupported credential record version " + version + " for " + subjectId);
        }
        if (stored.getAccessToken() == null || stored.getAccessToken().isBlank()) {
            throw new CredentialCodecException("Credential record for " + subjectId + " has no accessToken");
        }
        if (stored.getExpiresAt() == null) {
            throw new CredentialCodecException("Credential record for " + subjectId + " has no expiresAt");
        }

        return Credential.builder()
                .subjectId(subjectId)
                .accessToken(stored.getAccessToken())
                .refreshToken(stored.getRefreshToken())
                .expiresAt(Instant.ofEpochMilli(stored.getExpiresAt()))
                .build();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class StoredCredential {
        private Integer version;
        private String accessToken;
        private String refreshToken;
        private Long expiresAt;
    }
}
