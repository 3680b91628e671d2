package com.autolike.infrastructure.twitter;

import com.autolike.config.AutoLikeProperties;
import com.autolike.domain.model.TokenGrant;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Objects;

/**
 * OAuth2 token endpoint, authenticated as the registered confidential client.
 */
@Component
public class TwitterOAuth2Client {

    static final String TOKEN_PATH = "/2/oauth2/token";

    private final WebClient webClient;
    private final String clientId;
    private final String clientSecret;

    public TwitterOAuth2Client(@Qualifier("twitterWebClient") WebClient webClient, AutoLikeProperties properties) {
        this.webClient = webClient;
        this.clientId = properties.getTwitter().getClientId();
        this.clientSecret = properties.getTwitter().getClientSecret();
    }

    public TokenGrant refresh(String refreshToken) {
        Objects.requireNonNull(refreshToken, "refreshToken");
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        form.add("client_id", clientId);
        return requestToken(form);
    }

    /**
     * Authorization-code exchange used when a subscriber first registers.
     */
    public TokenGrant exchangeCode(String code, String redirectUri, String codeVerifier) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        form.add("code_verifier", codeVerifier);
        form.add("client_id", clientId);
        return requestToken(form);
    }

    private TokenGrant requestToken(MultiValueMap<String, String> form) {
        TokenResponse response = webClient.post()
                .uri(TOKEN_PATH)
                .headers(h -> h.setBasicAuth(clientId, clientSecret))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .accept(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromFormData(form))
                .retrieve()
                .bodyToMono(TokenResponse.class)
                .block();

        if (response == null || response.getAccessToken() == null) {
            throw new IllegalStateException("Token endpoint returned no access_token");
        }
        if (response.getExpiresIn() == null || response.getExpiresIn() <= 0) {
            throw new IllegalStateException("Token endpoint returned no usable expires_in: " + response.getExpiresIn());
        }
        return TokenGrant.builder()
                .accessToken(response.getAccessToken())
                .refreshToken(response.getRefreshToken())
                .expiresInSeconds(response.getExpiresIn())
                .build();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TokenResponse {
        @JsonProperty("access_token") private String accessToken;
        @JsonProperty("refresh_token") private String refreshToken;
        @JsonProperty("expires_in") private Long expiresIn;
        @JsonProperty("token_type") private String tokenType;
        private String scope;
    }
}
