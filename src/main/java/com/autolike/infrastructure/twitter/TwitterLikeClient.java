package com.autolike.infrastructure.twitter;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Like endpoint, called with the subscriber's own access token.
 */
@Component
public class TwitterLikeClient {

    static final String LIKES_PATH = "/2/users/{id}/likes";

    private final WebClient webClient;

    public TwitterLikeClient(@Qualifier("twitterWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    /**
     * @return whether upstream reports the post as liked
     */
    public boolean like(String subjectId, String accessToken, String postId) {
        LikeResponse response = webClient.post()
                .uri(LIKES_PATH, subjectId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("tweet_id", postId))
                .retrieve()
                .bodyToMono(LikeResponse.class)
                .block();

        return response != null && response.getData() != null && response.getData().isLiked();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LikeResponse {
        private LikeData data;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LikeData {
        private boolean liked;
    }
}
