package com.autolike.infrastructure.twitter;

import com.autolike.config.AutoLikeProperties;
import com.autolike.domain.model.FilterRule;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;
import java.util.Map;

/**
 * Filtered-stream rule management, authenticated with the app-only bearer token.
 */
@Slf4j
@Component
public class TwitterRulesClient {

    static final String RULES_PATH = "/2/tweets/search/stream/rules";

    private final WebClient webClient;
    private final String bearerToken;

    public TwitterRulesClient(@Qualifier("twitterWebClient") WebClient webClient, AutoLikeProperties properties) {
        this.webClient = webClient;
        this.bearerToken = properties.getTwitter().getBearerToken();
    }

    public List<FilterRule> listRules() {
        RulesResponse response = webClient.get()
                .uri(RULES_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(RulesResponse.class)
                .block();

        if (response == null || response.getData() == null) {
            return List.of();
        }
        return response.getData();
    }

    public RulesResponse deleteRules(List<String> ids) {
        return post(Map.of("delete", Map.of("ids", ids)));
    }

    public RulesResponse addRules(List<FilterRule> rules) {
        return post(Map.of("add", rules));
    }

    private RulesResponse post(Object body) {
        RulesResponse response = webClient.post()
                .uri(RULES_PATH)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(RulesResponse.class)
                .block();
        return response == null ? new RulesResponse() : response;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RulesResponse {
        private List<FilterRule> data;
        private Meta meta;
        private List<ApiError> errors;

        public Summary summary() {
            return meta == null || meta.getSummary() == null ? new Summary() : meta.getSummary();
        }

        public boolean hasErrors() {
            return errors != null && !errors.isEmpty();
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Meta {
        private Summary summary;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Summary {
        private int created;
        @JsonProperty("not_created") private int notCreated;
        private int deleted;
        @JsonProperty("not_deleted") private int notDeleted;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ApiError {
        private String title;
        private String detail;
        private String value;
    }
}
