package com.autolike.infrastructure.twitter;

import com.autolike.config.AutoLikeProperties;
import com.autolike.domain.exception.StreamRejectedException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Raw connection to the filtered stream. Every subscription opens a new connection.
 */
@Component
public class TwitterStreamClient {

    static final String STREAM_PATH = "/2/tweets/search/stream";

    private final WebClient webClient;
    private final String bearerToken;

    public TwitterStreamClient(@Qualifier("twitterStreamWebClient") WebClient webClient, AutoLikeProperties properties) {
        this.webClient = webClient;
        this.bearerToken = properties.getTwitter().getBearerToken();
    }

    /**
     * Newline-delimited lines of the stream body. Keep-alives arrive as empty lines.
     * 401 and 403 are mapped to {@link StreamRejectedException}; other error
     * statuses surface as {@code WebClientResponseException}.
     */
    public Flux<String> openStream() {
        return webClient.get()
                .uri(uri -> uri.path(STREAM_PATH)
                        .queryParam("tweet.fields", "id,text,source")
                        .build())
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.UNAUTHORIZED.value()
                                || status.value() == HttpStatus.FORBIDDEN.value(),
                        resp -> resp.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(body -> Mono.error(new StreamRejectedException(
                                        resp.statusCode().value(),
                                        "Stream connection rejected with " + resp.statusCode().value() + ": " + body))))
                .bodyToFlux(String.class);
    }
}
