package com.autolike.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Everything the pipeline needs to talk to the upstream API and the credential store.
 *
 * Example (application.yml):
 * app:
 *   twitter:
 *     bearer-token: ${BEARER_TOKEN}
 *     source-user-id: ${USER_ID}
 *   fanout:
 *     subscriber-concurrency: 16
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "app")
public class AutoLikeProperties {

    @Valid
    private Twitter twitter = new Twitter();

    @Valid
    private Stream stream = new Stream();

    @Valid
    private Store store = new Store();

    @Valid
    private Fanout fanout = new Fanout();

    @Getter
    @Setter
    public static class Twitter {

        @NotBlank
        private String apiBaseUrl = "https://api.twitter.com";

        /** App-only token used for rule management and the stream. */
        @NotBlank
        private String bearerToken;

        @NotBlank
        private String clientId;

        @NotBlank
        private String clientSecret;

        /** Account whose posts trigger likes. */
        @NotBlank
        private String sourceUserId;

        @NotBlank
        private String ruleTag = "ID filter";

        /** Only posts published through this client are liked. */
        @NotBlank
        private String provenance = "twittbot.net";

        @NotNull
        private Duration connectTimeout = Duration.ofSeconds(10);

        @NotNull
        private Duration readTimeout = Duration.ofSeconds(30);
    }

    @Getter
    @Setter
    public static class Stream {

        /** Upstream sends a keep-alive roughly every 20 seconds. */
        @NotNull
        private Duration heartbeatTimeout = Duration.ofSeconds(30);

        @NotNull
        private Duration minBackoff = Duration.ofSeconds(1);

        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Store {

        /** Redis hash with one field per subscriber. */
        @NotBlank
        private String key = "token";
    }

    @Getter
    @Setter
    public static class Fanout {

        @Min(1)
        private int eventConcurrency = 4;

        @Min(1)
        private int eventQueueCapacity = 100;

        @Min(1)
        private int subscriberConcurrency = 16;
    }
}
