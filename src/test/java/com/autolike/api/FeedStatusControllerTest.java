package com.autolike.api;

import com.autolike.infrastructure.stream.FeedStatus;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

class FeedStatusControllerTest {

    @Test
    void status_reportsFeedStateAndLastEvent() {
        FeedStatus feedStatus = new FeedStatus(Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
        feedStatus.connecting();
        feedStatus.connected();
        feedStatus.eventDispatched("p7");

        WebTestClient client = WebTestClient.bindToController(new FeedStatusController(feedStatus)).build();

        client.get().uri("/api/v1/feed/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("CONNECTED")
                .jsonPath("$.eventsDispatched").isEqualTo(1)
                .jsonPath("$.lastEventId").isEqualTo("p7");
    }
}
