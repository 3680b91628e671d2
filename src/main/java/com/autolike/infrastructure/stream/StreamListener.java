package com.autolike.infrastructure.stream;

import com.autolike.config.AutoLikeProperties;
import com.autolike.domain.exception.StreamEventValidationException;
import com.autolike.domain.exception.StreamRejectedException;
import com.autolike.domain.model.StreamEvent;
import com.autolike.infrastructure.twitter.TwitterStreamClient;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-lived connection to the filtered stream, exposed as an endless sequence
 * of qualifying posts.
 *
 * Drops (I/O errors, upstream close, error statuses, missed keep-alives) are
 * reconnected with exponential backoff; the backoff resets as soon as a line
 * arrives. The sequence only ends on {@link StreamRejectedException} or when the
 * subscriber disposes it. Posts from any client other than the configured one
 * never leave this class.
 */
@Slf4j
@Component
public class StreamListener {

    private final TwitterStreamClient streamClient;
    private final StreamEventDecoder decoder;
    private final FeedStatus feedStatus;
    private final MeterRegistry meterRegistry;
    private final String provenance;
    private final Duration heartbeatTimeout;
    private final Duration minBackoff;
    private final Duration maxBackoff;
    private final AtomicBoolean started = new AtomicBoolean();

    public StreamListener(TwitterStreamClient streamClient,
                          StreamEventDecoder decoder,
                          FeedStatus feedStatus,
                          MeterRegistry meterRegistry,
                          AutoLikeProperties properties) {
        this.streamClient = streamClient;
        this.decoder = decoder;
        this.feedStatus = feedStatus;
        this.meterRegistry = meterRegistry;
        this.provenance = properties.getTwitter().getProvenance();
        this.heartbeatTimeout = properties.getStream().getHeartbeatTimeout();
        this.minBackoff = properties.getStream().getMinBackoff();
        this.maxBackoff = properties.getStream().getMaxBackoff();
    }

    /**
     * Lazy sequence of qualifying posts. May be obtained once.
     */
    public Flux<StreamEvent> run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Stream listener has already been started");
        }

        return Flux.defer(this::connect)
                .retryWhen(Retry.backoff(Long.MAX_VALUE, minBackoff)
                        .maxBackoff(maxBackoff)
                        .transientErrors(true)
                        .filter(e -> !(e instanceof StreamRejectedException))
                        .doBeforeRetry(signal -> {
                            meterRegistry.counter("autolike.stream.reconnects").increment();
                            log.warn("Stream dropped ({}), reconnecting (attempt {})",
                                    signal.failure().toString(), signal.totalRetriesInARow() + 1);
                        }))
                .<StreamEvent>handle((line, sink) -> decode(line).ifPresent(sink::next))
                .filter(this::qualifies)
                .doOnError(StreamRejectedException.class, e -> log.error("Stream rejected: {}", e.getMessage()))
                .doFinally(signal -> feedStatus.terminated());
    }

    private Flux<String> connect() {
        feedStatus.connecting();
        log.info("Opening stream connection");
        return streamClient.openStream()
                .timeout(heartbeatTimeout)
                .doOnNext(line -> {
                    feedStatus.connected();
                    if (line.isBlank()) {
                        log.trace("Stream keep-alive");
                    }
                })
                .concatWith(Mono.error(() -> new IOException("Stream closed by upstream")));
    }

    private Optional<StreamEvent> decode(String line) {
        try {
            return decoder.decode(line);
        } catch (StreamEventValidationException e) {
            log.warn("Discarding stream line: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private boolean qualifies(StreamEvent event) {
        if (event.hasProvenance(provenance)) {
            return true;
        }
        meterRegistry.counter("autolike.events.received", "result", "filtered").increment();
        log.debug("Ignoring post {} from source '{}'", event.getId(), event.getSource());
        return false;
    }
}
