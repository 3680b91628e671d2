package com.autolike.domain.service;

import com.autolike.domain.exception.CredentialRefreshException;
import com.autolike.domain.exception.LikeActionException;
import com.autolike.domain.model.Credential;
import com.autolike.domain.model.DispatchReport;
import com.autolike.domain.model.ResolvedCredential;
import com.autolike.domain.model.StreamEvent;
import com.autolike.domain.model.SubscriberFailure;
import com.autolike.infrastructure.persistence.CredentialStore;
import com.autolike.infrastructure.twitter.TwitterLikeClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Likes one post on behalf of every registered subscriber.
 *
 * Each event reads a fresh snapshot of the credential store and runs one branch
 * per subscriber on the subscriber executor. A branch either likes the post or
 * records a failure; it never affects its siblings. Events are handed to the
 * event executor so the stream reader only ever enqueues work.
 *
 * Events are not deduplicated: the same post dispatched twice is liked twice.
 */
@Slf4j
@Service
public class FanoutDispatcher {

    private final CredentialStore credentialStore;
    private final CredentialRefresher credentialRefresher;
    private final TwitterLikeClient likeClient;
    private final MeterRegistry meterRegistry;
    private final Executor eventExecutor;
    private final Executor subscriberExecutor;

    public FanoutDispatcher(CredentialStore credentialStore,
                            CredentialRefresher credentialRefresher,
                            TwitterLikeClient likeClient,
                            MeterRegistry meterRegistry,
                            @Qualifier("eventExecutor") Executor eventExecutor,
                            @Qualifier("subscriberExecutor") Executor subscriberExecutor) {
        this.credentialStore = credentialStore;
        this.credentialRefresher = credentialRefresher;
        this.likeClient = likeClient;
        this.meterRegistry = meterRegistry;
        this.eventExecutor = eventExecutor;
        this.subscriberExecutor = subscriberExecutor;
    }

    /**
     * Schedules the fan-out of {@code event} and returns immediately.
     * When the event executor is saturated the event is dropped.
     */
    public CompletableFuture<DispatchReport> dispatch(StreamEvent event) {
        try {
            CompletableFuture<DispatchReport> future = CompletableFuture.supplyAsync(() -> handle(event), eventExecutor);
            meterRegistry.counter("autolike.events.received", "result", "dispatched").increment();
            return future.whenComplete((report, ex) -> {
                if (ex != null) {
                    log.error("Fan-out for post {} aborted: {}", event.getId(), ex.getMessage(), ex);
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Dropping post {}: fan-out capacity exhausted", event.getId());
            meterRegistry.counter("autolike.events.received", "result", "dropped").increment();
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Runs the fan-out for {@code event} and returns once every subscriber branch
     * has succeeded or failed.
     */
    public DispatchReport handle(StreamEvent event) {
        Timer.Sample sample = Timer.start(meterRegistry);

        Map<String, Credential> subscribers = credentialStore.getAll();
        log.debug("Fanning out post {} to {} subscribers", event.getId(), subscribers.size());

        List<CompletableFuture<Optional<SubscriberFailure>>> branches = subscribers.entrySet().stream()
                .map(entry -> branch(entry.getKey(), entry.getValue(), event))
                .collect(Collectors.toList());

        CompletableFuture.allOf(branches.toArray(new CompletableFuture[0])).join();

        DispatchReport.DispatchReportBuilder report = DispatchReport.builder()
                .eventId(event.getId())
                .subscribers(subscribers.size());
        int i = 0;
        for (String subjectId : subscribers.keySet()) {
            Optional<SubscriberFailure> failure = branches.get(i++).join();
            if (failure.isPresent()) {
                report.failure(failure.get());
            } else {
                report.liked(subjectId);
            }
        }
        DispatchReport result = report.build();

        sample.stop(Timer.builder("autolike.fanout.latency").register(meterRegistry));
        log.info("Post {} fanned out: {} liked, {} failed", event.getId(), result.successCount(), result.failureCount());
        return result;
    }

    private CompletableFuture<Optional<SubscriberFailure>> branch(String subjectId, Credential credential, StreamEvent event) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> likeOnBehalfOf(subjectId, credential, event), subscriberExecutor)
                    .exceptionally(ex -> dispatchFailure(subjectId, event, ex));
        } catch (RejectedExecutionException e) {
            // Subscriber executor is shutting down
            return CompletableFuture.completedFuture(dispatchFailure(subjectId, event, e));
        }
    }

    private Optional<SubscriberFailure> dispatchFailure(String subjectId, StreamEvent event, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        log.error("Subscriber {} not processed for post {}: {}", subjectId, event.getId(), cause.getMessage(), cause);
        return Optional.of(new SubscriberFailure(subjectId, SubscriberFailure.Stage.DISPATCH, String.valueOf(cause.getMessage())));
    }

    private Optional<SubscriberFailure> likeOnBehalfOf(String subjectId, Credential credential, StreamEvent event) {
        ResolvedCredential resolved;
        try {
            resolved = credentialRefresher.resolve(subjectId, credential);
        } catch (CredentialRefreshException e) {
            log.warn("Skipping subscriber {} for post {}: {}", subjectId, event.getId(), rootMessage(e));
            return Optional.of(new SubscriberFailure(subjectId, SubscriberFailure.Stage.REFRESH, rootMessage(e)));
        }

        try {
            like(subjectId, resolved, event);
            meterRegistry.counter("autolike.likes", "result", "success").increment();
            log.debug("Subscriber {} liked post {}", subjectId, event.getId());
            return Optional.empty();
        } catch (LikeActionException e) {
            meterRegistry.counter("autolike.likes", "result", "failed").increment();
            log.warn("Like of post {} failed for subscriber {}: {}", event.getId(), subjectId, rootMessage(e));
            return Optional.of(new SubscriberFailure(subjectId, SubscriberFailure.Stage.LIKE, rootMessage(e)));
        }
    }

    private void like(String subjectId, ResolvedCredential resolved, StreamEvent event) {
        boolean liked;
        try {
            liked = likeClient.like(subjectId, resolved.accessToken(), event.getId());
        } catch (RuntimeException e) {
            throw new LikeActionException("Like call failed", e);
        }
        if (!liked) {
            throw new LikeActionException("Upstream did not confirm the like", null);
        }
    }

    private static String rootMessage(Throwable e) {
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        return e.getMessage() + (cause != e ? ": " + cause.getMessage() : "");
    }
}
