package com.autolike.infrastructure.stream;

import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Live view of the feed, read by the status endpoint.
 */
@Component
public class FeedStatus {

    public enum State {
        STARTING,
        CONNECTING,
        CONNECTED,
        TERMINATED
    }

    private final Clock clock;
    private final AtomicReference<State> state = new AtomicReference<>(State.STARTING);
    private final AtomicLong eventsDispatched = new AtomicLong();
    private final AtomicReference<String> lastEventId = new AtomicReference<>();
    private final AtomicReference<Instant> lastEventAt = new AtomicReference<>();

    public FeedStatus(Clock clock) {
        this.clock = clock;
    }

    public void connecting() {
        state.set(State.CONNECTING);
    }

    public void connected() {
        state.compareAndSet(State.CONNECTING, State.CONNECTED);
    }

    public void terminated() {
        state.set(State.TERMINATED);
    }

    public void eventDispatched(String eventId) {
        eventsDispatched.incrementAndGet();
        lastEventId.set(eventId);
        lastEventAt.set(clock.instant());
    }

    public State getState() {
        return state.get();
    }

    public Snapshot snapshot() {
        return new Snapshot(state.get(), eventsDispatched.get(), lastEventId.get(), lastEventAt.get());
    }

    @Value
    public static class Snapshot {
        State state;
        long eventsDispatched;
        String lastEventId;
        Instant lastEventAt;
    }
}
