package com.autolike.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one fan-out cycle. Every subscriber of the snapshot ends up
 * either in {@code likedSubjects} or in {@code failures}.
 */
@Value
@Builder
public class DispatchReport {

    String eventId;
    int subscribers;
    @Singular("liked")
    List<String> likedSubjects;
    @Singular
    List<SubscriberFailure> failures;

    public int successCount() {
        return likedSubjects.size();
    }

    public int failureCount() {
        return failures.size();
    }
}
