package com.autolike.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Minimal projection of a post delivered by the filtered stream.
 */
@Value
@Builder
public class StreamEvent {

    String id;
    String text;
    String source;

    public boolean hasProvenance(String sentinel) {
        return sentinel.equals(source);
    }
}
