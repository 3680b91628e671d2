package com.autolike.domain.model;

import lombok.Value;

/**
 * One subscriber branch that ended in failure during a fan-out.
 */
@Value
public class SubscriberFailure {

    String subjectId;
    Stage stage;
    String reason;

    public enum Stage {
        REFRESH,
        LIKE,
        /** The branch could not run or failed outside refresh and like. */
        DISPATCH
    }
}
