package com.boxline.billing.application.subscription;

import com.boxline.billing.application.Actors;

/**
 * Who or what caused a status change.
 *
 * @param eventId external billing event id when the change comes from an inbound event
 */
public record TransitionContext(String eventId, String actor, String reason) {

    public static TransitionContext ofEvent(String eventId, String reason) {
        return new TransitionContext(eventId, Actors.GATEWAY, reason);
    }

    public static TransitionContext ofActor(String actor, String reason) {
        return new TransitionContext(null, actor, reason);
    }

    /** Stable key for notification dedup; falls back to {@code fallback} outside event processing. */
    String dedupKey(String fallback) {
        return eventId != null ? eventId : fallback;
    }
}
