package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.model.NotificationPayload;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * A composite request: several notifications timed relative to one anchor
 * instant (a tournament start, an event end).
 *
 * Each step fires at {@code anchor − offset}; a zero offset fires at the anchor.
 */
public record SequenceSpec(Instant anchor, List<Step> steps) {

    public SequenceSpec {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    /**
     * @param name    optional job name; unique among live jobs when set
     * @param offset  how long before the anchor this step fires
     */
    public record Step(String name, Duration offset, NotificationPayload payload) {

        public static Step of(Duration offset, NotificationPayload payload) {
            return new Step(null, offset, payload);
        }
    }
}
