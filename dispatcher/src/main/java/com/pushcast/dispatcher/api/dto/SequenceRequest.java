package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.PushMessage;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.service.SequenceSpec;
import com.pushcast.dispatcher.trigger.InvalidTriggerException;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Request body for POST /notifications/sequences: steps timed in minutes
 * before the anchor. Titles and bodies may contain {minutes}.
 */
public record SequenceRequest(Instant anchor, List<Step> steps) {

    public record Step(String name, Long minutesBefore, TargetSelector target, PushMessage message) {}

    public SequenceSpec toSpec() {
        if (steps == null || steps.isEmpty()) {
            throw new InvalidTriggerException("Sequence needs at least one step");
        }
        List<SequenceSpec.Step> converted = steps.stream()
                .map(s -> new SequenceSpec.Step(
                        s.name(),
                        Duration.ofMinutes(s.minutesBefore() == null ? 0 : s.minutesBefore()),
                        new NotificationPayload(s.target(), s.message())))
                .toList();
        return new SequenceSpec(anchor, converted);
    }
}
