package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.trigger.InvalidTriggerException;
import com.pushcast.dispatcher.trigger.TriggerEngine;
import com.pushcast.dispatcher.trigger.TriggerSpec;

import java.time.Duration;
import java.time.Instant;

/**
 * Wire form of a trigger.
 *
 * Examples:
 *   {"type":"one_shot","at":"2025-06-01T18:00:00Z"}
 *   {"type":"interval","everySeconds":3600}
 *   {"type":"cron","cron":"0 9 * * *","zone":"Europe/Paris"}
 */
public record TriggerRequest(
        String  type,
        Instant at,
        Long    everySeconds,
        Instant start,
        String  cron,
        String  zone
) {
    /** @throws InvalidTriggerException for unknown types or missing fields */
    public TriggerSpec toSpec() {
        if (type == null) {
            throw new InvalidTriggerException("Trigger type is required (one_shot, interval or cron)");
        }
        switch (type.strip().toLowerCase().replace('-', '_')) {
            case "one_shot", "date", "once":
                return new TriggerSpec.OneShot(at);
            case "interval":
                if (everySeconds == null) {
                    throw new InvalidTriggerException("Interval trigger needs everySeconds");
                }
                return new TriggerSpec.Interval(Duration.ofSeconds(everySeconds), start);
            case "cron":
                return new TriggerSpec.Cron(cron, TriggerEngine.parseZone(zone));
            default:
                throw new InvalidTriggerException("Unknown trigger type '" + type + "'");
        }
    }
}
