package com.pushcast.dispatcher.trigger;

import com.pushcast.dispatcher.model.TriggerType;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * When a job becomes due.
 *
 * OneShot fires once; Interval and Cron are recurring and are rescheduled
 * after every successful fire.
 */
public sealed interface TriggerSpec permits TriggerSpec.OneShot, TriggerSpec.Interval, TriggerSpec.Cron {

    TriggerType type();

    default boolean recurring() {
        return type() != TriggerType.ONE_SHOT;
    }

    /** Human-readable form for listings and logs. */
    String describe();

    record OneShot(Instant at) implements TriggerSpec {
        public TriggerType type() { return TriggerType.ONE_SHOT; }
        public String describe()  { return "once at " + at; }
    }

    /**
     * Fires at start + k·every. A null start means "the moment the job is
     * created" and is filled in before the job is persisted.
     */
    record Interval(Duration every, Instant start) implements TriggerSpec {
        public TriggerType type() { return TriggerType.INTERVAL; }
        public String describe()  { return "every " + every + " from " + start; }

        public Interval startingAt(Instant newStart) {
            return new Interval(every, newStart);
        }
    }

    record Cron(String expression, ZoneId zone) implements TriggerSpec {
        public TriggerType type() { return TriggerType.CRON; }
        public String describe()  { return "cron '" + expression + "' in " + zone; }
    }
}
