package com.pushcast.dispatcher.trigger;

import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes next-fire instants for every trigger kind.
 *
 * Stateless apart from a cache of parsed cron expressions, so one instance is
 * shared by the scheduler loop, the notification service and the composer.
 *
 * <p>Cron expressions are evaluated on local wall-clock time in the trigger's
 * zone, then mapped to an instant:
 * <ul>
 *   <li>Gap (spring-forward): the nominal time does not exist; it fires once at
 *       the same wall-clock time shifted forward by the gap length
 *       (02:30 becomes 03:30).</li>
 *   <li>Overlap (fall-back): the nominal time exists twice; it fires once, at
 *       the earlier offset. The repeated hour is not fired again.</li>
 * </ul>
 */
@Component
public class TriggerEngine {

    public static final Duration MIN_INTERVAL = Duration.ofSeconds(1);

    // Upper bound on candidates examined per call. A passed overlap candidate
    // moves the cursor past the repeated hour, so a handful always suffices.
    private static final int MAX_CRON_CANDIDATES = 16;

    static final int CRON_CACHE_SIZE = 256;

    // Least recently used expressions are evicted; callers submit arbitrary text.
    private final Map<String, CronExpression> cronCache = Collections.synchronizedMap(
            new LinkedHashMap<String, CronExpression>(64, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, CronExpression> eldest) {
                    return size() > CRON_CACHE_SIZE;
                }
            });

    // ------------------------------------------------------------------
    // Next-fire computation
    // ------------------------------------------------------------------

    /**
     * Next instant strictly after {@code reference} at which the trigger fires,
     * or empty when it never fires again (an elapsed one-shot).
     */
    public Optional<Instant> computeNextFire(TriggerSpec trigger, Instant reference) {
        return switch (trigger.type()) {
            case ONE_SHOT -> nextOneShot((TriggerSpec.OneShot) trigger, reference);
            case INTERVAL -> Optional.of(nextInterval((TriggerSpec.Interval) trigger, reference));
            case CRON     -> nextCron((TriggerSpec.Cron) trigger, reference);
        };
    }

    private static Optional<Instant> nextOneShot(TriggerSpec.OneShot trigger, Instant reference) {
        return trigger.at().isAfter(reference) ? Optional.of(trigger.at()) : Optional.empty();
    }

    /**
     * Smallest start + k·every strictly after reference. Computed from the
     * anchor rather than from the previous fire, so there is no drift and a
     * scheduler that was down for hours fires once, not once per missed tick.
     */
    private static Instant nextInterval(TriggerSpec.Interval trigger, Instant reference) {
        if (reference.isBefore(trigger.start())) {
            return trigger.start();
        }
        long elapsedPeriods = Duration.between(trigger.start(), reference).dividedBy(trigger.every());
        return trigger.start().plus(trigger.every().multipliedBy(elapsedPeriods + 1));
    }

    private Optional<Instant> nextCron(TriggerSpec.Cron trigger, Instant reference) {
        CronExpression cron = parseCron(trigger.expression());
        ZoneRules rules = trigger.zone().getRules();

        LocalDateTime cursor = LocalDateTime.ofInstant(reference, trigger.zone());
        for (int i = 0; i < MAX_CRON_CANDIDATES; i++) {
            LocalDateTime candidate = cron.next(cursor);
            if (candidate == null) {
                return Optional.empty();
            }
            Instant fireAt = resolveLocal(candidate, rules);
            if (fireAt.isAfter(reference)) {
                return Optional.of(fireAt);
            }
            // The reference sits in the second pass of a repeated hour. Every
            // candidate up to the end of the overlap already fired at the
            // earlier offset, so resume from the end of the overlap.
            ZoneOffsetTransition overlap = rules.getTransition(candidate);
            cursor = overlap != null && overlap.isOverlap()
                    ? overlap.getDateTimeBefore().minusSeconds(1)
                    : candidate;
        }
        throw new IllegalStateException("No cron candidate after " + reference + " for '" + trigger.expression() + "'");
    }

    private static Instant resolveLocal(LocalDateTime local, ZoneRules rules) {
        List<ZoneOffset> offsets = rules.getValidOffsets(local);
        if (offsets.isEmpty()) {
            ZoneOffsetTransition gap = rules.getTransition(local);
            return local.plus(gap.getDuration()).atOffset(gap.getOffsetAfter()).toInstant();
        }
        // One offset normally, two in an overlap: the first is the earlier instant.
        return local.atOffset(offsets.get(0)).toInstant();
    }

    // ------------------------------------------------------------------
    // Creation-time validation
    // ------------------------------------------------------------------

    /**
     * Validate a trigger and return the instant its job should first be due.
     *
     * A one-shot whose time has passed by no more than {@code pastDueGrace}
     * is accepted and due immediately; older ones are rejected.
     *
     * @throws InvalidTriggerException on any malformed trigger
     */
    public Instant firstFire(TriggerSpec trigger, Instant now, Duration pastDueGrace) {
        if (trigger == null) {
            throw new InvalidTriggerException("Trigger is required");
        }
        return switch (trigger.type()) {
            case ONE_SHOT -> firstOneShot((TriggerSpec.OneShot) trigger, now, pastDueGrace);
            case INTERVAL -> firstInterval((TriggerSpec.Interval) trigger, now);
            case CRON     -> firstCron((TriggerSpec.Cron) trigger, now);
        };
    }

    private static Instant firstOneShot(TriggerSpec.OneShot trigger, Instant now, Duration pastDueGrace) {
        if (trigger.at() == null) {
            throw new InvalidTriggerException("One-shot trigger needs a fire time");
        }
        if (trigger.at().isAfter(now)) {
            return trigger.at();
        }
        if (Duration.between(trigger.at(), now).compareTo(pastDueGrace) <= 0) {
            return trigger.at();
        }
        throw new InvalidTriggerException("One-shot time " + trigger.at() + " has already elapsed");
    }

    private static Instant firstInterval(TriggerSpec.Interval trigger, Instant now) {
        if (trigger.every() == null || trigger.every().compareTo(MIN_INTERVAL) < 0) {
            throw new InvalidTriggerException("Interval must be at least " + MIN_INTERVAL + ", got " + trigger.every());
        }
        if (trigger.every().getNano() != 0) {
            throw new InvalidTriggerException("Interval must be a whole number of seconds, got " + trigger.every());
        }
        if (trigger.start() == null) {
            throw new InvalidTriggerException("Interval trigger needs a start time");
        }
        return nextInterval(trigger, now);
    }

    private Instant firstCron(TriggerSpec.Cron trigger, Instant now) {
        if (trigger.zone() == null) {
            throw new InvalidTriggerException("Cron trigger needs a time zone");
        }
        return nextCron(trigger, now).orElseThrow(() ->
                new InvalidTriggerException("Cron expression '" + trigger.expression() + "' never fires"));
    }

    /**
     * Parse a time zone id.
     *
     * @throws InvalidTriggerException for unknown or malformed ids
     */
    public static ZoneId parseZone(String zone) {
        if (zone == null || zone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(zone.strip());
        } catch (RuntimeException e) {
            throw new InvalidTriggerException("Unknown time zone '" + zone + "'", e);
        }
    }

    // ------------------------------------------------------------------
    // Cron parsing
    // ------------------------------------------------------------------

    /**
     * Parse and cache a cron expression. Accepts Spring's six-field form,
     * the classic five-field form (seconds default to 0) and macros such as
     * {@code @daily}.
     */
    CronExpression parseCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidTriggerException("Cron expression is required");
        }
        return cronCache.computeIfAbsent(normalize(expression), normalized -> {
            try {
                return CronExpression.parse(normalized);
            } catch (IllegalArgumentException e) {
                throw new InvalidTriggerException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
            }
        });
    }

    int cachedCronCount() {
        return cronCache.size();
    }

    static String normalize(String expression) {
        String trimmed = expression.strip();
        if (trimmed.startsWith("@")) {
            return trimmed;
        }
        String[] fields = trimmed.split("\\s+");
        return fields.length == 5 ? "0 " + String.join(" ", fields) : String.join(" ", fields);
    }
}
