package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.delivery.PayloadCodec;
import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.PushMessage;
import com.pushcast.dispatcher.store.JobStore;
import com.pushcast.dispatcher.trigger.InvalidTriggerException;
import com.pushcast.dispatcher.trigger.TriggerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Expands a {@link SequenceSpec} into one-shot jobs sharing a group id.
 *
 * Steps whose fire time is not strictly after {@code now} are dropped, so a
 * sequence requested close to its anchor only keeps the steps still ahead.
 * Callers wanting all-or-nothing creation run compose() in a transaction.
 */
@Component
public class SequenceComposer {

    private static final Logger log = LoggerFactory.getLogger(SequenceComposer.class);

    private final JobStore     store;
    private final PayloadCodec codec;

    public SequenceComposer(JobStore store, PayloadCodec codec) {
        this.store = store;
        this.codec = codec;
    }

    public record ComposedSequence(UUID groupId, List<UUID> jobIds) {}

    /**
     * @throws InvalidTriggerException if the anchor is missing or an offset is negative
     */
    public ComposedSequence compose(SequenceSpec spec, Instant now) {
        if (spec.anchor() == null) {
            throw new InvalidTriggerException("Sequence anchor is required");
        }
        for (SequenceSpec.Step step : spec.steps()) {
            if (step.offset() == null || step.offset().isNegative()) {
                throw new InvalidTriggerException("Sequence offsets must be zero or positive, got " + step.offset());
            }
        }

        UUID groupId = UUID.randomUUID();
        List<UUID> jobIds = new ArrayList<>();
        for (SequenceSpec.Step step : spec.steps()) {
            Instant fireAt = spec.anchor().minus(step.offset());
            if (!fireAt.isAfter(now)) {
                log.debug("Skipping sequence step {} before anchor {}: {} is not in the future",
                        step.offset(), spec.anchor(), fireAt);
                continue;
            }
            Job job = new Job(new TriggerSpec.OneShot(fireAt), codec.encode(forStep(step)));
            job.setName(step.name());
            job.setGroupId(groupId);
            job.setNextFireAt(fireAt);
            jobIds.add(store.create(job));
        }

        log.info("Composed sequence {} anchored at {}: {} of {} step(s) scheduled",
                groupId, spec.anchor(), jobIds.size(), spec.steps().size());
        return new ComposedSequence(groupId, jobIds);
    }

    /** Fill {minutes} and add minutes_until for steps ahead of the anchor. */
    static NotificationPayload forStep(SequenceSpec.Step step) {
        NotificationPayload payload = step.payload();
        if (step.offset().isZero()) {
            return payload;
        }
        long minutes = step.offset().toMinutes();
        PushMessage message = payload.message();
        PushMessage rendered = message
                .withText(fill(message.title(), minutes), fill(message.body(), minutes))
                .withData("minutes_until", minutes);
        return payload.withMessage(rendered);
    }

    private static String fill(String text, long minutes) {
        return text == null ? null : text.replace(NotificationTemplate.MINUTES_PLACEHOLDER, Long.toString(minutes));
    }
}
