package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.delivery.PayloadCodec;
import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;
import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.store.InMemoryJobStore;
import com.pushcast.dispatcher.store.JobFilter;
import com.pushcast.dispatcher.store.RetryPolicy;
import com.pushcast.dispatcher.support.MutableClock;
import com.pushcast.dispatcher.support.Payloads;
import com.pushcast.dispatcher.trigger.InvalidTriggerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SequenceComposerTest {

    static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    MutableClock     clock = new MutableClock(NOW);
    PayloadCodec     codec = new PayloadCodec(Payloads.objectMapper());
    InMemoryJobStore store;
    SequenceComposer composer;

    @BeforeEach
    void setUp() {
        store    = new InMemoryJobStore(new RetryPolicy(3, Duration.ofSeconds(30), Duration.ofMinutes(10)), clock);
        composer = new SequenceComposer(store, codec);
    }

    private static SequenceSpec offsets(Instant anchor, int... minutes) {
        NotificationPayload payload = Payloads.toTopic("news");
        return new SequenceSpec(anchor, Arrays.stream(minutes)
                .mapToObj(m -> SequenceSpec.Step.of(Duration.ofMinutes(m), payload))
                .toList());
    }

    @Test
    void compose_allStepsAhead_createsOneJobPerStepInOneGroup() {
        Instant anchor = NOW.plus(Duration.ofHours(2));

        SequenceComposer.ComposedSequence seq = composer.compose(offsets(anchor, 60, 15, 5, 0), NOW);

        assertThat(seq.jobIds()).hasSize(4);
        List<Job> jobs = store.list(JobFilter.group(seq.groupId()));
        assertThat(jobs).hasSize(4)
                .allSatisfy(j -> {
                    assertThat(j.getState()).isEqualTo(JobState.SCHEDULED);
                    assertThat(j.isRecurring()).isFalse();
                });
        assertThat(jobs).extracting(Job::getNextFireAt).containsExactly(
                anchor.minus(Duration.ofMinutes(60)),
                anchor.minus(Duration.ofMinutes(15)),
                anchor.minus(Duration.ofMinutes(5)),
                anchor);
    }

    @Test
    void compose_dropsStepsThatAreNotStrictlyInTheFuture() {
        // anchor - 60min == now, so that step is dropped as well
        Instant anchor = NOW.plus(Duration.ofMinutes(60));

        SequenceComposer.ComposedSequence seq = composer.compose(offsets(anchor, 60, 15, 5, 0), NOW);

        assertThat(seq.jobIds()).hasSize(3);
    }

    @Test
    void compose_anchorAlmostDue_keepsOnlyTheAnchorStep() {
        Instant anchor = NOW.plus(Duration.ofMinutes(2));

        SequenceComposer.ComposedSequence seq = composer.compose(offsets(anchor, 60, 15, 5, 0), NOW);

        assertThat(seq.jobIds()).hasSize(1);
        assertThat(store.find(seq.jobIds().get(0)).orElseThrow().getNextFireAt()).isEqualTo(anchor);
    }

    @Test
    void compose_everyStepInThePast_createsNothingButStillReturnsGroup() {
        SequenceComposer.ComposedSequence seq = composer.compose(offsets(NOW.minusSeconds(1), 5, 0), NOW);

        assertThat(seq.groupId()).isNotNull();
        assertThat(seq.jobIds()).isEmpty();
    }

    @Test
    void compose_negativeOffset_isRejectedBeforeAnythingIsStored() {
        NotificationPayload payload = Payloads.toTopic("news");
        SequenceSpec spec = new SequenceSpec(NOW.plus(Duration.ofHours(1)), List.of(
                SequenceSpec.Step.of(Duration.ofMinutes(10), payload),
                SequenceSpec.Step.of(Duration.ofMinutes(-5), payload)));

        assertThatThrownBy(() -> composer.compose(spec, NOW)).isInstanceOf(InvalidTriggerException.class);
        assertThat(store.list(JobFilter.all())).isEmpty();
    }

    @Test
    void compose_missingAnchor_isRejected() {
        assertThatThrownBy(() -> composer.compose(offsets(null, 5), NOW))
                .isInstanceOf(InvalidTriggerException.class);
    }

    @Test
    void forStep_fillsMinutesPlaceholderAndAddsMinutesUntil() {
        NotificationPayload reminder = new NotificationPayload(TargetSelector.topics("tournament_42"),
                NotificationTemplate.TOURNAMENT_REMINDER.render(
                        Map.of("tournament_name", "Spring Cup", "tournament_id", "42")));

        NotificationPayload rendered = SequenceComposer.forStep(SequenceSpec.Step.of(Duration.ofMinutes(15), reminder));

        assertThat(rendered.message().body()).isEqualTo("Spring Cup starts in 15 minutes!");
        assertThat(rendered.message().data())
                .containsEntry("minutes_until", 15L)
                .containsEntry("tournament_id", "42");
        assertThat(rendered.target()).isEqualTo(reminder.target());
    }

    @Test
    void forStep_zeroOffset_leavesPayloadUntouched() {
        NotificationPayload payload = Payloads.toTopic("news");

        assertThat(SequenceComposer.forStep(SequenceSpec.Step.of(Duration.ZERO, payload))).isSameAs(payload);
    }

    @Test
    void compose_storesRenderedPayloadPerStep() {
        NotificationPayload reminder = new NotificationPayload(TargetSelector.topics("tournament_42"),
                NotificationTemplate.TOURNAMENT_REMINDER.render(
                        Map.of("tournament_name", "Spring Cup", "tournament_id", "42")));
        SequenceSpec spec = new SequenceSpec(NOW.plus(Duration.ofHours(1)),
                List.of(SequenceSpec.Step.of(Duration.ofMinutes(5), reminder)));

        SequenceComposer.ComposedSequence seq = composer.compose(spec, NOW);

        Job job = store.find(seq.jobIds().get(0)).orElseThrow();
        assertThat(codec.decode(job.getPayloadJson()).message().body()).isEqualTo("Spring Cup starts in 5 minutes!");
    }
}
