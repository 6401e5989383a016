package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.delivery.DeliveryExecutor;
import com.pushcast.dispatcher.delivery.DeliveryResult;
import com.pushcast.dispatcher.delivery.PayloadCodec;
import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobSummary;
import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.registry.Topics;
import com.pushcast.dispatcher.store.JobFilter;
import com.pushcast.dispatcher.store.JobStore;
import com.pushcast.dispatcher.trigger.InvalidTriggerException;
import com.pushcast.dispatcher.trigger.TriggerEngine;
import com.pushcast.dispatcher.trigger.TriggerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for everything a client can ask of the dispatcher:
 * schedule, cancel, list, compose sequences and send immediately.
 *
 * Validation happens here, before anything is stored; the scheduler loop
 * only ever sees jobs that passed it.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    public static final List<Integer> DEFAULT_REMINDER_MINUTES = List.of(60, 15, 5);

    /** Topic that receives every tournament start notification. */
    public static final String TOURNAMENTS_TOPIC = "tournaments";

    private final JobStore         store;
    private final TriggerEngine    triggerEngine;
    private final PayloadValidator validator;
    private final PayloadCodec     codec;
    private final SequenceComposer composer;
    private final DeliveryExecutor deliveryExecutor;
    private final Clock            clock;
    private final Duration         pastDueGrace;

    public NotificationService(JobStore store,
                               TriggerEngine triggerEngine,
                               PayloadValidator validator,
                               PayloadCodec codec,
                               SequenceComposer composer,
                               DeliveryExecutor deliveryExecutor,
                               Clock clock,
                               @Value("${pushcast.scheduler.past-due-grace:PT5M}") Duration pastDueGrace) {
        this.store            = store;
        this.triggerEngine    = triggerEngine;
        this.validator        = validator;
        this.codec            = codec;
        this.composer         = composer;
        this.deliveryExecutor = deliveryExecutor;
        this.clock            = clock;
        this.pastDueGrace     = pastDueGrace;
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    /**
     * Validate and store a job. An interval without a start is anchored at now.
     *
     * @throws InvalidTriggerException  for malformed or already-elapsed triggers
     * @throws InvalidPayloadException for malformed payloads
     */
    @Transactional
    public UUID schedule(TriggerSpec trigger, NotificationPayload payload) {
        return schedule(null, trigger, payload);
    }

    /**
     * Schedule under a name, once: if a live job already carries the name,
     * its id is returned and nothing is created. The store makes the final
     * check and the insert atomic, so nodes seeding at the same time agree.
     */
    @Transactional
    public UUID scheduleNamed(String name, TriggerSpec trigger, NotificationPayload payload) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        List<Job> existing = store.list(JobFilter.liveNamed(name));
        if (!existing.isEmpty()) {
            log.info("Job '{}' already scheduled as {}", name, existing.get(0).getId());
            return existing.get(0).getId();
        }
        return schedule(name, trigger, payload);
    }

    private UUID schedule(String name, TriggerSpec trigger, NotificationPayload payload) {
        validator.validate(payload);
        Instant now = clock.instant();
        TriggerSpec effective = withDefaults(trigger, now);
        Instant firstFire = triggerEngine.firstFire(effective, now, pastDueGrace);

        Job job = new Job(effective, codec.encode(payload));
        job.setName(name);
        job.setNextFireAt(firstFire);
        UUID id = name == null ? store.create(job) : store.createNamed(job);
        if (!id.equals(job.getId())) {
            log.info("Job '{}' was scheduled concurrently as {}", name, id);
            return id;
        }
        log.info("Scheduled job {}{} ({}), first fire at {}",
                id, name != null ? " '" + name + "'" : "", effective.describe(), firstFire);
        return id;
    }

    private static TriggerSpec withDefaults(TriggerSpec trigger, Instant now) {
        if (trigger instanceof TriggerSpec.Interval interval && interval.start() == null) {
            return interval.startingAt(now);
        }
        return trigger;
    }

    @Transactional
    public boolean cancel(UUID jobId) {
        boolean cancelled = store.cancel(jobId);
        log.info("Cancel job {}: {}", jobId, cancelled ? "cancelled" : "not scheduled");
        return cancelled;
    }

    @Transactional
    public int cancelGroup(UUID groupId) {
        int cancelled = store.cancelGroup(groupId);
        log.info("Cancelled {} job(s) of group {}", cancelled, groupId);
        return cancelled;
    }

    @Transactional(readOnly = true)
    public List<JobSummary> listScheduled(JobFilter filter) {
        return store.list(filter).stream().map(JobSummary::from).toList();
    }

    @Transactional(readOnly = true)
    public Optional<JobSummary> find(UUID jobId) {
        return store.find(jobId).map(JobSummary::from);
    }

    // ------------------------------------------------------------------
    // Sequences
    // ------------------------------------------------------------------

    /** The same payload at each offset before the anchor. */
    @Transactional
    public SequenceComposer.ComposedSequence composeSequence(Instant anchor, List<Duration> offsets,
                                                             NotificationPayload payload) {
        validator.validate(payload);
        List<SequenceSpec.Step> steps = new ArrayList<>();
        for (Duration offset : offsets) {
            steps.add(SequenceSpec.Step.of(offset, payload));
        }
        return composer.compose(new SequenceSpec(anchor, steps), clock.instant());
    }

    @Transactional
    public SequenceComposer.ComposedSequence composeSequence(SequenceSpec spec) {
        spec.steps().forEach(step -> validator.validate(step.payload()));
        return composer.compose(spec, clock.instant());
    }

    /**
     * Reminders to the tournament's own topic at each of {@code reminderMinutes}
     * before {@code start}, plus a start notification to the tournaments topic.
     * Scheduling the same tournament again replaces its pending notifications.
     */
    @Transactional
    public SequenceComposer.ComposedSequence scheduleTournament(String tournamentName, String tournamentId,
                                                                Instant start, List<Integer> reminderMinutes) {
        if (tournamentId == null || !Topics.isValidName(Topics.tournament(tournamentId))) {
            throw new InvalidPayloadException("Invalid tournament id '" + tournamentId + "'");
        }
        List<Integer> minutes = reminderMinutes == null || reminderMinutes.isEmpty()
                ? DEFAULT_REMINDER_MINUTES : reminderMinutes;

        replacePendingTournament(tournamentId);

        Map<String, String> params = Map.of("tournament_name", tournamentName, "tournament_id", tournamentId);
        TargetSelector tournamentTopic = TargetSelector.topics(Topics.tournament(tournamentId));

        List<SequenceSpec.Step> steps = new ArrayList<>();
        for (int m : new LinkedHashSet<>(minutes)) {
            if (m <= 0) {
                throw new InvalidTriggerException("Reminder minutes must be positive, got " + m);
            }
            steps.add(new SequenceSpec.Step(
                    "tournament_reminder_" + tournamentId + "_" + m + "min",
                    Duration.ofMinutes(m),
                    new NotificationPayload(tournamentTopic, NotificationTemplate.TOURNAMENT_REMINDER.render(params))));
        }
        steps.add(new SequenceSpec.Step(
                startJobName(tournamentId),
                Duration.ZERO,
                new NotificationPayload(TargetSelector.topics(TOURNAMENTS_TOPIC),
                        NotificationTemplate.TOURNAMENT_STARTED.render(params))));

        SequenceComposer.ComposedSequence sequence = composeSequence(new SequenceSpec(start, steps));
        log.info("Scheduled {} notification(s) for tournament '{}' ({})",
                sequence.jobIds().size(), tournamentName, tournamentId);
        return sequence;
    }

    private void replacePendingTournament(String tournamentId) {
        for (Job previous : store.list(JobFilter.liveNamed(startJobName(tournamentId)))) {
            if (previous.getGroupId() != null) {
                int cancelled = store.cancelGroup(previous.getGroupId());
                log.info("Replaced {} pending notification(s) of tournament {}", cancelled, tournamentId);
            }
        }
    }

    private static String startJobName(String tournamentId) {
        return "tournament_start_" + tournamentId;
    }

    // ------------------------------------------------------------------
    // Immediate sends
    // ------------------------------------------------------------------

    public DeliveryResult sendNow(NotificationPayload payload) {
        validator.validate(payload);
        return deliveryExecutor.deliver(payload);
    }

    public DeliveryResult sendTemplate(NotificationTemplate template, Map<String, String> params,
                                       TargetSelector target) {
        return sendNow(new NotificationPayload(target, template.render(params)));
    }
}
