package com.pushcast.dispatcher.store;

import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Process-local job store. Every operation holds the store's monitor, which
 * makes {@link #claimDue} and {@link #createNamed} trivially atomic across
 * threads of one process.
 *
 * Used by tests and single-node tooling; production runs on {@link JpaJobStore}.
 * Jobs go in and come out as copies, like detached entities, so only store
 * operations change stored state.
 */
public class InMemoryJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobStore.class);

    static final Comparator<Job> BY_NEXT_FIRE = Comparator
            .comparing(Job::getNextFireAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(Job::getCreatedAt);

    private final Map<UUID, Job> jobs = new LinkedHashMap<>();
    private final RetryPolicy retryPolicy;
    private final Clock clock;

    public InMemoryJobStore(RetryPolicy retryPolicy, Clock clock) {
        this.retryPolicy = retryPolicy;
        this.clock       = clock;
    }

    @Override
    public synchronized UUID create(Job job) {
        job.assignId(UUID.randomUUID());
        job.setState(JobState.SCHEDULED);
        job.stampCreated(clock.instant());
        jobs.put(job.getId(), job.copy());
        return job.getId();
    }

    @Override
    public synchronized UUID createNamed(Job job) {
        if (job.getName() == null) {
            throw new IllegalArgumentException("createNamed needs a named job");
        }
        Optional<Job> holder = jobs.values().stream()
                .filter(JobFilter.liveNamed(job.getName())::matches)
                .findFirst();
        if (holder.isPresent()) {
            return holder.get().getId();
        }
        return create(job);
    }

    @Override
    public synchronized List<Job> claimDue(Instant now, int limit, String owner) {
        if (limit <= 0) {
            return List.of();
        }
        List<Job> due = jobs.values().stream()
                .filter(j -> j.getState() == JobState.SCHEDULED)
                .filter(j -> j.getNextFireAt() != null && !j.getNextFireAt().isAfter(now))
                .sorted(BY_NEXT_FIRE)
                .limit(limit)
                .toList();
        List<Job> claimed = new ArrayList<>();
        for (Job job : due) {
            JobTransitions.claim(job, owner, now);
            claimed.add(job.copy());
        }
        return claimed;
    }

    @Override
    public synchronized void markExecuting(UUID id) {
        JobTransitions.startExecuting(require(id), clock.instant());
    }

    @Override
    public synchronized void heartbeat(UUID id, String owner) {
        JobTransitions.heartbeat(require(id), owner, clock.instant());
    }

    @Override
    public synchronized void markCompleted(UUID id) {
        JobTransitions.complete(require(id), clock.instant());
    }

    @Override
    public synchronized JobState markFailed(UUID id, boolean retry, String reason) {
        return JobTransitions.fail(require(id), retry, reason, retryPolicy, clock.instant());
    }

    @Override
    public synchronized void reschedule(UUID id, Instant nextFireAt) {
        JobTransitions.reschedule(require(id), nextFireAt, clock.instant());
    }

    @Override
    public synchronized void skipOccurrence(UUID id, Instant nextFireAt, String reason) {
        JobTransitions.skipOccurrence(require(id), nextFireAt, reason, clock.instant());
    }

    @Override
    public synchronized boolean cancel(UUID id) {
        Job job = jobs.get(id);
        return job != null && JobTransitions.cancel(job, clock.instant());
    }

    @Override
    public synchronized int cancelGroup(UUID groupId) {
        int cancelled = 0;
        Instant now = clock.instant();
        for (Job job : jobs.values()) {
            if (groupId.equals(job.getGroupId()) && JobTransitions.cancel(job, now)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    @Override
    public synchronized Optional<Job> find(UUID id) {
        return Optional.ofNullable(jobs.get(id)).map(Job::copy);
    }

    @Override
    public synchronized List<Job> list(JobFilter filter) {
        return jobs.values().stream()
                .filter(filter::matches)
                .sorted(BY_NEXT_FIRE)
                .map(Job::copy)
                .toList();
    }

    @Override
    public synchronized int recoverStale(Instant cutoff) {
        List<Job> stale = new ArrayList<>();
        for (Job job : jobs.values()) {
            if (JobTransitions.isStale(job, cutoff)) {
                stale.add(job);
            }
        }
        Instant now = clock.instant();
        for (Job job : stale) {
            JobState outcome = JobTransitions.recover(job, retryPolicy, now);
            log.warn("Recovered stale job {} -> {}", job.getId(), outcome);
        }
        return stale.size();
    }

    private Job require(UUID id) {
        Job job = jobs.get(id);
        if (job == null) {
            throw new StoreConsistencyException("Job " + id + " does not exist");
        }
        return job;
    }
}
