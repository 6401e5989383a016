package com.pushcast.dispatcher.store;

import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable record of scheduled jobs and their execution state.
 *
 * Every operation must be safe under concurrent callers, including callers in
 * other processes. {@link #claimDue} is the one concurrency primitive the
 * scheduler relies on: a job is handed to at most one caller until it returns
 * to SCHEDULED.
 *
 * Transitions on a job that is not in an allowed state throw
 * {@link StoreConsistencyException}, except cancel/cancelGroup which are
 * no-ops outside SCHEDULED.
 */
public interface JobStore {

    /** Assign an id, set SCHEDULED and persist. */
    UUID create(Job job);

    /**
     * Create a named job unless a live job already carries its name, and
     * return the id of the job holding the name. Atomic across processes,
     * so concurrent callers with the same name end up with one live job.
     */
    UUID createNamed(Job job);

    /**
     * Atomically move up to {@code limit} SCHEDULED jobs with
     * next_fire_at ≤ now to CLAIMED, oldest first, incrementing their
     * attempt count, and return them.
     */
    List<Job> claimDue(Instant now, int limit, String owner);

    /** CLAIMED → EXECUTING. */
    void markExecuting(UUID id);

    /**
     * Refresh the claim of an in-flight job held by {@code owner}, so the
     * recovery sweep does not requeue a delivery that is still running.
     * Throws {@link StoreConsistencyException} if the claim was lost.
     */
    void heartbeat(UUID id, String owner);

    /** CLAIMED/EXECUTING → COMPLETED (terminal, one-shot success). */
    void markCompleted(UUID id);

    /**
     * CLAIMED/EXECUTING → SCHEDULED with backoff when {@code retry} is set and
     * the attempt ceiling is not reached; otherwise → FAILED.
     *
     * @return the state the job ended up in
     */
    JobState markFailed(UUID id, boolean retry, String reason);

    /** CLAIMED/EXECUTING → SCHEDULED at {@code nextFireAt}, after a successful recurring fire. */
    void reschedule(UUID id, Instant nextFireAt);

    /**
     * CLAIMED/EXECUTING → SCHEDULED at {@code nextFireAt} after a recurring
     * occurrence failed for good. The job keeps its schedule; the reason is
     * kept as last_error.
     */
    void skipOccurrence(UUID id, Instant nextFireAt, String reason);

    /** SCHEDULED → CANCELLED. False if missing or not SCHEDULED. */
    boolean cancel(UUID id);

    /** Cancel every SCHEDULED member of the group; returns how many. */
    int cancelGroup(UUID groupId);

    Optional<Job> find(UUID id);

    /** Jobs matching the filter, ordered by next_fire_at (nulls last). */
    List<Job> list(JobFilter filter);

    /**
     * Return CLAIMED/EXECUTING jobs claimed before {@code cutoff} to
     * SCHEDULED, due immediately, or to FAILED when their attempts are used
     * up. Returns how many jobs were recovered.
     */
    int recoverStale(Instant cutoff);
}
