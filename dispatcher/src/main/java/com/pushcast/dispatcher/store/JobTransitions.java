package com.pushcast.dispatcher.store;

import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * State-machine rules shared by every {@link JobStore} implementation.
 * Each method checks the source state, then mutates the job in place.
 * Callers are responsible for locking and persisting.
 */
final class JobTransitions {

    private JobTransitions() {}

    static void claim(Job job, String owner, Instant now) {
        require(job, EnumSet.of(JobState.SCHEDULED), "claim");
        job.setState(JobState.CLAIMED);
        job.setClaimedBy(owner);
        job.setClaimedAt(now);
        job.incrementAttemptCount();
        job.setUpdatedAt(now);
    }

    static void startExecuting(Job job, Instant now) {
        require(job, EnumSet.of(JobState.CLAIMED), "mark executing");
        job.setState(JobState.EXECUTING);
        job.setClaimedAt(now);
        job.setUpdatedAt(now);
    }

    /** Refreshes claimed_at so the recovery sweep leaves a long delivery alone. */
    static void heartbeat(Job job, String owner, Instant now) {
        require(job, JobState.IN_FLIGHT, "heartbeat");
        if (!owner.equals(job.getClaimedBy())) {
            throw new StoreConsistencyException(
                    "Job " + job.getId() + " is claimed by " + job.getClaimedBy() + ", not " + owner);
        }
        job.setClaimedAt(now);
        job.setUpdatedAt(now);
    }

    static void complete(Job job, Instant now) {
        require(job, JobState.IN_FLIGHT, "complete");
        job.setState(JobState.COMPLETED);
        job.setNextFireAt(null);
        job.setLastFiredAt(now);
        job.incrementFireCount();
        job.setLastError(null);
        release(job, now);
    }

    static JobState fail(Job job, boolean retry, String reason, RetryPolicy policy, Instant now) {
        require(job, JobState.IN_FLIGHT, "mark failed");
        job.setLastError(reason);
        release(job, now);
        if (retry && policy.canRetry(job.getAttemptCount())) {
            job.setState(JobState.SCHEDULED);
            job.setNextFireAt(now.plus(policy.backoff(job.getAttemptCount())));
        } else {
            job.setState(JobState.FAILED);
            job.setNextFireAt(null);
        }
        return job.getState();
    }

    static void reschedule(Job job, Instant nextFireAt, Instant now) {
        require(job, JobState.IN_FLIGHT, "reschedule");
        job.setState(JobState.SCHEDULED);
        job.setNextFireAt(nextFireAt);
        job.setLastFiredAt(now);
        job.incrementFireCount();
        job.setAttemptCount(0);
        job.setLastError(null);
        release(job, now);
    }

    static void skipOccurrence(Job job, Instant nextFireAt, String reason, Instant now) {
        require(job, JobState.IN_FLIGHT, "skip occurrence");
        job.setState(JobState.SCHEDULED);
        job.setNextFireAt(nextFireAt);
        job.setAttemptCount(0);
        job.setLastError(reason);
        release(job, now);
    }

    static boolean cancel(Job job, Instant now) {
        if (job.getState() != JobState.SCHEDULED) {
            return false;
        }
        job.setState(JobState.CANCELLED);
        job.setNextFireAt(null);
        job.setUpdatedAt(now);
        return true;
    }

    static boolean isStale(Job job, Instant cutoff) {
        return JobState.IN_FLIGHT.contains(job.getState())
                && job.getClaimedAt() != null
                && job.getClaimedAt().isBefore(cutoff);
    }

    /** Stale claim back to SCHEDULED (due now), or FAILED if out of attempts. */
    static JobState recover(Job job, RetryPolicy policy, Instant now) {
        String owner = job.getClaimedBy();
        release(job, now);
        if (policy.canRetry(job.getAttemptCount())) {
            job.setState(JobState.SCHEDULED);
            job.setNextFireAt(now);
            job.setLastError("Claim by " + owner + " went stale; requeued");
        } else {
            job.setState(JobState.FAILED);
            job.setNextFireAt(null);
            job.setLastError("Claim by " + owner + " went stale after " + job.getAttemptCount() + " attempts");
        }
        return job.getState();
    }

    private static void release(Job job, Instant now) {
        job.setClaimedBy(null);
        job.setClaimedAt(null);
        job.setUpdatedAt(now);
    }

    private static void require(Job job, Set<JobState> allowed, String operation) {
        if (!allowed.contains(job.getState())) {
            throw new StoreConsistencyException(
                    "Cannot " + operation + " job " + job.getId() + " in state " + job.getState()
                    + " (expected one of " + allowed + ")");
        }
    }
}
