package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.delivery.DeliveryExecutor;
import com.pushcast.dispatcher.delivery.DeliveryResult;
import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;
import com.pushcast.dispatcher.store.JobStore;
import com.pushcast.dispatcher.store.RetryPolicy;
import com.pushcast.dispatcher.store.StoreConsistencyException;
import com.pushcast.dispatcher.trigger.TriggerEngine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Background driver that fires due jobs.
 *
 * Every tick it claims as many due jobs as it has free worker slots (capped
 * by the batch limit) and hands each to the worker pool. The database is the
 * queue: the claim is the dequeue, and several nodes can tick against the
 * same store without ever running a job twice concurrently.
 *
 * A separate, slower sweep returns jobs whose claim went stale (a node died
 * mid-delivery) to SCHEDULED.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "pushcast.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final JobStore         store;
    private final DeliveryExecutor deliveryExecutor;
    private final TriggerEngine    triggerEngine;
    private final RetryPolicy      retryPolicy;
    private final Clock            clock;

    private final Executor         workers;
    private final ExecutorService  ownedPool;   // null when the executor is supplied
    private final Semaphore        freeSlots;
    private final int              batchLimit;
    private final Duration         staleClaimTimeout;
    private final String           nodeId = "scheduler-" + UUID.randomUUID().toString().substring(0, 8);

    private final Counter claimed;
    private final Counter completed;
    private final Counter rescheduled;
    private final Counter retried;
    private final Counter failed;
    private final Counter skipped;
    private final Counter recovered;
    private final Counter consistencyErrors;

    @Autowired
    public SchedulerLoop(JobStore store,
                         DeliveryExecutor deliveryExecutor,
                         TriggerEngine triggerEngine,
                         RetryPolicy retryPolicy,
                         Clock clock,
                         MeterRegistry meterRegistry,
                         @Value("${pushcast.scheduler.workers:4}") int workerCount,
                         @Value("${pushcast.scheduler.batch-limit:50}") int batchLimit,
                         @Value("${pushcast.scheduler.stale-claim-timeout:PT5M}") Duration staleClaimTimeout) {
        this(store, deliveryExecutor, triggerEngine, retryPolicy, clock, meterRegistry,
                Executors.newFixedThreadPool(workerCount, new CustomizableThreadFactory("pushcast-worker-")),
                workerCount, batchLimit, staleClaimTimeout);
    }

    SchedulerLoop(JobStore store,
                  DeliveryExecutor deliveryExecutor,
                  TriggerEngine triggerEngine,
                  RetryPolicy retryPolicy,
                  Clock clock,
                  MeterRegistry meterRegistry,
                  Executor workers,
                  int workerCount,
                  int batchLimit,
                  Duration staleClaimTimeout) {
        this.store             = store;
        this.deliveryExecutor  = deliveryExecutor;
        this.triggerEngine     = triggerEngine;
        this.retryPolicy       = retryPolicy;
        this.clock             = clock;
        this.workers           = workers;
        this.ownedPool         = workers instanceof ExecutorService pool ? pool : null;
        this.freeSlots         = new Semaphore(workerCount);
        this.batchLimit        = batchLimit;
        this.staleClaimTimeout = staleClaimTimeout;

        this.claimed           = meterRegistry.counter("pushcast.jobs.claimed");
        this.completed         = meterRegistry.counter("pushcast.jobs.completed");
        this.rescheduled       = meterRegistry.counter("pushcast.jobs.rescheduled");
        this.retried           = meterRegistry.counter("pushcast.jobs.retried");
        this.failed            = meterRegistry.counter("pushcast.jobs.failed");
        this.skipped           = meterRegistry.counter("pushcast.jobs.skipped");
        this.recovered         = meterRegistry.counter("pushcast.jobs.recovered");
        this.consistencyErrors = meterRegistry.counter("pushcast.store.consistency.errors");
    }

    // ------------------------------------------------------------------
    // Ticks
    // ------------------------------------------------------------------

    /**
     * fixedDelay: the next tick starts tick-millis after this one returns, so
     * a slow claim never overlaps itself.
     */
    @Scheduled(fixedDelayString = "${pushcast.scheduler.tick-millis:2000}")
    public void tick() {
        claimAndDispatch();
    }

    /** @return how many jobs were claimed and handed to workers */
    public int claimAndDispatch() {
        int limit = Math.min(batchLimit, freeSlots.availablePermits());
        if (limit <= 0) {
            log.debug("All workers busy; skipping claim");
            return 0;
        }

        List<Job> due = store.claimDue(clock.instant(), limit, nodeId);
        if (due.isEmpty()) {
            return 0;
        }
        claimed.increment(due.size());
        log.info("Claimed {} due job(s)", due.size());

        for (Job job : due) {
            // Only this thread acquires, so the permits counted above are still free.
            freeSlots.acquireUninterruptibly();
            try {
                workers.execute(() -> {
                    try {
                        process(job);
                    } finally {
                        freeSlots.release();
                    }
                });
            } catch (RejectedExecutionException e) {
                freeSlots.release();
                log.warn("Worker pool rejected job {}; it stays claimed until stale recovery", job.getId());
            }
        }
        return due.size();
    }

    @Scheduled(fixedDelayString = "${pushcast.scheduler.recovery-interval-millis:60000}",
               initialDelayString = "${pushcast.scheduler.recovery-interval-millis:60000}")
    public int recoverStaleClaims() {
        Instant cutoff = clock.instant().minus(staleClaimTimeout);
        int count = store.recoverStale(cutoff);
        if (count > 0) {
            recovered.increment(count);
            log.warn("Recovered {} job(s) with claims older than {}", count, cutoff);
        }
        return count;
    }

    // ------------------------------------------------------------------
    // One job
    // ------------------------------------------------------------------

    /** Runs on a worker thread. Every outcome ends in a store transition. */
    void process(Job job) {
        MDC.put("jobId", String.valueOf(job.getId()));
        MDC.put("attempt", String.valueOf(job.getAttemptCount()));
        if (job.getGroupId() != null) {
            MDC.put("groupId", job.getGroupId().toString());
        }
        try {
            store.markExecuting(job.getId());

            DeliveryResult result;
            try {
                result = deliveryExecutor.execute(job, () -> store.heartbeat(job.getId(), nodeId));
            } catch (InvalidPayloadException e) {
                onFailure(job, false, e.getMessage());
                return;
            } catch (StoreConsistencyException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Unexpected error delivering job {}: {}", job.getId(), e.getMessage(), e);
                onFailure(job, true, "Unexpected error: " + e.getMessage());
                return;
            }

            if (result.isSuccess()) {
                onSuccess(job, result);
            } else {
                onFailure(job, result.isRetryable(), result.describe());
            }
        } catch (StoreConsistencyException e) {
            consistencyErrors.increment();
            log.error("Store consistency error on job {}: {}", job.getId(), e.getMessage(), e);
        } finally {
            MDC.clear();
        }
    }

    private void onSuccess(Job job, DeliveryResult result) {
        if (!job.isRecurring()) {
            store.markCompleted(job.getId());
            completed.increment();
            log.info("Job {} completed: {}", job.getId(), result.describe());
            return;
        }
        Optional<Instant> next = triggerEngine.computeNextFire(job.getTrigger(), clock.instant());
        if (next.isPresent()) {
            store.reschedule(job.getId(), next.get());
            rescheduled.increment();
            log.info("Job {} fired ({}); next fire at {}", job.getId(), result.describe(), next.get());
        } else {
            store.markCompleted(job.getId());
            completed.increment();
            log.info("Job {} fired ({}) and has no further occurrences", job.getId(), result.describe());
        }
    }

    /**
     * A retryable failure with attempts left goes back with backoff. Anything
     * else is terminal for a one-shot; a recurring job instead gives up on
     * this occurrence and waits for the next one.
     */
    private void onFailure(Job job, boolean retryable, String reason) {
        boolean canRetry = retryable && retryPolicy.canRetry(job.getAttemptCount());

        if (job.isRecurring() && !canRetry) {
            Optional<Instant> next = triggerEngine.computeNextFire(job.getTrigger(), clock.instant());
            if (next.isPresent()) {
                store.skipOccurrence(job.getId(), next.get(), reason);
                skipped.increment();
                log.error("Job {} occurrence failed after {} attempt(s), skipping to {}: {}",
                        job.getId(), job.getAttemptCount(), next.get(), reason);
                return;
            }
        }

        JobState outcome = store.markFailed(job.getId(), canRetry, reason);
        if (outcome == JobState.SCHEDULED) {
            retried.increment();
            log.warn("Job {} attempt {} failed, will retry: {}", job.getId(), job.getAttemptCount(), reason);
        } else {
            failed.increment();
            log.error("Job {} failed permanently after {} attempt(s): {}", job.getId(), job.getAttemptCount(), reason);
        }
    }

    public String nodeId() {
        return nodeId;
    }

    @PreDestroy
    public void shutdown() {
        if (ownedPool == null) {
            return;
        }
        ownedPool.shutdown();
        try {
            if (!ownedPool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers still running after 30s; in-flight jobs will be recovered as stale");
                ownedPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ownedPool.shutdownNow();
        }
    }
}
