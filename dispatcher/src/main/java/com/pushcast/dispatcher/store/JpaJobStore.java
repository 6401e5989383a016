package com.pushcast.dispatcher.store;

import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;
import com.pushcast.dispatcher.repository.JobRepository;
import jakarta.persistence.criteria.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL-backed job store.
 *
 * Every public method is @Transactional. Transitions lock the row
 * (SELECT ... FOR UPDATE), check the source state and write the new one
 * before the transaction commits, so a crash anywhere leaves the job either
 * untouched or fully transitioned. A job whose claim is lost to a crash stays
 * CLAIMED/EXECUTING until {@link #recoverStale} requeues it.
 */
@Component
public class JpaJobStore implements JobStore {

    private static final Logger log = LoggerFactory.getLogger(JpaJobStore.class);

    private static final Sort BY_NEXT_FIRE = Sort.by("nextFireAt", "createdAt");

    private final JobRepository repo;
    private final RetryPolicy   retryPolicy;
    private final Clock         clock;

    public JpaJobStore(JobRepository repo, RetryPolicy retryPolicy, Clock clock) {
        this.repo        = repo;
        this.retryPolicy = retryPolicy;
        this.clock       = clock;
    }

    @Override
    @Transactional
    public UUID create(Job job) {
        job.assignId(UUID.randomUUID());
        job.setState(JobState.SCHEDULED);
        job.stampCreated(clock.instant());
        return repo.save(job).getId();
    }

    /**
     * A transaction-scoped advisory lock on the name serializes every
     * createNamed for that name across nodes; it is released on commit,
     * after the insert is visible.
     */
    @Override
    @Transactional
    public UUID createNamed(Job job) {
        if (job.getName() == null) {
            throw new IllegalArgumentException("createNamed needs a named job");
        }
        repo.lockName(job.getName());
        List<Job> live = repo.findByNameAndStateIn(job.getName(), JobState.LIVE);
        if (!live.isEmpty()) {
            log.debug("Name '{}' already held by job {}", job.getName(), live.get(0).getId());
            return live.get(0).getId();
        }
        return create(job);
    }

    /**
     * SELECT ... FOR UPDATE SKIP LOCKED, then CLAIMED, in one transaction.
     * Rows another scheduler is claiming right now are invisible to this one.
     */
    @Override
    @Transactional
    public List<Job> claimDue(Instant now, int limit, String owner) {
        if (limit <= 0) {
            return List.of();
        }
        List<Job> due = repo.findDueForUpdate(JobState.SCHEDULED, now, PageRequest.of(0, limit));
        if (due.isEmpty()) {
            return List.of();
        }
        for (Job job : due) {
            JobTransitions.claim(job, owner, now);
        }
        repo.saveAll(due);
        log.debug("'{}' claimed {} due job(s)", owner, due.size());
        return due;
    }

    @Override
    @Transactional
    public void markExecuting(UUID id) {
        Job job = lock(id);
        JobTransitions.startExecuting(job, clock.instant());
        repo.save(job);
    }

    @Override
    @Transactional
    public void heartbeat(UUID id, String owner) {
        Job job = lock(id);
        JobTransitions.heartbeat(job, owner, clock.instant());
        repo.save(job);
    }

    @Override
    @Transactional
    public void markCompleted(UUID id) {
        Job job = lock(id);
        JobTransitions.complete(job, clock.instant());
        repo.save(job);
    }

    @Override
    @Transactional
    public JobState markFailed(UUID id, boolean retry, String reason) {
        Job job = lock(id);
        JobState outcome = JobTransitions.fail(job, retry, reason, retryPolicy, clock.instant());
        repo.save(job);
        return outcome;
    }

    @Override
    @Transactional
    public void reschedule(UUID id, Instant nextFireAt) {
        Job job = lock(id);
        JobTransitions.reschedule(job, nextFireAt, clock.instant());
        repo.save(job);
    }

    @Override
    @Transactional
    public void skipOccurrence(UUID id, Instant nextFireAt, String reason) {
        Job job = lock(id);
        JobTransitions.skipOccurrence(job, nextFireAt, reason, clock.instant());
        repo.save(job);
    }

    @Override
    @Transactional
    public boolean cancel(UUID id) {
        Optional<Job> opt = repo.findByIdForUpdate(id);
        if (opt.isEmpty() || !JobTransitions.cancel(opt.get(), clock.instant())) {
            return false;
        }
        repo.save(opt.get());
        return true;
    }

    @Override
    @Transactional
    public int cancelGroup(UUID groupId) {
        List<Job> members = repo.findByGroupIdAndState(groupId, JobState.SCHEDULED);
        List<Job> cancelled = new ArrayList<>();
        Instant now = clock.instant();
        for (Job job : members) {
            if (JobTransitions.cancel(job, now)) {
                cancelled.add(job);
            }
        }
        repo.saveAll(cancelled);
        return cancelled.size();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> find(UUID id) {
        return repo.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Job> list(JobFilter filter) {
        return repo.findAll(toSpecification(filter), BY_NEXT_FIRE);
    }

    @Override
    @Transactional
    public int recoverStale(Instant cutoff) {
        List<Job> stale = repo.findByStateInAndClaimedAtBefore(JobState.IN_FLIGHT, cutoff);
        Instant now = clock.instant();
        for (Job job : stale) {
            String owner = job.getClaimedBy();
            JobState outcome = JobTransitions.recover(job, retryPolicy, now);
            log.warn("Recovered stale job {} (claimed by {}, attempt {}) -> {}",
                    job.getId(), owner, job.getAttemptCount(), outcome);
        }
        repo.saveAll(stale);
        return stale.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Job lock(UUID id) {
        return repo.findByIdForUpdate(id).orElseThrow(() ->
                new StoreConsistencyException("Job " + id + " does not exist"));
    }

    static Specification<Job> toSpecification(JobFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (!filter.states().isEmpty()) {
                predicates.add(root.get("state").in(filter.states()));
            }
            if (filter.groupId() != null) {
                predicates.add(cb.equal(root.get("groupId"), filter.groupId()));
            }
            if (filter.name() != null) {
                predicates.add(cb.equal(root.get("name"), filter.name()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
