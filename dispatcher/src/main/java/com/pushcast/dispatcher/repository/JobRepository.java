package com.pushcast.dispatcher.repository;

import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + scheduler queries for the scheduled_jobs table.
 *
 * The locking queries must run inside a @Transactional method of the job
 * store, which applies the state change before the transaction commits.
 */
public interface JobRepository extends JpaRepository<Job, UUID>, JpaSpecificationExecutor<Job> {

    // Lock timeout -2 is Hibernate's SKIP LOCKED: rows locked by a concurrent
    // claim are skipped rather than waited on, so two schedulers never block
    // each other and never see the same due row.
    String SKIP_LOCKED = "-2";

    /**
     * Due SCHEDULED jobs, oldest first, locked FOR UPDATE SKIP LOCKED.
     * The page size is the claim batch limit.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = SKIP_LOCKED))
    @Query("""
            SELECT j FROM Job j
            WHERE j.state = :state
              AND j.nextFireAt <= :now
            ORDER BY j.nextFireAt ASC
            """)
    List<Job> findDueForUpdate(@Param("state") JobState state, @Param("now") Instant now, Pageable page);

    /** Single job, row-locked for a state transition. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") UUID id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    List<Job> findByGroupIdAndState(UUID groupId, JobState state);

    List<Job> findByNameAndStateIn(String name, Collection<JobState> states);

    /**
     * Transaction-scoped Postgres advisory lock keyed by the job name. Blocks
     * until any other transaction holding the same key commits.
     */
    @Query(value = "SELECT 1 FROM (SELECT pg_advisory_xact_lock(hashtext(:name))) AS l", nativeQuery = true)
    Integer lockName(@Param("name") String name);

    /** In-flight jobs whose claim is older than the cutoff. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = SKIP_LOCKED))
    List<Job> findByStateInAndClaimedAtBefore(Collection<JobState> states, Instant cutoff);
}
