package com.pushcast.dispatcher.store;

import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;
import com.pushcast.dispatcher.repository.JobRepository;
import com.pushcast.dispatcher.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static com.pushcast.dispatcher.support.Payloads.oneShot;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for JpaJobStore.
 *
 * The repository is mocked: these tests check that the store asks for the
 * locking queries and applies the right transition, not SQL behaviour.
 */
@ExtendWith(MockitoExtension.class)
class JpaJobStoreTest {

    private static final Instant T0 = Instant.parse("2025-06-01T12:00:00Z");

    @Mock JobRepository repo;

    MutableClock clock;
    JpaJobStore  store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new JpaJobStore(repo, new RetryPolicy(3, Duration.ofSeconds(30), Duration.ofMinutes(10)), clock);
    }

    @Test
    void create_assignsIdAndSaves() {
        when(repo.save(any(Job.class))).thenAnswer(inv -> inv.getArgument(0));

        UUID id = store.create(oneShot(T0.plusSeconds(60)));

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(repo).save(captor.capture());
        assertThat(captor.getValue().getId()).isEqualTo(id);
        assertThat(captor.getValue().getState()).isEqualTo(JobState.SCHEDULED);
    }

    @Test
    void create_stampsTimestampsFromStoreClock() {
        when(repo.save(any(Job.class))).thenAnswer(inv -> inv.getArgument(0));
        Job job = oneShot(T0.plusSeconds(60));

        store.create(job);

        assertThat(job.getCreatedAt()).isEqualTo(T0);
        assertThat(job.getUpdatedAt()).isEqualTo(T0);
    }

    @Test
    void createNamed_nameAlreadyLive_returnsHolderUnderAdvisoryLock() {
        Job holder = withId(oneShot(T0.plusSeconds(60)));
        holder.setName("daily");
        when(repo.findByNameAndStateIn("daily", JobState.LIVE)).thenReturn(List.of(holder));
        Job duplicate = oneShot(T0.plusSeconds(60));
        duplicate.setName("daily");

        assertThat(store.createNamed(duplicate)).isEqualTo(holder.getId());

        InOrder order = inOrder(repo);
        order.verify(repo).lockName("daily");
        order.verify(repo).findByNameAndStateIn("daily", JobState.LIVE);
        verify(repo, never()).save(any());
        assertThat(duplicate.getId()).isNull();
    }

    @Test
    void createNamed_nameFree_insertsAfterLocking() {
        when(repo.findByNameAndStateIn("daily", JobState.LIVE)).thenReturn(List.of());
        when(repo.save(any(Job.class))).thenAnswer(inv -> inv.getArgument(0));
        Job job = oneShot(T0.plusSeconds(60));
        job.setName("daily");

        UUID id = store.createNamed(job);

        assertThat(id).isEqualTo(job.getId());
        InOrder order = inOrder(repo);
        order.verify(repo).lockName("daily");
        order.verify(repo).save(job);
    }

    @Test
    void heartbeat_ownerRefreshesClaim() {
        Job job = claimed(oneShot(T0));
        when(repo.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));
        clock.advance(Duration.ofMinutes(3));

        store.heartbeat(job.getId(), "node-a");

        assertThat(job.getClaimedAt()).isEqualTo(T0.plus(Duration.ofMinutes(3)));
        verify(repo).save(job);
    }

    @Test
    void heartbeat_fromAnotherOwner_throwsConsistencyError() {
        Job job = claimed(oneShot(T0));
        when(repo.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));

        assertThatThrownBy(() -> store.heartbeat(job.getId(), "node-b"))
                .isInstanceOf(StoreConsistencyException.class);
        assertThat(job.getClaimedAt()).isEqualTo(T0);
        verify(repo, never()).save(any());
    }

    @Test
    void claimDue_locksDueRowsWithBatchLimit_andMarksThemClaimed() {
        Job a = withId(oneShot(T0.minusSeconds(10)));
        Job b = withId(oneShot(T0.minusSeconds(5)));
        when(repo.findDueForUpdate(eq(JobState.SCHEDULED), eq(T0), any(Pageable.class))).thenReturn(List.of(a, b));

        List<Job> claimed = store.claimDue(T0, 25, "node-a");

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(repo).findDueForUpdate(eq(JobState.SCHEDULED), eq(T0), page.capture());
        assertThat(page.getValue().getPageSize()).isEqualTo(25);
        assertThat(claimed).allSatisfy(j -> {
            assertThat(j.getState()).isEqualTo(JobState.CLAIMED);
            assertThat(j.getClaimedBy()).isEqualTo("node-a");
            assertThat(j.getAttemptCount()).isEqualTo(1);
        });
        verify(repo).saveAll(List.of(a, b));
    }

    @Test
    void claimDue_zeroLimit_doesNotQuery() {
        assertThat(store.claimDue(T0, 0, "node-a")).isEmpty();
        verifyNoInteractions(repo);
    }

    @Test
    void markCompleted_locksRowAndCompletes() {
        Job job = claimed(oneShot(T0));
        when(repo.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));

        store.markCompleted(job.getId());

        assertThat(job.getState()).isEqualTo(JobState.COMPLETED);
        verify(repo).save(job);
    }

    @Test
    void markCompleted_missingJob_throwsConsistencyError() {
        UUID id = UUID.randomUUID();
        when(repo.findByIdForUpdate(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.markCompleted(id)).isInstanceOf(StoreConsistencyException.class);
        verify(repo, never()).save(any());
    }

    @Test
    void markCompleted_notOwned_throwsConsistencyError() {
        Job job = withId(oneShot(T0));   // still SCHEDULED
        when(repo.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));

        assertThatThrownBy(() -> store.markCompleted(job.getId())).isInstanceOf(StoreConsistencyException.class);
        verify(repo, never()).save(any());
    }

    @Test
    void markFailed_retryable_reschedulesWithBackoff() {
        Job job = claimed(oneShot(T0));
        when(repo.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));

        JobState outcome = store.markFailed(job.getId(), true, "timeout");

        assertThat(outcome).isEqualTo(JobState.SCHEDULED);
        assertThat(job.getNextFireAt()).isEqualTo(T0.plusSeconds(30));
    }

    @Test
    void cancel_scheduledJob_savesCancelled() {
        Job job = withId(oneShot(T0.plusSeconds(60)));
        when(repo.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));

        assertThat(store.cancel(job.getId())).isTrue();
        assertThat(job.getState()).isEqualTo(JobState.CANCELLED);
        verify(repo).save(job);
    }

    @Test
    void cancel_inFlight_returnsFalseWithoutSaving() {
        Job job = claimed(oneShot(T0));
        when(repo.findByIdForUpdate(job.getId())).thenReturn(Optional.of(job));

        assertThat(store.cancel(job.getId())).isFalse();
        verify(repo, never()).save(any());
    }

    @Test
    void cancelGroup_cancelsLockedScheduledMembers() {
        UUID group = UUID.randomUUID();
        Job a = withId(oneShot(T0.plusSeconds(60)));
        Job b = withId(oneShot(T0.plusSeconds(120)));
        when(repo.findByGroupIdAndState(group, JobState.SCHEDULED)).thenReturn(List.of(a, b));

        assertThat(store.cancelGroup(group)).isEqualTo(2);
        assertThat(List.of(a, b)).allSatisfy(j -> assertThat(j.getState()).isEqualTo(JobState.CANCELLED));
        verify(repo).saveAll(List.of(a, b));
    }

    @Test
    void recoverStale_requeuesInFlightJobsOlderThanCutoff() {
        Job stale = claimed(oneShot(T0));
        Instant cutoff = T0.plusSeconds(1);
        when(repo.findByStateInAndClaimedAtBefore(JobState.IN_FLIGHT, cutoff)).thenReturn(List.of(stale));

        assertThat(store.recoverStale(cutoff)).isEqualTo(1);
        assertThat(stale.getState()).isEqualTo(JobState.SCHEDULED);
        assertThat(stale.getClaimedBy()).isNull();
        verify(repo).saveAll(anyList());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Job withId(Job job) {
        job.assignId(UUID.randomUUID());
        return job;
    }

    private static Job claimed(Job job) {
        withId(job);
        JobTransitions.claim(job, "node-a", T0);
        return job;
    }
}
