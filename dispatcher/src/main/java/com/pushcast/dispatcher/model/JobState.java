package com.pushcast.dispatcher.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a scheduled delivery job.
 *
 * Transitions:
 *   SCHEDULED → CLAIMED    (atomic claim by one scheduler pass)
 *   CLAIMED   → EXECUTING  (worker picked it up)
 *   EXECUTING → COMPLETED  (one-shot delivered)
 *   EXECUTING → SCHEDULED  (recurring job rescheduled, or retry with backoff)
 *   EXECUTING → FAILED     (permanent failure or retries exhausted)
 *   SCHEDULED → CANCELLED  (explicit cancel, single job or whole group)
 *
 * A stale CLAIMED/EXECUTING job is returned to SCHEDULED by the recovery sweep.
 */
public enum JobState {
    SCHEDULED,
    CLAIMED,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /** States owned by a scheduler pass. */
    public static final Set<JobState> IN_FLIGHT = EnumSet.of(CLAIMED, EXECUTING);

    /** States that never change again. */
    public static final Set<JobState> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    /** Everything that can still fire. */
    public static final Set<JobState> LIVE = EnumSet.of(SCHEDULED, CLAIMED, EXECUTING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
