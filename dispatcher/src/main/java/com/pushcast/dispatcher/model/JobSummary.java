package com.pushcast.dispatcher.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a job for operators and the REST layer.
 * Leaves out the raw payload JSON.
 */
public record JobSummary(
        UUID        id,
        String      name,
        JobState    state,
        TriggerType triggerType,
        String      trigger,
        Instant     nextFireAt,
        UUID        groupId,
        int         attemptCount,
        int         fireCount,
        Instant     lastFiredAt,
        String      lastError,
        Instant     createdAt
) {
    public static JobSummary from(Job job) {
        return new JobSummary(
                job.getId(),
                job.getName(),
                job.getState(),
                job.getTriggerType(),
                job.getTrigger().describe(),
                job.getNextFireAt(),
                job.getGroupId(),
                job.getAttemptCount(),
                job.getFireCount(),
                job.getLastFiredAt(),
                job.getLastError(),
                job.getCreatedAt()
        );
    }
}
