package com.pushcast.dispatcher.store;

import com.pushcast.dispatcher.model.Job;
import com.pushcast.dispatcher.model.JobState;

import java.util.EnumSet;
import java.util.Set;
import java.util.UUID;

/**
 * Read-only query over the job store. Null / empty fields match everything.
 */
public record JobFilter(Set<JobState> states, UUID groupId, String name) {

    public JobFilter {
        states = states == null || states.isEmpty() ? Set.of() : EnumSet.copyOf(states);
    }

    public static JobFilter all() {
        return new JobFilter(Set.of(), null, null);
    }

    public static JobFilter scheduled() {
        return new JobFilter(EnumSet.of(JobState.SCHEDULED), null, null);
    }

    public static JobFilter group(UUID groupId) {
        return new JobFilter(Set.of(), groupId, null);
    }

    public static JobFilter liveNamed(String name) {
        return new JobFilter(JobState.LIVE, null, name);
    }

    public boolean matches(Job job) {
        return (states.isEmpty() || states.contains(job.getState()))
                && (groupId == null || groupId.equals(job.getGroupId()))
                && (name == null || name.equals(job.getName()));
    }
}
