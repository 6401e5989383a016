package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.service.SequenceComposer;

import java.util.List;
import java.util.UUID;

public record SequenceResponse(UUID groupId, List<UUID> jobIds) {

    public static SequenceResponse from(SequenceComposer.ComposedSequence sequence) {
        return new SequenceResponse(sequence.groupId(), sequence.jobIds());
    }
}
