package com.pushcast.dispatcher.api.dto;

import java.time.Instant;
import java.util.UUID;

public record ScheduleResponse(UUID jobId, Instant nextFireAt) {}
