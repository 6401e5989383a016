package com.pushcast.dispatcher.api.dto;

import java.time.Instant;
import java.util.List;

/** Request body for POST /notifications/sequences/tournament. Reminders default to 60, 15 and 5 minutes. */
public record TournamentRequest(
        String        tournamentName,
        String        tournamentId,
        Instant       startTime,
        List<Integer> reminderMinutes
) {}
