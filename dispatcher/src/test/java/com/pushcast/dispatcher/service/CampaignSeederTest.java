package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.trigger.InvalidTriggerException;
import com.pushcast.dispatcher.trigger.TriggerEngine;
import com.pushcast.dispatcher.trigger.TriggerSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class CampaignSeederTest {

    @Mock NotificationService notificationService;

    @Test
    void run_registersEveryCampaignByName() {
        new CampaignSeeder(notificationService, "Europe/London").run(new DefaultApplicationArguments());

        ArgumentCaptor<TriggerSpec> trigger = ArgumentCaptor.forClass(TriggerSpec.class);
        ArgumentCaptor<NotificationPayload> payload = ArgumentCaptor.forClass(NotificationPayload.class);
        verify(notificationService).scheduleNamed(eq("daily_challenge_reminder"), trigger.capture(), payload.capture());

        assertThat(trigger.getValue()).isEqualTo(new TriggerSpec.Cron("0 0 9 * * *", ZoneId.of("Europe/London")));
        assertThat(payload.getValue().target()).isEqualTo(TargetSelector.topics("daily_challenge"));
        assertThat(payload.getValue().message().route()).isEqualTo("home");

        verify(notificationService).scheduleNamed(eq("weekly_leaderboard_update"), any(), any());
        verify(notificationService).scheduleNamed(eq("retention_campaign"), any(), any());
    }

    @Test
    void unknownZone_isRejectedAtStartup() {
        assertThatThrownBy(() -> new CampaignSeeder(notificationService, "Mars/Olympus"))
                .isInstanceOf(InvalidTriggerException.class);
    }

    @Test
    void weeklyLeaderboard_firesSundayEvening() {
        CampaignSeeder.Campaign weekly = CampaignSeeder.CAMPAIGNS.stream()
                .filter(c -> c.name().equals("weekly_leaderboard_update"))
                .findFirst().orElseThrow();

        // Wednesday noon -> following Sunday 18:00
        Instant next = new TriggerEngine().computeNextFire(
                new TriggerSpec.Cron(weekly.cron(), ZoneId.of("UTC")),
                Instant.parse("2025-06-04T12:00:00Z")).orElseThrow();

        assertThat(next).isEqualTo(Instant.parse("2025-06-08T18:00:00Z"));
    }
}
