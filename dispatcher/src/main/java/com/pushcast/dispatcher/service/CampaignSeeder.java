package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.trigger.TriggerEngine;
import com.pushcast.dispatcher.trigger.TriggerSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Registers the built-in recurring campaigns at startup.
 *
 * Each campaign is scheduled by name, so restarts and additional nodes find
 * the existing job instead of creating a second one.
 */
@Component
@ConditionalOnProperty(name = "pushcast.campaigns.enabled", havingValue = "true", matchIfMissing = true)
public class CampaignSeeder implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CampaignSeeder.class);

    public record Campaign(String name, String cron, String topic, NotificationTemplate template) {}

    public static final List<Campaign> CAMPAIGNS = List.of(
            new Campaign("daily_challenge_reminder",  "0 0 9 * * *",    "daily_challenge",     NotificationTemplate.DAILY_CHALLENGE),
            new Campaign("weekly_leaderboard_update", "0 0 18 * * SUN", "leaderboard_updates", NotificationTemplate.WEEKLY_LEADERBOARD),
            new Campaign("retention_campaign",        "0 0 14 * * *",   "retention_campaign",  NotificationTemplate.RETENTION)
    );

    private final NotificationService notificationService;
    private final ZoneId              zone;

    public CampaignSeeder(NotificationService notificationService,
                          @Value("${pushcast.campaigns.zone:UTC}") String zone) {
        this.notificationService = notificationService;
        this.zone                = TriggerEngine.parseZone(zone);
    }

    @Override
    public void run(ApplicationArguments args) {
        for (Campaign campaign : CAMPAIGNS) {
            NotificationPayload payload = new NotificationPayload(
                    TargetSelector.topics(campaign.topic()), campaign.template().render(Map.of()));
            notificationService.scheduleNamed(campaign.name(), new TriggerSpec.Cron(campaign.cron(), zone), payload);
        }
        log.info("Recurring campaigns registered: {} (zone {})", CAMPAIGNS.size(), zone);
    }
}
