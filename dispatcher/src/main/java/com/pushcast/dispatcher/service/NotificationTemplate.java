package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.model.NotificationPriority;
import com.pushcast.dispatcher.model.NotificationType;
import com.pushcast.dispatcher.model.PushMessage;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Built-in game notifications. Each template names the parameters it needs
 * and renders a {@link PushMessage}; who receives it is up to the caller.
 */
public enum NotificationTemplate {

    TOURNAMENT_STARTED("tournament-started", "tournament_name", "tournament_id") {
        @Override
        PushMessage build(Map<String, String> p) {
            String id = p.get("tournament_id");
            return new PushMessage(
                    "🏆 Tournament Started!",
                    p.get("tournament_name") + " has begun! Join now to compete!",
                    NotificationType.TOURNAMENT, NotificationPriority.HIGH,
                    Map.of("tournament_id", id, "action", "join"),
                    null, "tournament_detail", Map.of("tournament_id", id));
        }
    },

    /** Body carries a {minutes} placeholder, filled in per sequence step. */
    TOURNAMENT_REMINDER("tournament-reminder", "tournament_name", "tournament_id") {
        @Override
        PushMessage build(Map<String, String> p) {
            String id = p.get("tournament_id");
            return new PushMessage(
                    "🏆 Tournament Starting Soon!",
                    p.get("tournament_name") + " starts in {minutes} minutes!",
                    NotificationType.TOURNAMENT, NotificationPriority.NORMAL,
                    Map.of("tournament_id", id),
                    null, "tournament_detail", Map.of("tournament_id", id));
        }
    },

    ACHIEVEMENT_UNLOCKED("achievement-unlocked", "achievement_name", "achievement_id") {
        @Override
        PushMessage build(Map<String, String> p) {
            String id = p.get("achievement_id");
            return new PushMessage(
                    "🏆 Achievement Unlocked!",
                    "Congratulations! You've earned: " + p.get("achievement_name"),
                    NotificationType.ACHIEVEMENT, NotificationPriority.NORMAL,
                    Map.of("achievement_id", id, "action", "view"),
                    null, "achievements", Map.of("achievement_id", id));
        }
    },

    FRIEND_REQUEST("friend-request", "sender_name", "sender_id") {
        @Override
        PushMessage build(Map<String, String> p) {
            String id = p.get("sender_id");
            return new PushMessage(
                    "👥 New Friend Request!",
                    p.get("sender_name") + " wants to be your friend",
                    NotificationType.SOCIAL, NotificationPriority.NORMAL,
                    Map.of("sender_id", id, "action", "friend_request"),
                    null, "friends_screen", Map.of("user_id", id));
        }
    },

    DAILY_CHALLENGE("daily-challenge") {
        @Override
        PushMessage build(Map<String, String> p) {
            return new PushMessage(
                    "🐍 Daily Challenge Available!",
                    "Complete today's challenge and climb the leaderboard!",
                    NotificationType.DAILY_REMINDER, NotificationPriority.LOW,
                    Map.of("action", "daily_challenge"),
                    null, "home", null);
        }
    },

    SPECIAL_EVENT("special-event", "event_name", "event_description") {
        @Override
        PushMessage build(Map<String, String> p) {
            return new PushMessage(
                    "⭐ " + p.get("event_name"),
                    p.get("event_description"),
                    NotificationType.SPECIAL_EVENT, NotificationPriority.HIGH,
                    Map.of("action", "special_event", "event", p.get("event_name")),
                    null, "home", null);
        }
    },

    WEEKLY_LEADERBOARD("weekly-leaderboard") {
        @Override
        PushMessage build(Map<String, String> p) {
            return new PushMessage(
                    "📊 Weekly Leaderboard Updated!",
                    "See how you ranked this week and check out the new challenges!",
                    NotificationType.DAILY_REMINDER, NotificationPriority.NORMAL,
                    Map.of("action", "view_leaderboard"),
                    null, "leaderboard", null);
        }
    },

    RETENTION("retention") {
        @Override
        PushMessage build(Map<String, String> p) {
            return new PushMessage(
                    "🐍 We miss you!",
                    "Come back and beat your high score! New achievements await!",
                    NotificationType.DAILY_REMINDER, NotificationPriority.NORMAL,
                    Map.of("action", "retention"),
                    null, "home", null);
        }
    };

    public static final String MINUTES_PLACEHOLDER = "{minutes}";

    private final String       slug;
    private final List<String> requiredParams;

    NotificationTemplate(String slug, String... requiredParams) {
        this.slug           = slug;
        this.requiredParams = List.of(requiredParams);
    }

    abstract PushMessage build(Map<String, String> params);

    public String slug() {
        return slug;
    }

    public List<String> requiredParams() {
        return requiredParams;
    }

    /**
     * @throws InvalidPayloadException if a required parameter is missing or blank
     */
    public PushMessage render(Map<String, String> params) {
        Map<String, String> safe = params == null ? Map.of() : params;
        for (String name : requiredParams) {
            String value = safe.get(name);
            if (value == null || value.isBlank()) {
                throw new InvalidPayloadException("Template '" + slug + "' needs parameter '" + name + "'");
            }
        }
        return build(safe);
    }

    /** @throws InvalidPayloadException for unknown template names */
    public static NotificationTemplate fromSlug(String slug) {
        return Arrays.stream(values())
                .filter(t -> t.slug.equalsIgnoreCase(slug) || t.name().equalsIgnoreCase(slug))
                .findFirst()
                .orElseThrow(() -> new InvalidPayloadException("Unknown template '" + slug + "'"));
    }
}
