package com.pushcast.dispatcher.model;

/** Category of a notification, forwarded to the app in the data map. */
public enum NotificationType {
    TOURNAMENT,
    SOCIAL,
    ACHIEVEMENT,
    DAILY_REMINDER,
    SPECIAL_EVENT;

    public String wireValue() {
        return name().toLowerCase();
    }
}
