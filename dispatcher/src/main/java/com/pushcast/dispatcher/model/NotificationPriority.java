package com.pushcast.dispatcher.model;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH;

    public String wireValue() {
        return name().toLowerCase();
    }
}
