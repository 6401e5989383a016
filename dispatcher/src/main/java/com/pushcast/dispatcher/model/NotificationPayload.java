package com.pushcast.dispatcher.model;

/**
 * The delivery instruction carried by a job: who to notify and with what.
 * Persisted as JSON in {@code scheduled_jobs.payload_json}.
 */
public record NotificationPayload(TargetSelector target, PushMessage message) {

    public NotificationPayload withMessage(PushMessage newMessage) {
        return new NotificationPayload(target, newMessage);
    }
}
