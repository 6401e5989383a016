package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.PushMessage;
import com.pushcast.dispatcher.model.TargetSelector;

/**
 * Request body for POST /notifications/schedule.
 * A non-null name makes the request idempotent: a live job with the same
 * name is returned instead of creating another.
 */
public record ScheduleRequest(
        String         name,
        TriggerRequest trigger,
        TargetSelector target,
        PushMessage    message
) {
    public NotificationPayload toPayload() {
        return new NotificationPayload(target, message);
    }
}
