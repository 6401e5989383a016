package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.PushMessage;
import com.pushcast.dispatcher.model.TargetSelector;

/** Request body for POST /notifications/send. */
public record SendRequest(TargetSelector target, PushMessage message) {

    public NotificationPayload toPayload() {
        return new NotificationPayload(target, message);
    }
}
