package com.pushcast.dispatcher.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content of a push notification, independent of who receives it.
 *
 * data and routeParams are free-form; the gateway stringifies every value
 * before sending because the push wire format only carries strings.
 */
public record PushMessage(
        String                title,
        String                body,
        NotificationType      notificationType,
        NotificationPriority  priority,
        Map<String, Object>   data,
        String                imageUrl,
        String                route,
        Map<String, Object>   routeParams
) {
    // Compact constructor: default priority to NORMAL and keep maps non-null.
    public PushMessage {
        if (priority == null) priority = NotificationPriority.NORMAL;
        data        = data == null ? Map.of() : new LinkedHashMap<>(data);
        routeParams = routeParams == null ? Map.of() : new LinkedHashMap<>(routeParams);
    }

    public PushMessage withText(String newTitle, String newBody) {
        return new PushMessage(newTitle, newBody, notificationType, priority, data, imageUrl, route, routeParams);
    }

    public PushMessage withData(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(data);
        merged.put(key, value);
        return new PushMessage(title, body, notificationType, priority, merged, imageUrl, route, routeParams);
    }
}
