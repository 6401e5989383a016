package com.pushcast.dispatcher.service;

import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.model.NotificationPayload;
import com.pushcast.dispatcher.model.PushMessage;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.registry.TopicCondition;
import com.pushcast.dispatcher.registry.Topics;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Creation-time checks on a payload, so malformed requests are rejected
 * before anything is stored.
 */
@Component
public class PayloadValidator {

    // Keys the push gateway reserves for itself.
    private static final Set<String> RESERVED_KEYS = Set.of("from", "notification", "message_type");
    private static final Set<String> RESERVED_PREFIXES = Set.of("google.", "gcm.");

    /** @throws InvalidPayloadException describing the first problem found */
    public void validate(NotificationPayload payload) {
        if (payload == null) {
            throw new InvalidPayloadException("Payload is required");
        }
        validateTarget(payload.target());
        validateMessage(payload.message());
    }

    void validateTarget(TargetSelector target) {
        if (target == null || target.type() == null) {
            throw new InvalidPayloadException("Target type is required");
        }
        if (target.values().isEmpty()) {
            throw new InvalidPayloadException("Target " + target.type() + " needs at least one value");
        }
        for (String value : target.values()) {
            if (value == null || value.isBlank()) {
                throw new InvalidPayloadException("Target " + target.type() + " contains a blank value");
            }
        }
        switch (target.type()) {
            case TOPICS -> target.values().forEach(topic -> {
                if (!Topics.isValidName(topic)) {
                    throw new InvalidPayloadException("Invalid topic name '" + topic + "'");
                }
            });
            case CONDITION -> {
                if (target.values().size() != 1) {
                    throw new InvalidPayloadException("Condition target takes exactly one expression");
                }
                TopicCondition.parse(target.values().get(0));
            }
            case TOKENS, USERS -> { }
        }
    }

    void validateMessage(PushMessage message) {
        if (message == null) {
            throw new InvalidPayloadException("Message is required");
        }
        if (message.title() == null || message.title().isBlank()) {
            throw new InvalidPayloadException("Message title is required");
        }
        if (message.body() == null || message.body().isBlank()) {
            throw new InvalidPayloadException("Message body is required");
        }
        for (String key : message.data().keySet()) {
            if (isReserved(key)) {
                throw new InvalidPayloadException("Data key '" + key + "' is reserved");
            }
        }
    }

    private static boolean isReserved(String key) {
        if (RESERVED_KEYS.contains(key)) {
            return true;
        }
        return RESERVED_PREFIXES.stream().anyMatch(key::startsWith);
    }
}
