package com.pushcast.dispatcher.delivery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.model.NotificationPayload;
import org.springframework.stereotype.Component;

/**
 * JSON form of a {@link NotificationPayload} as stored in scheduled_jobs.payload_json.
 */
@Component
public class PayloadCodec {

    private final ObjectMapper json;

    public PayloadCodec(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public String encode(NotificationPayload payload) {
        try {
            return json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Payload cannot be serialized: " + e.getOriginalMessage(), e);
        }
    }

    /** @throws InvalidPayloadException if the stored JSON no longer maps to a payload */
    public NotificationPayload decode(String payloadJson) {
        try {
            return json.readValue(payloadJson, NotificationPayload.class);
        } catch (JsonProcessingException e) {
            throw new InvalidPayloadException("Stored payload is unreadable: " + e.getOriginalMessage(), e);
        }
    }
}
