package com.pushcast.dispatcher.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pushcast.dispatcher.model.NotificationPriority;
import com.pushcast.dispatcher.model.PushMessage;
import com.pushcast.dispatcher.registry.DatabaseTargetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * HTTP client for the Firebase Cloud Messaging v1 {@code messages:send} API.
 *
 * Uses java.net.http.HttpClient directly so every header and byte on the
 * wire is explicit. One request per device token; the caller fans out.
 *
 * The bearer token is taken from configuration as-is. Minting it from a
 * service account is left to the deployment (a sidecar or a refresh job).
 */
@Component
public class FcmPushGateway implements PushGateway {

    private static final Logger log = LoggerFactory.getLogger(FcmPushGateway.class);

    // Rejections that will never succeed on retry.
    private static final Set<String> PERMANENT_CODES = Set.of(
            "INVALID_ARGUMENT", "SENDER_ID_MISMATCH", "THIRD_PARTY_AUTH_ERROR", PermanentDeliveryException.UNREGISTERED);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final Clock        clock;
    private final GatewaySettings settings;

    public FcmPushGateway(GatewaySettings settings, ObjectMapper objectMapper, Clock clock) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .build(),
                settings, objectMapper, clock);
    }

    FcmPushGateway(HttpClient http, GatewaySettings settings, ObjectMapper objectMapper, Clock clock) {
        this.http     = http;
        this.settings = settings;
        this.json     = objectMapper;
        this.clock    = clock;
        if (settings.accessToken() == null || settings.accessToken().isBlank()) {
            log.warn("pushcast.gateway.access-token is not set; every send will be rejected as unauthenticated");
        }
    }

    @Override
    public String send(String token, PushMessage message) {
        String body = buildRequestBody(token, message);
        HttpRequest.Builder req = HttpRequest.newBuilder()
                .uri(URI.create(settings.baseUrl() + "/v1/projects/" + settings.projectId() + "/messages:send"))
                .timeout(settings.requestTimeout())
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (settings.accessToken() != null && !settings.accessToken().isBlank()) {
            req.header("Authorization", "Bearer " + settings.accessToken());
        }

        HttpResponse<String> resp;
        try {
            resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new TransientDeliveryException("Gateway timed out after " + settings.requestTimeout(), e);
        } catch (IOException e) {
            throw new TransientDeliveryException("Gateway I/O error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientDeliveryException("Interrupted while sending", e);
        }

        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            String messageId = messageId(resp.body());
            log.debug("Sent to token {}, message id {}", DatabaseTargetRegistry.abbreviate(token), messageId);
            return messageId;
        }
        throw classify(resp.statusCode(), resp.body());
    }

    // ------------------------------------------------------------------
    // Request body
    // ------------------------------------------------------------------

    /** {"message": {...}} for one token, including Android and APNs blocks. */
    String buildRequestBody(String token, PushMessage message) {
        ObjectNode root = json.createObjectNode();
        ObjectNode msg  = root.putObject("message");
        msg.put("token", token);

        ObjectNode notification = msg.putObject("notification");
        notification.put("title", message.title());
        notification.put("body",  message.body());
        if (message.imageUrl() != null) {
            notification.put("image", message.imageUrl());
        }

        ObjectNode data = msg.putObject("data");
        dataMap(message).forEach(data::put);

        ObjectNode android = msg.putObject("android");
        android.put("priority", message.priority() == NotificationPriority.HIGH ? "high" : "normal");
        ObjectNode androidNotification = android.putObject("notification");
        androidNotification.put("title", message.title());
        androidNotification.put("body",  message.body());
        androidNotification.put("icon",  settings.androidIcon());
        androidNotification.put("color", settings.androidColor());
        androidNotification.put("sound", "default");
        androidNotification.put("channel_id", settings.androidChannel());

        ObjectNode aps = msg.putObject("apns").putObject("payload").putObject("aps");
        ObjectNode alert = aps.putObject("alert");
        alert.put("title", message.title());
        alert.put("body",  message.body());
        aps.put("badge", 1);
        aps.put("sound", "default");
        aps.put("category", settings.apnsCategory());

        return toJson(root);
    }

    /**
     * The data map as sent: caller data, then routing and metadata keys,
     * every value stringified (the wire format only carries strings).
     */
    Map<String, String> dataMap(PushMessage message) {
        Map<String, String> data = new LinkedHashMap<>();
        message.data().forEach((k, v) -> data.put(k, stringify(v)));
        if (message.route() != null) {
            data.put("route", message.route());
        }
        if (!message.routeParams().isEmpty()) {
            data.put("route_params", toJson(message.routeParams()));
        }
        if (message.notificationType() != null) {
            data.put("notification_type", message.notificationType().wireValue());
        }
        data.put("priority", message.priority().wireValue());
        data.put("sent_at", clock.instant().toString());
        return data;
    }

    private String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?>) {
            return toJson(value);
        }
        return String.valueOf(value);
    }

    // ------------------------------------------------------------------
    // Response handling
    // ------------------------------------------------------------------

    private String messageId(String body) {
        try {
            JsonNode node = json.readTree(body);
            return node.path("name").asText("");
        } catch (JsonProcessingException e) {
            // Delivered regardless; the id is informational.
            log.warn("Unparseable success response from gateway: {}", body);
            return "";
        }
    }

    /**
     * Map a non-2xx response to the matching exception.
     *
     * 404 or UNREGISTERED → permanent (token gone); 400/403 and the
     * argument/sender/auth-config codes → permanent; 401, 408, 429 and 5xx
     * → transient.
     */
    DeliveryException classify(int status, String body) {
        String errorCode = errorCode(body);
        String detail = "HTTP " + status + (errorCode != null ? " " + errorCode : "") + ": " + abbreviateBody(body);

        if (status == 404 || PermanentDeliveryException.UNREGISTERED.equals(errorCode)) {
            return new PermanentDeliveryException(PermanentDeliveryException.UNREGISTERED, "Token is not registered (" + detail + ")");
        }
        if (status == 401 || status == 408 || status == 429 || status >= 500) {
            return new TransientDeliveryException("Gateway unavailable (" + detail + ")");
        }
        if (errorCode != null && PERMANENT_CODES.contains(errorCode)) {
            return new PermanentDeliveryException(errorCode, "Gateway rejected message (" + detail + ")");
        }
        return new PermanentDeliveryException(errorCode != null ? errorCode : "HTTP_" + status,
                "Gateway rejected message (" + detail + ")");
    }

    /** FCM error code from details[].errorCode, else error.status; null if absent. */
    private String errorCode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = json.readTree(body).path("error");
            for (JsonNode detail : error.path("details")) {
                if (detail.hasNonNull("errorCode")) {
                    return detail.get("errorCode").asText();
                }
            }
            return error.hasNonNull("status") ? error.get("status").asText() : null;
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    private static String abbreviateBody(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 300 ? body : body.substring(0, 300) + "…";
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new PermanentDeliveryException("SERIALIZATION", "JSON serialization failed: " + e.getMessage());
        }
    }
}
