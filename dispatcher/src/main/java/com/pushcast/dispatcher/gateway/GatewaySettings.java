package com.pushcast.dispatcher.gateway;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * pushcast.gateway.* properties.
 */
@Component
public class GatewaySettings {

    private final String   baseUrl;
    private final String   projectId;
    private final String   accessToken;
    private final Duration requestTimeout;
    private final String   androidIcon;
    private final String   androidColor;
    private final String   androidChannel;
    private final String   apnsCategory;

    public GatewaySettings(
            @Value("${pushcast.gateway.base-url:https://fcm.googleapis.com}") String baseUrl,
            @Value("${pushcast.gateway.project-id}") String projectId,
            @Value("${pushcast.gateway.access-token:}") String accessToken,
            @Value("${pushcast.gateway.request-timeout:PT10S}") Duration requestTimeout,
            @Value("${pushcast.gateway.android-icon:@mipmap/ic_launcher}") String androidIcon,
            @Value("${pushcast.gateway.android-color:#4CAF50}") String androidColor,
            @Value("${pushcast.gateway.android-channel:pushcast_notifications}") String androidChannel,
            @Value("${pushcast.gateway.apns-category:PUSHCAST_NOTIFICATION}") String apnsCategory) {
        this.baseUrl        = baseUrl;
        this.projectId      = projectId;
        this.accessToken    = accessToken;
        this.requestTimeout = requestTimeout;
        this.androidIcon    = androidIcon;
        this.androidColor   = androidColor;
        this.androidChannel = androidChannel;
        this.apnsCategory   = apnsCategory;
    }

    public String   baseUrl()        { return baseUrl; }
    public String   projectId()      { return projectId; }
    public String   accessToken()    { return accessToken; }
    public Duration requestTimeout() { return requestTimeout; }
    public String   androidIcon()    { return androidIcon; }
    public String   androidColor()   { return androidColor; }
    public String   androidChannel() { return androidChannel; }
    public String   apnsCategory()   { return apnsCategory; }
}
