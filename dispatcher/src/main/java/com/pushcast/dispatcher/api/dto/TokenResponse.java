package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.model.DevicePlatform;
import com.pushcast.dispatcher.model.DeviceToken;

import java.time.Instant;

public record TokenResponse(String token, String userId, DevicePlatform platform, Instant registeredAt) {

    public static TokenResponse from(DeviceToken device) {
        return new TokenResponse(device.getToken(), device.getUserId(), device.getPlatform(), device.getRegisteredAt());
    }
}
