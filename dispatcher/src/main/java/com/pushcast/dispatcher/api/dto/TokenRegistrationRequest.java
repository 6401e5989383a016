package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.model.DevicePlatform;

public record TokenRegistrationRequest(String token, String userId, DevicePlatform platform) {}
