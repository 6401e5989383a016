package com.pushcast.dispatcher.api.dto;

import java.util.List;

public record TopicSubscriptionRequest(List<String> tokens, String topic) {}
