package com.pushcast.dispatcher.api.dto;

import com.pushcast.dispatcher.model.TargetSelector;

import java.util.Map;

/** Request body for POST /notifications/templates/{template}. */
public record TemplateRequest(TargetSelector target, Map<String, String> params) {}
