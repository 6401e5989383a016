package com.pushcast.dispatcher.api.dto;

/** Error body returned for every rejected request. */
public record ApiError(int httpCode, String errorCode, String errorMessage) {}
