package com.pushcast.dispatcher.model;

public enum DevicePlatform {
    ANDROID,
    IOS,
    WEB,
    UNKNOWN
}
