package com.pushcast.dispatcher.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * A device registration: one push token, optionally tied to a user.
 *
 * DB table: device_tokens  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "device_tokens")
public class DeviceToken {

    @Id
    @Column(length = 4096)
    private String token;

    @Column(name = "user_id")
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private DevicePlatform platform = DevicePlatform.UNKNOWN;

    @Column(name = "registered_at", nullable = false)
    private Instant registeredAt = Instant.now();

    protected DeviceToken() {}   // required by JPA

    public DeviceToken(String token, String userId, DevicePlatform platform) {
        this.token    = token;
        this.userId   = userId;
        this.platform = platform == null ? DevicePlatform.UNKNOWN : platform;
    }

    public String         getToken()        { return token; }
    public String         getUserId()       { return userId; }
    public DevicePlatform getPlatform()     { return platform; }
    public Instant        getRegisteredAt() { return registeredAt; }

    /** Re-registration moves the token to the new owner and platform. */
    public void reassign(String newUserId, DevicePlatform newPlatform) {
        this.userId       = newUserId;
        this.platform     = newPlatform == null ? DevicePlatform.UNKNOWN : newPlatform;
        this.registeredAt = Instant.now();
    }
}
