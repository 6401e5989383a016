package com.pushcast.dispatcher.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Membership of one device token in one topic.
 *
 * DB table: topic_subscriptions  (created by Flyway V2 migration)
 */
@Entity
@Table(name = "topic_subscriptions",
       uniqueConstraints = @UniqueConstraint(columnNames = {"token", "topic"}))
public class TopicSubscription {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(nullable = false, length = 4096)
    private String token;

    @Column(nullable = false, length = 900)
    private String topic;

    @Column(name = "subscribed_at", nullable = false)
    private Instant subscribedAt = Instant.now();

    protected TopicSubscription() {}   // required by JPA

    public TopicSubscription(String token, String topic) {
        this.token = token;
        this.topic = topic;
    }

    public UUID    getId()           { return id; }
    public String  getToken()        { return token; }
    public String  getTopic()        { return topic; }
    public Instant getSubscribedAt() { return subscribedAt; }
}
