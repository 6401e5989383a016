package com.pushcast.dispatcher.repository;

import com.pushcast.dispatcher.model.TopicSubscription;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Token ↔ topic memberships. Delete methods must run inside a transaction
 * (the registry service provides it).
 */
public interface TopicSubscriptionRepository extends JpaRepository<TopicSubscription, UUID> {

    List<TopicSubscription> findByTopicIn(Collection<String> topics);

    List<TopicSubscription> findByTokenIn(Collection<String> tokens);

    List<TopicSubscription> findByTokenOrderByTopicAsc(String token);

    boolean existsByTokenAndTopic(String token, String topic);

    long deleteByTokenAndTopic(String token, String topic);

    long deleteByToken(String token);
}
