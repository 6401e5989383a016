package com.pushcast.dispatcher.registry;

import com.pushcast.dispatcher.model.DevicePlatform;
import com.pushcast.dispatcher.model.DeviceToken;
import com.pushcast.dispatcher.model.InvalidPayloadException;
import com.pushcast.dispatcher.model.TargetSelector;
import com.pushcast.dispatcher.model.TopicSubscription;
import com.pushcast.dispatcher.repository.DeviceTokenRepository;
import com.pushcast.dispatcher.repository.TopicSubscriptionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Registry backed by the device_tokens and topic_subscriptions tables.
 *
 * Topics and conditions are fanned out here rather than by the gateway, so
 * every recipient gets its own delivery outcome.
 */
@Service
public class DatabaseTargetRegistry implements TargetRegistry {

    private static final Logger log = LoggerFactory.getLogger(DatabaseTargetRegistry.class);

    private final DeviceTokenRepository       tokenRepo;
    private final TopicSubscriptionRepository subscriptionRepo;

    public DatabaseTargetRegistry(DeviceTokenRepository tokenRepo,
                                  TopicSubscriptionRepository subscriptionRepo) {
        this.tokenRepo        = tokenRepo;
        this.subscriptionRepo = subscriptionRepo;
    }

    // ------------------------------------------------------------------
    // Resolution
    // ------------------------------------------------------------------

    @Override
    @Transactional(readOnly = true)
    public Set<String> resolve(TargetSelector selector) {
        if (selector == null || selector.type() == null) {
            throw new InvalidPayloadException("Target selector is required");
        }
        return switch (selector.type()) {
            case TOKENS    -> new LinkedHashSet<>(selector.values());
            case TOPICS    -> subscribersOf(selector.values());
            case CONDITION -> matchingCondition(selector.values());
            case USERS     -> tokensOfUsers(selector.values());
        };
    }

    private Set<String> subscribersOf(Collection<String> topics) {
        Set<String> tokens = new LinkedHashSet<>();
        for (TopicSubscription sub : subscriptionRepo.findByTopicIn(topics)) {
            tokens.add(sub.getToken());
        }
        return tokens;
    }

    /**
     * Candidates are the subscribers of any topic the condition names; each
     * is kept if its full topic set satisfies the expression.
     */
    private Set<String> matchingCondition(List<String> expressions) {
        if (expressions.size() != 1) {
            throw new InvalidPayloadException("Condition target takes exactly one expression");
        }
        TopicCondition condition = TopicCondition.parse(expressions.get(0));
        Set<String> candidates = subscribersOf(condition.topics());
        if (candidates.isEmpty()) {
            return candidates;
        }

        Map<String, Set<String>> topicsByToken = new HashMap<>();
        for (TopicSubscription sub : subscriptionRepo.findByTokenIn(candidates)) {
            topicsByToken.computeIfAbsent(sub.getToken(), t -> new HashSet<>()).add(sub.getTopic());
        }

        Set<String> matched = new LinkedHashSet<>();
        for (String token : candidates) {
            if (condition.matches(topicsByToken.getOrDefault(token, Set.of()))) {
                matched.add(token);
            }
        }
        log.debug("Condition {} matched {} of {} candidate token(s)", condition, matched.size(), candidates.size());
        return matched;
    }

    private Set<String> tokensOfUsers(Collection<String> userIds) {
        Set<String> tokens = new LinkedHashSet<>();
        for (DeviceToken device : tokenRepo.findByUserIdIn(userIds)) {
            tokens.add(device.getToken());
        }
        return tokens;
    }

    // ------------------------------------------------------------------
    // Tokens
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public DeviceToken registerToken(String token, String userId, DevicePlatform platform) {
        requireToken(token);
        DeviceToken device = tokenRepo.findById(token)
                .map(existing -> {
                    existing.reassign(userId, platform);
                    return existing;
                })
                .orElseGet(() -> new DeviceToken(token, userId, platform));
        log.info("Registered token {} for user '{}' ({})", abbreviate(token), userId, device.getPlatform());
        return tokenRepo.save(device);
    }

    @Override
    @Transactional
    public boolean removeToken(String token) {
        requireToken(token);
        boolean known = tokenRepo.existsById(token);
        if (known) {
            tokenRepo.deleteById(token);
        }
        long subscriptions = subscriptionRepo.deleteByToken(token);
        if (known || subscriptions > 0) {
            log.info("Removed token {} and {} subscription(s)", abbreviate(token), subscriptions);
            return true;
        }
        return false;
    }

    // ------------------------------------------------------------------
    // Topics
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public int subscribe(Collection<String> tokens, String topic) {
        requireTopic(topic);
        int added = 0;
        for (String token : new LinkedHashSet<>(tokens)) {
            requireToken(token);
            if (!subscriptionRepo.existsByTokenAndTopic(token, topic)) {
                subscriptionRepo.save(new TopicSubscription(token, topic));
                added++;
            }
        }
        log.info("Subscribed {} of {} token(s) to topic '{}'", added, tokens.size(), topic);
        return added;
    }

    @Override
    @Transactional
    public int unsubscribe(Collection<String> tokens, String topic) {
        requireTopic(topic);
        int removed = 0;
        for (String token : new LinkedHashSet<>(tokens)) {
            removed += (int) subscriptionRepo.deleteByTokenAndTopic(token, topic);
        }
        log.info("Unsubscribed {} of {} token(s) from topic '{}'", removed, tokens.size(), topic);
        return removed;
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> topicsOf(String token) {
        return subscriptionRepo.findByTokenOrderByTopicAsc(token).stream()
                .map(TopicSubscription::getTopic)
                .toList();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static void requireToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidPayloadException("Device token must not be blank");
        }
    }

    private static void requireTopic(String topic) {
        if (topic == null || !Topics.isValidName(topic)) {
            throw new InvalidPayloadException("Invalid topic name '" + topic + "'");
        }
    }

    /** Tokens are credentials; only a prefix goes into logs. */
    public static String abbreviate(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 12 ? token : token.substring(0, 12) + "…";
    }
}
