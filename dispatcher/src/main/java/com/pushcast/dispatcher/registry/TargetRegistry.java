package com.pushcast.dispatcher.registry;

import com.pushcast.dispatcher.model.DevicePlatform;
import com.pushcast.dispatcher.model.DeviceToken;
import com.pushcast.dispatcher.model.TargetSelector;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Device tokens, their owners and their topic subscriptions.
 *
 * The delivery executor only ever talks to concrete tokens; this is where
 * topics, conditions and user ids are turned into them.
 */
public interface TargetRegistry {

    /**
     * Concrete device tokens for a selector, in a stable order, without
     * duplicates. An empty set means nobody would receive the message.
     */
    Set<String> resolve(TargetSelector selector);

    /** Register or re-register a token; re-registration moves it to the new user. */
    DeviceToken registerToken(String token, String userId, DevicePlatform platform);

    /** Forget a token and all its subscriptions. False if it was unknown. */
    boolean removeToken(String token);

    /** @return how many of the tokens were newly subscribed */
    int subscribe(Collection<String> tokens, String topic);

    /** @return how many of the tokens were actually unsubscribed */
    int unsubscribe(Collection<String> tokens, String topic);

    List<String> topicsOf(String token);
}
