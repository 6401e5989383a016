package com.pushcast.dispatcher.model;

import java.util.List;

/**
 * Who a notification goes to. Resolved into concrete device tokens by the
 * target registry at delivery time, not at scheduling time, so topic
 * subscriptions made after scheduling are honoured.
 */
public record TargetSelector(TargetType type, List<String> values) {

    public TargetSelector {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static TargetSelector tokens(String... tokens) {
        return new TargetSelector(TargetType.TOKENS, List.of(tokens));
    }

    public static TargetSelector topics(String... topics) {
        return new TargetSelector(TargetType.TOPICS, List.of(topics));
    }

    public static TargetSelector condition(String expression) {
        return new TargetSelector(TargetType.CONDITION, List.of(expression));
    }

    public static TargetSelector users(String... userIds) {
        return new TargetSelector(TargetType.USERS, List.of(userIds));
    }

    @Override
    public String toString() {
        return type + values.toString();
    }
}
