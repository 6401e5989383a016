package com.pushcast.dispatcher.model;

/**
 * How the values of a {@link TargetSelector} are interpreted.
 *
 *   TOKENS    — device tokens, delivered as given
 *   TOPICS    — topic names, fanned out to every subscribed token
 *   CONDITION — a single topic expression, e.g. "'a' in topics && !('b' in topics)"
 *   USERS     — user ids, resolved to their registered tokens
 */
public enum TargetType {
    TOKENS,
    TOPICS,
    CONDITION,
    USERS
}
