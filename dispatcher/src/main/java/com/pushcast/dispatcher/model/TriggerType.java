package com.pushcast.dispatcher.model;

/** Discriminator column for the trigger stored on a {@link Job}. */
public enum TriggerType {
    ONE_SHOT,
    INTERVAL,
    CRON
}
