package com.pushcast.dispatcher.model;

import com.pushcast.dispatcher.trigger.TriggerSpec;
import jakarta.persistence.*;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.UUID;

/**
 * One scheduled delivery: a trigger, a payload and its execution state.
 *
 * The trigger is flattened into nullable columns keyed by trigger_type and
 * rebuilt by {@link #getTrigger()}. The payload is opaque JSON here; it is
 * decoded only by the delivery executor at fire time.
 *
 * DB table: scheduled_jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "scheduled_jobs")
public class Job {

    // Assigned by the job store on create(), never by the database.
    @Id
    private UUID id;

    // Null version marks a new entity for Spring Data, so save() persists
    // instead of merging. Also gives optimistic locking on every update.
    @Version
    private Long version;

    // Operator label. Unique among live jobs when set (campaign jobs use it).
    @Column
    private String name;

    // ---- trigger ------------------------------------------------------

    @Enumerated(EnumType.STRING)
    @Column(name = "trigger_type", nullable = false)
    private TriggerType triggerType;

    @Column(name = "fire_at")
    private Instant fireAt;

    @Column(name = "interval_seconds")
    private Long intervalSeconds;

    @Column(name = "interval_start")
    private Instant intervalStart;

    @Column(name = "cron_expression")
    private String cronExpression;

    @Column(name = "time_zone")
    private String timeZone;

    // ---- payload ------------------------------------------------------

    @Column(name = "payload_json", nullable = false, columnDefinition = "TEXT")
    private String payloadJson;

    // ---- execution state ----------------------------------------------

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobState state = JobState.SCHEDULED;

    @Column(name = "next_fire_at")
    private Instant nextFireAt;

    @Column(name = "group_id")
    private UUID groupId;

    // Claims of the current occurrence. Reset when a recurring job moves on.
    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    // Successful fires over the job's lifetime (informational).
    @Column(name = "fire_count", nullable = false)
    private int fireCount = 0;

    @Column(name = "claimed_by")
    private String claimedBy;

    // Stamped on claim and again on execution start; the recovery sweep
    // compares it against the stale-claim timeout.
    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "last_fired_at")
    private Instant lastFiredAt;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    // Both stamped by the job store from its clock.
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Job() {}   // required by JPA

    public Job(TriggerSpec trigger, String payloadJson) {
        setTrigger(trigger);
        this.payloadJson = payloadJson;
    }

    private Job(Job other) {
        this.id              = other.id;
        this.version         = other.version;
        this.name            = other.name;
        this.triggerType     = other.triggerType;
        this.fireAt          = other.fireAt;
        this.intervalSeconds = other.intervalSeconds;
        this.intervalStart   = other.intervalStart;
        this.cronExpression  = other.cronExpression;
        this.timeZone        = other.timeZone;
        this.payloadJson     = other.payloadJson;
        this.state           = other.state;
        this.nextFireAt      = other.nextFireAt;
        this.groupId         = other.groupId;
        this.attemptCount    = other.attemptCount;
        this.fireCount       = other.fireCount;
        this.claimedBy       = other.claimedBy;
        this.claimedAt       = other.claimedAt;
        this.lastFiredAt     = other.lastFiredAt;
        this.lastError       = other.lastError;
        this.createdAt       = other.createdAt;
        this.updatedAt       = other.updatedAt;
    }

    /** Detached copy with the same id and state. */
    public Job copy() {
        return new Job(this);
    }

    // ------------------------------------------------------------------
    // Trigger mapping
    // ------------------------------------------------------------------

    public TriggerSpec getTrigger() {
        return switch (triggerType) {
            case ONE_SHOT -> new TriggerSpec.OneShot(fireAt);
            case INTERVAL -> new TriggerSpec.Interval(Duration.ofSeconds(intervalSeconds), intervalStart);
            case CRON     -> new TriggerSpec.Cron(cronExpression, ZoneId.of(timeZone));
        };
    }

    private void setTrigger(TriggerSpec trigger) {
        this.triggerType = trigger.type();
        switch (trigger.type()) {
            case ONE_SHOT -> this.fireAt = ((TriggerSpec.OneShot) trigger).at();
            case INTERVAL -> {
                TriggerSpec.Interval interval = (TriggerSpec.Interval) trigger;
                if (interval.every().getNano() != 0) {
                    throw new IllegalArgumentException("Interval must be whole seconds: " + interval.every());
                }
                this.intervalSeconds = interval.every().getSeconds();
                this.intervalStart   = interval.start();
            }
            case CRON -> {
                TriggerSpec.Cron cron = (TriggerSpec.Cron) trigger;
                this.cronExpression = cron.expression();
                this.timeZone       = cron.zone().getId();
            }
        }
    }

    public boolean isRecurring() {
        return triggerType != TriggerType.ONE_SHOT;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID        getId()           { return id; }
    public String      getName()         { return name; }
    public TriggerType getTriggerType()  { return triggerType; }
    public String      getPayloadJson()  { return payloadJson; }
    public JobState    getState()        { return state; }
    public Instant     getNextFireAt()   { return nextFireAt; }
    public UUID        getGroupId()      { return groupId; }
    public int         getAttemptCount() { return attemptCount; }
    public int         getFireCount()    { return fireCount; }
    public String      getClaimedBy()    { return claimedBy; }
    public Instant     getClaimedAt()    { return claimedAt; }
    public Instant     getLastFiredAt()  { return lastFiredAt; }
    public String      getLastError()    { return lastError; }
    public Instant     getCreatedAt()    { return createdAt; }
    public Instant     getUpdatedAt()    { return updatedAt; }

    public void assignId(UUID id) {
        if (this.id != null) {
            throw new IllegalStateException("Job " + this.id + " already has an id");
        }
        this.id = id;
    }

    public void stampCreated(Instant now) {
        this.createdAt = now;
        this.updatedAt = now;
    }

    public void setName(String name)                { this.name = name; }
    public void setState(JobState state)            { this.state = state; }
    public void setNextFireAt(Instant t)            { this.nextFireAt = t; }
    public void setGroupId(UUID groupId)            { this.groupId = groupId; }
    public void setClaimedBy(String claimedBy)      { this.claimedBy = claimedBy; }
    public void setClaimedAt(Instant t)             { this.claimedAt = t; }
    public void setLastFiredAt(Instant t)           { this.lastFiredAt = t; }
    public void setLastError(String lastError)      { this.lastError = lastError; }
    public void setAttemptCount(int attemptCount)   { this.attemptCount = attemptCount; }
    public void setUpdatedAt(Instant t)             { this.updatedAt = t; }
    public void incrementAttemptCount()             { this.attemptCount++; }
    public void incrementFireCount()                { this.fireCount++; }
}
