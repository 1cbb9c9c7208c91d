package io.tempo4j.internal.mongo;

import io.tempo4j.core.JobState;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.Map;

/**
 * Mongo document model for persisted jobs.
 */
@Document(collection = ScheduledJobDocument.COLLECTION)
public class ScheduledJobDocument {

    public static final String COLLECTION = "scheduled_jobs";

    public enum SpecType {
        FIXED_INSTANT,
        CRON
    }

    @Id
    private String id;

    private String ownerId;
    private String handlerKind;

    private SpecType specType;
    private Instant fireAt;
    private String cronExpression;
    private String timezone;
    private Instant validFrom;
    private Instant validUntil;

    private JobState state;

    @Field(write = Field.Write.ALWAYS)
    private Instant nextFireAt;

    private Instant lastFiredAt;
    private Instant createdAt;

    private Map<String, Object> payload;

    public ScheduledJobDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getHandlerKind() {
        return handlerKind;
    }

    public void setHandlerKind(String handlerKind) {
        this.handlerKind = handlerKind;
    }

    public SpecType getSpecType() {
        return specType;
    }

    public void setSpecType(SpecType specType) {
        this.specType = specType;
    }

    public Instant getFireAt() {
        return fireAt;
    }

    public void setFireAt(Instant fireAt) {
        this.fireAt = fireAt;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public void setCronExpression(String cronExpression) {
        this.cronExpression = cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public Instant getValidFrom() {
        return validFrom;
    }

    public void setValidFrom(Instant validFrom) {
        this.validFrom = validFrom;
    }

    public Instant getValidUntil() {
        return validUntil;
    }

    public void setValidUntil(Instant validUntil) {
        this.validUntil = validUntil;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    public Instant getNextFireAt() {
        return nextFireAt;
    }

    public void setNextFireAt(Instant nextFireAt) {
        this.nextFireAt = nextFireAt;
    }

    public Instant getLastFiredAt() {
        return lastFiredAt;
    }

    public void setLastFiredAt(Instant lastFiredAt) {
        this.lastFiredAt = lastFiredAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public void setPayload(Map<String, Object> payload) {
        this.payload = payload;
    }
}
