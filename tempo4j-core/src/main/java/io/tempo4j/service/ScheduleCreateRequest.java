package io.tempo4j.service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ScheduleCreateRequest describes a schedule a tenant asked for, in the shape a chat tool receives it.
 *
 * <p>Exactly one of {@link #cron()} and {@link #at()} is set. When {@link #jobId()} is absent a
 * deterministic id is derived from the task kind, chat and schedule.
 */
public final class ScheduleCreateRequest {

    private final String jobId;
    private final String ownerId;
    private final String chatId;
    private final String taskKind;
    private final String cron;
    private final Instant at;
    private final String timezone;
    private final Instant validFrom;
    private final Instant validUntil;
    private final Object payload;
    private final String originalRequest;
    private final Map<String, Object> preferences;

    private ScheduleCreateRequest(Builder b) {
        this.jobId = blankToNull(b.jobId);
        this.ownerId = b.ownerId;
        this.chatId = b.chatId;
        this.taskKind = b.taskKind;
        this.cron = blankToNull(b.cron);
        this.at = b.at;
        this.timezone = blankToNull(b.timezone);
        this.validFrom = b.validFrom;
        this.validUntil = b.validUntil;
        this.payload = b.payload;
        this.originalRequest = b.originalRequest;
        this.preferences = b.preferences.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(b.preferences));
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }

    public String jobId() {
        return jobId;
    }

    public String ownerId() {
        return ownerId;
    }

    public String chatId() {
        return chatId;
    }

    /**
     * Handler kind the job runs with (e.g. "reminder").
     */
    public String taskKind() {
        return taskKind;
    }

    public String cron() {
        return cron;
    }

    public Instant at() {
        return at;
    }

    public String timezone() {
        return timezone;
    }

    public Instant validFrom() {
        return validFrom;
    }

    public Instant validUntil() {
        return validUntil;
    }

    /**
     * Handler payload. Converted to a plain map before it is persisted.
     */
    public Object payload() {
        return payload;
    }

    /**
     * The tenant's request in their own words, kept for display.
     */
    public String originalRequest() {
        return originalRequest;
    }

    public Map<String, Object> preferences() {
        return preferences;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String jobId;
        private String ownerId;
        private String chatId;
        private String taskKind;
        private String cron;
        private Instant at;
        private String timezone;
        private Instant validFrom;
        private Instant validUntil;
        private Object payload;
        private String originalRequest;
        private final Map<String, Object> preferences = new LinkedHashMap<>();

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder ownerId(String ownerId) {
            this.ownerId = ownerId;
            return this;
        }

        public Builder chatId(String chatId) {
            this.chatId = chatId;
            return this;
        }

        public Builder taskKind(String taskKind) {
            this.taskKind = taskKind;
            return this;
        }

        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }

        public Builder at(Instant at) {
            this.at = at;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder validFrom(Instant validFrom) {
            this.validFrom = validFrom;
            return this;
        }

        public Builder validUntil(Instant validUntil) {
            this.validUntil = validUntil;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder originalRequest(String originalRequest) {
            this.originalRequest = originalRequest;
            return this;
        }

        public Builder preferences(Map<String, Object> preferences) {
            if (preferences != null) {
                this.preferences.putAll(preferences);
            }
            return this;
        }

        public Builder preference(String key, Object value) {
            this.preferences.put(key, value);
            return this;
        }

        public ScheduleCreateRequest build() {
            return new ScheduleCreateRequest(this);
        }
    }
}
