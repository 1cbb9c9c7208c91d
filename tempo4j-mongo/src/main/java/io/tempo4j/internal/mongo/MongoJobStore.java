package io.tempo4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.tempo4j.core.JobHandlerRegistry;
import io.tempo4j.core.JobRecord;
import io.tempo4j.core.JobStore;
import io.tempo4j.core.JobStoreException;
import io.tempo4j.core.PersistResult;
import io.tempo4j.core.ScheduleSpec;
import io.tempo4j.utils.CronExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs (collection {@code scheduled_jobs}).
 *
 * <p>One document per job id. {@link #put} is a single upsert on {@code _id}, so a record is either
 * fully written or left as it was.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public PersistResult put(JobRecord record) {
        Objects.requireNonNull(record, "record must not be null");

        Query query = byId(record.id());
        Update update = buildUpsertUpdate(record);
        try {
            UpdateResult result = mongoTemplate.upsert(query, update, ScheduledJobDocument.class);
            return PersistResult.of(result.getUpsertedId() != null);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to persist job id=" + record.id(), e);
        }
    }

    @Override
    public Optional<JobRecord> get(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ScheduledJobDocument doc;
        try {
            doc = mongoTemplate.findById(id, ScheduledJobDocument.class);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to read job id=" + id, e);
        }
        return doc == null ? Optional.empty() : Optional.of(toRecord(doc));
    }

    @Override
    public boolean remove(String id) {
        Objects.requireNonNull(id, "id must not be null");
        try {
            return mongoTemplate.remove(byId(id), ScheduledJobDocument.class).getDeletedCount() > 0;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to delete job id=" + id, e);
        }
    }

    @Override
    public List<JobRecord> loadAll(JobHandlerRegistry handlers) {
        Objects.requireNonNull(handlers, "handlers must not be null");
        List<ScheduledJobDocument> docs;
        try {
            docs = mongoTemplate.findAll(ScheduledJobDocument.class);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to load jobs", e);
        }

        List<JobRecord> records = new ArrayList<>(docs.size());
        for (ScheduledJobDocument doc : docs) {
            if (!handlers.contains(doc.getHandlerKind())) {
                log.warn("skipping job with unknown handler id={} kind={}", doc.getId(), doc.getHandlerKind());
                continue;
            }
            try {
                records.add(toRecord(doc));
            } catch (IllegalArgumentException | DateTimeException | NullPointerException e) {
                log.warn("skipping job that cannot be rebuilt id={} msg={}", doc.getId(), e.getMessage());
            }
        }
        log.debug("loaded jobs count={} skipped={}", records.size(), docs.size() - records.size());
        return records;
    }

    private Update buildUpsertUpdate(JobRecord record) {
        Update u = new Update();
        u.set("ownerId", record.ownerId());
        u.set("handlerKind", record.handlerKind());
        u.set("state", record.state());
        u.set("createdAt", record.createdAt());
        u.set("timezone", record.spec().zone().getId());

        if (record.spec() instanceof ScheduleSpec.Cron cron) {
            u.set("specType", ScheduledJobDocument.SpecType.CRON);
            u.set("cronExpression", cron.expression().expression());
            u.unset("fireAt");
            setOrUnset(u, "validFrom", cron.validFrom());
            setOrUnset(u, "validUntil", cron.validUntil());
        } else if (record.spec() instanceof ScheduleSpec.FixedInstant fixed) {
            u.set("specType", ScheduledJobDocument.SpecType.FIXED_INSTANT);
            u.set("fireAt", fixed.fireAt());
            u.unset("cronExpression");
            u.unset("validFrom");
            u.unset("validUntil");
        } else {
            throw new IllegalArgumentException("Unsupported schedule spec: " + record.spec().getClass().getName());
        }

        setOrUnset(u, "nextFireAt", record.nextFireAt());
        setOrUnset(u, "lastFiredAt", record.lastFiredAt());

        if (!record.payload().isEmpty()) {
            u.set("payload", record.payload());
        } else {
            u.unset("payload");
        }
        return u;
    }

    /**
     * Converts a persisted {@link ScheduledJobDocument} back into a {@link JobRecord}.
     *
     * @throws IllegalArgumentException if the stored cron text no longer parses
     * @throws DateTimeException        if the stored zone is unknown
     */
    JobRecord toRecord(ScheduledJobDocument doc) {
        ZoneId zone = ZoneId.of(Objects.requireNonNull(doc.getTimezone(), "timezone must not be null"));
        ScheduleSpec spec = switch (Objects.requireNonNull(doc.getSpecType(), "specType must not be null")) {
            case FIXED_INSTANT -> ScheduleSpec.at(doc.getFireAt(), zone);
            case CRON -> ScheduleSpec.cron(CronExpression.parse(doc.getCronExpression()), zone)
                    .withWindow(doc.getValidFrom(), doc.getValidUntil());
        };

        Map<String, Object> payload = doc.getPayload() == null ? null :
                objectMapper.convertValue(doc.getPayload(), new TypeReference<Map<String, Object>>() {
                });

        return new JobRecord(
                doc.getId(),
                doc.getOwnerId(),
                doc.getHandlerKind(),
                spec,
                doc.getState(),
                doc.getNextFireAt(),
                doc.getLastFiredAt(),
                payload,
                doc.getCreatedAt()
        );
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private static void setOrUnset(Update u, String key, Instant value) {
        if (value != null) {
            u.set(key, value);
        } else {
            u.unset(key);
        }
    }
}
