package io.tempo4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.tempo4j.core.JobStoreException;
import io.tempo4j.core.PersistResult;
import io.tempo4j.core.RegistryEntry;
import io.tempo4j.core.ScheduleRegistry;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence for schedule registry entries (collection {@code schedule_entries}).
 */
public class MongoScheduleRegistry implements ScheduleRegistry {

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoScheduleRegistry(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public PersistResult save(RegistryEntry entry) {
        Objects.requireNonNull(entry, "entry must not be null");

        Update u = new Update()
                .set("ownerId", entry.ownerId())
                .set("taskKind", entry.taskKind())
                .set("originalRequest", entry.originalRequest())
                .set("createdAt", entry.createdAt());
        if (entry.chatId() != null) {
            u.set("chatId", entry.chatId());
        } else {
            u.unset("chatId");
        }
        if (!entry.preferences().isEmpty()) {
            u.set("preferences", entry.preferences());
        } else {
            u.unset("preferences");
        }

        try {
            UpdateResult result = mongoTemplate.upsert(byId(entry.jobId()), u, ScheduleEntryDocument.class);
            return PersistResult.of(result.getUpsertedId() != null);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to persist registry entry jobId=" + entry.jobId(), e);
        }
    }

    @Override
    public Optional<RegistryEntry> find(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        try {
            return Optional.ofNullable(mongoTemplate.findById(jobId, ScheduleEntryDocument.class))
                    .map(this::toEntry);
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to read registry entry jobId=" + jobId, e);
        }
    }

    @Override
    public List<RegistryEntry> listByOwner(String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId must not be null");
        Query q = new Query(Criteria.where("ownerId").is(ownerId));
        q.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        try {
            return mongoTemplate.find(q, ScheduleEntryDocument.class).stream()
                    .map(this::toEntry)
                    .toList();
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to list registry entries ownerId=" + ownerId, e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        try {
            return mongoTemplate.remove(byId(jobId), ScheduleEntryDocument.class).getDeletedCount() > 0;
        } catch (DataAccessException e) {
            throw new JobStoreException("Failed to delete registry entry jobId=" + jobId, e);
        }
    }

    private RegistryEntry toEntry(ScheduleEntryDocument doc) {
        Map<String, Object> preferences = doc.getPreferences() == null ? null :
                objectMapper.convertValue(doc.getPreferences(), new TypeReference<Map<String, Object>>() {
                });
        return new RegistryEntry(
                doc.getId(),
                doc.getOwnerId(),
                doc.getChatId(),
                doc.getTaskKind(),
                doc.getOriginalRequest(),
                preferences,
                doc.getCreatedAt()
        );
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }
}
