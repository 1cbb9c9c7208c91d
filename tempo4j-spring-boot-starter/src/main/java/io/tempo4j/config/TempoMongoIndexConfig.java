package io.tempo4j.config;

import io.tempo4j.internal.mongo.ScheduleEntryDocument;
import io.tempo4j.internal.mongo.ScheduledJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for tempo4j.
 *
 * <p>Indexes are <b>not</b> created at startup unless {@code tempo.ensure-indexes-on-startup=true}.
 * In production they are usually managed by DB migrations or ops scripts.
 *
 * <h3>Collection {@code scheduled_jobs}</h3>
 * <ul>
 *   <li><b>idx_state_next_fire</b>: { state: 1, nextFireAt: 1 }
 *       <br/>Used by ops queries on upcoming and disabled jobs.</li>
 * </ul>
 *
 * <h3>Collection {@code schedule_entries}</h3>
 * <ul>
 *   <li><b>idx_owner_created</b>: { ownerId: 1, createdAt: 1 }
 *       <br/>Used by {@code listByOwner}.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_jobs.createIndex({ state: 1, nextFireAt: 1 }, { name: "idx_state_next_fire" });
 * db.schedule_entries.createIndex({ ownerId: 1, createdAt: 1 }, { name: "idx_owner_created" });
 * </pre>
 */
public class TempoMongoIndexConfig {

    public static final String IDX_STATE_NEXT_FIRE = "idx_state_next_fire";
    public static final String IDX_OWNER_CREATED = "idx_owner_created";

    private final MongoTemplate mongoTemplate;

    public TempoMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the indexes above. Safe to run repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledJobDocument.class).createIndex(stateNextFireIndex());
        mongoTemplate.indexOps(ScheduleEntryDocument.class).createIndex(entryOwnerCreatedIndex());
    }

    public static Index stateNextFireIndex() {
        return new Index()
                .on("state", Sort.Direction.ASC)
                .on("nextFireAt", Sort.Direction.ASC)
                .named(IDX_STATE_NEXT_FIRE);
    }

    public static Index entryOwnerCreatedIndex() {
        return new Index()
                .on("ownerId", Sort.Direction.ASC)
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_OWNER_CREATED);
    }
}
