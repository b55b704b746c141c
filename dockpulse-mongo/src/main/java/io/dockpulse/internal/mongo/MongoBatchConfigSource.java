package io.dockpulse.internal.mongo;

import io.dockpulse.core.BatchConfig;
import io.dockpulse.spi.BatchConfigSource;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import static io.dockpulse.internal.mongo.MongoBatchRunStore.persist;

/**
 * Batch configs stored one document per (userId, jobType).
 */
public class MongoBatchConfigSource implements BatchConfigSource {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoBatchConfigSource(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public Map<String, BatchConfig> findConfigs(String userId) {
        Query q = new Query(Criteria.where("userId").is(userId));
        return persist("findConfigs", () -> {
            Map<String, BatchConfig> configs = new LinkedHashMap<>();
            for (BatchConfigDocument doc : mongoTemplate.find(q, BatchConfigDocument.class)) {
                configs.put(doc.getJobType(), new BatchConfig(doc.isEnabled(), doc.getIntervalMinutes()));
            }
            return configs;
        });
    }

    /**
     * Upsert the config for a pair.
     *
     * @throws io.dockpulse.core.ConfigurationException when the interval is outside 1..1440 minutes
     */
    public BatchConfig save(String userId, String jobType, BatchConfig config) {
        Objects.requireNonNull(userId, "userId must not be null");
        Objects.requireNonNull(jobType, "jobType must not be null");
        Objects.requireNonNull(config, "config must not be null").validate();

        Instant now = clock.instant();
        Query q = new Query(Criteria.where("userId").is(userId).and("jobType").is(jobType));
        Update u = new Update()
                .set("enabled", config.enabled())
                .set("intervalMinutes", config.intervalMinutes())
                .set("updatedAt", now)
                .setOnInsert("createdAt", now);
        BatchConfigDocument saved = persist("saveConfig", () -> mongoTemplate.findAndModify(q, u,
                FindAndModifyOptions.options().upsert(true).returnNew(true), BatchConfigDocument.class));
        return new BatchConfig(saved.isEnabled(), saved.getIntervalMinutes());
    }
}
