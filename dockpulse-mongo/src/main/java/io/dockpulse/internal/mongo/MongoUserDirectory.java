package io.dockpulse.internal.mongo;

import io.dockpulse.spi.UserDirectory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

import static io.dockpulse.internal.mongo.MongoBatchRunStore.persist;

/**
 * Users known to the engine: anyone with a batch config or an intent.
 * <p>
 * A user with neither is not listed, so a handler whose default config is enabled never runs for
 * them until something is saved. Applications that own the user list should register their own
 * {@link UserDirectory} bean instead.
 */
public class MongoUserDirectory implements UserDirectory {

    private final MongoTemplate mongoTemplate;

    public MongoUserDirectory(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<String> findAllUserIds() {
        return persist("findAllUserIds", () -> {
            TreeSet<String> users = new TreeSet<>();
            mongoTemplate.findDistinct(new Query(), "userId", BatchConfigDocument.class, String.class)
                    .stream().filter(Objects::nonNull).forEach(users::add);
            mongoTemplate.findDistinct(new Query(), "userId", IntentDocument.class, String.class)
                    .stream().filter(Objects::nonNull).forEach(users::add);
            return new ArrayList<>(users);
        });
    }
}
