package io.dockpulse.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.dockpulse.BatchSystem;
import io.dockpulse.JobHandler;
import io.dockpulse.JobLogger;
import io.dockpulse.core.ConfigurationException;
import io.dockpulse.core.ScheduleEvaluator;
import io.dockpulse.internal.BatchManager;
import io.dockpulse.internal.IntentEvaluator;
import io.dockpulse.internal.ScanCompletionBus;
import io.dockpulse.internal.mongo.BatchMongoIndexConfig;
import io.dockpulse.internal.mongo.MongoBatchConfigSource;
import io.dockpulse.internal.mongo.MongoBatchRunStore;
import io.dockpulse.internal.mongo.MongoIntentStore;
import io.dockpulse.internal.mongo.MongoUserDirectory;
import io.dockpulse.spi.BatchConfigSource;
import io.dockpulse.spi.BatchRunStore;
import io.dockpulse.spi.IntentExecutor;
import io.dockpulse.spi.IntentStore;
import io.dockpulse.spi.UserDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the batch engine.
 *
 * <p>Every {@link JobHandler} bean is registered with the {@link BatchManager}. Intent execution is delegated
 * to the application's {@link IntentExecutor} bean.
 */
@AutoConfiguration
@ConditionalOnClass({BatchSystem.class, MongoTemplate.class})
@ConditionalOnProperty(prefix = "dockpulse", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DockpulseAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DockpulseAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "dockpulse")
    public BatchProperties batchProperties() {
        return new BatchProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock dockpulseClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleEvaluator scheduleEvaluator(BatchProperties props) {
        return new ScheduleEvaluator(props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean(BatchRunStore.class)
    protected MongoBatchRunStore mongoBatchRunStore(MongoTemplate mongoTemplate) {
        return new MongoBatchRunStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(IntentStore.class)
    protected MongoIntentStore mongoIntentStore(MongoTemplate mongoTemplate, ScheduleEvaluator scheduleEvaluator, Clock clock) {
        return new MongoIntentStore(mongoTemplate, scheduleEvaluator, clock);
    }

    @Bean
    @ConditionalOnMissingBean(BatchConfigSource.class)
    protected MongoBatchConfigSource mongoBatchConfigSource(MongoTemplate mongoTemplate, Clock clock) {
        return new MongoBatchConfigSource(mongoTemplate, clock);
    }

    @Bean
    @ConditionalOnMissingBean(UserDirectory.class)
    protected MongoUserDirectory mongoUserDirectory(MongoTemplate mongoTemplate) {
        return new MongoUserDirectory(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    protected BatchMongoIndexConfig batchMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new BatchMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScanCompletionBus scanCompletionBus() {
        return new ScanCompletionBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public IntentEvaluator intentEvaluator(IntentStore intentStore,
                                           UserDirectory userDirectory,
                                           ScheduleEvaluator scheduleEvaluator,
                                           ObjectProvider<IntentExecutor> intentExecutor,
                                           ScanCompletionBus scanCompletionBus,
                                           BatchProperties props,
                                           Clock clock) {
        IntentExecutor executor = intentExecutor.getIfAvailable(() -> {
            log.warn("No IntentExecutor bean found; intents will be recorded as failed when they fire");
            return (intent, userId, trigger) -> {
                throw new ConfigurationException("No IntentExecutor configured");
            };
        });
        return new IntentEvaluator(intentStore, userDirectory, scheduleEvaluator, executor, scanCompletionBus, props, clock);
    }

    @Bean
    @ConditionalOnMissingBean(BatchSystem.class)
    public BatchManager batchManager(BatchProperties props,
                                     BatchRunStore runStore,
                                     BatchConfigSource configSource,
                                     UserDirectory userDirectory,
                                     IntentStore intentStore,
                                     IntentEvaluator intentEvaluator,
                                     ScanCompletionBus scanCompletionBus,
                                     ObjectProvider<ObjectMapper> objectMapper,
                                     ObjectProvider<JobHandler> handlers,
                                     Clock clock) {
        BatchManager manager = new BatchManager(props, runStore, configSource, userDirectory, intentStore,
                intentEvaluator, scanCompletionBus, objectMapper.getIfAvailable(JobLogger::defaultObjectMapper), clock);
        handlers.orderedStream().forEach(manager::registerHandler);
        return manager;
    }

    @Bean
    @ConditionalOnMissingBean
    public BatchLifecycle batchLifecycle(BatchSystem batchSystem) {
        return new BatchLifecycle(batchSystem);
    }

    @Bean
    @ConditionalOnProperty(prefix = "dockpulse", name = "ensure-indexes-on-startup", havingValue = "true", matchIfMissing = true)
    public SmartInitializingSingleton dockpulseIndexesInitializer(BatchMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
