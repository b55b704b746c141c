package io.dockpulse.config;

import io.dockpulse.BatchSystem;
import io.dockpulse.JobContext;
import io.dockpulse.JobHandler;
import io.dockpulse.JobResult;
import io.dockpulse.core.BatchConfig;
import io.dockpulse.core.IntentExecutionResult;
import io.dockpulse.core.ScheduleEvaluator;
import io.dockpulse.internal.BatchManager;
import io.dockpulse.internal.IntentEvaluator;
import io.dockpulse.internal.mongo.BatchMongoIndexConfig;
import io.dockpulse.internal.mongo.BatchRunDocument;
import io.dockpulse.internal.mongo.MongoUserDirectory;
import io.dockpulse.spi.BatchRunStore;
import io.dockpulse.spi.IntentExecutor;
import io.dockpulse.spi.UserDirectory;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DockpulseAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class,
                    DockpulseAutoConfiguration.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(JobHandler.class, DemoJobHandler::new)
            .withPropertyValues(
                    "dockpulse.check-interval=2s",
                    "dockpulse.intent-startup-delay=1h",
                    "dockpulse.time-zone=Asia/Tokyo",
                    "dockpulse.ensure-indexes-on-startup=false"
            );

    @Test
    void shouldAutoConfigureBatchEngine() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(BatchSystem.class);
            assertThat(context).hasSingleBean(BatchLifecycle.class);
            assertThat(context).hasSingleBean(IntentEvaluator.class);
            assertThat(context).hasSingleBean(BatchRunStore.class);
            assertThat(context).doesNotHaveBean("dockpulseIndexesInitializer");

            BatchProperties props = context.getBean(BatchProperties.class);
            assertThat(props.getCheckInterval()).isEqualTo(Duration.ofSeconds(2));
            assertThat(context.getBean(ScheduleEvaluator.class).zone()).isEqualTo(ZoneId.of("Asia/Tokyo"));

            BatchManager manager = context.getBean(BatchManager.class);
            assertThat(manager.getRegisteredJobTypes()).containsExactly("demo");
            assertThat(manager.isStarted()).isTrue();
            assertThat(context.getBean(BatchLifecycle.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("dockpulse.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(BatchSystem.class);
            assertThat(context).doesNotHaveBean(BatchLifecycle.class);
        });
    }

    @Test
    void shouldUseApplicationIntentExecutor() {
        IntentExecutor executor = (intent, userId, trigger) -> IntentExecutionResult.nothingMatched();
        contextRunner.withBean(IntentExecutor.class, () -> executor).run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(IntentExecutor.class);
        });
    }

    @Test
    void shouldUseApplicationUserDirectory() {
        UserDirectory directory = () -> List.of("user-1");
        contextRunner.withBean(UserDirectory.class, () -> directory).run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(UserDirectory.class);
            assertThat(context).doesNotHaveBean(MongoUserDirectory.class);
            assertThat(context.getBean(UserDirectory.class).findAllUserIds()).containsExactly("user-1");
        });
    }

    @Test
    void shouldEnsureIndexesOnStartupByDefault() {
        MongoTemplate mongoTemplate = mock(MongoTemplate.class);
        IndexOperations indexOps = mock(IndexOperations.class);
        when(mongoTemplate.indexOps(any(Class.class))).thenReturn(indexOps);

        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(DockpulseAutoConfiguration.class))
                .withBean(MongoTemplate.class, () -> mongoTemplate)
                .withPropertyValues("dockpulse.intent-startup-delay=1h")
                .run(context -> {
                    assertThat(context).hasSingleBean(BatchMongoIndexConfig.class);
                    verify(mongoTemplate, atLeastOnce()).indexOps(BatchRunDocument.class);
                    verify(indexOps, times(7)).ensureIndex(any(IndexDefinition.class));
                    // no handlers: the engine declines to start
                    assertThat(context.getBean(BatchLifecycle.class).isRunning()).isFalse();
                });
    }

    static class DemoJobHandler implements JobHandler {
        @Override
        public String jobType() {
            return "demo";
        }

        @Override
        public String displayName() {
            return "Demo";
        }

        @Override
        public BatchConfig defaultConfig() {
            return new BatchConfig(false, 60);
        }

        @Override
        public JobResult execute(JobContext ctx) {
            return JobResult.empty();
        }
    }
}
