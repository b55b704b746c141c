package io.dockpulse.core;

import io.dockpulse.support.TestHandler;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobHandlerRegistryTest {

    @Test
    void keepsRegistrationOrder() {
        JobHandlerRegistry registry = new JobHandlerRegistry(List.of(new TestHandler("scan"), new TestHandler("cleanup")));

        assertThat(registry.jobTypes()).containsExactly("scan", "cleanup");
        assertThat(registry.find("cleanup")).isPresent();
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void rejectsDuplicateAndBlankJobTypes() {
        JobHandlerRegistry registry = new JobHandlerRegistry();
        registry.register(new TestHandler("scan"));

        assertThatThrownBy(() -> registry.register(new TestHandler("scan")))
                .isInstanceOfSatisfying(DuplicateHandlerException.class, e -> assertThat(e.getJobType()).isEqualTo("scan"));
        assertThatThrownBy(() -> registry.register(new TestHandler(" ")))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void getRequiredFailsForUnknownType() {
        JobHandlerRegistry registry = new JobHandlerRegistry();

        assertThatThrownBy(() -> registry.getRequired("scan"))
                .isInstanceOfSatisfying(UnknownJobTypeException.class, e -> assertThat(e.getJobType()).isEqualTo("scan"));
        assertThat(registry.isEmpty()).isTrue();
    }
}
