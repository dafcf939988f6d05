package com.firefly.core.retention.config;

import com.firefly.core.retention.adapter.memory.InMemoryRetentionPolicyStore;
import com.firefly.core.retention.event.RetentionEventDispatcher;
import com.firefly.core.retention.service.RetentionPorts;
import com.firefly.core.retention.service.schedule.RetentionTickScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = RetentionAutoConfiguration.class)
@TestPropertySource(properties = {
        "firefly.retention.executor.scheduling-enabled=true",
        "firefly.retention.executor.tick-interval=6h",
        "firefly.retention.cache.enabled=false",
        "firefly.retention.events.dispatch-enabled=false"
})
class RetentionSchedulingConfigurationTest {

    @Autowired
    private RetentionTickScheduler scheduler;

    @Autowired
    private RetentionPorts ports;

    @Autowired
    private RetentionProperties properties;

    @Autowired
    private ObjectProvider<RetentionEventDispatcher> dispatcher;

    @Test
    void contextLoads_withTickSchedulerAndUncachedPolicyStore() {
        assertThat(scheduler.isRunning()).isTrue();
        assertThat(properties.getExecutor().getTickInterval()).isEqualTo(Duration.ofHours(6));
        assertThat(ports.getPolicyStore()).isInstanceOf(InMemoryRetentionPolicyStore.class);
        assertThat(dispatcher.getIfAvailable()).isNull();
    }
}
