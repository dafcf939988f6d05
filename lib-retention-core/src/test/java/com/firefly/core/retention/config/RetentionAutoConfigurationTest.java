package com.firefly.core.retention.config;

import com.firefly.core.retention.adapter.cache.CachingRetentionPolicyStore;
import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.event.RetentionEventDispatcher;
import com.firefly.core.retention.service.RetentionEngine;
import com.firefly.core.retention.service.RetentionPorts;
import com.firefly.core.retention.service.schedule.RetentionTickScheduler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;
import reactor.test.StepVerifier;

import static com.firefly.core.retention.support.RetentionFixtures.invoice;
import static com.firefly.core.retention.support.RetentionFixtures.invoicePolicy;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = RetentionAutoConfiguration.class)
@TestPropertySource(properties = {
        "firefly.retention.enabled=true",
        "firefly.retention.adapter-type=in-memory",
        "firefly.retention.executor.max-retries=5"
})
class RetentionAutoConfigurationTest {

    @Autowired
    private RetentionEngine engine;

    @Autowired
    private RetentionPorts ports;

    @Autowired
    private RetentionProperties properties;

    @Autowired
    private RetentionEventDispatcher dispatcher;

    @Autowired
    private ObjectProvider<RetentionTickScheduler> scheduler;

    @Test
    void contextLoads_withInMemoryStoresAndNoOpStorageBackend() {
        assertThat(engine).isNotNull();
        assertThat(ports.getStorageBackend().getAdapterName()).isEqualTo("NoOpStorageBackendPortAdapter");
        assertThat(ports.getPolicyStore()).isInstanceOf(CachingRetentionPolicyStore.class);
        assertThat(ports.getNotifications().getAdapterName()).isEqualTo("LoggingNotificationAdapter");
        assertThat(dispatcher.isRunning()).isTrue();
        assertThat(scheduler.getIfAvailable()).isNull();
        assertThat(properties.getExecutor().getMaxRetries()).isEqualTo(5);
    }

    @Test
    void engine_ShouldScheduleRegisteredItems() {
        engine.createPolicy(invoicePolicy().id("policy-autoconfig").build()).block();

        StepVerifier.create(engine.registerDataItem(invoice("inv-autoconfig").retentionPolicyId("policy-autoconfig").build()))
            .assertNext(entries -> assertThat(entries).extracting(entry -> entry.getNextTier())
                .containsExactly(StorageTier.WARM, StorageTier.COLD, null))
            .verifyComplete();
    }
}
