/*
 * Copyright 2024 Firefly Software Solutions Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.firefly.core.retention.config;

import com.firefly.core.retention.adapter.AdapterSelector;
import com.firefly.core.retention.adapter.cache.CachingRetentionPolicyStore;
import com.firefly.core.retention.adapter.noop.NoOpAdapterFactory;
import com.firefly.core.retention.event.RetentionEventBus;
import com.firefly.core.retention.event.RetentionEventDispatcher;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import com.firefly.core.retention.service.RetentionEngine;
import com.firefly.core.retention.service.RetentionPortProvider;
import com.firefly.core.retention.service.RetentionPorts;
import com.firefly.core.retention.service.hold.LegalHoldRegistry;
import com.firefly.core.retention.service.hold.LegalHoldValidator;
import com.firefly.core.retention.service.policy.RetentionPolicyService;
import com.firefly.core.retention.service.policy.RetentionPolicyValidator;
import com.firefly.core.retention.service.policy.RuleEvaluator;
import com.firefly.core.retention.service.report.RetentionReportService;
import com.firefly.core.retention.service.schedule.RetentionExecutor;
import com.firefly.core.retention.service.schedule.RetentionTickScheduler;
import com.firefly.core.retention.service.schedule.ScheduleGenerator;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for the Firefly retention engine.
 *
 * <p>This configuration class sets up the retention infrastructure based on
 * application properties. It handles:</p>
 * <ul>
 *   <li>Adapter discovery and registration</li>
 *   <li>Port resolution, with a no-op storage backend as fallback</li>
 *   <li>The engine services and the event bus</li>
 *   <li>An optional tick timer</li>
 * </ul>
 *
 * <p>The auto-configuration is activated when the property {@code firefly.retention.enabled}
 * is set to {@code true} (which is the default).</p>
 *
 * <p>Example configuration:</p>
 * <pre>
 * firefly:
 *   retention:
 *     enabled: true
 *     adapter-type: s3
 *     executor:
 *       scheduling-enabled: true
 *       tick-interval: 1h
 * </pre>
 *
 * @see RetentionProperties
 * @see RetentionPortProvider
 * @see RetentionEngine
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(RetentionProperties.class)
@ComponentScan(basePackages = "com.firefly.core.retention.adapter")
@ConditionalOnProperty(prefix = "firefly.retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class RetentionAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock retentionClock() {
        return Clock.systemUTC();
    }

    /**
     * Bean Validation used for policy checks. Closed with the context.
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean(name = "retentionValidatorFactory")
    public ValidatorFactory retentionValidatorFactory() {
        return Validation.buildDefaultValidatorFactory();
    }

    @Bean
    public RetentionPortProvider retentionPortProvider(AdapterSelector adapterSelector, RetentionProperties properties) {
        log.info("Configuring retention port provider with adapter type: {}", properties.getAdapterType());
        return new RetentionPortProvider(adapterSelector, properties);
    }

    /**
     * Resolves every port once. Stores and the catalog are required; the storage
     * backend falls back to a no-op adapter whose operations all fail.
     *
     * @param portProvider the port provider
     * @param noOpAdapterFactory factory of fallback adapters
     * @param properties the retention properties
     * @param clock the engine clock
     * @return the resolved ports
     * @throws IllegalStateException if a required store adapter is missing
     */
    @Bean
    public RetentionPorts retentionPorts(RetentionPortProvider portProvider,
                                         NoOpAdapterFactory noOpAdapterFactory,
                                         RetentionProperties properties,
                                         Clock clock) {
        RetentionPolicyStore policyStore = portProvider.getRetentionPolicyStore()
            .orElseThrow(() -> new IllegalStateException("No RetentionPolicyStore adapter available"));
        RetentionProperties.Cache cache = properties.getCache();
        if (Boolean.TRUE.equals(cache.getEnabled())) {
            policyStore = new CachingRetentionPolicyStore(policyStore, clock, cache.getMaxSize(), cache.getExpiration());
        }

        return RetentionPorts.builder()
            .storageBackend(portProvider.getStorageBackendPort()
                .orElseGet(noOpAdapterFactory::createStorageBackendPort))
            .policyStore(policyStore)
            .entryStore(portProvider.getScheduleEntryStore()
                .orElseThrow(() -> new IllegalStateException("No ScheduleEntryStore adapter available")))
            .holdStore(portProvider.getLegalHoldStore()
                .orElseThrow(() -> new IllegalStateException("No LegalHoldStore adapter available")))
            .dataCatalog(portProvider.getDataCatalogPort()
                .orElseThrow(() -> new IllegalStateException("No DataCatalogPort adapter available")))
            .notifications(portProvider.getNotificationPort().orElse(null))
            .build();
    }

    @Bean(destroyMethod = "shutdown")
    public RetentionEventBus retentionEventBus(RetentionProperties properties, Clock clock) {
        return new RetentionEventBus(properties.getEvents().getBufferSize(), clock);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "firefly.retention.events", name = "dispatch-enabled", havingValue = "true", matchIfMissing = true)
    public RetentionEventDispatcher retentionEventDispatcher(RetentionEventBus eventBus, RetentionPorts ports) {
        if (ports.getNotifications() == null) {
            throw new IllegalStateException("No RetentionNotificationPort adapter available");
        }
        return new RetentionEventDispatcher(eventBus, ports.getNotifications());
    }

    @Bean
    public RuleEvaluator retentionRuleEvaluator() {
        return new RuleEvaluator();
    }

    @Bean
    public RetentionPolicyValidator retentionPolicyValidator(ValidatorFactory retentionValidatorFactory) {
        Validator validator = retentionValidatorFactory.getValidator();
        return new RetentionPolicyValidator(validator);
    }

    @Bean
    public ScheduleGenerator scheduleGenerator(RetentionPorts ports, RuleEvaluator ruleEvaluator, Clock clock) {
        return new ScheduleGenerator(ports.getEntryStore(), ruleEvaluator, clock);
    }

    /**
     * The legal hold registry, with its active-hold index loaded from the store.
     */
    @Bean
    public LegalHoldRegistry legalHoldRegistry(RetentionPorts ports,
                                               ScheduleGenerator scheduleGenerator,
                                               RetentionEventBus eventBus,
                                               Clock clock) {
        LegalHoldRegistry registry = new LegalHoldRegistry(
            ports.getHoldStore(),
            ports.getEntryStore(),
            ports.getDataCatalog(),
            ports.getStorageBackend(),
            ports.getPolicyStore(),
            scheduleGenerator,
            new LegalHoldValidator(),
            eventBus,
            clock);
        registry.reload().block();
        return registry;
    }

    @Bean
    public RetentionPolicyService retentionPolicyService(RetentionPorts ports,
                                                         ScheduleGenerator scheduleGenerator,
                                                         RetentionPolicyValidator policyValidator,
                                                         LegalHoldRegistry legalHoldRegistry,
                                                         RetentionEventBus eventBus,
                                                         Clock clock) {
        return new RetentionPolicyService(ports.getPolicyStore(), ports.getDataCatalog(),
                scheduleGenerator, policyValidator, legalHoldRegistry, eventBus, clock);
    }

    @Bean
    public RetentionExecutor retentionExecutor(RetentionPorts ports,
                                               LegalHoldRegistry holdRegistry,
                                               RuleEvaluator ruleEvaluator,
                                               RetentionPolicyValidator policyValidator,
                                               RetentionEventBus eventBus,
                                               RetentionProperties properties,
                                               Clock clock) {
        return new RetentionExecutor(ports.getPolicyStore(), ports.getEntryStore(), ports.getDataCatalog(),
                ports.getStorageBackend(), holdRegistry, ruleEvaluator, policyValidator, eventBus,
                properties.getExecutor(), clock);
    }

    @Bean
    public RetentionReportService retentionReportService(RetentionPorts ports,
                                                         LegalHoldRegistry holdRegistry,
                                                         RetentionProperties properties,
                                                         Clock clock) {
        return new RetentionReportService(ports.getPolicyStore(), ports.getEntryStore(), ports.getDataCatalog(),
                holdRegistry, properties.getReport().getOverdueTolerance(), clock);
    }

    @Bean
    public RetentionEngine retentionEngine(RetentionPolicyService policyService,
                                           RetentionExecutor executor,
                                           LegalHoldRegistry holdRegistry,
                                           RetentionReportService reportService) {
        return new RetentionEngine(policyService, executor, holdRegistry, reportService);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "firefly.retention.executor", name = "scheduling-enabled", havingValue = "true")
    public RetentionTickScheduler retentionTickScheduler(RetentionEngine engine, RetentionProperties properties) {
        return new RetentionTickScheduler(engine, properties.getExecutor().getTickInterval());
    }
}
