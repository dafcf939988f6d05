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
package com.firefly.core.retention.support;

import com.firefly.core.retention.adapter.memory.InMemoryDataCatalog;
import com.firefly.core.retention.adapter.memory.InMemoryLegalHoldStore;
import com.firefly.core.retention.adapter.memory.InMemoryRetentionPolicyStore;
import com.firefly.core.retention.adapter.memory.InMemoryScheduleEntryStore;
import com.firefly.core.retention.config.RetentionProperties;
import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.event.RetentionEventBus;
import com.firefly.core.retention.port.storage.StorageBackendPort;
import com.firefly.core.retention.service.RetentionEngine;
import com.firefly.core.retention.service.hold.LegalHoldRegistry;
import com.firefly.core.retention.service.hold.LegalHoldValidator;
import com.firefly.core.retention.service.policy.RetentionPolicyService;
import com.firefly.core.retention.service.policy.RetentionPolicyValidator;
import com.firefly.core.retention.service.policy.RuleEvaluator;
import com.firefly.core.retention.service.report.RetentionReportService;
import com.firefly.core.retention.service.schedule.RetentionExecutor;
import com.firefly.core.retention.service.schedule.ScheduleGenerator;
import jakarta.validation.Validation;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Engine wired on in-memory adapters around a test-supplied storage backend.
 */
public class EngineHarness {

    public final MutableClock clock = new MutableClock(RetentionFixtures.T0);
    public final InMemoryRetentionPolicyStore policyStore = new InMemoryRetentionPolicyStore();
    public final InMemoryScheduleEntryStore entryStore = new InMemoryScheduleEntryStore();
    public final InMemoryLegalHoldStore holdStore = new InMemoryLegalHoldStore();
    public final InMemoryDataCatalog catalog = new InMemoryDataCatalog();
    public final RetentionEventBus eventBus = new RetentionEventBus(1024, clock);
    public final RetentionProperties.Executor settings = new RetentionProperties.Executor();

    public final RuleEvaluator ruleEvaluator = new RuleEvaluator();
    public final RetentionPolicyValidator policyValidator =
        new RetentionPolicyValidator(Validation.buildDefaultValidatorFactory().getValidator());
    public final ScheduleGenerator scheduleGenerator = new ScheduleGenerator(entryStore, ruleEvaluator, clock);
    public final LegalHoldRegistry holdRegistry;
    public final RetentionExecutor executor;
    public final RetentionPolicyService policyService;
    public final RetentionReportService reportService;
    public final RetentionEngine engine;

    public EngineHarness(StorageBackendPort storageBackend) {
        holdRegistry = new LegalHoldRegistry(holdStore, entryStore, catalog, storageBackend, policyStore,
                scheduleGenerator, new LegalHoldValidator(), eventBus, clock);
        executor = new RetentionExecutor(policyStore, entryStore, catalog, storageBackend, holdRegistry,
                ruleEvaluator, policyValidator, eventBus, settings, clock);
        policyService = new RetentionPolicyService(policyStore, catalog, scheduleGenerator, policyValidator,
                holdRegistry, eventBus, clock);
        reportService = new RetentionReportService(policyStore, entryStore, catalog, holdRegistry, Duration.ofDays(1), clock);
        engine = new RetentionEngine(policyService, executor, holdRegistry, reportService);
    }

    /**
     * Stores the policy and the item and generates the item's schedule.
     */
    public List<RetentionScheduleEntry> register(RetentionPolicy policy, DataItem item) {
        policyStore.save(policy).block();
        catalog.save(item).block();
        return scheduleGenerator.schedule(item, policy).block();
    }

    public List<RetentionScheduleEntry> entries(String dataId) {
        return entryStore.findByDataId(dataId).collectList().block();
    }

    public List<ScheduleStatus> statuses(String dataId) {
        return entries(dataId).stream().map(RetentionScheduleEntry::getStatus).collect(Collectors.toList());
    }

    public DataItem item(String dataId) {
        return catalog.findById(dataId).block();
    }
}
