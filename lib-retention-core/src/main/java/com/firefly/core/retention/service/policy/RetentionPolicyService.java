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
package com.firefly.core.retention.service.policy;

import com.firefly.core.retention.domain.enums.event.RetentionEventType;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.event.RetentionEventBus;
import com.firefly.core.retention.exception.PolicyNotFoundException;
import com.firefly.core.retention.exception.RetentionException;
import com.firefly.core.retention.port.catalog.DataCatalogPort;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import com.firefly.core.retention.service.hold.LegalHoldRegistry;
import com.firefly.core.retention.service.schedule.ScheduleGenerator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Creates and versions retention policies and keeps item schedules in step with them.
 */
@Slf4j
public class RetentionPolicyService {

    private final RetentionPolicyStore policyStore;
    private final DataCatalogPort dataCatalog;
    private final ScheduleGenerator scheduleGenerator;
    private final RetentionPolicyValidator validator;
    private final LegalHoldRegistry holdRegistry;
    private final RetentionEventBus eventBus;
    private final Clock clock;

    public RetentionPolicyService(RetentionPolicyStore policyStore,
                                  DataCatalogPort dataCatalog,
                                  ScheduleGenerator scheduleGenerator,
                                  RetentionPolicyValidator validator,
                                  LegalHoldRegistry holdRegistry,
                                  RetentionEventBus eventBus,
                                  Clock clock) {
        this.policyStore = policyStore;
        this.dataCatalog = dataCatalog;
        this.scheduleGenerator = scheduleGenerator;
        this.validator = validator;
        this.holdRegistry = holdRegistry;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    /**
     * Validates and stores a new policy as version 1, then schedules every
     * catalog item it covers that has no policy yet.
     *
     * @param draft the policy definition
     * @return Mono containing the stored policy, or a
     *         {@link com.firefly.core.retention.exception.PolicyValidationException}
     */
    public Mono<RetentionPolicy> createPolicy(RetentionPolicy draft) {
        return Mono.defer(() -> {
            validator.validate(draft);
            Instant now = clock.instant();
            RetentionPolicy policy = draft.toBuilder()
                .id(draft.getId() != null ? draft.getId() : "policy-" + UUID.randomUUID())
                .version(1)
                .createdAt(now)
                .updatedAt(now)
                .build();
            return policyStore.save(policy);
        })
        .flatMap(policy -> {
            log.info("Created retention policy {} ({})", policy.getId(), policy.getName());
            eventBus.publish(eventBus.event(RetentionEventType.POLICY_CREATED)
                .policyId(policy.getId())
                .message("Retention policy created: " + policy.getName())
                .build());
            if (!policy.isEnabled()) {
                return Mono.just(policy);
            }
            return dataCatalog.findByDataTypes(policy.getDataTypes())
                .filter(item -> item.getRetentionPolicyId() == null && covers(policy, item))
                .concatMap(item -> dataCatalog.save(item.toBuilder().retentionPolicyId(policy.getId()).build())
                    .flatMap(assigned -> scheduleGenerator.schedule(assigned, policy, holdRegistry::isHeld)))
                .reduce(0, (count, entries) -> count + entries.size())
                .doOnNext(count -> publishScheduled(policy, count))
                .thenReturn(policy);
        });
    }

    /**
     * Replaces a policy with a new version. Outstanding entries of every item
     * governed by the policy are regenerated; completed entries stay as they are.
     * Regenerated entries of held items stay paused.
     *
     * @param policyId the policy ID
     * @param changes the new definition; identity and creation fields are kept from the stored version
     * @return Mono containing the new version
     */
    public Mono<RetentionPolicy> updatePolicy(String policyId, RetentionPolicy changes) {
        return getPolicy(policyId)
            .flatMap(current -> Mono.defer(() -> {
                RetentionPolicy next = changes.toBuilder()
                    .id(current.getId())
                    .version(current.getVersion() + 1)
                    .createdAt(current.getCreatedAt())
                    .createdBy(current.getCreatedBy())
                    .updatedAt(clock.instant())
                    .build();
                validator.validate(next);
                return policyStore.save(next);
            }))
            .flatMap(policy -> {
                log.info("Updated retention policy {} to version {}", policy.getId(), policy.getVersion());
                eventBus.publish(eventBus.event(RetentionEventType.POLICY_UPDATED)
                    .policyId(policy.getId())
                    .message("Retention policy updated to version " + policy.getVersion())
                    .attributes(Map.of("version", policy.getVersion()))
                    .build());
                return dataCatalog.findByRetentionPolicy(policy.getId())
                    .concatMap(item -> scheduleGenerator.regenerate(item, policy, holdRegistry::isHeld))
                    .reduce(0, (count, entries) -> count + entries.size())
                    .doOnNext(count -> publishScheduled(policy, count))
                    .thenReturn(policy);
            });
    }

    /**
     * Registers newly arrived data and schedules it. The item's own policy id
     * wins; otherwise the first enabled policy covering it is assigned, tenant
     * specific policies first.
     *
     * @param item the data item
     * @return Mono containing the generated entries
     */
    public Mono<List<RetentionScheduleEntry>> registerDataItem(DataItem item) {
        Mono<RetentionPolicy> policy = item.getRetentionPolicyId() != null
            ? getPolicy(item.getRetentionPolicyId())
            : policyStore.findAll()
                .filter(RetentionPolicy::isEnabled)
                .filter(candidate -> candidate.getDataTypes().contains(item.getDataType()) && covers(candidate, item))
                .sort(Comparator.comparing((RetentionPolicy candidate) -> candidate.getTenantId() == null))
                .next()
                .switchIfEmpty(Mono.error(new RetentionException(
                        "No retention policy covers data type " + item.getDataType() + " of item " + item.getId())));

        return policy.flatMap(selected -> dataCatalog.save(item.toBuilder().retentionPolicyId(selected.getId()).build())
            .flatMap(saved -> scheduleGenerator.regenerate(saved, selected, holdRegistry::isHeld))
            .doOnNext(entries -> {
                log.debug("Registered {} under policy {} with {} entries", item.getId(), selected.getId(), entries.size());
                publishScheduled(selected, entries.size());
            }));
    }

    public Mono<RetentionPolicy> getPolicy(String policyId) {
        return policyStore.findById(policyId)
            .switchIfEmpty(Mono.error(new PolicyNotFoundException(policyId)));
    }

    public Flux<RetentionPolicy> listPolicies() {
        return policyStore.findAll();
    }

    private static boolean covers(RetentionPolicy policy, DataItem item) {
        boolean classificationMatches = policy.getClassifications().isEmpty()
            || policy.getClassifications().contains(item.getClassification());
        boolean tenantMatches = policy.getTenantId() == null || policy.getTenantId().equals(item.getTenantId());
        return classificationMatches && tenantMatches;
    }

    private void publishScheduled(RetentionPolicy policy, int entryCount) {
        if (entryCount == 0) {
            return;
        }
        eventBus.publish(eventBus.event(RetentionEventType.SCHEDULE_GENERATED)
            .policyId(policy.getId())
            .message("Generated " + entryCount + " schedule entries")
            .attributes(Map.of("entries", entryCount, "version", policy.getVersion()))
            .build());
    }
}
