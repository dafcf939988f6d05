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
import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.enums.schedule.ScheduledAction;
import com.firefly.core.retention.domain.model.event.RetentionEvent;
import com.firefly.core.retention.domain.model.hold.HoldCompliance;
import com.firefly.core.retention.domain.model.hold.LegalHold;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.policy.TierDescriptor;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.domain.model.storage.StorageOperationResult;
import com.firefly.core.retention.exception.PolicyNotFoundException;
import com.firefly.core.retention.exception.PolicyValidationException;
import com.firefly.core.retention.exception.RetentionException;
import com.firefly.core.retention.port.storage.StorageBackendPort;
import com.firefly.core.retention.support.EngineHarness;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.firefly.core.retention.support.RetentionFixtures.T0;
import static com.firefly.core.retention.support.RetentionFixtures.invoice;
import static com.firefly.core.retention.support.RetentionFixtures.invoicePolicy;
import static com.firefly.core.retention.support.RetentionFixtures.litigationHold;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetentionPolicyServiceTest {

    @Mock
    private StorageBackendPort storageBackend;

    private EngineHarness harness;
    private RetentionPolicyService service;
    private final List<RetentionEvent> events = new CopyOnWriteArrayList<>();
    private Disposable eventSubscription;

    @BeforeEach
    void setUp() {
        harness = new EngineHarness(storageBackend);
        service = harness.policyService;
        eventSubscription = harness.eventBus.allEvents().subscribe(events::add);
    }

    @AfterEach
    void tearDown() {
        eventSubscription.dispose();
    }

    @Test
    void createPolicy_ShouldStoreVersionOneAndScheduleUnassignedItems() {
        // Given
        harness.catalog.save(invoice("inv-1").retentionPolicyId(null).build()).block();
        harness.catalog.save(invoice("inv-2").retentionPolicyId("policy-elsewhere").build()).block();
        harness.catalog.save(invoice("rcpt-1").dataType("receipt").retentionPolicyId(null).build()).block();

        // When
        RetentionPolicy created = service.createPolicy(invoicePolicy().version(7).build()).block();

        // Then
        assertThat(created.getVersion()).isEqualTo(1);
        assertThat(created.getCreatedAt()).isEqualTo(T0);
        assertThat(harness.item("inv-1").getRetentionPolicyId()).isEqualTo("policy-invoices");
        assertThat(harness.entries("inv-1")).hasSize(3);
        assertThat(harness.entries("inv-2")).isEmpty();
        assertThat(harness.entries("rcpt-1")).isEmpty();
        assertThat(events).extracting(RetentionEvent::getType)
            .containsExactly(RetentionEventType.POLICY_CREATED, RetentionEventType.SCHEDULE_GENERATED);
    }

    @Test
    void createPolicy_ShouldRejectInvalidPolicyWithoutStoringIt() {
        StepVerifier.create(service.createPolicy(invoicePolicy().totalRetention(365).build()))
            .expectError(PolicyValidationException.class)
            .verify();

        assertThat(harness.policyStore.findById("policy-invoices").blockOptional()).isEmpty();
    }

    @Test
    void updatePolicy_ShouldBumpVersionAndRegenerateOutstandingEntries() {
        // Given
        RetentionPolicy v1 = service.createPolicy(invoicePolicy().build()).block();
        harness.register(v1, invoice("inv-1").build());
        RetentionScheduleEntry first = harness.entries("inv-1").get(0);
        harness.entryStore.replaceIfStatus(first.withStatus(ScheduleStatus.COMPLETED, T0), ScheduleStatus.PENDING).block();
        harness.clock.advanceDays(1);

        // When
        RetentionPolicy v2 = service.updatePolicy("policy-invoices",
                v1.toBuilder().warm(TierDescriptor.of(30)).cold(TierDescriptor.of(120)).build()).block();

        // Then
        assertThat(v2.getVersion()).isEqualTo(2);
        assertThat(v2.getCreatedAt()).isEqualTo(v1.getCreatedAt());
        assertThat(v2.getUpdatedAt()).isEqualTo(T0.plus(Duration.ofDays(1)));
        List<RetentionScheduleEntry> entries = harness.entries("inv-1");
        assertThat(entries).filteredOn(entry -> entry.getStatus() == ScheduleStatus.COMPLETED).hasSize(1);
        assertThat(entries).filteredOn(entry -> entry.getStatus() == ScheduleStatus.PENDING)
            .extracting(RetentionScheduleEntry::getPolicyVersion)
            .containsOnly(2);
        assertThat(events).extracting(RetentionEvent::getType).contains(RetentionEventType.POLICY_UPDATED);
    }

    @Test
    void updatePolicy_ShouldKeepRegeneratedEntriesOfHeldItemPaused() {
        // Given: a hold that still allows tier moves
        when(storageBackend.setHeldFlag(anyString(), anyBoolean(), anyString()))
            .thenReturn(Mono.just(StorageOperationResult.success(0)));
        RetentionPolicy v1 = service.createPolicy(invoicePolicy().build()).block();
        harness.register(v1, invoice("inv-1").build());
        LegalHold hold = harness.holdRegistry.createHold(litigationHold()
            .compliance(HoldCompliance.builder().preventModification(false).build())
            .build()).block();
        harness.holdRegistry.applyHold(hold.getId(), List.of("inv-1")).block();

        // When
        service.updatePolicy("policy-invoices", v1.toBuilder().gracePeriod(45).build()).block();

        // Then
        assertThat(harness.entries("inv-1")).hasSize(3)
            .allSatisfy(entry -> {
                assertThat(entry.getStatus()).isEqualTo(ScheduleStatus.PAUSED);
                assertThat(entry.getPolicyVersion()).isEqualTo(2);
            });

        // When: the warm date passes while the hold is still active
        harness.clock.advanceDays(31);
        harness.executor.runTick().blockLast();

        // Then
        verify(storageBackend, never()).transition(anyString(), any(StorageTier.class));
        assertThat(harness.item("inv-1").getCurrentTier()).isNotEqualTo(StorageTier.WARM);
        assertThat(harness.statuses("inv-1")).containsOnly(ScheduleStatus.PAUSED);
    }

    @Test
    void registerDataItem_ShouldStoreEntriesOfHeldItemAsPaused() {
        // Given: the item was put on hold before it had a schedule
        when(storageBackend.setHeldFlag(anyString(), anyBoolean(), anyString()))
            .thenReturn(Mono.just(StorageOperationResult.success(0)));
        harness.policyStore.save(invoicePolicy().build()).block();
        harness.catalog.save(invoice("inv-1").retentionPolicyId(null).build()).block();
        LegalHold hold = harness.holdRegistry.createHold(litigationHold().build()).block();
        harness.holdRegistry.applyHold(hold.getId(), List.of("inv-1")).block();

        // When
        List<RetentionScheduleEntry> entries = service.registerDataItem(harness.item("inv-1")).block();

        // Then
        assertThat(entries).hasSize(3).extracting(RetentionScheduleEntry::getStatus).containsOnly(ScheduleStatus.PAUSED);
        assertThat(entries).extracting(RetentionScheduleEntry::getScheduledAction)
            .containsExactly(ScheduledAction.TRANSITION, ScheduledAction.TRANSITION, ScheduledAction.DELETE);
        assertThat(harness.statuses("inv-1")).containsOnly(ScheduleStatus.PAUSED);
    }

    @Test
    void updatePolicy_ShouldFailForUnknownPolicy() {
        StepVerifier.create(service.updatePolicy("policy-missing", invoicePolicy().build()))
            .expectError(PolicyNotFoundException.class)
            .verify();
    }

    @Test
    void registerDataItem_ShouldPreferTenantSpecificPolicy() {
        // Given
        harness.policyStore.save(invoicePolicy().build()).block();
        harness.policyStore.save(invoicePolicy().id("policy-tenant-a").tenantId("tenant-a").build()).block();
        harness.policyStore.save(invoicePolicy().id("policy-disabled").enabled(false).build()).block();

        // When
        List<RetentionScheduleEntry> entries = service.registerDataItem(invoice("inv-1").retentionPolicyId(null).build()).block();

        // Then
        assertThat(entries).hasSize(3).allMatch(entry -> "policy-tenant-a".equals(entry.getPolicyId()));
        assertThat(harness.item("inv-1").getRetentionPolicyId()).isEqualTo("policy-tenant-a");
    }

    @Test
    void registerDataItem_ShouldFailWhenNoPolicyCoversItem() {
        harness.policyStore.save(invoicePolicy().build()).block();

        StepVerifier.create(service.registerDataItem(invoice("doc-1").dataType("contract").retentionPolicyId(null).build()))
            .expectErrorSatisfies(error -> {
                assertThat(error).isExactlyInstanceOf(RetentionException.class);
                assertThat(error.getMessage()).isEqualTo("No retention policy covers data type contract of item doc-1");
            })
            .verify();
    }

    @Test
    void getPolicy_ShouldFailForUnknownPolicy() {
        StepVerifier.create(service.getPolicy("policy-missing"))
            .expectError(PolicyNotFoundException.class)
            .verify();
    }
}
