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
package com.firefly.core.retention.adapter.memory;

import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.enums.schedule.ScheduledAction;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.IntStream;

import static com.firefly.core.retention.support.RetentionFixtures.T0;
import static org.assertj.core.api.Assertions.assertThat;

class InMemoryScheduleEntryStoreTest {

    private InMemoryScheduleEntryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleEntryStore();
        store.saveAll(List.of(
                entry("e-1", "inv-1", 30),
                entry("e-2", "inv-1", 90),
                entry("e-3", "inv-2", 10),
                entry("e-4", "inv-3", 60).toBuilder().policyId("policy-other").build()))
            .blockLast();
    }

    @Test
    void claim_ShouldGrantEntryToExactlyOneConcurrentCaller() {
        List<Boolean> outcomes = Flux.fromStream(IntStream.range(0, 16).boxed())
            .parallel()
            .runOn(Schedulers.parallel())
            .flatMap(i -> store.claim("e-1"))
            .sequential()
            .collectList()
            .block();

        assertThat(outcomes).filteredOn(Boolean::booleanValue).hasSize(1);
        assertThat(store.findById("e-1").block().getStatus()).isEqualTo(ScheduleStatus.PROCESSING);
    }

    @Test
    void claim_ShouldRefuseWhileAnotherEntryOfSameItemIsProcessing() {
        StepVerifier.create(store.claim("e-1")).expectNext(true).verifyComplete();

        StepVerifier.create(store.claim("e-2")).expectNext(false).verifyComplete();
        StepVerifier.create(store.claim("e-3")).expectNext(true).verifyComplete();
    }

    @Test
    void claim_ShouldRefuseUnknownOrNonPendingEntry() {
        store.pauseByDataId("inv-2", T0).block();

        StepVerifier.create(store.claim("missing")).expectNext(false).verifyComplete();
        StepVerifier.create(store.claim("e-3")).expectNext(false).verifyComplete();
    }

    @Test
    void replaceIfStatus_ShouldOnlyReplaceWhenStoredStatusMatches() {
        RetentionScheduleEntry stored = store.findById("e-1").block();

        StepVerifier.create(store.replaceIfStatus(stored.withStatus(ScheduleStatus.COMPLETED, T0), ScheduleStatus.PROCESSING))
            .expectNext(false)
            .verifyComplete();
        StepVerifier.create(store.replaceIfStatus(stored.withStatus(ScheduleStatus.FAILED, T0), ScheduleStatus.PENDING))
            .expectNext(true)
            .verifyComplete();
        assertThat(store.findById("e-1").block().getStatus()).isEqualTo(ScheduleStatus.FAILED);
    }

    @Test
    void pauseAndResume_ShouldOnlyMoveMatchingStatuses() {
        store.claim("e-1").block();

        StepVerifier.create(store.pauseByDataId("inv-1", T0)).expectNext(1).verifyComplete();
        assertThat(store.findByDataId("inv-1").map(RetentionScheduleEntry::getStatus).collectList().block())
            .containsExactly(ScheduleStatus.PROCESSING, ScheduleStatus.PAUSED);

        StepVerifier.create(store.resumeByDataId("inv-1", T0)).expectNext(1).verifyComplete();
        assertThat(store.findById("e-2").block().getStatus()).isEqualTo(ScheduleStatus.PENDING);
    }

    @Test
    void findDue_ShouldReturnPendingEntriesOfPolicyOldestFirstUpToLimit() {
        Instant now = T0.plus(Duration.ofDays(100));

        StepVerifier.create(store.findDue("policy-invoices", now, 10).map(RetentionScheduleEntry::getId))
            .expectNext("e-3", "e-1", "e-2")
            .verifyComplete();
        StepVerifier.create(store.findDue("policy-invoices", now, 2).map(RetentionScheduleEntry::getId))
            .expectNext("e-3", "e-1")
            .verifyComplete();
        StepVerifier.create(store.findDue("policy-invoices", T0.plus(Duration.ofDays(29)), 10).map(RetentionScheduleEntry::getId))
            .expectNext("e-3")
            .verifyComplete();
    }

    @Test
    void deleteByDataIdAndStatusIn_ShouldKeepOtherStatuses() {
        RetentionScheduleEntry done = store.findById("e-1").block().withStatus(ScheduleStatus.COMPLETED, T0);
        store.replaceIfStatus(done, ScheduleStatus.PENDING).block();

        StepVerifier.create(store.deleteByDataIdAndStatusIn("inv-1", Set.of(ScheduleStatus.PENDING, ScheduleStatus.PAUSED)))
            .expectNext(1)
            .verifyComplete();
        StepVerifier.create(store.findByDataId("inv-1").map(RetentionScheduleEntry::getId))
            .expectNext("e-1")
            .verifyComplete();
        StepVerifier.create(store.deleteByDataId("inv-1")).expectNext(1).verifyComplete();
    }

    private static RetentionScheduleEntry entry(String id, String dataId, int day) {
        return RetentionScheduleEntry.builder()
            .id(id)
            .dataId(dataId)
            .policyId("policy-invoices")
            .policyVersion(1)
            .scheduledDate(T0.plus(Duration.ofDays(day)))
            .scheduledAction(ScheduledAction.TRANSITION)
            .createdAt(T0)
            .build();
    }
}
