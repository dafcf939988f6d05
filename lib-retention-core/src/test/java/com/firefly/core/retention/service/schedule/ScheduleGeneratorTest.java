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
package com.firefly.core.retention.service.schedule;

import com.firefly.core.retention.adapter.memory.InMemoryScheduleEntryStore;
import com.firefly.core.retention.domain.enums.policy.ConditionField;
import com.firefly.core.retention.domain.enums.policy.ConditionOperator;
import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.enums.schedule.ScheduledAction;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.policy.CustomRule;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.policy.RuleAction;
import com.firefly.core.retention.domain.model.policy.RuleCondition;
import com.firefly.core.retention.domain.model.policy.TierDescriptor;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.service.policy.RuleEvaluator;
import com.firefly.core.retention.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static com.firefly.core.retention.support.RetentionFixtures.T0;
import static com.firefly.core.retention.support.RetentionFixtures.invoice;
import static com.firefly.core.retention.support.RetentionFixtures.invoicePolicy;
import static org.assertj.core.api.Assertions.assertThat;

class ScheduleGeneratorTest {

    private MutableClock clock;
    private InMemoryScheduleEntryStore entryStore;
    private ScheduleGenerator generator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        entryStore = new InMemoryScheduleEntryStore();
        generator = new ScheduleGenerator(entryStore, new RuleEvaluator(), clock);
    }

    @Test
    void generate_ShouldPlanTransitionsAndDeletionFromCreationDate() {
        List<RetentionScheduleEntry> entries = generator.generate(invoice("inv-1").build(), invoicePolicy().build());

        assertThat(entries).extracting(RetentionScheduleEntry::getScheduledAction)
            .containsExactly(ScheduledAction.TRANSITION, ScheduledAction.TRANSITION, ScheduledAction.DELETE);
        assertThat(entries).extracting(RetentionScheduleEntry::getScheduledDate)
            .containsExactly(T0.plus(Duration.ofDays(30)), T0.plus(Duration.ofDays(90)), T0.plus(Duration.ofDays(180)));
        assertThat(entries).extracting(RetentionScheduleEntry::getNextTier)
            .containsExactly(StorageTier.WARM, StorageTier.COLD, null);
        assertThat(entries).allMatch(entry -> entry.getStatus() == ScheduleStatus.PENDING);
        assertThat(entries).allMatch(entry -> entry.getPolicyVersion() == 1);

        RetentionScheduleEntry deletion = entries.get(2);
        assertThat(deletion.getGracePeriodEnd()).isEqualTo(T0.plus(Duration.ofDays(210)));
        assertThat(deletion.getCurrentTier()).isEqualTo(StorageTier.COLD);
        assertThat(deletion.isRetroactive()).isFalse();
        assertThat(entries.get(0).getMetadata()).containsEntry(ScheduleGenerator.METADATA_TRANSITION, "hot_to_warm");
    }

    @Test
    void generate_ShouldIncludeArchiveWhenPolicyHasArchiveTier() {
        RetentionPolicy policy = invoicePolicy()
            .archive(TierDescriptor.of(185))
            .totalRetention(365)
            .build();

        List<RetentionScheduleEntry> entries = generator.generate(invoice("inv-1").build(), policy);

        assertThat(entries).hasSize(4);
        assertThat(entries.get(2).getNextTier()).isEqualTo(StorageTier.ARCHIVE);
        assertThat(entries.get(2).getScheduledDate()).isEqualTo(T0.plus(Duration.ofDays(180)));
        assertThat(entries.get(3).getScheduledDate()).isEqualTo(T0.plus(Duration.ofDays(365)));
        assertThat(entries.get(3).getCurrentTier()).isEqualTo(StorageTier.ARCHIVE);
    }

    @Test
    void generate_ShouldSkipTiersTheItemHasAlreadyReached() {
        DataItem warmItem = invoice("inv-2").currentTier(StorageTier.WARM).build();

        List<RetentionScheduleEntry> entries = generator.generate(warmItem, invoicePolicy().build());

        assertThat(entries).extracting(RetentionScheduleEntry::getNextTier).containsExactly(StorageTier.COLD, null);
    }

    @Test
    void generate_ShouldNotScheduleManualTiers() {
        RetentionPolicy policy = invoicePolicy().cold(TierDescriptor.manual(90)).build();

        List<RetentionScheduleEntry> entries = generator.generate(invoice("inv-3").build(), policy);

        assertThat(entries).extracting(RetentionScheduleEntry::getScheduledAction)
            .containsExactly(ScheduledAction.TRANSITION, ScheduledAction.DELETE);
        assertThat(entries.get(1).getCurrentTier()).isEqualTo(StorageTier.WARM);
    }

    @Test
    void generate_ShouldShiftDeletionForMatchingExtendRule() {
        RetentionPolicy policy = invoicePolicy()
            .customRules(List.of(CustomRule.builder()
                .name("confidential-extension")
                .conditions(List.of(RuleCondition.builder()
                    .field(ConditionField.CLASSIFICATION)
                    .operator(ConditionOperator.EQUALS)
                    .value("confidential")
                    .build()))
                .action(RuleAction.extend(30))
                .build()))
            .build();

        RetentionScheduleEntry plain = last(generator.generate(invoice("inv-4").build(), policy));
        RetentionScheduleEntry extended = last(generator.generate(
                invoice("inv-5").classification("confidential").build(), policy));

        assertThat(plain.getScheduledDate()).isEqualTo(T0.plus(Duration.ofDays(180)));
        assertThat(extended.getScheduledDate()).isEqualTo(T0.plus(Duration.ofDays(210)));
        assertThat(extended.getGracePeriodEnd()).isEqualTo(T0.plus(Duration.ofDays(240)));
        assertThat(extended.getMetadata()).containsEntry(ScheduleGenerator.METADATA_RULE_ADJUSTMENT_DAYS, "30");
    }

    @Test
    void generate_ShouldNotAccelerateDeletionBeforeLastTransition() {
        RetentionPolicy policy = invoicePolicy()
            .customRules(List.of(CustomRule.builder()
                .name("purge-early")
                .conditions(List.of(RuleCondition.builder()
                    .field(ConditionField.DATA_TYPE)
                    .operator(ConditionOperator.EQUALS)
                    .value("invoice")
                    .build()))
                .action(RuleAction.accelerate(150))
                .build()))
            .build();

        List<RetentionScheduleEntry> entries = generator.generate(invoice("inv-6").build(), policy);

        assertThat(last(entries).getScheduledDate()).isEqualTo(T0.plus(Duration.ofDays(90)));
        for (int i = 1; i < entries.size(); i++) {
            assertThat(entries.get(i).getScheduledDate()).isAfterOrEqualTo(entries.get(i - 1).getScheduledDate());
        }
    }

    @Test
    void generate_ShouldFlagDeletionInThePastAsRetroactive() {
        clock.advanceDays(400);

        RetentionScheduleEntry deletion = last(generator.generate(invoice("inv-7").build(), invoicePolicy().build()));

        assertThat(deletion.isRetroactive()).isTrue();
        assertThat(deletion.getScheduledDate()).isEqualTo(T0.plus(Duration.ofDays(180)));
    }

    @Test
    void regenerate_ShouldKeepCompletedEntriesAndReplaceOutstandingOnes() {
        DataItem item = invoice("inv-8").build();
        RetentionPolicy v1 = invoicePolicy().build();
        List<RetentionScheduleEntry> original = generator.schedule(item, v1).block();
        RetentionScheduleEntry first = original.get(0);
        entryStore.replaceIfStatus(first.withStatus(ScheduleStatus.COMPLETED, T0), ScheduleStatus.PENDING).block();

        RetentionPolicy v2 = v1.toBuilder().version(2).hot(TierDescriptor.of(60)).warm(TierDescriptor.of(30)).build();

        StepVerifier.create(generator.regenerate(item.toBuilder().currentTier(StorageTier.WARM).build(), v2))
            .assertNext(fresh -> assertThat(fresh).allMatch(entry -> entry.getPolicyVersion() == 2))
            .verifyComplete();

        List<RetentionScheduleEntry> stored = entryStore.findByDataId("inv-8").collectList().block();
        assertThat(stored).filteredOn(entry -> entry.getStatus() == ScheduleStatus.COMPLETED)
            .extracting(RetentionScheduleEntry::getId)
            .containsExactly(first.getId());
        assertThat(stored).filteredOn(entry -> entry.getStatus() == ScheduleStatus.PENDING)
            .allMatch(entry -> entry.getPolicyVersion() == 2)
            .hasSize(2);
    }

    private static RetentionScheduleEntry last(List<RetentionScheduleEntry> entries) {
        return entries.get(entries.size() - 1);
    }
}
