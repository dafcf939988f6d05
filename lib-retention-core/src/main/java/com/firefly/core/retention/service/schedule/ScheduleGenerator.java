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

import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.enums.schedule.ScheduledAction;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.policy.RuleAction;
import com.firefly.core.retention.domain.model.policy.TierDescriptor;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.port.store.ScheduleEntryStore;
import com.firefly.core.retention.service.policy.RuleEvaluator;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Turns a policy and a data item into the item's ordered schedule.
 *
 * <p>Planning does not look at legal holds. Holds only decide whether stored
 * entries start out paused.</p>
 */
@Slf4j
public class ScheduleGenerator {

    public static final String METADATA_TRANSITION = "transition";
    public static final String METADATA_RULE_ADJUSTMENT_DAYS = "ruleAdjustmentDays";

    private final ScheduleEntryStore entryStore;
    private final RuleEvaluator ruleEvaluator;
    private final Clock clock;

    public ScheduleGenerator(ScheduleEntryStore entryStore, RuleEvaluator ruleEvaluator, Clock clock) {
        this.entryStore = entryStore;
        this.ruleEvaluator = ruleEvaluator;
        this.clock = clock;
    }

    /**
     * Builds the schedule of an item: one transition per automatic tier the item
     * has not reached yet, then one deletion. Dates are offsets from the item's
     * creation time and never decrease along the list.
     *
     * @param item the data item
     * @param policy the governing policy
     * @return entries ordered by scheduled date
     */
    public List<RetentionScheduleEntry> generate(DataItem item, RetentionPolicy policy) {
        Instant now = clock.instant();
        Instant anchor = item.getCreatedAt() != null ? item.getCreatedAt() : now;
        StorageTier reached = item.getCurrentTier() != null ? item.getCurrentTier() : StorageTier.HOT;

        List<RetentionScheduleEntry> entries = new ArrayList<>();
        StorageTier finalTier = reached;
        Instant lastTransition = anchor;

        int offset = policy.getHot().getDuration();
        offset = addTransition(entries, item, policy, reached, anchor, offset, StorageTier.WARM, policy.getWarm(), now);
        offset = addTransition(entries, item, policy, reached, anchor, offset, StorageTier.COLD, policy.getCold(), now);
        addTransition(entries, item, policy, reached, anchor, offset, StorageTier.ARCHIVE, policy.getArchive(), now);

        for (RetentionScheduleEntry entry : entries) {
            finalTier = entry.getNextTier();
            lastTransition = entry.getScheduledDate();
        }

        int shift = ruleEvaluator.matchingActions(policy, item, now).stream()
            .mapToInt(RuleAction::deletionShiftDays)
            .sum();
        Instant deletionDate = anchor.plus(Duration.ofDays((long) policy.getTotalRetention() + shift));
        if (deletionDate.isBefore(lastTransition)) {
            log.debug("Accelerated deletion of {} clamped to last transition {}", item.getId(), lastTransition);
            deletionDate = lastTransition;
        }

        Map<String, String> deletionMetadata = new HashMap<>();
        if (shift != 0) {
            deletionMetadata.put(METADATA_RULE_ADJUSTMENT_DAYS, String.valueOf(shift));
        }

        entries.add(RetentionScheduleEntry.builder()
            .id(UUID.randomUUID().toString())
            .dataId(item.getId())
            .policyId(policy.getId())
            .policyVersion(policy.getVersion())
            .scheduledDate(deletionDate)
            .scheduledAction(ScheduledAction.DELETE)
            .currentTier(finalTier)
            .status(ScheduleStatus.PENDING)
            .gracePeriodEnd(deletionDate.plus(Duration.ofDays(policy.getGracePeriod())))
            .retroactive(deletionDate.isBefore(now))
            .metadata(Map.copyOf(deletionMetadata))
            .createdAt(now)
            .updatedAt(now)
            .build());

        entries.sort(Comparator.comparing(RetentionScheduleEntry::getScheduledDate));
        log.debug("Generated {} schedule entries for {} under policy {} v{}",
                entries.size(), item.getId(), policy.getId(), policy.getVersion());
        return entries;
    }

    /**
     * Replaces the item's pending and paused entries with a fresh schedule.
     * Completed and failed entries are kept.
     *
     * @param item the data item
     * @param policy the governing policy
     * @return the newly stored entries
     */
    public Mono<List<RetentionScheduleEntry>> regenerate(DataItem item, RetentionPolicy policy) {
        return regenerate(item, policy, dataId -> false);
    }

    /**
     * Replaces the item's pending and paused entries with a fresh schedule.
     * The new entries are paused when the item is under an active legal hold.
     *
     * @param item the data item
     * @param policy the governing policy
     * @param heldData tells whether an active legal hold references a data id
     * @return the newly stored entries
     */
    public Mono<List<RetentionScheduleEntry>> regenerate(DataItem item, RetentionPolicy policy, Predicate<String> heldData) {
        return entryStore.deleteByDataIdAndStatusIn(item.getId(), ScheduleStatus.REPLACEABLE)
            .doOnNext(removed -> log.debug("Discarded {} outstanding entries of {}", removed, item.getId()))
            .then(Mono.defer(() -> store(item, generate(item, policy), heldData)));
    }

    /**
     * Generates and stores the schedule of an item that has none yet.
     *
     * @param item the data item
     * @param policy the governing policy
     * @return the stored entries
     */
    public Mono<List<RetentionScheduleEntry>> schedule(DataItem item, RetentionPolicy policy) {
        return schedule(item, policy, dataId -> false);
    }

    public Mono<List<RetentionScheduleEntry>> schedule(DataItem item, RetentionPolicy policy, Predicate<String> heldData) {
        return Mono.defer(() -> store(item, generate(item, policy), heldData));
    }

    // the hold check runs after the save so a hold applied meanwhile still parks the new entries
    private Mono<List<RetentionScheduleEntry>> store(DataItem item, List<RetentionScheduleEntry> generated,
                                                     Predicate<String> heldData) {
        return entryStore.saveAll(generated).collectList()
            .flatMap(stored -> {
                if (!heldData.test(item.getId())) {
                    return Mono.just(stored);
                }
                return entryStore.pauseByDataId(item.getId(), clock.instant())
                    .doOnNext(paused -> log.debug("Stored {} entries of held item {} as paused", paused, item.getId()))
                    .then(Mono.defer(() -> entryStore.findByDataId(item.getId())
                        .collectMap(RetentionScheduleEntry::getId)))
                    .map(current -> stored.stream()
                        .map(entry -> current.getOrDefault(entry.getId(), entry))
                        .collect(Collectors.toList()));
            });
    }

    private int addTransition(List<RetentionScheduleEntry> entries, DataItem item, RetentionPolicy policy,
                              StorageTier reached, Instant anchor, int offset, StorageTier to,
                              TierDescriptor target, Instant now) {
        if (target == null) {
            return offset;
        }
        StorageTier from = StorageTier.values()[to.ordinal() - 1];
        if (target.isAutoTransition() && to.isAfter(reached)) {
            entries.add(RetentionScheduleEntry.builder()
                .id(UUID.randomUUID().toString())
                .dataId(item.getId())
                .policyId(policy.getId())
                .policyVersion(policy.getVersion())
                .scheduledDate(anchor.plus(Duration.ofDays(offset)))
                .scheduledAction(ScheduledAction.TRANSITION)
                .currentTier(from)
                .nextTier(to)
                .status(ScheduleStatus.PENDING)
                .metadata(Map.of(METADATA_TRANSITION, from.name().toLowerCase() + "_to_" + to.name().toLowerCase()))
                .createdAt(now)
                .updatedAt(now)
                .build());
        }
        return offset + target.getDuration();
    }
}
