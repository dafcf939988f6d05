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

import com.firefly.core.retention.adapter.AdapterFeature;
import com.firefly.core.retention.adapter.RetentionAdapter;
import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.port.store.ScheduleEntryStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Heap-backed schedule entry store.
 *
 * <p>Every operation that changes entries of a data item runs under that item's
 * lock, which gives conditional updates their compare-and-set semantics and
 * keeps at most one entry per item in PROCESSING.</p>
 */
@RetentionAdapter(
    type = "in-memory",
    priority = -100,
    description = "In-memory schedule entry store",
    supportedFeatures = {AdapterFeature.SCHEDULE_STORAGE}
)
public class InMemoryScheduleEntryStore implements ScheduleEntryStore {

    private static final Comparator<RetentionScheduleEntry> BY_DATE =
        Comparator.comparing(RetentionScheduleEntry::getScheduledDate);

    private final Map<String, RetentionScheduleEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, Object> dataLocks = new ConcurrentHashMap<>();

    @Override
    public Flux<RetentionScheduleEntry> saveAll(Collection<RetentionScheduleEntry> toSave) {
        return Flux.defer(() -> {
            for (RetentionScheduleEntry entry : toSave) {
                withDataLock(entry.getDataId(), () -> entries.put(entry.getId(), entry));
            }
            return Flux.fromIterable(toSave);
        });
    }

    @Override
    public Mono<RetentionScheduleEntry> findById(String entryId) {
        return Mono.fromCallable(() -> entries.get(entryId));
    }

    @Override
    public Flux<RetentionScheduleEntry> findByDataId(String dataId) {
        return Flux.defer(() -> Flux.fromIterable(snapshot(dataId)));
    }

    @Override
    public Flux<RetentionScheduleEntry> findByPolicyId(String policyId) {
        return Flux.defer(() -> Flux.fromIterable(entries.values().stream()
            .filter(entry -> policyId.equals(entry.getPolicyId()))
            .sorted(BY_DATE)
            .collect(Collectors.toList())));
    }

    @Override
    public Flux<RetentionScheduleEntry> findByPolicyIdAndStatus(String policyId, ScheduleStatus status) {
        return findByPolicyId(policyId).filter(entry -> entry.getStatus() == status);
    }

    @Override
    public Flux<RetentionScheduleEntry> findDue(String policyId, Instant now, int limit) {
        return Flux.defer(() -> Flux.fromIterable(entries.values().stream()
            .filter(entry -> policyId.equals(entry.getPolicyId()))
            .filter(entry -> entry.getStatus() == ScheduleStatus.PENDING)
            .filter(entry -> !entry.getScheduledDate().isAfter(now))
            .sorted(BY_DATE)
            .limit(limit)
            .collect(Collectors.toList())));
    }

    @Override
    public Mono<Boolean> claim(String entryId) {
        return Mono.fromCallable(() -> {
            RetentionScheduleEntry current = entries.get(entryId);
            if (current == null) {
                return false;
            }
            return withDataLock(current.getDataId(), () -> {
                RetentionScheduleEntry latest = entries.get(entryId);
                if (latest == null || latest.getStatus() != ScheduleStatus.PENDING) {
                    return false;
                }
                boolean otherProcessing = snapshot(latest.getDataId()).stream()
                    .anyMatch(entry -> entry.getStatus() == ScheduleStatus.PROCESSING);
                if (otherProcessing) {
                    return false;
                }
                entries.put(entryId, latest.toBuilder().status(ScheduleStatus.PROCESSING).build());
                return true;
            });
        });
    }

    @Override
    public Mono<Boolean> replaceIfStatus(RetentionScheduleEntry entry, ScheduleStatus expected) {
        return Mono.fromCallable(() -> withDataLock(entry.getDataId(), () -> {
            RetentionScheduleEntry current = entries.get(entry.getId());
            if (current == null || current.getStatus() != expected) {
                return false;
            }
            entries.put(entry.getId(), entry);
            return true;
        }));
    }

    @Override
    public Mono<Integer> pauseByDataId(String dataId, Instant at) {
        return moveAll(dataId, ScheduleStatus.PENDING, ScheduleStatus.PAUSED, at);
    }

    @Override
    public Mono<Integer> resumeByDataId(String dataId, Instant at) {
        return moveAll(dataId, ScheduleStatus.PAUSED, ScheduleStatus.PENDING, at);
    }

    @Override
    public Mono<Integer> deleteByDataIdAndStatusIn(String dataId, Set<ScheduleStatus> statuses) {
        return Mono.fromCallable(() -> withDataLock(dataId, () -> {
            int removed = 0;
            for (RetentionScheduleEntry entry : snapshot(dataId)) {
                if (statuses.contains(entry.getStatus())) {
                    entries.remove(entry.getId());
                    removed++;
                }
            }
            return removed;
        }));
    }

    @Override
    public Mono<Integer> deleteByDataId(String dataId) {
        return Mono.fromCallable(() -> withDataLock(dataId, () -> {
            List<RetentionScheduleEntry> owned = snapshot(dataId);
            owned.forEach(entry -> entries.remove(entry.getId()));
            return owned.size();
        }));
    }

    private Mono<Integer> moveAll(String dataId, ScheduleStatus from, ScheduleStatus to, Instant at) {
        return Mono.fromCallable(() -> withDataLock(dataId, () -> {
            int moved = 0;
            for (RetentionScheduleEntry entry : snapshot(dataId)) {
                if (entry.getStatus() == from) {
                    entries.put(entry.getId(), entry.withStatus(to, at));
                    moved++;
                }
            }
            return moved;
        }));
    }

    private List<RetentionScheduleEntry> snapshot(String dataId) {
        List<RetentionScheduleEntry> owned = new ArrayList<>();
        for (RetentionScheduleEntry entry : entries.values()) {
            if (dataId.equals(entry.getDataId())) {
                owned.add(entry);
            }
        }
        owned.sort(BY_DATE);
        return owned;
    }

    private <T> T withDataLock(String dataId, Supplier<T> action) {
        Object lock = dataLocks.computeIfAbsent(dataId, k -> new Object());
        synchronized (lock) {
            return action.get();
        }
    }
}
