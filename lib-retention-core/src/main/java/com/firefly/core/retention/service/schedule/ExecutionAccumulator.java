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
import com.firefly.core.retention.domain.model.schedule.ExecutionError;
import com.firefly.core.retention.domain.model.schedule.ExecutionWarning;
import com.firefly.core.retention.domain.model.schedule.RetentionExecutionResult;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import com.firefly.core.retention.domain.model.schedule.TransitionCounts;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects the counters of one policy execution while entries run concurrently.
 */
class ExecutionAccumulator {

    private final String policyId;
    private final Instant startedAt;

    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger hotToWarm = new AtomicInteger();
    private final AtomicInteger warmToCold = new AtomicInteger();
    private final AtomicInteger coldToArchive = new AtomicInteger();
    private final AtomicInteger deleted = new AtomicInteger();
    private final AtomicLong spaceSaved = new AtomicLong();
    private final Queue<ExecutionError> errors = new ConcurrentLinkedQueue<>();
    private final Queue<ExecutionWarning> warnings = new ConcurrentLinkedQueue<>();
    private final Map<String, RetentionScheduleEntry> inFlight = new ConcurrentHashMap<>();

    ExecutionAccumulator(String policyId, Instant startedAt) {
        this.policyId = policyId;
        this.startedAt = startedAt;
    }

    void claimed(RetentionScheduleEntry entry) {
        processed.incrementAndGet();
        inFlight.put(entry.getId(), entry);
    }

    void settled(String entryId) {
        inFlight.remove(entryId);
    }

    /**
     * Claimed entries whose processing has not finished.
     */
    List<RetentionScheduleEntry> inFlight() {
        return new ArrayList<>(inFlight.values());
    }

    void transitioned(StorageTier target, long sizeBytes) {
        switch (target) {
            case WARM:
                hotToWarm.incrementAndGet();
                break;
            case COLD:
                warmToCold.incrementAndGet();
                break;
            case ARCHIVE:
                coldToArchive.incrementAndGet();
                break;
            default:
                break;
        }
        if (target.reclaimsSpace()) {
            spaceSaved.addAndGet(sizeBytes);
        }
    }

    void deleted(long sizeBytes) {
        deleted.incrementAndGet();
        spaceSaved.addAndGet(sizeBytes);
    }

    void error(String dataId, String action, String message, Instant at) {
        errors.add(ExecutionError.builder()
            .dataId(dataId)
            .action(action)
            .error(message)
            .timestamp(at)
            .build());
    }

    void warning(String dataId, String message) {
        warnings.add(ExecutionWarning.builder()
            .dataId(dataId)
            .warning(message)
            .build());
    }

    RetentionExecutionResult toResult(Instant finishedAt) {
        return toResult(finishedAt, false);
    }

    RetentionExecutionResult toResult(Instant finishedAt, boolean skipped) {
        return RetentionExecutionResult.builder()
            .policyId(policyId)
            .executionTime(startedAt)
            .processed(processed.get())
            .transitioned(TransitionCounts.builder()
                .hotToWarm(hotToWarm.get())
                .warmToCold(warmToCold.get())
                .coldToArchive(coldToArchive.get())
                .build())
            .deleted(deleted.get())
            .spaceSaved(spaceSaved.get())
            .errors(new ArrayList<>(errors))
            .warnings(new ArrayList<>(warnings))
            .totalTimeMs(Math.max(0, Duration.between(startedAt, finishedAt).toMillis()))
            .skipped(skipped)
            .build();
    }
}
