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
package com.firefly.core.retention.domain.model.schedule;

import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.enums.schedule.ScheduledAction;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One planned lifecycle action for one data item.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class RetentionScheduleEntry {

    /**
     * Unique entry identifier
     */
    private final String id;

    /**
     * Data item this entry acts on
     */
    private final String dataId;

    /**
     * Policy the entry was generated from
     */
    private final String policyId;

    /**
     * Policy version the entry was generated from
     */
    private final int policyVersion;

    /**
     * When the action becomes due
     */
    private final Instant scheduledDate;

    /**
     * Action to carry out
     */
    private final ScheduledAction scheduledAction;

    /**
     * Tier the item is expected to be in when the action runs
     */
    private final StorageTier currentTier;

    /**
     * Target tier, set for transitions only
     */
    private final StorageTier nextTier;

    @Builder.Default
    private final ScheduleStatus status = ScheduleStatus.PENDING;

    /**
     * Failed attempts so far
     */
    private final int retryCount;

    /**
     * Message of the most recent failure
     */
    private final String lastError;

    /**
     * End of the grace window, set for deletions
     */
    private final Instant gracePeriodEnd;

    /**
     * True when the deletion date was already in the past at generation time
     */
    private final boolean retroactive;

    /**
     * Times at which deletion warnings were sent
     */
    @Builder.Default
    private final List<Instant> notificationsSent = List.of();

    @Builder.Default
    private final Map<String, String> metadata = Map.of();

    private final Instant createdAt;

    private final Instant updatedAt;

    /**
     * Copy of this entry with a new status and update time.
     */
    public RetentionScheduleEntry withStatus(ScheduleStatus newStatus, Instant at) {
        return toBuilder().status(newStatus).updatedAt(at).build();
    }
}
