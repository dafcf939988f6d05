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
package com.firefly.core.retention.port.store;

import com.firefly.core.retention.domain.enums.schedule.ScheduleStatus;
import com.firefly.core.retention.domain.model.schedule.RetentionScheduleEntry;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;

/**
 * Port interface for schedule entry persistence.
 *
 * <p>Status changes go through conditional updates so that at most one writer
 * moves an entry out of a given status. Implementations must also serialize
 * all conditional operations that touch entries of the same data item.</p>
 */
public interface ScheduleEntryStore {

    /**
     * Insert entries.
     *
     * @param entries the entries to insert
     * @return Flux of the stored entries
     */
    Flux<RetentionScheduleEntry> saveAll(Collection<RetentionScheduleEntry> entries);

    /**
     * Get an entry by ID.
     *
     * @param entryId the entry ID
     * @return Mono containing the entry, empty if not found
     */
    Mono<RetentionScheduleEntry> findById(String entryId);

    /**
     * Get all entries of a data item, ordered by scheduled date.
     *
     * @param dataId the data item ID
     * @return Flux of entries
     */
    Flux<RetentionScheduleEntry> findByDataId(String dataId);

    /**
     * Get all entries generated from a policy.
     *
     * @param policyId the policy ID
     * @return Flux of entries
     */
    Flux<RetentionScheduleEntry> findByPolicyId(String policyId);

    /**
     * Get entries of a policy with the given status.
     *
     * @param policyId the policy ID
     * @param status the status to match
     * @return Flux of entries
     */
    Flux<RetentionScheduleEntry> findByPolicyIdAndStatus(String policyId, ScheduleStatus status);

    /**
     * Get pending entries of a policy whose scheduled date is not after {@code now},
     * oldest first.
     *
     * @param policyId the policy ID
     * @param now the reference time
     * @param limit maximum number of entries
     * @return Flux of due entries
     */
    Flux<RetentionScheduleEntry> findDue(String policyId, Instant now, int limit);

    /**
     * Move an entry from PENDING to PROCESSING, unless another entry of the same
     * data item is already PROCESSING.
     *
     * @param entryId the entry ID
     * @return Mono containing true if this caller now owns the entry
     */
    Mono<Boolean> claim(String entryId);

    /**
     * Replace an entry only if its stored status equals {@code expected}.
     *
     * @param entry the new entry state
     * @param expected the status the stored entry must have
     * @return Mono containing true if the entry was replaced
     */
    Mono<Boolean> replaceIfStatus(RetentionScheduleEntry entry, ScheduleStatus expected);

    /**
     * Move every PENDING entry of a data item to PAUSED.
     *
     * @param dataId the data item ID
     * @param at the update time
     * @return Mono containing the number of paused entries
     */
    Mono<Integer> pauseByDataId(String dataId, Instant at);

    /**
     * Move every PAUSED entry of a data item back to PENDING.
     *
     * @param dataId the data item ID
     * @param at the update time
     * @return Mono containing the number of resumed entries
     */
    Mono<Integer> resumeByDataId(String dataId, Instant at);

    /**
     * Delete the entries of a data item whose status is in {@code statuses}.
     *
     * @param dataId the data item ID
     * @param statuses the statuses to delete
     * @return Mono containing the number of deleted entries
     */
    Mono<Integer> deleteByDataIdAndStatusIn(String dataId, Set<ScheduleStatus> statuses);

    /**
     * Delete every entry of a data item.
     *
     * @param dataId the data item ID
     * @return Mono containing the number of deleted entries
     */
    Mono<Integer> deleteByDataId(String dataId);
}
