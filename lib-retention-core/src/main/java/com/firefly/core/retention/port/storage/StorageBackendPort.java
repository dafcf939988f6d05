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
package com.firefly.core.retention.port.storage;

import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.domain.model.storage.StorageOperationResult;
import reactor.core.publisher.Mono;

/**
 * Port interface for the physical storage of data items.
 * Adapters must implement this interface to let the engine move, delete and
 * flag data in a concrete storage service.
 *
 * <p>Failures may be reported either as an unsuccessful
 * {@link StorageOperationResult} or as an error signal; callers treat both the same.</p>
 */
public interface StorageBackendPort {

    /**
     * Move a data item to another storage tier.
     *
     * @param dataId the data item identifier
     * @param targetTier the tier to move to
     * @return Mono containing the result, with the item size on success
     */
    Mono<StorageOperationResult> transition(String dataId, StorageTier targetTier);

    /**
     * Permanently delete a data item.
     *
     * @param dataId the data item identifier
     * @return Mono containing the result, with the freed size on success
     */
    Mono<StorageOperationResult> delete(String dataId);

    /**
     * Set or clear the backend-side legal hold flag of a data item.
     *
     * @param dataId the data item identifier
     * @param held whether the item is held
     * @param holdId the hold setting or clearing the flag
     * @return Mono containing the result
     */
    Mono<StorageOperationResult> setHeldFlag(String dataId, boolean held, String holdId);

    /**
     * Get the adapter name for identification.
     *
     * @return the adapter name
     */
    String getAdapterName();
}
