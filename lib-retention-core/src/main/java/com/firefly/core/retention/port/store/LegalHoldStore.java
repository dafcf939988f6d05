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

import com.firefly.core.retention.domain.enums.hold.LegalHoldStatus;
import com.firefly.core.retention.domain.model.hold.DataUnderHold;
import com.firefly.core.retention.domain.model.hold.LegalHold;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Port interface for legal holds and their data bindings.
 */
public interface LegalHoldStore {

    /**
     * Insert or replace a hold.
     *
     * @param hold the hold, with its id set
     * @return Mono containing the stored hold
     */
    Mono<LegalHold> saveHold(LegalHold hold);

    /**
     * Get a hold by ID.
     *
     * @param holdId the hold ID
     * @return Mono containing the hold, empty if not found
     */
    Mono<LegalHold> findHold(String holdId);

    /**
     * Get holds with the given status.
     *
     * @param status the status to match
     * @return Flux of holds
     */
    Flux<LegalHold> findHoldsByStatus(LegalHoldStatus status);

    /**
     * Bind a data item to a hold.
     *
     * @param binding the binding
     * @return Mono containing false if the binding already existed
     */
    Mono<Boolean> addDataUnderHold(DataUnderHold binding);

    /**
     * Remove a binding.
     *
     * @param holdId the hold ID
     * @param dataId the data item ID
     * @return Mono containing true if a binding was removed
     */
    Mono<Boolean> removeDataUnderHold(String holdId, String dataId);

    /**
     * Get every data item bound to a hold.
     *
     * @param holdId the hold ID
     * @return Flux of bindings
     */
    Flux<DataUnderHold> findDataUnderHold(String holdId);

    /**
     * Get every hold binding of a data item.
     *
     * @param dataId the data item ID
     * @return Flux of bindings
     */
    Flux<DataUnderHold> findHoldsForData(String dataId);
}
