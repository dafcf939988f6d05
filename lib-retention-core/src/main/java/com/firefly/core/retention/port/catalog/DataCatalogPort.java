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
package com.firefly.core.retention.port.catalog;

import com.firefly.core.retention.domain.model.data.DataItem;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;

/**
 * Port interface for the catalog of data items under retention management.
 */
public interface DataCatalogPort {

    /**
     * Insert or replace a data item.
     *
     * @param item the item
     * @return Mono containing the stored item
     */
    Mono<DataItem> save(DataItem item);

    /**
     * Get a data item by ID.
     *
     * @param dataId the data item ID
     * @return Mono containing the item, empty if not found
     */
    Mono<DataItem> findById(String dataId);

    /**
     * Get items whose data type is one of {@code dataTypes}.
     *
     * @param dataTypes the data types to match
     * @return Flux of items
     */
    Flux<DataItem> findByDataTypes(Collection<String> dataTypes);

    /**
     * Get items governed by a policy.
     *
     * @param policyId the policy ID
     * @return Flux of items
     */
    Flux<DataItem> findByRetentionPolicy(String policyId);

    /**
     * Remove a data item.
     *
     * @param dataId the data item ID
     * @return Mono indicating completion
     */
    Mono<Void> delete(String dataId);
}
