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
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.port.catalog.DataCatalogPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Heap-backed data catalog.
 */
@RetentionAdapter(
    type = "in-memory",
    priority = -100,
    description = "In-memory data catalog",
    supportedFeatures = {AdapterFeature.DATA_CATALOG}
)
public class InMemoryDataCatalog implements DataCatalogPort {

    private final Map<String, DataItem> items = new ConcurrentHashMap<>();

    @Override
    public Mono<DataItem> save(DataItem item) {
        return Mono.fromCallable(() -> {
            items.put(item.getId(), item);
            return item;
        });
    }

    @Override
    public Mono<DataItem> findById(String dataId) {
        return Mono.fromCallable(() -> items.get(dataId));
    }

    @Override
    public Flux<DataItem> findByDataTypes(Collection<String> dataTypes) {
        return Flux.defer(() -> Flux.fromIterable(items.values().stream()
            .filter(item -> dataTypes.contains(item.getDataType()))
            .collect(Collectors.toList())));
    }

    @Override
    public Flux<DataItem> findByRetentionPolicy(String policyId) {
        return Flux.defer(() -> Flux.fromIterable(items.values().stream()
            .filter(item -> policyId.equals(item.getRetentionPolicyId()))
            .collect(Collectors.toList())));
    }

    @Override
    public Mono<Void> delete(String dataId) {
        return Mono.fromRunnable(() -> items.remove(dataId));
    }
}
