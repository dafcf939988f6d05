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
import com.firefly.core.retention.domain.enums.hold.LegalHoldStatus;
import com.firefly.core.retention.domain.model.hold.DataUnderHold;
import com.firefly.core.retention.domain.model.hold.LegalHold;
import com.firefly.core.retention.port.store.LegalHoldStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Heap-backed legal hold store.
 */
@RetentionAdapter(
    type = "in-memory",
    priority = -100,
    description = "In-memory legal hold store",
    supportedFeatures = {AdapterFeature.LEGAL_HOLD_STORAGE}
)
public class InMemoryLegalHoldStore implements LegalHoldStore {

    private final Map<String, LegalHold> holds = new ConcurrentHashMap<>();
    private final Map<String, DataUnderHold> bindings = new ConcurrentHashMap<>();

    @Override
    public Mono<LegalHold> saveHold(LegalHold hold) {
        return Mono.fromCallable(() -> {
            holds.put(hold.getId(), hold);
            return hold;
        });
    }

    @Override
    public Mono<LegalHold> findHold(String holdId) {
        return Mono.fromCallable(() -> holds.get(holdId));
    }

    @Override
    public Flux<LegalHold> findHoldsByStatus(LegalHoldStatus status) {
        return Flux.defer(() -> Flux.fromIterable(holds.values().stream()
            .filter(hold -> hold.getStatus() == status)
            .collect(Collectors.toList())));
    }

    @Override
    public Mono<Boolean> addDataUnderHold(DataUnderHold binding) {
        return Mono.fromCallable(() ->
            bindings.putIfAbsent(key(binding.getHoldId(), binding.getDataId()), binding) == null);
    }

    @Override
    public Mono<Boolean> removeDataUnderHold(String holdId, String dataId) {
        return Mono.fromCallable(() -> bindings.remove(key(holdId, dataId)) != null);
    }

    @Override
    public Flux<DataUnderHold> findDataUnderHold(String holdId) {
        return Flux.defer(() -> Flux.fromIterable(filter(holdId, null)));
    }

    @Override
    public Flux<DataUnderHold> findHoldsForData(String dataId) {
        return Flux.defer(() -> Flux.fromIterable(filter(null, dataId)));
    }

    private List<DataUnderHold> filter(String holdId, String dataId) {
        List<DataUnderHold> result = new ArrayList<>();
        for (DataUnderHold binding : bindings.values()) {
            if ((holdId == null || holdId.equals(binding.getHoldId()))
                    && (dataId == null || dataId.equals(binding.getDataId()))) {
                result.add(binding);
            }
        }
        return result;
    }

    private static String key(String holdId, String dataId) {
        return holdId + "::" + dataId;
    }
}
