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
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed policy store. Default when no persistent store adapter is present.
 */
@RetentionAdapter(
    type = "in-memory",
    priority = -100,
    description = "In-memory retention policy store",
    supportedFeatures = {AdapterFeature.POLICY_STORAGE}
)
public class InMemoryRetentionPolicyStore implements RetentionPolicyStore {

    private final Map<String, RetentionPolicy> policies = new ConcurrentHashMap<>();

    @Override
    public Mono<RetentionPolicy> save(RetentionPolicy policy) {
        return Mono.fromCallable(() -> {
            policies.put(policy.getId(), policy);
            return policy;
        });
    }

    @Override
    public Mono<RetentionPolicy> findById(String policyId) {
        return Mono.fromCallable(() -> policies.get(policyId));
    }

    @Override
    public Flux<RetentionPolicy> findAll() {
        return Flux.defer(() -> Flux.fromIterable(new ArrayList<>(policies.values())));
    }

    @Override
    public Mono<Void> deleteById(String policyId) {
        return Mono.fromRunnable(() -> policies.remove(policyId));
    }
}
