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

import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Port interface for retention policy persistence.
 */
public interface RetentionPolicyStore {

    /**
     * Insert or replace a policy.
     *
     * @param policy the policy, with its id set
     * @return Mono containing the stored policy
     */
    Mono<RetentionPolicy> save(RetentionPolicy policy);

    /**
     * Get a policy by ID.
     *
     * @param policyId the policy ID
     * @return Mono containing the policy, empty if not found
     */
    Mono<RetentionPolicy> findById(String policyId);

    /**
     * Get all policies.
     *
     * @return Flux of every stored policy
     */
    Flux<RetentionPolicy> findAll();

    /**
     * Delete a policy.
     *
     * @param policyId the policy ID
     * @return Mono indicating completion
     */
    Mono<Void> deleteById(String policyId);
}
