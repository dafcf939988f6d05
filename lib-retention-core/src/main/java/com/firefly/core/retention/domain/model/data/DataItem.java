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
package com.firefly.core.retention.domain.model.data;

import com.firefly.core.retention.domain.enums.policy.StorageTier;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * Catalog view of a stored data item.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class DataItem {

    /**
     * Opaque identifier, unique across the system
     */
    private final String id;

    /**
     * Data type, matched against policy data types
     */
    private final String dataType;

    /**
     * Sensitivity classification
     */
    private final String classification;

    /**
     * Owning tenant
     */
    private final String tenantId;

    /**
     * Size in bytes
     */
    private final long sizeBytes;

    /**
     * Creation time, the anchor for all schedule dates
     */
    private final Instant createdAt;

    /**
     * Tier the item currently lives in
     */
    @Builder.Default
    private final StorageTier currentTier = StorageTier.HOT;

    /**
     * Governing policy, null until one is assigned
     */
    private final String retentionPolicyId;

    @Builder.Default
    private final Set<String> tags = Set.of();

    @Builder.Default
    private final Map<String, String> metadata = Map.of();
}
