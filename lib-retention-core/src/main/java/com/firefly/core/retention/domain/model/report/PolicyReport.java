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
package com.firefly.core.retention.domain.model.report;

import com.firefly.core.retention.domain.enums.policy.StorageTier;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Report section for one retention policy.
 */
@Data
@Builder
@Jacksonized
public class PolicyReport {

    private final String policyId;

    private final String policyName;

    private final int policyVersion;

    private final boolean enabled;

    /**
     * Items governed by the policy and created inside the report period
     */
    private final int dataCount;

    private final long totalSize;

    @Builder.Default
    private final Map<StorageTier, TierUsage> tierDistribution = Map.of();

    private final UpcomingActions upcomingActions;

    /**
     * Entries that exhausted their retries
     */
    private final int failedEntries;

    /**
     * Entries currently suspended by a legal hold
     */
    private final int pausedEntries;

    @Builder.Default
    private final List<FrameworkCompliance> compliance = List.of();
}
