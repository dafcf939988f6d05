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
package com.firefly.core.retention.domain.model.hold;

import com.firefly.core.retention.domain.enums.hold.RiskLevel;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Status report of a single legal hold.
 */
@Data
@Builder
@Jacksonized
public class HoldReport {

    private final LegalHold hold;

    private final Instant generatedAt;

    private final int totalDataItems;

    private final long totalSize;

    private final int custodianCount;

    private final int acknowledgedCustodians;

    private final int preservedCustodians;

    private final int pendingCustodians;

    @Builder.Default
    private final List<CustodianStatus> custodianStatus = List.of();

    @Builder.Default
    private final Map<String, Integer> dataByType = Map.of();

    @Builder.Default
    private final Map<String, Integer> dataByClassification = Map.of();

    /**
     * Held items whose original retention policy is being overridden
     */
    private final int overriddenPolicies;

    /**
     * Deletions the executor refused because of this hold
     */
    private final long preventedDeletions;

    private final RiskLevel riskLevel;

    @Builder.Default
    private final List<String> issues = List.of();
}
