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
package com.firefly.core.retention.domain.model.policy;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Retention policy: which data it governs, how long data stays in each tier,
 * and when it is deleted.
 *
 * <p>The tier durations always add up to {@code totalRetention}. A missing
 * archive descriptor counts as zero days.</p>
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class RetentionPolicy {

    /**
     * Unique policy identifier, assigned on creation
     */
    private final String id;

    /**
     * Human-readable name
     */
    @NotBlank
    private final String name;

    /**
     * Free-form description
     */
    private final String description;

    /**
     * Version, starts at 1 and grows on every update
     */
    @Builder.Default
    private final int version = 1;

    /**
     * Disabled policies are skipped by the executor
     */
    @Builder.Default
    private final boolean enabled = true;

    /**
     * Data types this policy governs
     */
    @NotEmpty
    private final List<String> dataTypes;

    /**
     * Classifications this policy governs; empty means any
     */
    @Builder.Default
    private final List<String> classifications = List.of();

    /**
     * Tenant scope; null means the policy applies to every tenant
     */
    private final String tenantId;

    @NotNull
    @Valid
    private final TierDescriptor hot;

    @NotNull
    @Valid
    private final TierDescriptor warm;

    @NotNull
    @Valid
    private final TierDescriptor cold;

    /**
     * Optional archive tier
     */
    @Valid
    private final TierDescriptor archive;

    /**
     * Days from item creation to deletion
     */
    @PositiveOrZero
    private final int totalRetention;

    /**
     * Days after a retroactive deletion date before deletion may run
     */
    @PositiveOrZero
    private final int gracePeriod;

    /**
     * When true, legal holds cannot pause deletion; a conflict is raised instead
     */
    private final boolean legalHoldExempt;

    /**
     * Framework tags, e.g. GDPR or SOX
     */
    @Builder.Default
    private final List<String> complianceFrameworks = List.of();

    /**
     * Ordered custom rules
     */
    @Builder.Default
    private final List<@Valid CustomRule> customRules = List.of();

    /**
     * Deletion warning settings
     */
    @Valid
    private final PolicyNotifications notifications;

    private final Instant createdAt;

    private final String createdBy;

    private final Instant updatedAt;

    private final String updatedBy;

    /**
     * Sum of all tier durations.
     */
    public int tierDurationSum() {
        int sum = 0;
        if (hot != null) {
            sum += hot.getDuration();
        }
        if (warm != null) {
            sum += warm.getDuration();
        }
        if (cold != null) {
            sum += cold.getDuration();
        }
        if (archive != null) {
            sum += archive.getDuration();
        }
        return sum;
    }
}
