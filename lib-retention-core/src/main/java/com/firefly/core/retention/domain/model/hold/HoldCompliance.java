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

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Compliance flags of a legal hold.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class HoldCompliance {

    /**
     * Keep the data with no end date while the hold is active
     */
    @Builder.Default
    private final boolean retainIndefinitely = true;

    /**
     * The hold takes precedence over the item's retention policy
     */
    @Builder.Default
    private final boolean overrideRetentionPolicies = true;

    /**
     * Held data must never be deleted
     */
    @Builder.Default
    private final boolean preventDeletion = true;

    /**
     * Held data must not be moved between tiers or otherwise altered
     */
    @Builder.Default
    private final boolean preventModification = true;

    /**
     * Default flags: everything is blocked.
     */
    public static HoldCompliance strict() {
        return HoldCompliance.builder().build();
    }
}
