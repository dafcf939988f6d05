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
package com.firefly.core.retention.domain.enums.policy;

/**
 * Storage tiers a data item moves through during its lifecycle.
 * Declaration order is the lifecycle order: data only ever moves forward.
 */
public enum StorageTier {

    /**
     * Frequently accessed, highest cost
     */
    HOT,

    /**
     * Infrequently accessed
     */
    WARM,

    /**
     * Rarely accessed, retrieval may be slow
     */
    COLD,

    /**
     * Long-term archive, retrieval measured in hours
     */
    ARCHIVE;

    /**
     * Returns true if this tier comes strictly after the given tier.
     *
     * @param other the tier to compare with
     * @return true if this tier is later in the lifecycle
     */
    public boolean isAfter(StorageTier other) {
        return other != null && ordinal() > other.ordinal();
    }

    /**
     * Tiers where moving data in frees primary storage space.
     *
     * @return true for COLD and ARCHIVE
     */
    public boolean reclaimsSpace() {
        return this == COLD || this == ARCHIVE;
    }
}
