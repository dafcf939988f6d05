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

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * How long data stays in one storage tier and whether the engine moves it
 * into that tier on its own.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class TierDescriptor {

    /**
     * Days spent in this tier
     */
    @PositiveOrZero
    private final int duration;

    /**
     * Backend storage class hint, e.g. STANDARD_IA or Cool
     */
    private final String storageClass;

    /**
     * Whether reaching this tier is scheduled automatically
     */
    @Builder.Default
    private final boolean autoTransition = true;

    /**
     * Descriptor for a tier that is scheduled automatically.
     */
    public static TierDescriptor of(int duration) {
        return TierDescriptor.builder().duration(duration).build();
    }

    /**
     * Descriptor for a tier the engine never moves data into on its own.
     */
    public static TierDescriptor manual(int duration) {
        return TierDescriptor.builder().duration(duration).autoTransition(false).build();
    }
}
