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

import java.time.Instant;

/**
 * Binding between one hold and one data item.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class DataUnderHold {

    private final String holdId;

    private final String dataId;

    /**
     * Policy governing the item when the hold was applied, reinstated on release
     */
    private final String originalRetentionPolicy;

    private final Instant holdAppliedAt;

    private final String dataType;

    private final String classification;

    private final long sizeBytes;
}
