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
package com.firefly.core.retention.domain.model.event;

import com.firefly.core.retention.domain.enums.event.RetentionEventType;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle event delivered to subscribers of the event bus.
 */
@Data
@Builder
@Jacksonized
public class RetentionEvent {

    private final RetentionEventType type;

    private final Instant timestamp;

    private final String policyId;

    private final String dataId;

    private final String entryId;

    private final String holdId;

    /**
     * Human-readable summary
     */
    private final String message;

    @Builder.Default
    private final Map<String, Object> attributes = Map.of();
}
