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
import java.util.List;

/**
 * Description of the data a hold is meant to cover.
 * Informational: data is bound to a hold explicitly by id.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class HoldScope {

    @Builder.Default
    private final List<String> dataTypes = List.of();

    private final Instant dateRangeStart;

    private final Instant dateRangeEnd;

    @Builder.Default
    private final List<String> keywords = List.of();

    @Builder.Default
    private final List<String> classifications = List.of();

    @Builder.Default
    private final List<String> tags = List.of();
}
