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

import java.util.List;
import java.util.Map;

/**
 * Per-item outcome of applying or releasing a hold.
 */
@Data
@Builder
@Jacksonized
public class HoldOperationResult {

    private final String holdId;

    /**
     * Items the operation took effect on
     */
    @Builder.Default
    private final List<String> succeeded = List.of();

    /**
     * Items left unchanged: already held on apply, still held by another hold on release
     */
    @Builder.Default
    private final List<String> skipped = List.of();

    /**
     * Items that failed, with the reason
     */
    @Builder.Default
    private final Map<String, String> failures = Map.of();

    /**
     * Schedule entries paused (apply) or resumed (release)
     */
    private final int affectedEntries;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
