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
package com.firefly.core.retention.domain.model.schedule;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of running one policy's due entries.
 */
@Data
@Builder
@Jacksonized
public class RetentionExecutionResult {

    /**
     * Policy that was executed
     */
    private final String policyId;

    /**
     * When the execution started
     */
    private final Instant executionTime;

    /**
     * Entries claimed and carried out
     */
    private final int processed;

    private final TransitionCounts transitioned;

    private final int deleted;

    /**
     * Bytes freed by cold and archive moves and by deletions
     */
    private final long spaceSaved;

    @Builder.Default
    private final List<ExecutionError> errors = List.of();

    @Builder.Default
    private final List<ExecutionWarning> warnings = List.of();

    private final long totalTimeMs;

    /**
     * True when the whole policy was skipped rather than executed
     */
    private final boolean skipped;
}
