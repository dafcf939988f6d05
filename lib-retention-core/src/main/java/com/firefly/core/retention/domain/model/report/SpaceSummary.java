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
package com.firefly.core.retention.domain.model.report;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Storage totals across all policies in a report.
 */
@Data
@Builder
@Jacksonized
public class SpaceSummary {

    private final long totalBytes;

    private final long hotBytes;

    private final long warmBytes;

    private final long coldBytes;

    private final long archiveBytes;

    /**
     * Bytes that pending cold and archive moves and deletions would free
     */
    private final long projectedSavings;
}
