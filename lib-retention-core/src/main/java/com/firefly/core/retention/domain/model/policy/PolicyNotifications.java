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

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Advance warning settings for upcoming deletions.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class PolicyNotifications {

    /**
     * Days before the deletion date at which a warning is emitted
     */
    @Builder.Default
    private final List<Integer> warnDaysBefore = List.of();

    /**
     * Addresses or channel identifiers the notification adapter forwards warnings to
     */
    @Builder.Default
    private final List<String> recipients = List.of();
}
