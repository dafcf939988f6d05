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

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Named rule that adjusts the schedule of items matching all of its conditions.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class CustomRule {

    /**
     * Rule name, used in logs and warnings
     */
    @NotBlank
    private final String name;

    /**
     * Conditions combined with AND
     */
    @NotEmpty
    private final List<@Valid RuleCondition> conditions;

    /**
     * Action applied when every condition matches
     */
    @NotNull
    @Valid
    private final RuleAction action;
}
