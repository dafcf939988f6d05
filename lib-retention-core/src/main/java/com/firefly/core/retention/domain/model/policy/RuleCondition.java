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

import com.firefly.core.retention.domain.enums.policy.ConditionField;
import com.firefly.core.retention.domain.enums.policy.ConditionOperator;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Single predicate over a data item attribute.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class RuleCondition {

    /**
     * Attribute being tested
     */
    @NotNull
    private final ConditionField field;

    /**
     * Comparison operator
     */
    @NotNull
    private final ConditionOperator operator;

    /**
     * Operand for single-value operators
     */
    private final String value;

    /**
     * Operands for IN
     */
    private final List<String> values;
}
