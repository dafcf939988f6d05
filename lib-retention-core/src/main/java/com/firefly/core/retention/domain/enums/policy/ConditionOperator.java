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
package com.firefly.core.retention.domain.enums.policy;

/**
 * Comparison operators for custom rule conditions.
 */
public enum ConditionOperator {

    EQUALS,
    NOT_EQUALS,
    IN,
    CONTAINS,
    GREATER_THAN,
    LESS_THAN;

    /**
     * Operators that only make sense against numeric fields.
     */
    public boolean requiresNumericField() {
        return this == GREATER_THAN || this == LESS_THAN;
    }
}
