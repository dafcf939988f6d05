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

import com.firefly.core.retention.domain.enums.policy.RuleActionType;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Effect of a matching custom rule.
 *
 * <p>{@code days} is only meaningful for EXTEND and ACCELERATE.</p>
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class RuleAction {

    @NotNull
    private final RuleActionType type;

    private final Integer days;

    public static RuleAction extend(int days) {
        return RuleAction.builder().type(RuleActionType.EXTEND).days(days).build();
    }

    public static RuleAction accelerate(int days) {
        return RuleAction.builder().type(RuleActionType.ACCELERATE).days(days).build();
    }

    public static RuleAction hold() {
        return RuleAction.builder().type(RuleActionType.HOLD).build();
    }

    public static RuleAction preserve() {
        return RuleAction.builder().type(RuleActionType.PRESERVE).build();
    }

    /**
     * Signed shift of the deletion date in days: positive for EXTEND,
     * negative for ACCELERATE, zero otherwise.
     */
    public int deletionShiftDays() {
        if (days == null) {
            return 0;
        }
        if (type == RuleActionType.EXTEND) {
            return days;
        }
        if (type == RuleActionType.ACCELERATE) {
            return -days;
        }
        return 0;
    }
}
