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
package com.firefly.core.retention.service.policy;

import com.firefly.core.retention.domain.enums.policy.ConditionField;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.policy.CustomRule;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.policy.RuleAction;
import com.firefly.core.retention.domain.model.policy.RuleCondition;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Evaluates custom rule conditions against data items.
 */
public class RuleEvaluator {

    /**
     * Actions of every rule in the policy that matches the item, in rule order.
     *
     * @param policy the policy whose rules are evaluated
     * @param item the data item
     * @param now reference time for age conditions
     * @return matching actions
     */
    public List<RuleAction> matchingActions(RetentionPolicy policy, DataItem item, Instant now) {
        return policy.getCustomRules().stream()
            .filter(rule -> matches(rule, item, now))
            .map(CustomRule::getAction)
            .collect(Collectors.toList());
    }

    /**
     * Whether every condition of the rule holds for the item.
     */
    public boolean matches(CustomRule rule, DataItem item, Instant now) {
        if (rule.getConditions() == null || rule.getConditions().isEmpty()) {
            return false;
        }
        return rule.getConditions().stream().allMatch(condition -> matches(condition, item, now));
    }

    boolean matches(RuleCondition condition, DataItem item, Instant now) {
        if (condition.getField() == ConditionField.TAG) {
            return matchesTags(condition, item.getTags());
        }
        if (condition.getField().isNumeric()) {
            return matchesNumber(condition, numericValue(condition.getField(), item, now));
        }
        return matchesText(condition, textValue(condition.getField(), item));
    }

    private boolean matchesText(RuleCondition condition, String actual) {
        switch (condition.getOperator()) {
            case EQUALS:
                return actual != null && actual.equals(condition.getValue());
            case NOT_EQUALS:
                return actual == null || !actual.equals(condition.getValue());
            case IN:
                return actual != null && condition.getValues() != null && condition.getValues().contains(actual);
            case CONTAINS:
                return actual != null && condition.getValue() != null && actual.contains(condition.getValue());
            default:
                return false;
        }
    }

    private boolean matchesTags(RuleCondition condition, Set<String> tags) {
        switch (condition.getOperator()) {
            case EQUALS:
            case CONTAINS:
                return tags.contains(condition.getValue());
            case NOT_EQUALS:
                return !tags.contains(condition.getValue());
            case IN:
                return condition.getValues() != null && condition.getValues().stream().anyMatch(tags::contains);
            default:
                return false;
        }
    }

    private boolean matchesNumber(RuleCondition condition, long actual) {
        switch (condition.getOperator()) {
            case EQUALS:
                return actual == parse(condition.getValue());
            case NOT_EQUALS:
                return actual != parse(condition.getValue());
            case GREATER_THAN:
                return actual > parse(condition.getValue());
            case LESS_THAN:
                return actual < parse(condition.getValue());
            case IN:
                return condition.getValues() != null
                    && condition.getValues().stream().anyMatch(value -> parse(value) == actual);
            default:
                return false;
        }
    }

    private static String textValue(ConditionField field, DataItem item) {
        switch (field) {
            case DATA_TYPE:
                return item.getDataType();
            case CLASSIFICATION:
                return item.getClassification();
            case TENANT_ID:
                return item.getTenantId();
            default:
                return null;
        }
    }

    private static long numericValue(ConditionField field, DataItem item, Instant now) {
        if (field == ConditionField.SIZE_BYTES) {
            return item.getSizeBytes();
        }
        if (item.getCreatedAt() == null) {
            return 0;
        }
        return Duration.between(item.getCreatedAt(), now).toDays();
    }

    private static long parse(String value) {
        return Long.parseLong(value.trim());
    }
}
