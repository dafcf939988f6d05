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

import com.firefly.core.retention.domain.enums.policy.ComplianceFramework;
import com.firefly.core.retention.domain.enums.policy.ConditionOperator;
import com.firefly.core.retention.domain.enums.policy.RuleActionType;
import com.firefly.core.retention.domain.model.policy.CustomRule;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.policy.RuleAction;
import com.firefly.core.retention.domain.model.policy.RuleCondition;
import com.firefly.core.retention.exception.PolicyValidationException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structural and semantic checks on retention policies.
 */
public class RetentionPolicyValidator {

    private final Validator validator;

    public RetentionPolicyValidator(Validator validator) {
        this.validator = validator;
    }

    /**
     * Throws if the policy is invalid.
     *
     * @param policy the policy to check
     * @throws PolicyValidationException listing every problem found
     */
    public void validate(RetentionPolicy policy) {
        List<String> errors = collectErrors(policy);
        if (!errors.isEmpty()) {
            throw new PolicyValidationException(errors);
        }
    }

    /**
     * Collects every problem with the policy.
     *
     * @param policy the policy to check
     * @return error messages, empty when the policy is valid
     */
    public List<String> collectErrors(RetentionPolicy policy) {
        List<String> errors = new ArrayList<>();
        if (policy == null) {
            errors.add("Policy is required");
            return errors;
        }

        if (validator != null) {
            errors.addAll(validator.validate(policy).stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .map(RetentionPolicyValidator::describe)
                .collect(Collectors.toList()));
        }

        if (policy.getDataTypes() == null || policy.getDataTypes().isEmpty()) {
            addOnce(errors, "At least one data type must be specified");
        }

        if (policy.getHot() != null && policy.getWarm() != null && policy.getCold() != null) {
            int sum = policy.tierDurationSum();
            if (sum != policy.getTotalRetention()) {
                errors.add("Tier durations (" + sum + ") must equal total retention (" + policy.getTotalRetention() + ")");
            }
        }

        if (policy.getComplianceFrameworks() != null) {
            for (String framework : policy.getComplianceFrameworks()) {
                if (ComplianceFramework.fromTag(framework).isEmpty()) {
                    errors.add("Unsupported compliance framework: " + framework);
                }
            }
        }

        if (policy.getNotifications() != null && policy.getNotifications().getWarnDaysBefore() != null) {
            for (Integer days : policy.getNotifications().getWarnDaysBefore()) {
                if (days == null || days <= 0) {
                    errors.add("Deletion warning days must be positive: " + days);
                }
            }
        }

        if (policy.getCustomRules() != null) {
            for (CustomRule rule : policy.getCustomRules()) {
                validateRule(rule, errors);
            }
        }
        return errors;
    }

    private void validateRule(CustomRule rule, List<String> errors) {
        String name = rule.getName() == null ? "<unnamed>" : rule.getName();

        if (rule.getConditions() != null) {
            for (RuleCondition condition : rule.getConditions()) {
                if (condition.getField() == null || condition.getOperator() == null) {
                    continue;
                }
                if (condition.getOperator().requiresNumericField() && !condition.getField().isNumeric()) {
                    errors.add("Rule '" + name + "': operator " + condition.getOperator()
                            + " requires a numeric field, got " + condition.getField());
                }
                if (condition.getOperator() == ConditionOperator.IN) {
                    if (condition.getValues() == null || condition.getValues().isEmpty()) {
                        errors.add("Rule '" + name + "': IN condition on " + condition.getField() + " needs values");
                    }
                } else if (condition.getValue() == null) {
                    errors.add("Rule '" + name + "': condition on " + condition.getField() + " needs a value");
                } else if (condition.getField().isNumeric() && !isNumber(condition.getValue())) {
                    errors.add("Rule '" + name + "': value '" + condition.getValue()
                            + "' is not a number for " + condition.getField());
                }
            }
        }

        RuleAction action = rule.getAction();
        if (action != null && (action.getType() == RuleActionType.EXTEND || action.getType() == RuleActionType.ACCELERATE)) {
            if (action.getDays() == null || action.getDays() <= 0) {
                errors.add("Rule '" + name + "': " + action.getType() + " needs a positive number of days");
            }
        }
    }

    private static boolean isNumber(String value) {
        try {
            Long.parseLong(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static void addOnce(List<String> errors, String message) {
        if (!errors.contains(message)) {
            errors.add(message);
        }
    }

    private static String describe(ConstraintViolation<RetentionPolicy> violation) {
        if ("dataTypes".equals(violation.getPropertyPath().toString())) {
            return "At least one data type must be specified";
        }
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }
}
