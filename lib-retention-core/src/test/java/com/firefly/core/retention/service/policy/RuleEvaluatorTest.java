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
import com.firefly.core.retention.domain.enums.policy.ConditionOperator;
import com.firefly.core.retention.domain.enums.policy.RuleActionType;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.policy.CustomRule;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.policy.RuleAction;
import com.firefly.core.retention.domain.model.policy.RuleCondition;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static com.firefly.core.retention.support.RetentionFixtures.T0;
import static com.firefly.core.retention.support.RetentionFixtures.invoice;
import static com.firefly.core.retention.support.RetentionFixtures.invoicePolicy;
import static org.assertj.core.api.Assertions.assertThat;

class RuleEvaluatorTest {

    private final RuleEvaluator evaluator = new RuleEvaluator();
    private final Instant now = T0.plus(Duration.ofDays(45));

    @Test
    void matches_ShouldRequireEveryCondition() {
        CustomRule rule = rule(RuleAction.hold(),
                condition(ConditionField.CLASSIFICATION, ConditionOperator.EQUALS, "restricted"),
                condition(ConditionField.SIZE_BYTES, ConditionOperator.GREATER_THAN, "500"));

        assertThat(evaluator.matches(rule, invoice("a").classification("restricted").build(), now)).isTrue();
        assertThat(evaluator.matches(rule, invoice("b").classification("restricted").sizeBytes(100).build(), now)).isFalse();
        assertThat(evaluator.matches(rule, invoice("c").build(), now)).isFalse();
    }

    @Test
    void matches_ShouldEvaluateAgeInDaysFromCreation() {
        CustomRule olderThanMonth = rule(RuleAction.extend(10),
                condition(ConditionField.AGE_DAYS, ConditionOperator.GREATER_THAN, "30"));

        assertThat(evaluator.matches(olderThanMonth, invoice("a").build(), now)).isTrue();
        assertThat(evaluator.matches(olderThanMonth, invoice("b").createdAt(T0.plus(Duration.ofDays(40))).build(), now)).isFalse();
    }

    @Test
    void matches_ShouldSupportInAndContains() {
        CustomRule tenants = rule(RuleAction.preserve(), RuleCondition.builder()
                .field(ConditionField.TENANT_ID)
                .operator(ConditionOperator.IN)
                .values(List.of("tenant-a", "tenant-b"))
                .build());
        CustomRule dataType = rule(RuleAction.preserve(),
                condition(ConditionField.DATA_TYPE, ConditionOperator.CONTAINS, "voi"));

        assertThat(evaluator.matches(tenants, invoice("a").build(), now)).isTrue();
        assertThat(evaluator.matches(tenants, invoice("b").tenantId("tenant-z").build(), now)).isFalse();
        assertThat(evaluator.matches(dataType, invoice("c").build(), now)).isTrue();
    }

    @Test
    void matches_ShouldTestTagMembership() {
        CustomRule tagged = rule(RuleAction.hold(), condition(ConditionField.TAG, ConditionOperator.EQUALS, "audit"));
        CustomRule untagged = rule(RuleAction.hold(), condition(ConditionField.TAG, ConditionOperator.NOT_EQUALS, "audit"));
        DataItem item = invoice("a").tags(Set.of("audit", "q4")).build();

        assertThat(evaluator.matches(tagged, item, now)).isTrue();
        assertThat(evaluator.matches(untagged, item, now)).isFalse();
    }

    @Test
    void matches_ShouldTreatMissingAttributeAsNotEqual() {
        CustomRule rule = rule(RuleAction.hold(), condition(ConditionField.CLASSIFICATION, ConditionOperator.NOT_EQUALS, "public"));

        assertThat(evaluator.matches(rule, invoice("a").classification(null).build(), now)).isTrue();
    }

    @Test
    void matchingActions_ShouldReturnActionsInRuleOrder() {
        RetentionPolicy policy = invoicePolicy()
            .customRules(List.of(
                rule(RuleAction.extend(30), condition(ConditionField.DATA_TYPE, ConditionOperator.EQUALS, "invoice")),
                rule(RuleAction.accelerate(5), condition(ConditionField.DATA_TYPE, ConditionOperator.EQUALS, "receipt")),
                rule(RuleAction.hold(), condition(ConditionField.SIZE_BYTES, ConditionOperator.LESS_THAN, "5000"))))
            .build();

        List<RuleAction> actions = evaluator.matchingActions(policy, invoice("a").build(), now);

        assertThat(actions).extracting(RuleAction::getType).containsExactly(RuleActionType.EXTEND, RuleActionType.HOLD);
    }

    private static CustomRule rule(RuleAction action, RuleCondition... conditions) {
        return CustomRule.builder().name("rule-" + action.getType()).conditions(List.of(conditions)).action(action).build();
    }

    private static RuleCondition condition(ConditionField field, ConditionOperator operator, String value) {
        return RuleCondition.builder().field(field).operator(operator).value(value).build();
    }
}
