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

import java.util.Arrays;
import java.util.Optional;

/**
 * Regulatory frameworks a retention policy can declare.
 *
 * <p>Each framework carries the baseline minimum retention (in days) used by
 * the compliance report. A value of zero means the framework imposes no
 * minimum and only cares that data is removed when it is due.</p>
 */
public enum ComplianceFramework {

    PCI(365),
    HIPAA(2190),
    GDPR(0),
    SOX(2555),
    CCPA(0),
    SOC2(365);

    private final int minimumRetentionDays;

    ComplianceFramework(int minimumRetentionDays) {
        this.minimumRetentionDays = minimumRetentionDays;
    }

    public int getMinimumRetentionDays() {
        return minimumRetentionDays;
    }

    /**
     * Resolves a framework tag, ignoring case.
     *
     * @param tag the framework tag as declared on a policy
     * @return the framework, or empty if the tag is not supported
     */
    public static Optional<ComplianceFramework> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(framework -> framework.name().equalsIgnoreCase(tag.trim()))
            .findFirst();
    }
}
