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
package com.firefly.core.retention.support;

import com.firefly.core.retention.domain.enums.hold.HoldType;
import com.firefly.core.retention.domain.model.data.DataItem;
import com.firefly.core.retention.domain.model.hold.Custodian;
import com.firefly.core.retention.domain.model.hold.HoldScope;
import com.firefly.core.retention.domain.model.hold.LegalHold;
import com.firefly.core.retention.domain.model.hold.LegalMatter;
import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.domain.model.policy.TierDescriptor;

import java.time.Instant;
import java.util.List;

/**
 * Builders for the policies, items and holds used across tests.
 */
public final class RetentionFixtures {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private RetentionFixtures() {
    }

    /**
     * Invoice policy: 30 days hot, 60 warm, 90 cold, deleted after 180 days
     * with a 30 day grace period.
     */
    public static RetentionPolicy.RetentionPolicyBuilder invoicePolicy() {
        return RetentionPolicy.builder()
            .id("policy-invoices")
            .name("Invoices")
            .dataTypes(List.of("invoice"))
            .hot(TierDescriptor.of(30))
            .warm(TierDescriptor.of(60))
            .cold(TierDescriptor.of(90))
            .totalRetention(180)
            .gracePeriod(30);
    }

    public static DataItem.DataItemBuilder invoice(String id) {
        return DataItem.builder()
            .id(id)
            .dataType("invoice")
            .classification("internal")
            .tenantId("tenant-a")
            .sizeBytes(1_000)
            .createdAt(T0)
            .retentionPolicyId("policy-invoices");
    }

    public static LegalHold.LegalHoldBuilder litigationHold() {
        return LegalHold.builder()
            .name("Acme v. Firefly")
            .type(HoldType.LITIGATION)
            .matter(LegalMatter.builder().id("matter-1").name("Acme v. Firefly").build())
            .scope(HoldScope.builder().dataTypes(List.of("invoice")).build())
            .custodians(List.of(custodian("Jane Roe", "jane@example.com")));
    }

    public static Custodian custodian(String name, String email) {
        return Custodian.builder().name(name).email(email).build();
    }
}
