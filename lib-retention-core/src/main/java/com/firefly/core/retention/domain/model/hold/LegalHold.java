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
package com.firefly.core.retention.domain.model.hold;

import com.firefly.core.retention.domain.enums.hold.HoldType;
import com.firefly.core.retention.domain.enums.hold.LegalHoldStatus;
import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Legal hold: a directive that suspends lifecycle actions on specific data.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class LegalHold {

    /**
     * Unique hold identifier, assigned on creation
     */
    private final String id;

    private final String name;

    private final String description;

    private final HoldType type;

    @Builder.Default
    private final LegalHoldStatus status = LegalHoldStatus.ACTIVE;

    private final LegalMatter matter;

    @Builder.Default
    private final List<Custodian> custodians = List.of();

    private final HoldScope scope;

    @Builder.Default
    private final HoldCompliance compliance = HoldCompliance.strict();

    /**
     * When the hold takes effect
     */
    private final Instant effectiveDate;

    /**
     * Optional automatic expiry
     */
    private final Instant expirationDate;

    private final Instant createdAt;

    private final String createdBy;

    private final Instant updatedAt;

    private final Instant releasedAt;

    private final String releasedBy;

    private final String releaseReason;

    public boolean isActive() {
        return status == LegalHoldStatus.ACTIVE;
    }

    /**
     * Finds a custodian by id.
     */
    public Optional<Custodian> findCustodian(String custodianId) {
        return custodians.stream()
            .filter(custodian -> custodian.getId().equals(custodianId))
            .findFirst();
    }
}
