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

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Person responsible for preserving data under a hold.
 */
@Data
@Builder(toBuilder = true)
@Jacksonized
public class Custodian {

    private final String id;

    private final String userId;

    private final String name;

    private final String email;

    private final String department;

    private final String role;

    private final boolean notified;

    private final Instant notifiedAt;

    private final boolean acknowledged;

    private final Instant acknowledgedAt;

    private final String acknowledgedBy;

    private final boolean dataPreserved;

    private final Instant preservationConfirmedAt;

    /**
     * Most recent custodian activity, used by hold reports.
     */
    public Instant lastActivity() {
        Instant last = notifiedAt;
        if (acknowledgedAt != null && (last == null || acknowledgedAt.isAfter(last))) {
            last = acknowledgedAt;
        }
        if (preservationConfirmedAt != null && (last == null || preservationConfirmedAt.isAfter(last))) {
            last = preservationConfirmedAt;
        }
        return last;
    }
}
