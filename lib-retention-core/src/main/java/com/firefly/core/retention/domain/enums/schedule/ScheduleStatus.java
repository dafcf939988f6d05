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
package com.firefly.core.retention.domain.enums.schedule;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a schedule entry.
 *
 * <p>Allowed moves: PENDING to PROCESSING, PROCESSING to COMPLETED, FAILED or
 * back to PENDING (retry), PENDING or PROCESSING to PAUSED, PAUSED to PENDING.
 * COMPLETED and FAILED are terminal.</p>
 */
public enum ScheduleStatus {

    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    PAUSED;

    /**
     * Statuses that regeneration is allowed to discard.
     */
    public static final Set<ScheduleStatus> REPLACEABLE = EnumSet.of(PENDING, PAUSED);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
