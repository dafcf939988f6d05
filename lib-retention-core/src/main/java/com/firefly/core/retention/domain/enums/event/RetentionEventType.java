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
package com.firefly.core.retention.domain.enums.event;

/**
 * Kinds of lifecycle events published by the engine.
 * Each kind is delivered on its own channel.
 */
public enum RetentionEventType {
    POLICY_CREATED,
    POLICY_UPDATED,
    SCHEDULE_GENERATED,
    ENTRY_TRANSITIONED,
    ENTRY_DELETED,
    ENTRY_FAILED,
    ENTRY_PAUSED,
    DELETION_WARNING,
    REVIEW_REQUIRED,
    EXECUTION_COMPLETED,
    LEGAL_HOLD_CREATED,
    LEGAL_HOLD_APPLIED,
    LEGAL_HOLD_RELEASED,
    LEGAL_HOLD_EXPIRED,
    CUSTODIAN_NOTIFIED
}
