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
package com.firefly.core.retention.adapter;

/**
 * Enumeration of retention adapter features.
 * Used to declare what capabilities an adapter supports.
 */
public enum AdapterFeature {

    /**
     * Moving data between storage tiers
     */
    TIER_TRANSITION,

    /**
     * Permanent deletion of data
     */
    DELETION,

    /**
     * Backend-side legal hold flag
     */
    LEGAL_HOLD_FLAG,

    /**
     * Persistence of retention policies
     */
    POLICY_STORAGE,

    /**
     * Persistence of schedule entries
     */
    SCHEDULE_STORAGE,

    /**
     * Persistence of legal holds
     */
    LEGAL_HOLD_STORAGE,

    /**
     * Data item catalog
     */
    DATA_CATALOG,

    /**
     * Event delivery
     */
    NOTIFICATIONS,

    /**
     * Cloud storage integration
     */
    CLOUD_STORAGE
}
