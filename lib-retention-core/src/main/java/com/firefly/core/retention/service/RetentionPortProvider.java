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
package com.firefly.core.retention.service;

import com.firefly.core.retention.adapter.AdapterSelector;
import com.firefly.core.retention.config.RetentionProperties;
import com.firefly.core.retention.port.catalog.DataCatalogPort;
import com.firefly.core.retention.port.notification.RetentionNotificationPort;
import com.firefly.core.retention.port.storage.StorageBackendPort;
import com.firefly.core.retention.port.store.LegalHoldStore;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import com.firefly.core.retention.port.store.ScheduleEntryStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Central service that provides access to retention ports with proper adapter selection and logging.
 *
 * <p>Each getter asks the {@link AdapterSelector} for the adapter of the configured
 * type and falls back to the highest-priority adapter implementing the port. A
 * missing adapter is logged and reported as an empty Optional so that callers
 * decide whether to degrade or fail.</p>
 *
 * @see AdapterSelector
 * @see RetentionProperties
 */
@Slf4j
public class RetentionPortProvider {

    /** The adapter selector responsible for choosing appropriate adapters. */
    private final AdapterSelector adapterSelector;

    /** The retention configuration properties. */
    private final RetentionProperties properties;

    public RetentionPortProvider(AdapterSelector adapterSelector, RetentionProperties properties) {
        this.adapterSelector = adapterSelector;
        this.properties = properties;
    }

    /**
     * Retrieves the storage backend that moves and deletes data.
     *
     * @return the adapter, or empty if none is available
     */
    public Optional<StorageBackendPort> getStorageBackendPort() {
        Optional<StorageBackendPort> port = adapterSelector.selectAdapter(properties.getAdapterType(), StorageBackendPort.class);
        if (port.isEmpty()) {
            log.warn("No StorageBackendPort adapter found for type: {}. Tier transitions and deletions will fail.",
                    properties.getAdapterType());
        }
        return port;
    }

    public Optional<RetentionPolicyStore> getRetentionPolicyStore() {
        return select(RetentionPolicyStore.class, "Policies cannot be stored.");
    }

    public Optional<ScheduleEntryStore> getScheduleEntryStore() {
        return select(ScheduleEntryStore.class, "Schedules cannot be stored.");
    }

    public Optional<LegalHoldStore> getLegalHoldStore() {
        return select(LegalHoldStore.class, "Legal holds cannot be stored.");
    }

    public Optional<DataCatalogPort> getDataCatalogPort() {
        return select(DataCatalogPort.class, "Data items cannot be looked up.");
    }

    /**
     * Retrieves the notification adapter events are delivered to.
     *
     * @return the adapter, or empty if none is available
     */
    public Optional<RetentionNotificationPort> getNotificationPort() {
        return select(RetentionNotificationPort.class, "Events will not be delivered.");
    }

    private <T> Optional<T> select(Class<T> portType, String consequence) {
        Optional<T> port = adapterSelector.selectAdapter(properties.getAdapterType(), portType);
        if (port.isEmpty()) {
            log.warn("No {} adapter found for type: {}. {}", portType.getSimpleName(), properties.getAdapterType(), consequence);
        }
        return port;
    }
}
