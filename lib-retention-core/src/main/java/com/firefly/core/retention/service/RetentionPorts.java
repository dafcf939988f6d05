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

import com.firefly.core.retention.port.catalog.DataCatalogPort;
import com.firefly.core.retention.port.notification.RetentionNotificationPort;
import com.firefly.core.retention.port.storage.StorageBackendPort;
import com.firefly.core.retention.port.store.LegalHoldStore;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import com.firefly.core.retention.port.store.ScheduleEntryStore;
import lombok.Builder;
import lombok.Getter;

/**
 * The resolved set of ports the engine runs on.
 *
 * <p>Adapters are themselves Spring beans, so the engine's services take their
 * ports from this holder rather than by type from the context.</p>
 */
@Getter
@Builder
public class RetentionPorts {

    private final StorageBackendPort storageBackend;

    private final RetentionPolicyStore policyStore;

    private final ScheduleEntryStore entryStore;

    private final LegalHoldStore holdStore;

    private final DataCatalogPort dataCatalog;

    private final RetentionNotificationPort notifications;
}
