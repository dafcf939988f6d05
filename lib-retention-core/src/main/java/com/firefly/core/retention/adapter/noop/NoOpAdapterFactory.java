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
package com.firefly.core.retention.adapter.noop;

import com.firefly.core.retention.port.storage.StorageBackendPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Factory for no-op fallback adapters.
 *
 * <p>Used when no real adapter is configured for a port, so the engine can start
 * and report clearly what is missing instead of failing at bootstrap.</p>
 */
@Slf4j
@Component
public class NoOpAdapterFactory {

    /**
     * Creates a no-op StorageBackendPort adapter. Every transition, deletion and
     * hold-flag change fails, so schedule entries retry and eventually fail
     * instead of being silently marked done.
     *
     * @return a new no-op adapter instance
     */
    public StorageBackendPort createStorageBackendPort() {
        log.info("Creating no-op StorageBackendPort adapter as fallback");
        return new NoOpGenericAdapter<>("StorageBackendPort", StorageBackendPort.class).getProxy();
    }
}
