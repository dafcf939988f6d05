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
package com.firefly.core.retention.exception;

/**
 * Thrown by storage adapters when the backend rejects or fails an operation.
 */
public class StorageBackendException extends RetentionException {

    private final String dataId;

    public StorageBackendException(String dataId, String message) {
        super(message);
        this.dataId = dataId;
    }

    public StorageBackendException(String dataId, String message, Throwable cause) {
        super(message, cause);
        this.dataId = dataId;
    }

    public String getDataId() {
        return dataId;
    }
}
