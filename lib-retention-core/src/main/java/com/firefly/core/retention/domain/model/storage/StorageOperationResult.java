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
package com.firefly.core.retention.domain.model.storage;

import lombok.Builder;
import lombok.Data;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of a storage backend call.
 */
@Data
@Builder
@Jacksonized
public class StorageOperationResult {

    private final boolean success;

    /**
     * Bytes affected by the operation, used for space accounting
     */
    private final long sizeBytes;

    /**
     * Failure message when {@code success} is false
     */
    private final String error;

    public static StorageOperationResult success(long sizeBytes) {
        return StorageOperationResult.builder().success(true).sizeBytes(sizeBytes).build();
    }

    public static StorageOperationResult failure(String error) {
        return StorageOperationResult.builder().success(false).error(error).build();
    }
}
