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

import lombok.Builder;
import lombok.Data;

import java.util.Set;

/**
 * Result of checking an adapter's required configuration.
 */
@Data
@Builder
public class AdapterValidationResult {

    private final boolean valid;

    private final String errorMessage;

    private final Set<String> missingProperties;

    private final AdapterInfo adapterInfo;
}
