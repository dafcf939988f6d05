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
 * Registry entry describing a discovered adapter.
 */
@Data
@Builder
public class AdapterInfo {

    private final String beanName;

    private final Object adapterBean;

    private final String type;

    private final int priority;

    private final String description;

    private final String version;

    private final String vendor;

    private final Set<String> requiredProperties;

    private final Set<String> optionalProperties;

    private final Set<AdapterFeature> supportedFeatures;

    public boolean supports(AdapterFeature feature) {
        return supportedFeatures != null && supportedFeatures.contains(feature);
    }
}
