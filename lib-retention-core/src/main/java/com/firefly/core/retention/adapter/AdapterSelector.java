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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Selects retention adapters based on the configured adapter type, falling
 * back to the highest-priority adapter implementing the requested port.
 */
@Slf4j
@Component
public class AdapterSelector {

    private final AdapterRegistry adapterRegistry;

    public AdapterSelector(AdapterRegistry adapterRegistry) {
        this.adapterRegistry = adapterRegistry;
    }

    /**
     * Select adapter by type with fallback logic.
     *
     * @param preferredType the preferred adapter type, may be null
     * @param interfaceClass the port interface to implement
     * @param <T> the port type
     * @return the selected adapter, or empty if none available
     */
    public <T> Optional<T> selectAdapter(String preferredType, Class<T> interfaceClass) {
        if (preferredType != null && !preferredType.trim().isEmpty()) {
            Optional<AdapterInfo> adapterInfo = adapterRegistry.getAdapter(preferredType);
            if (adapterInfo.isPresent()) {
                Object adapterBean = adapterInfo.get().getAdapterBean();
                if (interfaceClass.isInstance(adapterBean)) {
                    log.info("Selected {} adapter of type: {}", interfaceClass.getSimpleName(), preferredType);
                    return Optional.of(interfaceClass.cast(adapterBean));
                }
                log.debug("Adapter type '{}' does not implement {}", preferredType, interfaceClass.getSimpleName());
            } else {
                log.warn("No adapter found for preferred type: {}", preferredType);
            }
        }

        Optional<T> fallbackAdapter = adapterRegistry.getAdapter(interfaceClass);
        if (fallbackAdapter.isPresent()) {
            log.info("Using fallback {} adapter", interfaceClass.getSimpleName());
            return fallbackAdapter;
        }

        log.warn("No {} adapter available", interfaceClass.getSimpleName());
        return Optional.empty();
    }

    /**
     * Check the configured properties against an adapter's required ones.
     *
     * @param adapterType the adapter type
     * @param configuredProperties the property names that are set
     * @return validation result
     */
    public AdapterValidationResult validateAdapterConfiguration(String adapterType, Set<String> configuredProperties) {
        Optional<AdapterInfo> adapterInfo = adapterRegistry.getAdapter(adapterType);
        if (adapterInfo.isEmpty()) {
            return AdapterValidationResult.builder()
                .valid(false)
                .errorMessage("Adapter type '" + adapterType + "' not found")
                .build();
        }

        AdapterInfo info = adapterInfo.get();
        Set<String> missingProperties = new HashSet<>(info.getRequiredProperties());
        missingProperties.removeAll(configuredProperties);

        if (!missingProperties.isEmpty()) {
            return AdapterValidationResult.builder()
                .valid(false)
                .errorMessage("Missing required properties: " + missingProperties)
                .missingProperties(missingProperties)
                .adapterInfo(info)
                .build();
        }

        return AdapterValidationResult.builder()
            .valid(true)
            .adapterInfo(info)
            .build();
    }
}
