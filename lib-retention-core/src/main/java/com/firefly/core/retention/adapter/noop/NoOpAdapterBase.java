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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Shared behavior of no-op fallback adapters: every call logs a warning,
 * lookups come back empty and changes fail with {@link UnsupportedOperationException}.
 */
@Slf4j
public abstract class NoOpAdapterBase {

    private final String portName;

    protected NoOpAdapterBase(String portName) {
        this.portName = portName;
    }

    public String getPortName() {
        return portName;
    }

    protected void logNotConfigured(String methodName) {
        log.warn("{}.{} called but no {} adapter is configured; set firefly.retention.adapter-type to enable it",
                portName, methodName, portName);
    }

    protected <T> Mono<T> emptyResult(String methodName) {
        logNotConfigured(methodName);
        return Mono.empty();
    }

    protected <T> Flux<T> emptyResults(String methodName) {
        logNotConfigured(methodName);
        return Flux.empty();
    }

    protected <T> Mono<T> unsupported(String methodName) {
        logNotConfigured(methodName);
        return Mono.error(new UnsupportedOperationException(
                portName + "." + methodName + " is not available: no " + portName + " adapter configured"));
    }
}
