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
package com.firefly.core.retention.port.notification;

import com.firefly.core.retention.domain.model.event.RetentionEvent;
import reactor.core.publisher.Mono;

/**
 * Port interface for delivering lifecycle events to people or external systems.
 */
public interface RetentionNotificationPort {

    /**
     * Deliver an event.
     *
     * @param event the event
     * @return Mono indicating completion
     */
    Mono<Void> send(RetentionEvent event);

    /**
     * Get the adapter name for identification.
     *
     * @return the adapter name
     */
    String getAdapterName();
}
