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
package com.firefly.core.retention.adapter.memory;

import com.firefly.core.retention.adapter.AdapterFeature;
import com.firefly.core.retention.adapter.RetentionAdapter;
import com.firefly.core.retention.domain.model.event.RetentionEvent;
import com.firefly.core.retention.port.notification.RetentionNotificationPort;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Notification adapter that writes events to the log. Default when no
 * delivery adapter is present.
 */
@Slf4j
@RetentionAdapter(
    type = "logging",
    priority = -100,
    description = "Log-only notification adapter",
    supportedFeatures = {AdapterFeature.NOTIFICATIONS}
)
public class LoggingNotificationAdapter implements RetentionNotificationPort {

    @Override
    public Mono<Void> send(RetentionEvent event) {
        return Mono.fromRunnable(() -> log.info("Retention event {} [policy={}, data={}, hold={}]: {}",
                event.getType(), event.getPolicyId(), event.getDataId(), event.getHoldId(), event.getMessage()));
    }

    @Override
    public String getAdapterName() {
        return "LoggingNotificationAdapter";
    }
}
