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
package com.firefly.core.retention.event;

import com.firefly.core.retention.port.notification.RetentionNotificationPort;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

/**
 * Forwards every bus event to the notification adapter. A failed delivery is
 * logged and never reaches the component that published the event.
 */
@Slf4j
public class RetentionEventDispatcher {

    private final RetentionEventBus eventBus;
    private final RetentionNotificationPort notificationPort;
    private Disposable subscription;

    public RetentionEventDispatcher(RetentionEventBus eventBus, RetentionNotificationPort notificationPort) {
        this.eventBus = eventBus;
        this.notificationPort = notificationPort;
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        log.info("Dispatching retention events to {}", notificationPort.getAdapterName());
        subscription = eventBus.allEvents()
            .concatMap(event -> notificationPort.send(event)
                .onErrorResume(error -> {
                    log.warn("Failed to deliver {} event for data {}: {}",
                            event.getType(), event.getDataId(), error.getMessage());
                    return Mono.empty();
                }))
            .subscribe();
    }

    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }

    public synchronized boolean isRunning() {
        return subscription != null && !subscription.isDisposed();
    }
}
