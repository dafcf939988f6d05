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

import com.firefly.core.retention.domain.enums.event.RetentionEventType;
import com.firefly.core.retention.domain.model.event.RetentionEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Typed, in-process event bus. Each event type has its own bounded multicast
 * channel, so a slow subscriber of one type never delays another type.
 *
 * <p>Publishing never fails the caller: an event that cannot be buffered is
 * dropped and logged.</p>
 */
@Slf4j
public class RetentionEventBus {

    private final Map<RetentionEventType, Sinks.Many<RetentionEvent>> channels = new EnumMap<>(RetentionEventType.class);
    private final Clock clock;

    public RetentionEventBus(int bufferSize, Clock clock) {
        this.clock = clock;
        for (RetentionEventType type : RetentionEventType.values()) {
            channels.put(type, Sinks.many().multicast().onBackpressureBuffer(bufferSize, false));
        }
    }

    /**
     * Publishes an event on its type's channel.
     *
     * @param event the event
     */
    public void publish(RetentionEvent event) {
        Sinks.Many<RetentionEvent> channel = channels.get(event.getType());
        Sinks.EmitResult result;
        synchronized (channel) {
            result = channel.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.warn("Dropped {} event for data {}: {}", event.getType(), event.getDataId(), result);
        }
    }

    /**
     * Starts a builder pre-filled with the type and current time.
     *
     * @param type the event type
     * @return event builder
     */
    public RetentionEvent.RetentionEventBuilder event(RetentionEventType type) {
        return RetentionEvent.builder().type(type).timestamp(clock.instant());
    }

    /**
     * Events of one type.
     *
     * @param type the event type
     * @return hot stream of events
     */
    public Flux<RetentionEvent> events(RetentionEventType type) {
        return channels.get(type).asFlux();
    }

    /**
     * Events of every type.
     *
     * @return hot stream merging all channels
     */
    public Flux<RetentionEvent> allEvents() {
        List<Flux<RetentionEvent>> streams = new ArrayList<>();
        channels.values().forEach(channel -> streams.add(channel.asFlux()));
        return Flux.merge(streams);
    }

    /**
     * Completes every channel.
     */
    public void shutdown() {
        channels.values().forEach(channel -> {
            synchronized (channel) {
                channel.tryEmitComplete();
            }
        });
    }
}
