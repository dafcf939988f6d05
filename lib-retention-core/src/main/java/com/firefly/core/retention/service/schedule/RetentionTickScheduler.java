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
package com.firefly.core.retention.service.schedule;

import com.firefly.core.retention.service.RetentionEngine;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Optional timer that drives {@link RetentionEngine#runTick()} at a fixed interval.
 * Ticks never overlap: the next one starts only after the previous one finished.
 */
@Slf4j
public class RetentionTickScheduler {

    private final RetentionEngine engine;
    private final Duration interval;
    private Disposable subscription;

    public RetentionTickScheduler(RetentionEngine engine, Duration interval) {
        this.engine = engine;
        this.interval = interval;
    }

    public synchronized void start() {
        if (subscription != null && !subscription.isDisposed()) {
            return;
        }
        log.info("Scheduling retention ticks every {}", interval);
        subscription = Flux.interval(interval, interval)
            .onBackpressureDrop(tick -> log.warn("Retention tick {} dropped: previous tick still running", tick))
            .concatMap(tick -> engine.runTick()
                .then()
                .onErrorResume(error -> {
                    log.error("Retention tick {} failed: {}", tick, error.getMessage(), error);
                    return Mono.empty();
                }), 1)
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
