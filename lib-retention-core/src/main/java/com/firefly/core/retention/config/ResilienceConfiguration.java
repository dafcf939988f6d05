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
package com.firefly.core.retention.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import io.github.resilience4j.reactor.retry.RetryOperator;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Shared resilience settings for storage adapters.
 */
public final class ResilienceConfiguration {

    private ResilienceConfiguration() {
    }

    /**
     * Circuit breaker with the library defaults: opens at 50% failures over the
     * last 10 calls (minimum 5) and half-opens after 30 seconds.
     *
     * @param name the circuit breaker name
     * @return configured circuit breaker
     */
    public static CircuitBreaker circuitBreaker(String name) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .permittedNumberOfCallsInHalfOpenState(3)
            .build();
        return CircuitBreaker.of(name, config);
    }

    /**
     * Retry with a fixed two-second wait.
     *
     * @param name the retry name
     * @param maxAttempts total attempts including the first
     * @param retryOn which failures are worth retrying
     * @return configured retry
     */
    public static Retry retry(String name, int maxAttempts, Predicate<Throwable> retryOn) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(maxAttempts)
            .waitDuration(Duration.ofSeconds(2))
            .retryOnException(retryOn)
            .build();
        return Retry.of(name, config);
    }

    /**
     * Reactor operators wrapping a publisher with retry and circuit breaking.
     */
    public static final class ReactiveResilience {

        private ReactiveResilience() {
        }

        /**
         * Applies the circuit breaker to each attempt and retries the guarded call.
         *
         * @param operation the operation
         * @param circuitBreaker the circuit breaker
         * @param retry the retry
         * @param <T> the element type
         * @return the guarded operation
         */
        public static <T> Mono<T> withResilience(Mono<T> operation, CircuitBreaker circuitBreaker, Retry retry) {
            return operation
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .transformDeferred(RetryOperator.of(retry));
        }
    }
}
