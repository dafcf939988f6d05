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
package com.firefly.core.retention.adapter.cache;

import com.firefly.core.retention.domain.model.policy.RetentionPolicy;
import com.firefly.core.retention.port.store.RetentionPolicyStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-through cache in front of a {@link RetentionPolicyStore}.
 *
 * <p>Bounded LRU with a time-to-live. Writes go straight to the delegate and
 * evict the cached copy.</p>
 */
@Slf4j
public class CachingRetentionPolicyStore implements RetentionPolicyStore {

    private final RetentionPolicyStore delegate;
    private final Clock clock;
    private final Duration expiration;
    private final Map<String, CachedPolicy> cache;

    public CachingRetentionPolicyStore(RetentionPolicyStore delegate, Clock clock, int maxSize, Duration expiration) {
        this.delegate = delegate;
        this.clock = clock;
        this.expiration = expiration;
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CachedPolicy> eldest) {
                return size() > maxSize;
            }
        };
    }

    @Override
    public Mono<RetentionPolicy> save(RetentionPolicy policy) {
        return delegate.save(policy)
            .doOnNext(saved -> invalidate(saved.getId()));
    }

    @Override
    public Mono<RetentionPolicy> findById(String policyId) {
        return Mono.defer(() -> {
            RetentionPolicy cached = lookup(policyId);
            if (cached != null) {
                log.trace("Policy cache hit for {}", policyId);
                return Mono.just(cached);
            }
            return delegate.findById(policyId).doOnNext(this::put);
        });
    }

    @Override
    public Flux<RetentionPolicy> findAll() {
        return delegate.findAll().doOnNext(this::put);
    }

    @Override
    public Mono<Void> deleteById(String policyId) {
        return delegate.deleteById(policyId)
            .doOnTerminate(() -> invalidate(policyId));
    }

    /**
     * Drops every cached policy.
     */
    public synchronized void clear() {
        cache.clear();
    }

    synchronized int size() {
        return cache.size();
    }

    private synchronized RetentionPolicy lookup(String policyId) {
        CachedPolicy cached = cache.get(policyId);
        if (cached == null) {
            return null;
        }
        if (cached.expiresAt.isBefore(clock.instant())) {
            cache.remove(policyId);
            return null;
        }
        return cached.policy;
    }

    private synchronized void put(RetentionPolicy policy) {
        cache.put(policy.getId(), new CachedPolicy(policy, clock.instant().plus(expiration)));
    }

    private synchronized void invalidate(String policyId) {
        cache.remove(policyId);
    }

    private static final class CachedPolicy {
        private final RetentionPolicy policy;
        private final Instant expiresAt;

        private CachedPolicy(RetentionPolicy policy, Instant expiresAt) {
            this.policy = policy;
            this.expiresAt = expiresAt;
        }
    }
}
