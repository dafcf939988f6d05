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
import com.firefly.core.retention.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static com.firefly.core.retention.support.RetentionFixtures.T0;
import static com.firefly.core.retention.support.RetentionFixtures.invoicePolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CachingRetentionPolicyStoreTest {

    @Mock
    private RetentionPolicyStore delegate;

    private MutableClock clock;
    private CachingRetentionPolicyStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new CachingRetentionPolicyStore(delegate, clock, 2, Duration.ofMinutes(10));

        when(delegate.findById(anyString()))
            .thenAnswer(invocation -> Mono.just(invoicePolicy().id(invocation.getArgument(0)).build()));
        when(delegate.save(any(RetentionPolicy.class)))
            .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
    }

    @Test
    void findById_ShouldServeRepeatedReadsFromCache() {
        store.findById("policy-a").block();
        store.findById("policy-a").block();

        verify(delegate, times(1)).findById("policy-a");
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void findById_ShouldReloadAfterExpiration() {
        store.findById("policy-a").block();
        clock.advance(Duration.ofMinutes(11));

        store.findById("policy-a").block();

        verify(delegate, times(2)).findById("policy-a");
    }

    @Test
    void findById_ShouldEvictLeastRecentlyUsedPolicy() {
        store.findById("policy-a").block();
        store.findById("policy-b").block();
        store.findById("policy-a").block();
        store.findById("policy-c").block();

        store.findById("policy-a").block();
        store.findById("policy-b").block();

        assertThat(store.size()).isEqualTo(2);
        verify(delegate, times(1)).findById("policy-a");
        verify(delegate, times(2)).findById("policy-b");
    }

    @Test
    void save_ShouldInvalidateCachedCopy() {
        store.findById("policy-a").block();

        StepVerifier.create(store.save(invoicePolicy().id("policy-a").version(2).build()))
            .assertNext(saved -> assertThat(saved.getVersion()).isEqualTo(2))
            .verifyComplete();
        store.findById("policy-a").block();

        verify(delegate, times(2)).findById("policy-a");
    }

    @Test
    void deleteById_ShouldInvalidateCachedCopy() {
        when(delegate.deleteById("policy-a")).thenReturn(Mono.empty());
        store.findById("policy-a").block();

        store.deleteById("policy-a").block();

        assertThat(store.size()).isZero();
    }
}
