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
package com.firefly.retention.adapter.azureblob;

import com.azure.storage.blob.BlobClient;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.models.AccessTier;
import com.azure.storage.blob.models.BlobProperties;
import com.azure.storage.blob.models.BlobStorageException;
import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.exception.StorageBackendException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.test.StepVerifier;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for AzureBlobStorageBackendAdapter against mocked blob clients.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AzureBlobStorageBackendAdapterTest {

    @Mock
    private BlobContainerClient containerClient;

    @Mock
    private BlobClient blobClient;

    @Mock
    private BlobProperties blobProperties;

    private AzureBlobAdapterProperties properties;

    private AzureBlobStorageBackendAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new AzureBlobAdapterProperties();
        properties.setAccountName("account");
        properties.setContainerName("retained");
        properties.setPathPrefix("data/");
        properties.setTimeoutSeconds(5);

        CircuitBreaker circuitBreaker = CircuitBreaker.of("test-cb", CircuitBreakerConfig.custom()
                .failureRateThreshold(100)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(10)
                .build());
        Retry retry = Retry.of("test-retry", RetryConfig.custom().maxAttempts(1).build());

        adapter = new AzureBlobStorageBackendAdapter(containerClient, properties, circuitBreaker, retry);

        when(containerClient.getBlobClient("data/item-1")).thenReturn(blobClient);
        when(blobClient.getProperties()).thenReturn(blobProperties);
        when(blobProperties.getBlobSize()).thenReturn(4096L);
        when(blobProperties.getMetadata()).thenReturn(new HashMap<>(Map.of("owner", "finance")));
    }

    @Test
    void transition_ShouldSetAccessTier() {
        // When & Then
        StepVerifier.create(adapter.transition("item-1", StorageTier.WARM))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.getSizeBytes()).isEqualTo(4096L);
                })
                .verifyComplete();

        verify(blobClient).setAccessTier(AccessTier.COOL);
    }

    @Test
    void accessTierFor_ShouldMapEveryTier() {
        assertThat(AzureBlobStorageBackendAdapter.accessTierFor(StorageTier.HOT)).isEqualTo(AccessTier.HOT);
        assertThat(AzureBlobStorageBackendAdapter.accessTierFor(StorageTier.WARM)).isEqualTo(AccessTier.COOL);
        assertThat(AzureBlobStorageBackendAdapter.accessTierFor(StorageTier.COLD)).isEqualTo(AccessTier.COLD);
        assertThat(AzureBlobStorageBackendAdapter.accessTierFor(StorageTier.ARCHIVE)).isEqualTo(AccessTier.ARCHIVE);
    }

    @Test
    void delete_ShouldDeleteBlob() {
        // When & Then
        StepVerifier.create(adapter.delete("item-1"))
                .assertNext(result -> assertThat(result.getSizeBytes()).isEqualTo(4096L))
                .verifyComplete();

        verify(blobClient).delete();
    }

    @Test
    void delete_ShouldWrapStorageErrors() {
        // Given
        BlobStorageException notFound = mock(BlobStorageException.class);
        when(notFound.getStatusCode()).thenReturn(404);
        doThrow(notFound).when(blobClient).delete();

        // When & Then
        StepVerifier.create(adapter.delete("item-1"))
                .expectError(StorageBackendException.class)
                .verify();
    }

    @Test
    void setHeldFlag_ShouldWriteMetadataWithoutImmutableStorage() {
        // When
        StepVerifier.create(adapter.setHeldFlag("item-1", true, "hold-9"))
                .expectNextCount(1)
                .verifyComplete();

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(blobClient).setMetadata(captor.capture());
        assertThat(captor.getValue())
                .containsEntry("owner", "finance")
                .containsEntry("fireflylegalhold", "hold-9");
        verify(blobClient, never()).setLegalHold(anyBoolean());
    }

    @Test
    void setHeldFlag_ShouldUseBlobLegalHoldWithImmutableStorage() {
        // Given
        properties.setImmutableStorageEnabled(true);

        // When
        StepVerifier.create(adapter.setHeldFlag("item-1", false, "hold-9"))
                .expectNextCount(1)
                .verifyComplete();

        // Then
        verify(blobClient).setLegalHold(false);
        verify(blobClient, never()).setMetadata(anyMap());
    }

    @Test
    void isRetryable_ShouldRetryOnlyTransientFailures() {
        BlobStorageException throttled = mock(BlobStorageException.class);
        when(throttled.getStatusCode()).thenReturn(503);
        BlobStorageException missing = mock(BlobStorageException.class);
        when(missing.getStatusCode()).thenReturn(404);

        assertThat(AzureBlobAutoConfiguration.isRetryable(throttled)).isTrue();
        assertThat(AzureBlobAutoConfiguration.isRetryable(missing)).isFalse();
        assertThat(AzureBlobAutoConfiguration.isRetryable(new IllegalArgumentException())).isFalse();
    }
}
