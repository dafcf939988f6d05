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
import com.firefly.core.retention.adapter.AdapterFeature;
import com.firefly.core.retention.adapter.RetentionAdapter;
import com.firefly.core.retention.config.ResilienceConfiguration;
import com.firefly.core.retention.domain.enums.policy.StorageTier;
import com.firefly.core.retention.domain.model.storage.StorageOperationResult;
import com.firefly.core.retention.exception.StorageBackendException;
import com.firefly.core.retention.port.storage.StorageBackendPort;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Azure Blob Storage implementation of {@link StorageBackendPort}.
 *
 * <p>Tiers map onto blob access tiers (HOT, COOL, COLD, ARCHIVE) and a transition
 * is a tier change on the blob. Legal holds use the blob legal hold when the
 * container has version-level immutability, otherwise a metadata entry.</p>
 */
@Slf4j
@RetentionAdapter(
    type = "azure-blob",
    description = "Azure Blob Storage retention storage backend",
    supportedFeatures = {
        AdapterFeature.TIER_TRANSITION,
        AdapterFeature.DELETION,
        AdapterFeature.LEGAL_HOLD_FLAG,
        AdapterFeature.CLOUD_STORAGE
    },
    requiredProperties = {"account-name", "container-name"},
    optionalProperties = {"account-key", "connection-string", "sas-token", "managed-identity",
        "endpoint", "path-prefix", "immutable-storage-enabled"}
)
public class AzureBlobStorageBackendAdapter implements StorageBackendPort {

    private static final Map<StorageTier, AccessTier> ACCESS_TIERS = new EnumMap<>(StorageTier.class);

    static {
        ACCESS_TIERS.put(StorageTier.HOT, AccessTier.HOT);
        ACCESS_TIERS.put(StorageTier.WARM, AccessTier.COOL);
        ACCESS_TIERS.put(StorageTier.COLD, AccessTier.COLD);
        ACCESS_TIERS.put(StorageTier.ARCHIVE, AccessTier.ARCHIVE);
    }

    private final BlobContainerClient containerClient;
    private final AzureBlobAdapterProperties properties;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    public AzureBlobStorageBackendAdapter(BlobContainerClient containerClient,
                                          AzureBlobAdapterProperties properties,
                                          CircuitBreaker circuitBreaker,
                                          Retry retry) {
        this.containerClient = containerClient;
        this.properties = properties;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        log.info("AzureBlobStorageBackendAdapter initialized with container: {}, prefix: '{}'",
                properties.getContainerName(), properties.getPathPrefix());
    }

    @Override
    public Mono<StorageOperationResult> transition(String dataId, StorageTier targetTier) {
        Mono<StorageOperationResult> operation = Mono.fromCallable(() -> {
            BlobClient blobClient = blob(dataId);
            long size = blobClient.getProperties().getBlobSize();
            blobClient.setAccessTier(accessTierFor(targetTier));
            return StorageOperationResult.success(size);
        })
        .doOnSuccess(result -> log.debug("Set access tier of {} to {}", dataId, accessTierFor(targetTier)))
        .doOnError(error -> log.error("Failed to move {} to {} in Azure Blob Storage", dataId, targetTier, error));

        return guarded(operation, dataId, "transition");
    }

    @Override
    public Mono<StorageOperationResult> delete(String dataId) {
        Mono<StorageOperationResult> operation = Mono.fromCallable(() -> {
            BlobClient blobClient = blob(dataId);
            long size = blobClient.getProperties().getBlobSize();
            blobClient.delete();
            return StorageOperationResult.success(size);
        })
        .doOnSuccess(result -> log.debug("Deleted {} from container {}", dataId, properties.getContainerName()))
        .doOnError(error -> log.error("Failed to delete {} from Azure Blob Storage", dataId, error));

        return guarded(operation, dataId, "delete");
    }

    @Override
    public Mono<StorageOperationResult> setHeldFlag(String dataId, boolean held, String holdId) {
        Mono<StorageOperationResult> operation = Mono.fromCallable(() -> {
            BlobClient blobClient = blob(dataId);
            if (Boolean.TRUE.equals(properties.getImmutableStorageEnabled())) {
                blobClient.setLegalHold(held);
            } else {
                Map<String, String> metadata = new HashMap<>(blobClient.getProperties().getMetadata());
                if (held) {
                    metadata.put(properties.getLegalHoldMetadataKey(), holdId);
                } else {
                    metadata.remove(properties.getLegalHoldMetadataKey());
                }
                blobClient.setMetadata(metadata);
            }
            return StorageOperationResult.success(0);
        })
        .doOnSuccess(result -> log.debug("Set legal hold flag of {} to {} (hold {})", dataId, held, holdId))
        .doOnError(error -> log.error("Failed to set legal hold flag of {} in Azure Blob Storage", dataId, error));

        return guarded(operation, dataId, "legal hold update");
    }

    @Override
    public String getAdapterName() {
        return "AzureBlobStorageBackendAdapter";
    }

    static AccessTier accessTierFor(StorageTier tier) {
        return ACCESS_TIERS.get(tier);
    }

    String blobName(String dataId) {
        String prefix = properties.getPathPrefix();
        return prefix == null || prefix.isEmpty() ? dataId : prefix + dataId;
    }

    private BlobClient blob(String dataId) {
        return containerClient.getBlobClient(blobName(dataId));
    }

    private Mono<StorageOperationResult> guarded(Mono<StorageOperationResult> operation, String dataId, String action) {
        return ResilienceConfiguration.ReactiveResilience.withResilience(operation, circuitBreaker, retry)
                .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()).multipliedBy(properties.getMaxRetries() + 1L))
                .onErrorMap(error -> !(error instanceof StorageBackendException),
                        error -> new StorageBackendException(dataId, "Azure Blob " + action + " failed: " + error.getMessage(), error))
                .doOnError(error -> log.warn("Azure Blob {} of {} failed after all resilience attempts: {}",
                        action, dataId, error.getMessage()));
    }
}
