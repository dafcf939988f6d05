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
package com.firefly.retention.adapter.s3;

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
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.MetadataDirective;
import software.amazon.awssdk.services.s3.model.ObjectLockLegalHold;
import software.amazon.awssdk.services.s3.model.ObjectLockLegalHoldStatus;
import software.amazon.awssdk.services.s3.model.PutObjectLegalHoldRequest;
import software.amazon.awssdk.services.s3.model.PutObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.StorageClass;
import software.amazon.awssdk.services.s3.model.Tag;
import software.amazon.awssdk.services.s3.model.Tagging;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Amazon S3 implementation of {@link StorageBackendPort}.
 *
 * <p>Tiers map onto S3 storage classes and a transition rewrites the object in
 * place with the new class. Legal holds use S3 Object Lock legal hold status when
 * the bucket supports it, otherwise an object tag carrying the hold ID.</p>
 *
 * <p>Tier mapping:</p>
 * <ul>
 *   <li>HOT: STANDARD</li>
 *   <li>WARM: STANDARD_IA</li>
 *   <li>COLD: GLACIER_IR</li>
 *   <li>ARCHIVE: DEEP_ARCHIVE</li>
 * </ul>
 */
@Slf4j
@RetentionAdapter(
    type = "s3",
    description = "Amazon S3 retention storage backend",
    supportedFeatures = {
        AdapterFeature.TIER_TRANSITION,
        AdapterFeature.DELETION,
        AdapterFeature.LEGAL_HOLD_FLAG,
        AdapterFeature.CLOUD_STORAGE
    },
    requiredProperties = {"bucket-name", "region"},
    optionalProperties = {"access-key", "secret-key", "endpoint", "path-prefix", "object-lock-enabled"}
)
public class S3StorageBackendAdapter implements StorageBackendPort {

    private static final Map<StorageTier, StorageClass> STORAGE_CLASSES = new EnumMap<>(StorageTier.class);

    static {
        STORAGE_CLASSES.put(StorageTier.HOT, StorageClass.STANDARD);
        STORAGE_CLASSES.put(StorageTier.WARM, StorageClass.STANDARD_IA);
        STORAGE_CLASSES.put(StorageTier.COLD, StorageClass.GLACIER_IR);
        STORAGE_CLASSES.put(StorageTier.ARCHIVE, StorageClass.DEEP_ARCHIVE);
    }

    private final S3Client s3Client;
    private final S3AdapterProperties properties;
    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    public S3StorageBackendAdapter(S3Client s3Client,
                                   S3AdapterProperties properties,
                                   CircuitBreaker circuitBreaker,
                                   Retry retry) {
        this.s3Client = s3Client;
        this.properties = properties;
        this.circuitBreaker = circuitBreaker;
        this.retry = retry;
        log.info("S3StorageBackendAdapter initialized with bucket: {}, prefix: '{}', object lock: {}",
                properties.getBucketName(), properties.getPathPrefix(), properties.getObjectLockEnabled());
    }

    @Override
    public Mono<StorageOperationResult> transition(String dataId, StorageTier targetTier) {
        Mono<StorageOperationResult> operation = Mono.fromCallable(() -> {
            String objectKey = objectKey(dataId);
            HeadObjectResponse head = head(objectKey);

            CopyObjectRequest copyRequest = CopyObjectRequest.builder()
                    .sourceBucket(properties.getBucketName())
                    .sourceKey(objectKey)
                    .destinationBucket(properties.getBucketName())
                    .destinationKey(objectKey)
                    .storageClass(storageClassFor(targetTier))
                    .metadataDirective(MetadataDirective.COPY)
                    .build();
            s3Client.copyObject(copyRequest);

            return StorageOperationResult.success(sizeOf(head));
        })
        .doOnSuccess(result -> log.debug("Moved {} to {} ({})", dataId, targetTier, storageClassFor(targetTier)))
        .doOnError(error -> log.error("Failed to move {} to {} in S3", dataId, targetTier, error));

        return guarded(operation, dataId, "transition");
    }

    @Override
    public Mono<StorageOperationResult> delete(String dataId) {
        Mono<StorageOperationResult> operation = Mono.fromCallable(() -> {
            String objectKey = objectKey(dataId);
            HeadObjectResponse head = head(objectKey);

            DeleteObjectRequest deleteRequest = DeleteObjectRequest.builder()
                    .bucket(properties.getBucketName())
                    .key(objectKey)
                    .build();
            s3Client.deleteObject(deleteRequest);

            return StorageOperationResult.success(sizeOf(head));
        })
        .doOnSuccess(result -> log.debug("Deleted {} from S3 bucket {}", dataId, properties.getBucketName()))
        .doOnError(error -> log.error("Failed to delete {} from S3", dataId, error));

        return guarded(operation, dataId, "delete");
    }

    @Override
    public Mono<StorageOperationResult> setHeldFlag(String dataId, boolean held, String holdId) {
        Mono<StorageOperationResult> operation = Mono.fromCallable(() -> {
            String objectKey = objectKey(dataId);
            if (Boolean.TRUE.equals(properties.getObjectLockEnabled())) {
                PutObjectLegalHoldRequest request = PutObjectLegalHoldRequest.builder()
                        .bucket(properties.getBucketName())
                        .key(objectKey)
                        .legalHold(ObjectLockLegalHold.builder()
                                .status(held ? ObjectLockLegalHoldStatus.ON : ObjectLockLegalHoldStatus.OFF)
                                .build())
                        .build();
                s3Client.putObjectLegalHold(request);
            } else {
                updateHoldTag(objectKey, held, holdId);
            }
            return StorageOperationResult.success(0);
        })
        .doOnSuccess(result -> log.debug("Set legal hold flag of {} to {} (hold {})", dataId, held, holdId))
        .doOnError(error -> log.error("Failed to set legal hold flag of {} in S3", dataId, error));

        return guarded(operation, dataId, "legal hold update");
    }

    @Override
    public String getAdapterName() {
        return "S3StorageBackendAdapter";
    }

    static StorageClass storageClassFor(StorageTier tier) {
        return STORAGE_CLASSES.get(tier);
    }

    String objectKey(String dataId) {
        String prefix = properties.getPathPrefix();
        return prefix == null || prefix.isEmpty() ? dataId : prefix + dataId;
    }

    private void updateHoldTag(String objectKey, boolean held, String holdId) {
        List<Tag> tags = s3Client.getObjectTagging(GetObjectTaggingRequest.builder()
                        .bucket(properties.getBucketName())
                        .key(objectKey)
                        .build())
                .tagSet()
                .stream()
                .filter(tag -> !tag.key().equals(properties.getLegalHoldTagKey()))
                .collect(Collectors.toList());
        if (held) {
            tags.add(Tag.builder().key(properties.getLegalHoldTagKey()).value(holdId).build());
        }
        s3Client.putObjectTagging(PutObjectTaggingRequest.builder()
                .bucket(properties.getBucketName())
                .key(objectKey)
                .tagging(Tagging.builder().tagSet(tags).build())
                .build());
    }

    private HeadObjectResponse head(String objectKey) {
        return s3Client.headObject(HeadObjectRequest.builder()
                .bucket(properties.getBucketName())
                .key(objectKey)
                .build());
    }

    private static long sizeOf(HeadObjectResponse head) {
        return head.contentLength() != null ? head.contentLength() : 0L;
    }

    private Mono<StorageOperationResult> guarded(Mono<StorageOperationResult> operation, String dataId, String action) {
        return ResilienceConfiguration.ReactiveResilience.withResilience(operation, circuitBreaker, retry)
                .timeout(properties.getOperationTimeout())
                .onErrorMap(error -> !(error instanceof StorageBackendException),
                        error -> new StorageBackendException(dataId, "S3 " + action + " failed: " + error.getMessage(), error))
                .doOnError(error -> log.warn("S3 {} of {} failed after all resilience attempts: {}", action, dataId, error.getMessage()));
    }
}
