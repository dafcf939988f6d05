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
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CopyObjectRequest;
import software.amazon.awssdk.services.s3.model.CopyObjectResponse;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.DeleteObjectResponse;
import software.amazon.awssdk.services.s3.model.GetObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.GetObjectTaggingResponse;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.ObjectLockLegalHoldStatus;
import software.amazon.awssdk.services.s3.model.PutObjectLegalHoldRequest;
import software.amazon.awssdk.services.s3.model.PutObjectLegalHoldResponse;
import software.amazon.awssdk.services.s3.model.PutObjectTaggingRequest;
import software.amazon.awssdk.services.s3.model.PutObjectTaggingResponse;
import software.amazon.awssdk.services.s3.model.StorageClass;
import software.amazon.awssdk.services.s3.model.Tag;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for S3StorageBackendAdapter against a mocked S3Client.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class S3StorageBackendAdapterTest {

    private static final String TEST_BUCKET = "retained-data";

    @Mock
    private S3Client s3Client;

    private S3AdapterProperties properties;

    private S3StorageBackendAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new S3AdapterProperties();
        properties.setBucketName(TEST_BUCKET);
        properties.setRegion("us-east-1");
        properties.setPathPrefix("retention/");
        properties.setOperationTimeout(Duration.ofSeconds(5));

        CircuitBreaker circuitBreaker = CircuitBreaker.of("test-cb", CircuitBreakerConfig.custom()
                .failureRateThreshold(100)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(10)
                .build());
        Retry retry = Retry.of("test-retry", RetryConfig.custom().maxAttempts(1).build());

        adapter = new S3StorageBackendAdapter(s3Client, properties, circuitBreaker, retry);

        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenReturn(HeadObjectResponse.builder().contentLength(2048L).build());
    }

    @Test
    void transition_ShouldCopyObjectInPlaceWithTargetStorageClass() {
        // Given
        when(s3Client.copyObject(any(CopyObjectRequest.class))).thenReturn(CopyObjectResponse.builder().build());

        // When & Then
        StepVerifier.create(adapter.transition("item-1", StorageTier.COLD))
                .assertNext(result -> {
                    assertThat(result.isSuccess()).isTrue();
                    assertThat(result.getSizeBytes()).isEqualTo(2048L);
                })
                .verifyComplete();

        ArgumentCaptor<CopyObjectRequest> captor = ArgumentCaptor.forClass(CopyObjectRequest.class);
        verify(s3Client).copyObject(captor.capture());
        CopyObjectRequest request = captor.getValue();
        assertThat(request.sourceKey()).isEqualTo("retention/item-1");
        assertThat(request.destinationKey()).isEqualTo("retention/item-1");
        assertThat(request.destinationBucket()).isEqualTo(TEST_BUCKET);
        assertThat(request.storageClass()).isEqualTo(StorageClass.GLACIER_IR);
    }

    @Test
    void storageClassFor_ShouldMapEveryTier() {
        assertThat(S3StorageBackendAdapter.storageClassFor(StorageTier.HOT)).isEqualTo(StorageClass.STANDARD);
        assertThat(S3StorageBackendAdapter.storageClassFor(StorageTier.WARM)).isEqualTo(StorageClass.STANDARD_IA);
        assertThat(S3StorageBackendAdapter.storageClassFor(StorageTier.COLD)).isEqualTo(StorageClass.GLACIER_IR);
        assertThat(S3StorageBackendAdapter.storageClassFor(StorageTier.ARCHIVE)).isEqualTo(StorageClass.DEEP_ARCHIVE);
    }

    @Test
    void delete_ShouldDeleteObjectAndReportSize() {
        // Given
        when(s3Client.deleteObject(any(DeleteObjectRequest.class))).thenReturn(DeleteObjectResponse.builder().build());

        // When & Then
        StepVerifier.create(adapter.delete("item-2"))
                .assertNext(result -> assertThat(result.getSizeBytes()).isEqualTo(2048L))
                .verifyComplete();

        ArgumentCaptor<DeleteObjectRequest> captor = ArgumentCaptor.forClass(DeleteObjectRequest.class);
        verify(s3Client).deleteObject(captor.capture());
        assertThat(captor.getValue().key()).isEqualTo("retention/item-2");
    }

    @Test
    void delete_ShouldFailWithStorageBackendExceptionWhenObjectIsMissing() {
        // Given
        when(s3Client.headObject(any(HeadObjectRequest.class)))
                .thenThrow(NoSuchKeyException.builder().message("missing").build());

        // When & Then
        StepVerifier.create(adapter.delete("item-3"))
                .expectErrorSatisfies(error -> {
                    assertThat(error).isInstanceOf(StorageBackendException.class);
                    assertThat(((StorageBackendException) error).getDataId()).isEqualTo("item-3");
                })
                .verify();

        verify(s3Client, never()).deleteObject(any(DeleteObjectRequest.class));
    }

    @Test
    void setHeldFlag_ShouldUseObjectLockWhenEnabled() {
        // Given
        properties.setObjectLockEnabled(true);
        when(s3Client.putObjectLegalHold(any(PutObjectLegalHoldRequest.class)))
                .thenReturn(PutObjectLegalHoldResponse.builder().build());

        // When & Then
        StepVerifier.create(adapter.setHeldFlag("item-4", true, "hold-1"))
                .assertNext(result -> assertThat(result.isSuccess()).isTrue())
                .verifyComplete();

        ArgumentCaptor<PutObjectLegalHoldRequest> captor = ArgumentCaptor.forClass(PutObjectLegalHoldRequest.class);
        verify(s3Client).putObjectLegalHold(captor.capture());
        assertThat(captor.getValue().legalHold().status()).isEqualTo(ObjectLockLegalHoldStatus.ON);
    }

    @Test
    void setHeldFlag_ShouldReplaceHoldTagWithoutObjectLock() {
        // Given
        when(s3Client.getObjectTagging(any(GetObjectTaggingRequest.class)))
                .thenReturn(GetObjectTaggingResponse.builder()
                        .tagSet(Tag.builder().key("owner").value("finance").build(),
                                Tag.builder().key("firefly-legal-hold").value("hold-old").build())
                        .build());
        when(s3Client.putObjectTagging(any(PutObjectTaggingRequest.class)))
                .thenReturn(PutObjectTaggingResponse.builder().build());

        // When
        StepVerifier.create(adapter.setHeldFlag("item-5", false, "hold-old"))
                .expectNextCount(1)
                .verifyComplete();

        // Then
        ArgumentCaptor<PutObjectTaggingRequest> captor = ArgumentCaptor.forClass(PutObjectTaggingRequest.class);
        verify(s3Client).putObjectTagging(captor.capture());
        assertThat(captor.getValue().tagging().tagSet())
                .extracting(Tag::key)
                .containsExactly("owner");
        verify(s3Client, never()).putObjectLegalHold(any(PutObjectLegalHoldRequest.class));
    }

    @Test
    void getAdapterName_ShouldNameTheAdapter() {
        assertThat(adapter.getAdapterName()).isEqualTo("S3StorageBackendAdapter");
    }
}
