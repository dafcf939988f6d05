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

import com.firefly.core.retention.config.ResilienceConfiguration;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

/**
 * Auto-configuration for the S3 retention storage backend.
 *
 * <p>Active when {@code firefly.retention.adapter-type=s3} and the AWS SDK is on
 * the classpath. Registers the S3 client, its circuit breaker and retry, and the
 * {@link S3StorageBackendAdapter}, which the adapter registry then picks up.</p>
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(S3Client.class)
@ConditionalOnProperty(name = "firefly.retention.adapter-type", havingValue = "s3")
@EnableConfigurationProperties(S3AdapterProperties.class)
public class S3AdapterAutoConfiguration {

    /**
     * Creates the AWS credentials provider: static credentials when access and
     * secret key are configured, otherwise the default provider chain
     * (environment, system properties, profile file, instance profile).
     *
     * @param properties the S3 adapter properties
     * @return configured AWS credentials provider
     */
    @Bean
    @ConditionalOnMissingBean
    public AwsCredentialsProvider awsCredentialsProvider(S3AdapterProperties properties) {
        if (properties.getAccessKey() != null && properties.getSecretKey() != null) {
            log.info("Using static credentials for S3 retention adapter");
            AwsBasicCredentials credentials = AwsBasicCredentials.create(
                    properties.getAccessKey(),
                    properties.getSecretKey()
            );
            return StaticCredentialsProvider.create(credentials);
        } else {
            log.info("Using default credentials provider chain for S3 retention adapter");
            return DefaultCredentialsProvider.create();
        }
    }

    /**
     * Creates the S3 client with region, credentials, optional custom endpoint,
     * path-style access, timeouts and SDK retry policy.
     *
     * @param properties the S3 adapter properties
     * @param credentialsProvider the AWS credentials provider
     * @return configured S3 client
     */
    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public S3Client s3Client(S3AdapterProperties properties, AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring S3 client for region: {}, bucket: {}",
                properties.getRegion(), properties.getBucketName());

        S3ClientBuilder clientBuilder = S3Client.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(credentialsProvider);

        if (properties.getEndpoint() != null && !properties.getEndpoint().trim().isEmpty()) {
            log.info("Using custom S3 endpoint: {}", properties.getEndpoint());
            clientBuilder.endpointOverride(URI.create(properties.getEndpoint()));
        }

        if (Boolean.TRUE.equals(properties.getPathStyleAccess())) {
            log.info("Enabling path-style access for S3 client");
            clientBuilder.forcePathStyle(true);
        }

        ClientOverrideConfiguration.Builder overrideBuilder = ClientOverrideConfiguration.builder()
                .apiCallTimeout(properties.getConnectionTimeout())
                .apiCallAttemptTimeout(properties.getSocketTimeout());
        if (properties.getMaxRetries() != null) {
            overrideBuilder.retryPolicy(RetryPolicy.builder()
                    .numRetries(properties.getMaxRetries())
                    .build());
        }
        clientBuilder.overrideConfiguration(overrideBuilder.build());

        S3Client s3Client = clientBuilder.build();

        if (Boolean.TRUE.equals(properties.getValidateOnStartup())) {
            validateBucketAccess(s3Client, properties);
        }

        return s3Client;
    }

    @Bean("s3RetentionCircuitBreaker")
    @ConditionalOnMissingBean(name = "s3RetentionCircuitBreaker")
    public CircuitBreaker s3RetentionCircuitBreaker() {
        return ResilienceConfiguration.circuitBreaker("s3-retention");
    }

    /**
     * Retry for S3 calls the SDK marks as retryable (throttling, 5xx, I/O).
     */
    @Bean("s3RetentionRetry")
    @ConditionalOnMissingBean(name = "s3RetentionRetry")
    public Retry s3RetentionRetry() {
        return ResilienceConfiguration.retry("s3-retention", 3,
                error -> error instanceof SdkException && ((SdkException) error).retryable());
    }

    @Bean
    @ConditionalOnMissingBean
    public S3StorageBackendAdapter s3StorageBackendAdapter(S3Client s3Client,
                                                           S3AdapterProperties properties,
                                                           @Qualifier("s3RetentionCircuitBreaker") CircuitBreaker circuitBreaker,
                                                           @Qualifier("s3RetentionRetry") Retry retry) {
        return new S3StorageBackendAdapter(s3Client, properties, circuitBreaker, retry);
    }

    private void validateBucketAccess(S3Client s3Client, S3AdapterProperties properties) {
        try {
            log.info("Validating access to S3 bucket: {}", properties.getBucketName());
            s3Client.headBucket(builder -> builder.bucket(properties.getBucketName()));
            log.info("Successfully validated access to S3 bucket: {}", properties.getBucketName());
        } catch (Exception e) {
            log.error("Failed to validate access to S3 bucket: {}. Please check bucket name, region, and credentials.",
                    properties.getBucketName(), e);
            throw new IllegalStateException("S3 bucket validation failed", e);
        }
    }
}
