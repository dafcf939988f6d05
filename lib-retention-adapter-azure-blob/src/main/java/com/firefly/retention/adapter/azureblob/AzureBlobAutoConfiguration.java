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

import com.azure.core.credential.TokenCredential;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.models.BlobStorageException;
import com.azure.storage.common.StorageSharedKeyCredential;
import com.azure.storage.common.policy.RequestRetryOptions;
import com.azure.storage.common.policy.RetryPolicyType;
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

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Auto-configuration for the Azure Blob retention storage backend.
 *
 * <p>Active when {@code firefly.retention.adapter-type=azure-blob} and the Azure
 * Storage SDK is on the classpath.</p>
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass({BlobServiceClient.class, BlobContainerClient.class})
@ConditionalOnProperty(name = "firefly.retention.adapter-type", havingValue = "azure-blob")
@EnableConfigurationProperties(AzureBlobAdapterProperties.class)
public class AzureBlobAutoConfiguration {

    /**
     * Creates the blob service client using the first configured authentication
     * method.
     *
     * @param properties the adapter properties
     * @return configured service client
     * @throws IllegalArgumentException if no authentication method is configured
     */
    @Bean
    @ConditionalOnMissingBean
    public BlobServiceClient blobServiceClient(AzureBlobAdapterProperties properties) {
        BlobServiceClientBuilder builder = new BlobServiceClientBuilder();

        if (properties.getEndpoint() != null) {
            builder.endpoint(properties.getEndpoint());
        } else {
            builder.endpoint(String.format("https://%s.blob.core.windows.net", properties.getAccountName()));
        }

        if (properties.getConnectionString() != null) {
            log.info("Configuring Azure Blob Storage with connection string authentication");
            builder.connectionString(properties.getConnectionString());
        } else if (properties.getAccountKey() != null) {
            log.info("Configuring Azure Blob Storage with account key authentication");
            StorageSharedKeyCredential credential = new StorageSharedKeyCredential(
                properties.getAccountName(), properties.getAccountKey());
            builder.credential(credential);
        } else if (properties.getSasToken() != null) {
            log.info("Configuring Azure Blob Storage with SAS token authentication");
            builder.sasToken(properties.getSasToken());
        } else if (Boolean.TRUE.equals(properties.getManagedIdentity())) {
            log.info("Configuring Azure Blob Storage with managed identity authentication");
            TokenCredential credential = new DefaultAzureCredentialBuilder().build();
            builder.credential(credential);
        } else {
            throw new IllegalArgumentException(
                "Azure Blob Storage authentication not configured. Please provide one of: " +
                "connection-string, account-key, sas-token, or enable managed-identity");
        }

        builder.retryOptions(new RequestRetryOptions(RetryPolicyType.EXPONENTIAL, properties.getMaxRetries(),
                Duration.ofSeconds(properties.getTimeoutSeconds()), null, null, null));

        BlobServiceClient client = builder.buildClient();
        log.info("Azure Blob Service Client configured for account: {}", properties.getAccountName());
        return client;
    }

    /**
     * Container client for the retained data. The container must already exist;
     * the engine never creates storage for data it is meant to govern.
     */
    @Bean
    @ConditionalOnMissingBean
    public BlobContainerClient blobContainerClient(BlobServiceClient blobServiceClient,
                                                   AzureBlobAdapterProperties properties) {
        BlobContainerClient containerClient = blobServiceClient.getBlobContainerClient(properties.getContainerName());
        if (Boolean.TRUE.equals(properties.getValidateOnStartup()) && !containerClient.exists()) {
            throw new IllegalStateException("Azure Blob container does not exist: " + properties.getContainerName());
        }
        log.info("Azure Blob Container Client configured for container: {}", properties.getContainerName());
        return containerClient;
    }

    @Bean("azureBlobRetentionCircuitBreaker")
    @ConditionalOnMissingBean(name = "azureBlobRetentionCircuitBreaker")
    public CircuitBreaker azureBlobRetentionCircuitBreaker() {
        CircuitBreaker circuitBreaker = ResilienceConfiguration.circuitBreaker("azureBlobRetention");
        log.info("Azure Blob retention circuit breaker configured");
        return circuitBreaker;
    }

    @Bean("azureBlobRetentionRetry")
    @ConditionalOnMissingBean(name = "azureBlobRetentionRetry")
    public Retry azureBlobRetentionRetry(AzureBlobAdapterProperties properties) {
        Retry retry = ResilienceConfiguration.retry("azureBlobRetention", properties.getMaxRetries(),
                AzureBlobAutoConfiguration::isRetryable);
        log.info("Azure Blob retention retry configured with {} max attempts", properties.getMaxRetries());
        return retry;
    }

    @Bean
    @ConditionalOnMissingBean
    public AzureBlobStorageBackendAdapter azureBlobStorageBackendAdapter(
            BlobContainerClient containerClient,
            AzureBlobAdapterProperties properties,
            @Qualifier("azureBlobRetentionCircuitBreaker") CircuitBreaker circuitBreaker,
            @Qualifier("azureBlobRetentionRetry") Retry retry) {
        log.info("Creating Azure Blob retention storage backend");
        return new AzureBlobStorageBackendAdapter(containerClient, properties, circuitBreaker, retry);
    }

    /**
     * Throttling, server errors and timeouts are retried; client errors such as a
     * missing blob are not.
     */
    static boolean isRetryable(Throwable throwable) {
        if (throwable instanceof BlobStorageException) {
            int status = ((BlobStorageException) throwable).getStatusCode();
            return status == 408 || status == 429 || status >= 500;
        }
        return throwable instanceof TimeoutException;
    }
}
