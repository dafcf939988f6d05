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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Configuration properties for the Azure Blob retention storage backend.
 *
 * <p>Exactly one authentication method is used, checked in this order:
 * connection string, account key, SAS token, managed identity.</p>
 *
 * <p>Example configuration:</p>
 * <pre>
 * firefly:
 *   retention:
 *     adapter-type: azure-blob
 *     adapter:
 *       azure-blob:
 *         account-name: mystorageaccount
 *         container-name: retained-data
 *         managed-identity: true
 *         immutable-storage-enabled: true
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "firefly.retention.adapter.azure-blob")
public class AzureBlobAdapterProperties {

    /**
     * Storage account name.
     * Environment variable: FIREFLY_RETENTION_ADAPTER_AZURE_BLOB_ACCOUNT_NAME
     */
    @NotBlank(message = "Azure Storage account name is required")
    private String accountName;

    /**
     * Container holding the retained blobs.
     * Environment variable: FIREFLY_RETENTION_ADAPTER_AZURE_BLOB_CONTAINER_NAME
     */
    @NotBlank(message = "Azure Blob container name is required")
    private String containerName;

    private String accountKey;

    private String connectionString;

    private String sasToken;

    private Boolean managedIdentity = false;

    /**
     * Custom endpoint; defaults to https://{account-name}.blob.core.windows.net
     */
    private String endpoint;

    /**
     * Prefix prepended to data IDs to form blob names
     */
    private String pathPrefix = "";

    /**
     * Whether the container has version-level immutability; legal holds then use
     * the blob legal hold, otherwise a metadata entry
     */
    private Boolean immutableStorageEnabled = false;

    /**
     * Metadata key marking held blobs when immutable storage is not available
     */
    @NotBlank
    private String legalHoldMetadataKey = "fireflylegalhold";

    @Min(value = 1, message = "Max retries must be at least 1")
    @Max(value = 10, message = "Max retries must not exceed 10")
    private Integer maxRetries = 3;

    @Min(value = 1, message = "Timeout must be at least 1 second")
    @Max(value = 300, message = "Timeout must not exceed 300 seconds")
    private Integer timeoutSeconds = 30;

    /**
     * Whether the container's existence is checked when the client is created
     */
    private Boolean validateOnStartup = true;
}
