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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;

/**
 * Configuration properties for the S3 retention storage backend.
 *
 * <p>Example configuration:</p>
 * <pre>
 * firefly:
 *   retention:
 *     adapter-type: s3
 *     adapter:
 *       s3:
 *         bucket-name: my-retained-data
 *         region: us-east-1
 *         object-lock-enabled: true
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "firefly.retention.adapter.s3")
public class S3AdapterProperties {

    /**
     * Bucket holding the retained objects.
     * Environment variable: FIREFLY_RETENTION_ADAPTER_S3_BUCKET_NAME
     */
    @NotBlank(message = "S3 bucket name is required")
    private String bucketName;

    /**
     * AWS region of the bucket.
     * Environment variable: FIREFLY_RETENTION_ADAPTER_S3_REGION
     */
    @NotBlank(message = "AWS region is required")
    private String region;

    /**
     * Access key; the default credentials chain is used when absent
     */
    private String accessKey;

    private String secretKey;

    /**
     * Custom endpoint for S3-compatible services
     */
    private String endpoint;

    /**
     * Prefix prepended to data IDs to form object keys
     */
    private String pathPrefix = "";

    private Boolean pathStyleAccess = false;

    /**
     * Whether the bucket has S3 Object Lock; legal holds then use object legal
     * hold status, otherwise an object tag
     */
    private Boolean objectLockEnabled = false;

    /**
     * Tag key marking held objects when Object Lock is not available
     */
    @NotBlank
    private String legalHoldTagKey = "firefly-legal-hold";

    @NotNull
    private Duration connectionTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration socketTimeout = Duration.ofSeconds(30);

    /**
     * SDK-level retries per request
     */
    private Integer maxRetries = 3;

    /**
     * Upper bound for one adapter operation including resilience retries
     */
    @NotNull
    private Duration operationTimeout = Duration.ofMinutes(2);

    /**
     * Whether bucket access is checked when the client is created
     */
    private Boolean validateOnStartup = true;
}
