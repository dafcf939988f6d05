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
package com.firefly.core.retention.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the retention engine.
 *
 * <p>Example:</p>
 * <pre>
 * firefly:
 *   retention:
 *     adapter-type: s3
 *     executor:
 *       max-retries: 3
 *       tick-interval: 1h
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "firefly.retention")
public class RetentionProperties {

    /**
     * Whether the retention engine is enabled
     */
    private Boolean enabled = true;

    /**
     * Storage adapter type to use (e.g., "s3", "azure-blob")
     */
    private String adapterType;

    /**
     * Executor settings
     */
    @Valid
    private Executor executor = new Executor();

    /**
     * Event bus settings
     */
    @Valid
    private Events events = new Events();

    /**
     * Policy cache settings
     */
    @Valid
    private Cache cache = new Cache();

    /**
     * Report settings
     */
    @Valid
    private Report report = new Report();

    /**
     * Executor configuration
     */
    @Data
    public static class Executor {

        /**
         * Failed attempts after which an entry is marked failed
         */
        @Min(1)
        private Integer maxRetries = 3;

        /**
         * Time between scheduled ticks, also the retry backoff
         */
        @NotNull
        private Duration tickInterval = Duration.ofHours(1);

        /**
         * Whether ticks are triggered on a timer; when false the host calls runTick
         */
        private Boolean schedulingEnabled = false;

        /**
         * Entries processed in parallel within one policy
         */
        @Min(1)
        private Integer concurrency = 50;

        /**
         * Maximum due entries fetched per policy per tick
         */
        @Min(1)
        private Integer batchSize = 100;

        /**
         * Upper bound for one policy's execution
         */
        @NotNull
        private Duration tickTimeout = Duration.ofMinutes(30);
    }

    /**
     * Event bus configuration
     */
    @Data
    public static class Events {

        /**
         * Buffered events per event type before new ones are dropped
         */
        @Min(1)
        private Integer bufferSize = 1024;

        /**
         * Whether events are forwarded to the notification adapter
         */
        private Boolean dispatchEnabled = true;
    }

    /**
     * Policy cache configuration
     */
    @Data
    public static class Cache {
        private Boolean enabled = true;

        @Min(1)
        private Integer maxSize = 500;

        @NotNull
        private Duration expiration = Duration.ofMinutes(30);
    }

    /**
     * Report configuration
     */
    @Data
    public static class Report {

        /**
         * How long an entry may stay overdue before the report flags it
         */
        @NotNull
        private Duration overdueTolerance = Duration.ofDays(1);
    }
}
