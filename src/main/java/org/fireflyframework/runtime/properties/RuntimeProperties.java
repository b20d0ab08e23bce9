/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.runtime.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the workflow runtime reliability layer.
 */
@ConfigurationProperties(prefix = "firefly.runtime")
@Validated
@Data
public class RuntimeProperties {

    /**
     * Whether the runtime layer is enabled.
     */
    private boolean enabled = true;

    /**
     * Whether to register the actuator health indicator.
     */
    private boolean healthIndicatorEnabled = true;

    /**
     * Bus event persistence configuration.
     */
    @Valid
    @NotNull
    private PersistenceConfig persistence = new PersistenceConfig();

    /**
     * Per-tenant storage configuration.
     */
    @Valid
    @NotNull
    private TenantConfig tenants = new TenantConfig();

    /**
     * Live subscriber configuration.
     */
    @Valid
    @NotNull
    private LiveConfig live = new LiveConfig();

    /**
     * Bus event persistence configuration.
     */
    @Data
    public static class PersistenceConfig {

        /**
         * Whether bus event persistence is enabled.
         */
        private boolean enabled = true;

        /**
         * Whether to use the R2DBC durable backend when a DatabaseClient is available.
         * When disabled, events are only buffered in memory.
         */
        private boolean backendEnabled = true;

        /**
         * Maximum number of events kept in memory while the backend is unreachable.
         */
        @Min(1)
        private int capacity = 1000;

        /**
         * How long a buffered event is kept before it is dropped.
         */
        @NotNull
        private Duration memoryTtl = Duration.ofHours(24);

        /**
         * Interval between two attempts to drain the buffer into the backend.
         */
        @NotNull
        private Duration drainInterval = Duration.ofSeconds(5);

        /**
         * Maximum time a health probe may take before the backend is considered down.
         */
        @NotNull
        private Duration pingTimeout = Duration.ofSeconds(5);

        /**
         * Maximum time to wait for the final drain on shutdown.
         */
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        /**
         * Database schema holding the bus event table.
         */
        @NotBlank
        private String schema = "bus";

        /**
         * Table holding bus events.
         */
        @NotBlank
        private String table = "bus_events";
    }

    /**
     * Per-tenant storage configuration.
     */
    @Data
    public static class TenantConfig {

        /**
         * Prefix identifying tenant databases in the store catalog.
         */
        @NotBlank
        private String databasePrefix = "org-";

        /**
         * Organization used when none is given.
         */
        @NotBlank
        private String defaultOrganization = "default";

        /**
         * Maximum time a tenant store health probe may take.
         */
        @NotNull
        private Duration pingTimeout = Duration.ofSeconds(5);

        /**
         * Maximum time to wait for pending workflow history writes on shutdown.
         */
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    /**
     * Live subscriber configuration.
     */
    @Data
    public static class LiveConfig {

        /**
         * Whether to expose the WebSocket endpoint for live workflow updates.
         */
        private boolean enabled = true;

        /**
         * Path of the WebSocket endpoint.
         */
        @NotBlank
        private String path = "/ws/workflows";

        /**
         * Request header carrying the subscriber's organization.
         */
        @NotBlank
        private String organizationHeader = "X-Organization";
    }
}
