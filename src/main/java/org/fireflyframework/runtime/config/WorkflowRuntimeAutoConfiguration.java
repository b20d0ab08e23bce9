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


package org.fireflyframework.runtime.config;

import org.fireflyframework.runtime.bus.persistence.BusPersistenceCoordinator;
import org.fireflyframework.runtime.bus.persistence.DurableEventStore;
import org.fireflyframework.runtime.bus.persistence.r2dbc.R2dbcDurableEventStore;
import org.fireflyframework.runtime.fault.FaultHandler;
import org.fireflyframework.runtime.fault.LoggingFaultHandler;
import org.fireflyframework.runtime.health.RuntimeHealthIndicator;
import org.fireflyframework.runtime.live.LiveSubscriberRegistry;
import org.fireflyframework.runtime.metrics.RuntimeMetrics;
import org.fireflyframework.runtime.properties.RuntimeProperties;
import org.fireflyframework.runtime.tenant.OrganizationNames;
import org.fireflyframework.runtime.tenant.StoreCatalog;
import org.fireflyframework.runtime.tenant.TenantHandleFactory;
import org.fireflyframework.runtime.tenant.TenantStoreRegistry;
import org.fireflyframework.runtime.tenant.r2dbc.R2dbcStoreCatalog;
import org.fireflyframework.runtime.tenant.r2dbc.R2dbcTenantHandleFactory;
import org.fireflyframework.runtime.workflow.WorkflowRuntimeRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.lang.Nullable;
import org.springframework.r2dbc.core.DatabaseClient;

import java.time.Clock;

/**
 * Auto-configuration for the Firefly workflow runtime layer.
 * <p>
 * This configuration provides:
 * <ul>
 *   <li>BusPersistenceCoordinator - durable bus events with in-memory fallback</li>
 *   <li>TenantStoreRegistry - per-organization storage handles (requires a DatabaseClient)</li>
 *   <li>WorkflowRuntimeRegistry - live workflow executions, history and live updates</li>
 *   <li>RuntimeHealthIndicator - health monitoring</li>
 * </ul>
 * Without a DatabaseClient, bus events are kept in memory only and workflow
 * tracking is not available.
 */
@Slf4j
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.autoconfigure.data.r2dbc.R2dbcDataAutoConfiguration",
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
@EnableConfigurationProperties(RuntimeProperties.class)
@ConditionalOnProperty(prefix = "firefly.runtime", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowRuntimeAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MeterRegistry.class)
    public RuntimeMetrics runtimeMetrics(MeterRegistry meterRegistry) {
        return new RuntimeMetrics(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public FaultHandler runtimeFaultHandler(@Nullable RuntimeMetrics metrics) {
        return new LoggingFaultHandler(metrics);
    }

    // ==================== Bus Persistence ====================

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    @ConditionalOnProperty(prefix = "firefly.runtime.persistence", name = "backend-enabled", havingValue = "true", matchIfMissing = true)
    public DurableEventStore durableEventStore(DatabaseClient databaseClient, RuntimeProperties properties) {
        RuntimeProperties.PersistenceConfig config = properties.getPersistence();
        log.info("Creating R2dbcDurableEventStore on {}.{}", config.getSchema(), config.getTable());
        return new R2dbcDurableEventStore(databaseClient, config.getSchema(), config.getTable());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "firefly.runtime.persistence", name = "enabled", havingValue = "true", matchIfMissing = true)
    public BusPersistenceCoordinator busPersistenceCoordinator(
            @Nullable DurableEventStore durableEventStore,
            RuntimeProperties properties,
            FaultHandler faultHandler,
            @Nullable RuntimeMetrics metrics) {
        log.info("Creating BusPersistenceCoordinator with capacity: {}, memoryTtl: {}",
                properties.getPersistence().getCapacity(), properties.getPersistence().getMemoryTtl());
        return new BusPersistenceCoordinator(durableEventStore, properties.getPersistence(), faultHandler, metrics);
    }

    // ==================== Tenants ====================

    @Bean
    @ConditionalOnMissingBean
    public OrganizationNames organizationNames(RuntimeProperties properties) {
        return new OrganizationNames(
                properties.getTenants().getDatabasePrefix(),
                properties.getTenants().getDefaultOrganization());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public StoreCatalog storeCatalog(DatabaseClient databaseClient) {
        return new R2dbcStoreCatalog(databaseClient);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(DatabaseClient.class)
    public TenantHandleFactory tenantHandleFactory(DatabaseClient databaseClient,
                                                   ObjectProvider<ObjectMapper> objectMapper) {
        return new R2dbcTenantHandleFactory(databaseClient, objectMapper.getIfAvailable(this::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({StoreCatalog.class, TenantHandleFactory.class})
    public TenantStoreRegistry tenantStoreRegistry(StoreCatalog storeCatalog,
                                                   TenantHandleFactory tenantHandleFactory,
                                                   OrganizationNames organizationNames,
                                                   RuntimeProperties properties) {
        log.info("Creating TenantStoreRegistry with database prefix: {}", properties.getTenants().getDatabasePrefix());
        return new TenantStoreRegistry(storeCatalog, tenantHandleFactory, organizationNames,
                properties.getTenants().getPingTimeout());
    }

    // ==================== Workflow Runtime ====================

    @Bean
    @ConditionalOnMissingBean
    public LiveSubscriberRegistry liveSubscriberRegistry(ObjectProvider<ObjectMapper> objectMapper) {
        return new LiveSubscriberRegistry(objectMapper.getIfAvailable(this::defaultObjectMapper));
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TenantStoreRegistry.class)
    public WorkflowRuntimeRegistry workflowRuntimeRegistry(TenantStoreRegistry tenantStoreRegistry,
                                                           LiveSubscriberRegistry liveSubscriberRegistry,
                                                           OrganizationNames organizationNames,
                                                           FaultHandler faultHandler,
                                                           @Nullable RuntimeMetrics metrics,
                                                           RuntimeProperties properties) {
        log.info("Creating WorkflowRuntimeRegistry");
        return new WorkflowRuntimeRegistry(tenantStoreRegistry, liveSubscriberRegistry, organizationNames,
                faultHandler, metrics, Clock.systemUTC(), properties.getTenants().getShutdownTimeout());
    }

    /**
     * Health indicator for runtime layer monitoring.
     */
    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({BusPersistenceCoordinator.class, WorkflowRuntimeRegistry.class})
    @ConditionalOnProperty(prefix = "firefly.runtime", name = "health-indicator-enabled", havingValue = "true", matchIfMissing = true)
    public RuntimeHealthIndicator runtimeHealthIndicator(BusPersistenceCoordinator coordinator,
                                                         WorkflowRuntimeRegistry workflowRuntimeRegistry,
                                                         LiveSubscriberRegistry liveSubscriberRegistry) {
        return new RuntimeHealthIndicator(coordinator, workflowRuntimeRegistry, liveSubscriberRegistry);
    }

    private ObjectMapper defaultObjectMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }
}
