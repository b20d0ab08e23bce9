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


package org.fireflyframework.runtime.tenant;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Lazily creates and caches one {@link TenantHandle} per organization.
 * <p>
 * The first caller for an organization checks the store, builds the handle
 * and runs its initialization; concurrent callers share that same attempt, so
 * initialization runs once per organization. A failed attempt is dropped from
 * the cache and surfaced to the callers that shared it.
 */
@Slf4j
public class TenantStoreRegistry {

    private final StoreCatalog catalog;
    private final TenantHandleFactory handleFactory;
    private final OrganizationNames names;
    private final Duration pingTimeout;

    private final Map<String, Mono<TenantHandle>> handles = new ConcurrentHashMap<>();

    public TenantStoreRegistry(StoreCatalog catalog,
                               TenantHandleFactory handleFactory,
                               OrganizationNames names,
                               Duration pingTimeout) {
        this.catalog = catalog;
        this.handleFactory = handleFactory;
        this.names = names;
        this.pingTimeout = pingTimeout;
    }

    /**
     * Returns the handle of an organization, creating and initializing it on first use.
     *
     * @param organization the organization, null for the default one
     * @return the ready handle, or {@link TenantInitFailedException}
     */
    public Mono<TenantHandle> getOrCreate(String organization) {
        return Mono.defer(() -> {
            String org;
            try {
                org = names.normalize(organization);
            } catch (IllegalArgumentException e) {
                return Mono.error(new TenantInitFailedException(String.valueOf(organization), e));
            }
            String databaseName = names.databaseName(org);

            Mono<TenantHandle> existing = handles.get(databaseName);
            if (existing != null) {
                return existing;
            }
            return reachable().flatMap(up -> {
                if (!up) {
                    return Mono.error(new TenantInitFailedException(org, "store unreachable"));
                }
                return handles.computeIfAbsent(databaseName, name -> initialize(org, name));
            });
        });
    }

    /**
     * Runs {@code work} with the ready handle of an organization. The store is
     * health-checked on every call, even when the handle is cached.
     *
     * @param organization the organization, null for the default one
     * @param work the work to run
     * @return the result of the work
     */
    public <T> Mono<T> scopedAccess(String organization, Function<TenantHandle, Mono<T>> work) {
        return reachable()
                .flatMap(up -> up
                        ? getOrCreate(organization)
                        : Mono.error(new TenantStoreException("Tenant store unreachable")))
                .flatMap(work);
    }

    /**
     * Lists the organizations that have a database in the store.
     *
     * @return organization names, prefix stripped
     */
    public Flux<String> listOrganizations() {
        return catalog.listDatabases()
                .filter(names::isTenantDatabase)
                .map(names::organizationOf)
                .onErrorMap(error -> !(error instanceof TenantStoreException),
                        error -> new TenantStoreException("Could not list tenant databases", error));
    }

    /**
     * Returns the number of handles that are cached, including ones still initializing.
     */
    public int cachedCount() {
        return handles.size();
    }

    private Mono<TenantHandle> initialize(String organization, String databaseName) {
        log.info("Setting up tenant storage for organization '{}' in '{}'", organization, databaseName);
        return Mono.defer(() -> {
                    TenantHandle handle = handleFactory.create(organization, databaseName);
                    return handle.init().thenReturn(handle);
                })
                .doOnSuccess(handle -> log.info("TENANT_READY: organization={}, database={}", organization, databaseName))
                .onErrorMap(error -> !(error instanceof TenantInitFailedException),
                        error -> new TenantInitFailedException(organization, error))
                .doOnError(error -> {
                    handles.remove(databaseName);
                    log.warn("Tenant storage setup failed for organization '{}': {}", organization, error.getMessage());
                })
                .cache();
    }

    private Mono<Boolean> reachable() {
        return catalog.ping()
                .timeout(pingTimeout)
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    log.debug("Tenant store health probe failed: {}", error.toString());
                    return Mono.just(false);
                });
    }
}
