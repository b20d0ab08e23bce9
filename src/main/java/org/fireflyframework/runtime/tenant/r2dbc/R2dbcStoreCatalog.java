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


package org.fireflyframework.runtime.tenant.r2dbc;

import org.fireflyframework.runtime.tenant.StoreCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * {@link StoreCatalog} over an R2DBC connection, where each tenant is a schema.
 */
@RequiredArgsConstructor
public class R2dbcStoreCatalog implements StoreCatalog {

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Boolean> ping() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .map(row -> true)
                .defaultIfEmpty(true);
    }

    @Override
    public Flux<String> listDatabases() {
        return databaseClient.sql("SELECT schema_name FROM information_schema.schemata ORDER BY schema_name")
                .map(row -> row.get("schema_name", String.class))
                .all();
    }
}
