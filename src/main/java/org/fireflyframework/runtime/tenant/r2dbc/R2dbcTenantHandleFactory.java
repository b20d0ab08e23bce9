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

import org.fireflyframework.runtime.tenant.TenantHandle;
import org.fireflyframework.runtime.tenant.TenantHandleFactory;
import org.fireflyframework.runtime.workflow.history.r2dbc.R2dbcWorkflowHistoryStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.r2dbc.core.DatabaseClient;

/**
 * Builds tenant handles whose stores live in the tenant's own schema.
 */
@RequiredArgsConstructor
public class R2dbcTenantHandleFactory implements TenantHandleFactory {

    private final DatabaseClient databaseClient;
    private final ObjectMapper objectMapper;

    @Override
    public TenantHandle create(String organization, String databaseName) {
        return new TenantHandle(organization, databaseName,
                new R2dbcWorkflowHistoryStore(databaseClient, objectMapper, databaseName));
    }
}
