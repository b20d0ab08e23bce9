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

import org.fireflyframework.runtime.workflow.history.WorkflowHistoryStore;
import reactor.core.publisher.Mono;

/**
 * Storage handle of one organization.
 *
 * @param organization the organization
 * @param databaseName the tenant database (or schema) name
 * @param history the organization's workflow history
 */
public record TenantHandle(String organization, String databaseName, WorkflowHistoryStore history) {

    /**
     * Runs the one-time setup of every store of the tenant.
     */
    public Mono<Void> init() {
        return history.init();
    }
}
