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


package org.fireflyframework.runtime.workflow.history;

import org.fireflyframework.runtime.workflow.model.WorkflowReport;
import reactor.core.publisher.Mono;

/**
 * Per-tenant store of finished workflow executions.
 */
public interface WorkflowHistoryStore {

    /**
     * Creates the storage structures and indexes. Safe to call repeatedly.
     *
     * @return completion signal
     */
    Mono<Void> init();

    /**
     * Stores the report of a finished execution.
     *
     * @param report the final report
     * @return completion signal
     */
    Mono<Void> insert(WorkflowReport report);

    /**
     * Finds one finished execution.
     *
     * @param executionId the execution id
     * @param full whether to include the template graph
     * @return the report, or empty if not found
     */
    Mono<WorkflowReport> findOne(String executionId, boolean full);

    /**
     * Lists finished executions.
     *
     * @param query filter and paging options
     * @return the total count and the requested page
     */
    Mono<HistoryPage> find(HistoryQuery query);
}
