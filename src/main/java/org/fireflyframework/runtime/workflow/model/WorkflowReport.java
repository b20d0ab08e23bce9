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


package org.fireflyframework.runtime.workflow.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Merged view of a workflow execution and its template.
 * <p>
 * This is both the document pushed to live subscribers on connect and the
 * document stored in the tenant's history when the execution finishes.
 *
 * @param id execution identifier
 * @param organization owning organization
 * @param requester who requested the execution, may be null
 * @param track caller supplied tracking data, may be null
 * @param state overall execution state
 * @param start execution start
 * @param end execution end, null while running
 * @param template template the execution runs
 * @param tasks one entry per task, template order first
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowReport(
        String id,
        String organization,
        String requester,
        Object track,
        ExecutionState state,
        Instant start,
        Instant end,
        TemplateSnapshot template,
        List<TaskReport> tasks
) {

    public WorkflowReport {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }

    public WorkflowReport withTemplate(TemplateSnapshot newTemplate) {
        return new WorkflowReport(id, organization, requester, track, state, start, end, newTemplate, tasks);
    }

    public WorkflowReport withTasks(List<TaskReport> newTasks) {
        return new WorkflowReport(id, organization, requester, track, state, start, end, template, newTasks);
    }

    public WorkflowReport withTrack(Object newTrack) {
        return new WorkflowReport(id, organization, requester, newTrack, state, start, end, template, tasks);
    }
}
