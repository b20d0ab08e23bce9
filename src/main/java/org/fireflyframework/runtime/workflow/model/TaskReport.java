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
import java.util.Map;

/**
 * One task entry of a {@link WorkflowReport}: the static template fields of
 * the task combined with its execution state, when it has one.
 *
 * @param id task identifier
 * @param name task type, from the template
 * @param title task title, from the template
 * @param config task configuration, from the template
 * @param status execution status, null if the task never ran
 * @param start execution start, may be null
 * @param end execution end, may be null
 * @param inputs execution inputs, may be null
 * @param outputs execution outputs, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskReport(
        String id,
        String name,
        String title,
        Map<String, Object> config,
        TaskStatus status,
        Instant start,
        Instant end,
        Map<String, Object> inputs,
        Map<String, Object> outputs
) {

    /**
     * Creates an entry carrying only the static fields of a task that never ran.
     */
    public static TaskReport of(TaskDefinition definition) {
        return new TaskReport(definition.id(), definition.name(), definition.title(), definition.config(),
                null, null, null, null, null);
    }

    /**
     * Creates an entry combining a task definition with its execution state.
     * Either side may be null, but not both.
     */
    public static TaskReport merge(TaskDefinition definition, TaskExecution execution) {
        if (execution == null) {
            return of(definition);
        }
        if (definition == null) {
            return new TaskReport(execution.id(), null, null, null, execution.status(),
                    execution.start(), execution.end(), execution.inputs(), execution.outputs());
        }
        return new TaskReport(definition.id(), definition.name(), definition.title(), definition.config(),
                execution.status(), execution.start(), execution.end(), execution.inputs(), execution.outputs());
    }

    public TaskReport withData(Map<String, Object> newConfig, Map<String, Object> newInputs,
                               Map<String, Object> newOutputs) {
        return new TaskReport(id, name, title, newConfig, status, start, end, newInputs, newOutputs);
    }
}
