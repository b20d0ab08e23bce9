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
import java.util.Objects;

/**
 * Execution state of a single task, as reported by the engine.
 *
 * @param id task identifier, matching a {@link TaskDefinition#id()}
 * @param status task status
 * @param start start time, may be null
 * @param end end time, may be null
 * @param inputs task inputs, may be null
 * @param outputs task outputs, may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskExecution(
        String id,
        TaskStatus status,
        Instant start,
        Instant end,
        Map<String, Object> inputs,
        Map<String, Object> outputs
) {

    public TaskExecution {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
    }

    public static TaskExecution running(String id, Instant start, Map<String, Object> inputs) {
        return new TaskExecution(id, TaskStatus.RUNNING, start, null, inputs, null);
    }

    public TaskExecution complete(TaskStatus finalStatus, Instant endTime, Map<String, Object> taskOutputs) {
        return new TaskExecution(id, finalStatus, start, endTime, inputs, taskOutputs);
    }
}
