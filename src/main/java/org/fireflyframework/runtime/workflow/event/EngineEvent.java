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


package org.fireflyframework.runtime.workflow.event;

import org.fireflyframework.runtime.workflow.model.ExecutionState;
import org.fireflyframework.runtime.workflow.model.TaskExecution;
import org.fireflyframework.runtime.workflow.model.WorkflowStart;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Lifecycle event emitted by the workflow engine.
 *
 * @param type lifecycle state the event reports
 * @param executionId execution the event refers to
 * @param organization organization reported by the engine, may be null
 * @param content event content
 * @param task task state delta, null when the event is not about a task
 * @param start start data, only present on {@link ExecutionState#BEGIN}
 * @param timestamp time the engine emitted the event
 */
public record EngineEvent(
        ExecutionState type,
        String executionId,
        String organization,
        Map<String, Object> content,
        TaskExecution task,
        WorkflowStart start,
        Instant timestamp
) {

    public EngineEvent {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(executionId, "executionId cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        content = content != null ? Collections.unmodifiableMap(new LinkedHashMap<>(content)) : Map.of();
        if (start != null && type != ExecutionState.BEGIN) {
            throw new IllegalArgumentException("Start data is only allowed on begin events");
        }
    }

    public static EngineEvent begin(WorkflowStart start, Instant timestamp) {
        return new EngineEvent(ExecutionState.BEGIN, start.executionId(), start.organization(),
                Map.of(), null, start, timestamp);
    }

    public static EngineEvent begin(String executionId, Instant timestamp) {
        return new EngineEvent(ExecutionState.BEGIN, executionId, null, Map.of(), null, null, timestamp);
    }

    public static EngineEvent progress(String executionId, TaskExecution task, Instant timestamp) {
        return new EngineEvent(ExecutionState.PROGRESS, executionId, null, Map.of(), task, null, timestamp);
    }

    public static EngineEvent end(String executionId, Instant timestamp) {
        return new EngineEvent(ExecutionState.END, executionId, null, Map.of(), null, null, timestamp);
    }

    public static EngineEvent error(String executionId, Map<String, Object> content, Instant timestamp) {
        return new EngineEvent(ExecutionState.ERROR, executionId, null, content, null, null, timestamp);
    }
}
