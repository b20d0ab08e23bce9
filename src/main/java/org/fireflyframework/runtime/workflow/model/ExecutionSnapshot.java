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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable view of a workflow execution at a point in time.
 * <p>
 * Every engine event produces a new snapshot; task states are kept in the
 * order the engine first reported them.
 *
 * @param executionId execution identifier
 * @param state overall state
 * @param start time the execution began
 * @param end time the execution reached a terminal state, null until then
 * @param tasks task states by task id
 */
public record ExecutionSnapshot(
        String executionId,
        ExecutionState state,
        Instant start,
        Instant end,
        Map<String, TaskExecution> tasks
) {

    public ExecutionSnapshot {
        Objects.requireNonNull(executionId, "executionId cannot be null");
        Objects.requireNonNull(state, "state cannot be null");
        tasks = tasks != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(tasks))
                : Map.of();
    }

    public static ExecutionSnapshot begin(String executionId, Instant start) {
        return new ExecutionSnapshot(executionId, ExecutionState.BEGIN, start, null, Map.of());
    }

    /**
     * Creates a copy in the given state. Terminal states also set the end time.
     *
     * @param newState the new state
     * @param timestamp time of the transition
     * @return updated snapshot
     */
    public ExecutionSnapshot withState(ExecutionState newState, Instant timestamp) {
        Instant newEnd = newState.isTerminal() ? timestamp : end;
        return new ExecutionSnapshot(executionId, newState, start, newEnd, tasks);
    }

    /**
     * Creates a copy where the given task state replaces any previous state of that task.
     *
     * @param task the task state
     * @return updated snapshot
     */
    public ExecutionSnapshot withTask(TaskExecution task) {
        Map<String, TaskExecution> updated = new LinkedHashMap<>(tasks);
        updated.put(task.id(), task);
        return new ExecutionSnapshot(executionId, state, start, end, updated);
    }
}
