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
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Live record of a running workflow execution: its template, its latest
 * execution snapshot and the caller metadata kept for reporting.
 * <p>
 * The template is never modified. Each state change replaces the execution
 * snapshot, so a report built concurrently sees either the previous or the
 * next snapshot, never a mix.
 */
public class WorkflowInstanceRecord {

    /**
     * Caller metadata keys copied into reports; anything else is discarded.
     */
    public static final Set<String> ALLOWED_METADATA_KEYS = Set.of("requester", "track");

    private final TemplateSnapshot template;
    private final String organization;
    private final Map<String, Object> metadata;
    private final AtomicBoolean finalizing = new AtomicBoolean(false);
    private volatile ExecutionSnapshot execution;

    public WorkflowInstanceRecord(TemplateSnapshot template, String executionId, String organization,
                                  Map<String, Object> metadata, Instant start) {
        this.template = template;
        this.organization = organization;
        this.execution = ExecutionSnapshot.begin(executionId, start);

        Map<String, Object> allowed = new LinkedHashMap<>();
        if (metadata != null) {
            metadata.forEach((key, value) -> {
                if (ALLOWED_METADATA_KEYS.contains(key)) {
                    allowed.put(key, value);
                }
            });
        }
        this.metadata = Collections.unmodifiableMap(allowed);
    }

    public static WorkflowInstanceRecord from(WorkflowStart start, String organization, Instant startTime) {
        return new WorkflowInstanceRecord(start.template(), start.executionId(), organization,
                start.metadata(), startTime);
    }

    public String executionId() {
        return execution.executionId();
    }

    public String organization() {
        return organization;
    }

    public TemplateSnapshot template() {
        return template;
    }

    public ExecutionSnapshot execution() {
        return execution;
    }

    public Map<String, Object> metadata() {
        return metadata;
    }

    public String requester() {
        Object requester = metadata.get("requester");
        return requester != null ? requester.toString() : null;
    }

    /**
     * Moves the execution to a new state, optionally recording a task delta.
     *
     * @param state the reported state
     * @param task the task delta, may be null
     * @param timestamp time of the event
     */
    public synchronized void apply(ExecutionState state, TaskExecution task, Instant timestamp) {
        ExecutionSnapshot next = execution.withState(state, timestamp);
        if (task != null) {
            next = next.withTask(task);
        }
        execution = next;
    }

    /**
     * Marks the record as being finalized.
     *
     * @return true for the first caller only
     */
    public boolean markFinalizing() {
        return finalizing.compareAndSet(false, true);
    }

    public boolean isFinalizing() {
        return finalizing.get();
    }

    /**
     * Builds the merged report: one entry per task id, template order first,
     * then tasks the engine reported that the template does not define.
     *
     * @return the report
     */
    public WorkflowReport report() {
        ExecutionSnapshot snapshot = execution;
        Map<String, TaskExecution> executed = snapshot.tasks();

        List<TaskReport> tasks = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (TaskDefinition definition : template.tasks()) {
            if (seen.add(definition.id())) {
                tasks.add(TaskReport.merge(definition, executed.get(definition.id())));
            }
        }
        executed.forEach((taskId, taskExecution) -> {
            if (seen.add(taskId)) {
                tasks.add(TaskReport.merge(null, taskExecution));
            }
        });

        return new WorkflowReport(
                snapshot.executionId(),
                organization,
                requester(),
                metadata.get("track"),
                snapshot.state(),
                snapshot.start(),
                snapshot.end(),
                template,
                tasks);
    }
}
