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
import org.fireflyframework.runtime.workflow.model.TemplateSnapshot;
import org.fireflyframework.runtime.workflow.model.WorkflowInstanceRecord;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Message pushed to live subscribers for every lifecycle event of an execution.
 * <p>
 * Only {@link ExecutionState#BEGIN} updates carry the template; later updates
 * carry the delta only.
 *
 * @param type the lifecycle state reported
 * @param data event content
 * @param task task delta, may be null
 * @param source execution the update is about
 * @param timestamp time the update was built
 * @param template full template, begin only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowUpdate(
        ExecutionState type,
        Map<String, Object> data,
        TaskExecution task,
        Source source,
        Instant timestamp,
        TemplateSnapshot template
) {

    /**
     * Identifies the execution an update is about.
     *
     * @param executionId execution identifier
     * @param templateId template identifier
     * @param templateVersion template version
     * @param requester requester of the execution, may be null
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Source(String executionId, String templateId, int templateVersion, String requester) {
    }

    /**
     * Builds the update for an engine event applied to a record.
     *
     * @param record the record the event was applied to
     * @param event the engine event
     * @param timestamp time the update is built
     * @return the update
     */
    public static WorkflowUpdate of(WorkflowInstanceRecord record, EngineEvent event, Instant timestamp) {
        Source source = new Source(
                record.executionId(),
                record.template().id(),
                record.template().version(),
                record.requester());
        TemplateSnapshot template = event.type() == ExecutionState.BEGIN ? record.template() : null;
        return new WorkflowUpdate(event.type(), event.content(), event.task(), source, timestamp, template);
    }
}
