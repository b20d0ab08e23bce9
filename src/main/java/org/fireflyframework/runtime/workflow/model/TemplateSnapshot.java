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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable copy of the workflow template an execution was started from.
 *
 * @param id template identifier
 * @param version template version
 * @param title template title
 * @param state publication state
 * @param tasks task definitions, in template order
 * @param graph template graph (task links and topics), may be null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TemplateSnapshot(
        String id,
        int version,
        String title,
        TemplateState state,
        List<TaskDefinition> tasks,
        Map<String, Object> graph
) {

    public TemplateSnapshot {
        Objects.requireNonNull(id, "id cannot be null");
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
        graph = graph != null ? Collections.unmodifiableMap(new LinkedHashMap<>(graph)) : null;
    }

    /**
     * Creates a copy without the template graph.
     *
     * @return a lighter snapshot, used for listings
     */
    public TemplateSnapshot withoutGraph() {
        return new TemplateSnapshot(id, version, title, state, tasks, null);
    }
}
