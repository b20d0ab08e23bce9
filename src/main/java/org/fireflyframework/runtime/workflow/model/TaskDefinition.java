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
import java.util.Map;
import java.util.Objects;

/**
 * Static definition of a task within a workflow template.
 *
 * @param id task identifier, unique within the template
 * @param name task type
 * @param title human readable title
 * @param config task configuration
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskDefinition(
        String id,
        String name,
        String title,
        Map<String, Object> config
) {

    public TaskDefinition {
        Objects.requireNonNull(id, "id cannot be null");
        config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static TaskDefinition of(String id, String name) {
        return new TaskDefinition(id, name, null, Map.of());
    }
}
