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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Data needed to start tracking a workflow execution.
 *
 * @param template the template the execution runs
 * @param executionId execution identifier
 * @param organization owning organization, null for the default one
 * @param metadata caller supplied fields; only allow-listed keys are kept
 */
public record WorkflowStart(
        TemplateSnapshot template,
        String executionId,
        String organization,
        Map<String, Object> metadata
) {

    public WorkflowStart {
        Objects.requireNonNull(template, "template cannot be null");
        Objects.requireNonNull(executionId, "executionId cannot be null");
        metadata = metadata != null ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata)) : Map.of();
    }
}
