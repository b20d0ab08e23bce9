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


package org.fireflyframework.runtime.workflow.history;

import org.fireflyframework.runtime.workflow.model.TaskDefinition;
import org.fireflyframework.runtime.workflow.model.TaskReport;
import org.fireflyframework.runtime.workflow.model.TemplateSnapshot;
import org.fireflyframework.runtime.workflow.model.WorkflowReport;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replaces values that cannot be stored as a JSON document with a
 * placeholder string before a report is written to history.
 * <p>
 * Kept as-is: maps, collections, strings, numbers, booleans, null and
 * timestamps (recursively for containers). Anything else becomes
 * {@code "Internal server data: <type>"}.
 */
public final class ReportSanitizer {

    static final String PLACEHOLDER_PREFIX = "Internal server data: ";

    private ReportSanitizer() {
    }

    public static WorkflowReport sanitize(WorkflowReport report) {
        List<TaskReport> tasks = report.tasks().stream()
                .map(task -> task.withData(
                        sanitizeMap(task.config()),
                        sanitizeMap(task.inputs()),
                        sanitizeMap(task.outputs())))
                .toList();
        return report
                .withTemplate(sanitize(report.template()))
                .withTasks(tasks)
                .withTrack(sanitizeValue(report.track()));
    }

    static TemplateSnapshot sanitize(TemplateSnapshot template) {
        if (template == null) {
            return null;
        }
        List<TaskDefinition> tasks = template.tasks().stream()
                .map(task -> new TaskDefinition(task.id(), task.name(), task.title(), sanitizeMap(task.config())))
                .toList();
        return new TemplateSnapshot(template.id(), template.version(), template.title(), template.state(),
                tasks, sanitizeMap(template.graph()));
    }

    /**
     * Sanitizes a single value.
     *
     * @param value any value
     * @return the value, a sanitized copy of it, or a placeholder string
     */
    public static Object sanitizeValue(Object value) {
        if (value == null
                || value instanceof String
                || value instanceof Number
                || value instanceof Boolean
                || value instanceof TemporalAccessor
                || value instanceof Date) {
            return value;
        }
        if (value instanceof Map<?, ?> map) {
            return sanitizeMap(map);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> sanitized = new ArrayList<>(collection.size());
            for (Object item : collection) {
                sanitized.add(sanitizeValue(item));
            }
            return sanitized;
        }
        if (value instanceof Object[] array) {
            return sanitizeValue(Arrays.asList(array));
        }
        return PLACEHOLDER_PREFIX + value.getClass().getName();
    }

    static Map<String, Object> sanitizeMap(Map<?, ?> map) {
        if (map == null) {
            return null;
        }
        Map<String, Object> sanitized = new LinkedHashMap<>();
        map.forEach((key, value) -> sanitized.put(String.valueOf(key), sanitizeValue(value)));
        return sanitized;
    }
}
