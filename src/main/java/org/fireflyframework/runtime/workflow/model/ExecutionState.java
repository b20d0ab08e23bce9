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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall state of a workflow execution, as emitted by the engine.
 * <p>
 * Valid transitions: {@code BEGIN -> PROGRESS* -> END | ERROR}.
 */
public enum ExecutionState {

    /**
     * Execution has started.
     */
    BEGIN,

    /**
     * A task of the execution changed state.
     */
    PROGRESS,

    /**
     * Execution completed.
     */
    END,

    /**
     * Execution failed.
     */
    ERROR;

    /**
     * Checks if this is a terminal state.
     *
     * @return true if no further event is expected for the execution
     */
    public boolean isTerminal() {
        return this == END || this == ERROR;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
