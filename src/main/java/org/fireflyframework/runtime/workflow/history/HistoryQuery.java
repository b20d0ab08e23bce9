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

import org.fireflyframework.runtime.workflow.model.ExecutionState;
import lombok.Builder;

import java.time.Instant;

/**
 * Filter and paging options for listing workflow history.
 *
 * @param since only executions started at or after this time, may be null
 * @param state only executions in this state, may be null
 * @param rootOnly exclude executions requested by another workflow
 * @param search only executions whose template title contains this text, may be null
 * @param order sort order, defaults to {@link HistoryOrdering#END_DESC}
 * @param offset number of items to skip, ignored when null or negative
 * @param limit maximum number of items, ignored when null or not positive
 * @param full whether to include the template graph
 */
@Builder
public record HistoryQuery(
        Instant since,
        ExecutionState state,
        boolean rootOnly,
        String search,
        HistoryOrdering order,
        Integer offset,
        Integer limit,
        boolean full
) {

    public HistoryQuery {
        if (order == null) {
            order = HistoryOrdering.END_DESC;
        }
    }

    public boolean hasOffset() {
        return offset != null && offset >= 0;
    }

    public boolean hasLimit() {
        return limit != null && limit > 0;
    }
}
