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

/**
 * Sort orders available when listing workflow history.
 */
public enum HistoryOrdering {

    TITLE_ASC("title", true),
    TITLE_DESC("title", false),
    START_ASC("start_at", true),
    START_DESC("start_at", false),
    END_ASC("end_at", true),
    END_DESC("end_at", false);

    private final String column;
    private final boolean ascending;

    HistoryOrdering(String column, boolean ascending) {
        this.column = column;
        this.ascending = ascending;
    }

    /**
     * Returns the SQL {@code ORDER BY} expression for this ordering.
     */
    public String toSql() {
        return column + (ascending ? " ASC" : " DESC");
    }
}
