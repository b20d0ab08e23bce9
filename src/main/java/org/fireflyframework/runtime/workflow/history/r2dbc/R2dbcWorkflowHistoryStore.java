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


package org.fireflyframework.runtime.workflow.history.r2dbc;

import org.fireflyframework.runtime.workflow.history.HistoryPage;
import org.fireflyframework.runtime.workflow.history.HistoryQuery;
import org.fireflyframework.runtime.workflow.history.WorkflowHistoryStore;
import org.fireflyframework.runtime.workflow.model.WorkflowReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link WorkflowHistoryStore} keeping one {@code workflow_instances} table per
 * tenant schema.
 * <p>
 * Queryable fields are stored in columns; the full report is stored as a JSON
 * document next to them.
 */
@Slf4j
public class R2dbcWorkflowHistoryStore implements WorkflowHistoryStore {

    static final String TABLE = "workflow_instances";
    static final String REQUESTED_BY_WORKFLOW_PREFIX = "workflow://";

    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final DatabaseClient databaseClient;
    private final ObjectMapper objectMapper;
    private final String schema;
    private final String qualifiedTable;

    public R2dbcWorkflowHistoryStore(DatabaseClient databaseClient, ObjectMapper objectMapper, String schema) {
        if (schema == null || !SCHEMA_NAME.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid schema name: " + schema);
        }
        this.databaseClient = databaseClient;
        this.objectMapper = objectMapper;
        this.schema = "\"" + schema + "\"";
        this.qualifiedTable = this.schema + "." + TABLE;
    }

    @Override
    public Mono<Void> init() {
        List<String> statements = List.of(
                "CREATE SCHEMA IF NOT EXISTS " + schema,
                """
                CREATE TABLE IF NOT EXISTS %s (
                    id VARCHAR(64) PRIMARY KEY,
                    state VARCHAR(16) NOT NULL,
                    requester VARCHAR(255),
                    title VARCHAR(255),
                    start_at TIMESTAMP WITH TIME ZONE,
                    end_at TIMESTAMP WITH TIME ZONE,
                    document TEXT NOT NULL
                )
                """.formatted(qualifiedTable),
                "CREATE INDEX IF NOT EXISTS idx_workflow_instances_state ON " + qualifiedTable + " (state)",
                "CREATE INDEX IF NOT EXISTS idx_workflow_instances_requester ON " + qualifiedTable + " (requester)",
                "CREATE INDEX IF NOT EXISTS idx_workflow_instances_title ON " + qualifiedTable + " (title)",
                "CREATE INDEX IF NOT EXISTS idx_workflow_instances_start ON " + qualifiedTable + " (start_at DESC)",
                "CREATE INDEX IF NOT EXISTS idx_workflow_instances_end ON " + qualifiedTable + " (end_at DESC)");

        return Flux.fromIterable(statements)
                .concatMap(sql -> databaseClient.sql(sql).then())
                .then()
                .doOnSuccess(v -> log.info("Workflow history ready in schema {}", schema));
    }

    @Override
    public Mono<Void> insert(WorkflowReport report) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(report))
                .flatMap(document -> {
                    DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("""
                                INSERT INTO %s (id, state, requester, title, start_at, end_at, document)
                                VALUES (:id, :state, :requester, :title, :startAt, :endAt, :document)
                                """.formatted(qualifiedTable))
                            .bind("id", report.id())
                            .bind("state", report.state().value())
                            .bind("document", document);
                    spec = bindNullable(spec, "requester", report.requester(), String.class);
                    spec = bindNullable(spec, "title",
                            report.template() != null ? report.template().title() : null, String.class);
                    spec = bindNullable(spec, "startAt", report.start(), Instant.class);
                    spec = bindNullable(spec, "endAt", report.end(), Instant.class);
                    return spec.then();
                })
                .doOnSuccess(v -> log.debug("WORKFLOW_HISTORY_INSERTED: id={}, schema={}", report.id(), schema));
    }

    @Override
    public Mono<WorkflowReport> findOne(String executionId, boolean full) {
        return databaseClient.sql("SELECT document FROM " + qualifiedTable + " WHERE id = :id")
                .bind("id", executionId)
                .map(row -> row.get("document", String.class))
                .one()
                .map(document -> readDocument(document, full));
    }

    @Override
    public Mono<HistoryPage> find(HistoryQuery query) {
        List<String> conditions = new ArrayList<>();
        if (query.since() != null) {
            conditions.add("start_at >= :since");
        }
        if (query.state() != null) {
            conditions.add("state = :state");
        }
        if (query.rootOnly()) {
            conditions.add("(requester IS NULL OR requester NOT LIKE :requesterPrefix)");
        }
        if (query.search() != null && !query.search().isEmpty()) {
            conditions.add("title LIKE :search");
        }
        String where = conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);

        StringBuilder pageSql = new StringBuilder("SELECT document FROM ")
                .append(qualifiedTable)
                .append(where)
                .append(" ORDER BY ")
                .append(query.order().toSql());
        if (query.hasLimit()) {
            pageSql.append(" LIMIT :limit");
        }
        if (query.hasOffset()) {
            pageSql.append(" OFFSET :offset");
        }

        Mono<Long> count = bindFilters(databaseClient.sql("SELECT COUNT(*) AS cnt FROM " + qualifiedTable + where), query)
                .map(row -> row.get("cnt", Long.class))
                .one()
                .defaultIfEmpty(0L);

        DatabaseClient.GenericExecuteSpec pageSpec = bindFilters(databaseClient.sql(pageSql.toString()), query);
        if (query.hasLimit()) {
            pageSpec = pageSpec.bind("limit", query.limit());
        }
        if (query.hasOffset()) {
            pageSpec = pageSpec.bind("offset", query.offset());
        }
        Mono<List<WorkflowReport>> items = pageSpec
                .map(row -> row.get("document", String.class))
                .all()
                .map(document -> readDocument(document, query.full()))
                .collectList();

        return Mono.zip(count, items).map(tuple -> new HistoryPage(tuple.getT1(), tuple.getT2()));
    }

    private DatabaseClient.GenericExecuteSpec bindFilters(DatabaseClient.GenericExecuteSpec spec, HistoryQuery query) {
        if (query.since() != null) {
            spec = spec.bind("since", query.since());
        }
        if (query.state() != null) {
            spec = spec.bind("state", query.state().value());
        }
        if (query.rootOnly()) {
            spec = spec.bind("requesterPrefix", REQUESTED_BY_WORKFLOW_PREFIX + "%");
        }
        if (query.search() != null && !query.search().isEmpty()) {
            spec = spec.bind("search", "%" + escapeLike(query.search()) + "%");
        }
        return spec;
    }

    private WorkflowReport readDocument(String document, boolean full) {
        WorkflowReport report;
        try {
            report = objectMapper.readValue(document, WorkflowReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable workflow history document in " + schema, e);
        }
        if (!full && report.template() != null) {
            return report.withTemplate(report.template().withoutGraph());
        }
        return report;
    }

    private static <T> DatabaseClient.GenericExecuteSpec bindNullable(DatabaseClient.GenericExecuteSpec spec,
                                                                      String name, T value, Class<T> type) {
        return value != null ? spec.bind(name, value) : spec.bindNull(name, type);
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
