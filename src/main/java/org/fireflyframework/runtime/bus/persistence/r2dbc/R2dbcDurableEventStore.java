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


package org.fireflyframework.runtime.bus.persistence.r2dbc;

import org.fireflyframework.runtime.bus.model.BusEvent;
import org.fireflyframework.runtime.bus.model.EventQuery;
import org.fireflyframework.runtime.bus.model.EventStatus;
import org.fireflyframework.runtime.bus.persistence.BackendUnavailableException;
import org.fireflyframework.runtime.bus.persistence.DurableEventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.regex.Pattern;

/**
 * {@link DurableEventStore} backed by a relational database through R2DBC.
 * <p>
 * Events live in a single table, by default {@code bus.bus_events}, indexed on
 * creation time and status. Connection-level failures are reported as
 * {@link BackendUnavailableException}; anything else propagates as-is.
 */
@Slf4j
public class R2dbcDurableEventStore implements DurableEventStore {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final DatabaseClient databaseClient;
    private final String schema;
    private final String qualifiedTable;

    public R2dbcDurableEventStore(DatabaseClient databaseClient, String schema, String table) {
        this.databaseClient = databaseClient;
        this.schema = requireIdentifier(schema, "schema");
        this.qualifiedTable = this.schema + "." + requireIdentifier(table, "table");
    }

    @Override
    public Mono<Void> init() {
        List<String> statements = List.of(
                "CREATE SCHEMA IF NOT EXISTS " + schema,
                """
                CREATE TABLE IF NOT EXISTS %s (
                    id VARCHAR(64) PRIMARY KEY,
                    status VARCHAR(16) NOT NULL,
                    topic VARCHAR(255) NOT NULL,
                    payload TEXT,
                    created_at TIMESTAMP WITH TIME ZONE NOT NULL
                )
                """.formatted(qualifiedTable),
                "CREATE INDEX IF NOT EXISTS idx_bus_events_created_at ON " + qualifiedTable + " (created_at)",
                "CREATE INDEX IF NOT EXISTS idx_bus_events_status ON " + qualifiedTable + " (status)");

        return Flux.fromIterable(statements)
                .concatMap(sql -> databaseClient.sql(sql).then())
                .then()
                .doOnSuccess(v -> log.debug("Bus event table ready: {}", qualifiedTable))
                .onErrorMap(this::translate);
    }

    @Override
    public Mono<Void> store(BusEvent event) {
        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql("""
                    INSERT INTO %s (id, status, topic, payload, created_at)
                    VALUES (:id, :status, :topic, :payload, :createdAt)
                    """.formatted(qualifiedTable))
                .bind("id", event.id())
                .bind("status", event.status().value())
                .bind("topic", event.topic())
                .bind("createdAt", event.createdAt());
        spec = event.payload() != null
                ? spec.bind("payload", event.payload())
                : spec.bindNull("payload", String.class);

        return spec.then()
                .doOnSuccess(v -> log.debug("BUS_EVENT_STORED: id={}, topic={}", event.id(), event.topic()))
                .onErrorMap(this::translate);
    }

    @Override
    public Mono<Void> update(String id, EventStatus status) {
        return databaseClient.sql("UPDATE " + qualifiedTable + " SET status = :status WHERE id = :id")
                .bind("status", status.value())
                .bind("id", id)
                .fetch()
                .rowsUpdated()
                .doOnNext(count -> {
                    if (count == 0) {
                        log.debug("No stored bus event to update: id={}", id);
                    }
                })
                .then()
                .onErrorMap(this::translate);
    }

    @Override
    public Flux<BusEvent> retrieve(EventQuery query) {
        StringBuilder sql = new StringBuilder("SELECT id, status, topic, payload, created_at FROM ")
                .append(qualifiedTable)
                .append(" WHERE 1 = 1");
        if (query.since() != null) {
            sql.append(" AND created_at >= :since");
        }
        if (!query.statuses().isEmpty()) {
            sql.append(" AND status IN (:statuses)");
        }
        sql.append(" ORDER BY created_at");

        DatabaseClient.GenericExecuteSpec spec = databaseClient.sql(sql.toString());
        if (query.since() != null) {
            spec = spec.bind("since", query.since());
        }
        if (!query.statuses().isEmpty()) {
            spec = spec.bind("statuses", query.statuses().stream().map(EventStatus::value).toList());
        }

        return spec.map(row -> new BusEvent(
                        row.get("id", String.class),
                        EventStatus.fromValue(row.get("status", String.class)),
                        row.get("topic", String.class),
                        row.get("payload", String.class),
                        row.get("created_at", Instant.class)))
                .all()
                .onErrorMap(this::translate);
    }

    @Override
    public Mono<Boolean> ping() {
        return databaseClient.sql("SELECT 1")
                .fetch()
                .first()
                .map(row -> true)
                .defaultIfEmpty(true)
                .onErrorMap(this::translate);
    }

    private Throwable translate(Throwable error) {
        if (error instanceof DataAccessResourceFailureException
                || error instanceof TransientDataAccessResourceException) {
            return new BackendUnavailableException("Bus event backend unreachable: " + error.getMessage(), error);
        }
        return error;
    }

    private static String requireIdentifier(String value, String what) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " name: " + value);
        }
        return value;
    }
}
