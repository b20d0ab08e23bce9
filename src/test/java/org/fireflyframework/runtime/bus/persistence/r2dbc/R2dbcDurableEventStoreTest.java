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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.r2dbc.core.FetchSpec;
import org.springframework.r2dbc.core.RowsFetchSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link R2dbcDurableEventStore}.
 */
@ExtendWith(MockitoExtension.class)
class R2dbcDurableEventStoreTest {

    private static final Instant CREATED = Instant.parse("2026-02-01T08:00:00Z");

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private GenericExecuteSpec executeSpec;

    @Mock
    private RowsFetchSpec<BusEvent> eventRowsFetchSpec;

    @Mock
    @SuppressWarnings("rawtypes")
    private FetchSpec fetchSpec;

    @Captor
    private ArgumentCaptor<String> sqlCaptor;

    private R2dbcDurableEventStore store;

    @BeforeEach
    void setUp() {
        store = new R2dbcDurableEventStore(databaseClient, "bus", "bus_events");
    }

    private void setupExecute() {
        when(databaseClient.sql(anyString())).thenReturn(executeSpec);
        lenient().when(executeSpec.bind(anyString(), any())).thenReturn(executeSpec);
        lenient().when(executeSpec.bindNull(anyString(), any())).thenReturn(executeSpec);
    }

    @Nested
    @DisplayName("Writes")
    class WriteTests {

        @Test
        @DisplayName("init should create the schema, table and indexes")
        void init_runsDdl() {
            setupExecute();
            when(executeSpec.then()).thenReturn(Mono.empty());

            StepVerifier.create(store.init()).verifyComplete();

            verify(databaseClient, times(4)).sql(sqlCaptor.capture());
            assertThat(sqlCaptor.getAllValues().get(0)).isEqualTo("CREATE SCHEMA IF NOT EXISTS bus");
            assertThat(sqlCaptor.getAllValues().get(1)).contains("CREATE TABLE IF NOT EXISTS bus.bus_events");
        }

        @Test
        @DisplayName("store should insert every column")
        void store_insertsRow() {
            setupExecute();
            when(executeSpec.then()).thenReturn(Mono.empty());
            BusEvent event = new BusEvent("e1", EventStatus.PENDING, "orders", "{}", CREATED);

            StepVerifier.create(store.store(event)).verifyComplete();

            verify(databaseClient).sql(sqlCaptor.capture());
            assertThat(sqlCaptor.getValue()).contains("INSERT INTO bus.bus_events");
            verify(executeSpec).bind("id", "e1");
            verify(executeSpec).bind("status", "pending");
            verify(executeSpec).bind("payload", "{}");
            verify(executeSpec).bind("createdAt", CREATED);
        }

        @Test
        @DisplayName("store should bind a null payload explicitly")
        void store_nullPayload() {
            setupExecute();
            when(executeSpec.then()).thenReturn(Mono.empty());

            StepVerifier.create(store.store(new BusEvent("e1", EventStatus.PENDING, "orders", null, CREATED)))
                    .verifyComplete();

            verify(executeSpec).bindNull("payload", String.class);
        }

        @Test
        @DisplayName("a connection failure should surface as BackendUnavailableException")
        void store_connectionFailure() {
            setupExecute();
            when(executeSpec.then()).thenReturn(Mono.error(new DataAccessResourceFailureException("refused")));

            StepVerifier.create(store.store(new BusEvent("e1", EventStatus.PENDING, "orders", "{}", CREATED)))
                    .expectError(BackendUnavailableException.class)
                    .verify();
        }

        @Test
        @DisplayName("other failures should propagate unchanged")
        void store_otherFailure() {
            setupExecute();
            when(executeSpec.then()).thenReturn(Mono.error(new DataIntegrityViolationException("duplicate")));

            StepVerifier.create(store.store(new BusEvent("e1", EventStatus.PENDING, "orders", "{}", CREATED)))
                    .expectError(DataIntegrityViolationException.class)
                    .verify();
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("update should set the status by id")
        void update_setsStatus() {
            setupExecute();
            when(executeSpec.fetch()).thenReturn(fetchSpec);
            when(fetchSpec.rowsUpdated()).thenReturn(Mono.just(1L));

            StepVerifier.create(store.update("e1", EventStatus.SENT)).verifyComplete();

            verify(databaseClient).sql(sqlCaptor.capture());
            assertThat(sqlCaptor.getValue()).isEqualTo("UPDATE bus.bus_events SET status = :status WHERE id = :id");
            verify(executeSpec).bind("status", "sent");
            verify(executeSpec).bind("id", "e1");
        }
    }

    @Nested
    @DisplayName("Reads")
    class ReadTests {

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("retrieve should filter on creation time and statuses, oldest first")
        void retrieve_withFilters() {
            setupExecute();
            BusEvent event = new BusEvent("e1", EventStatus.SENT, "orders", "{}", CREATED);
            when(executeSpec.map(any(Function.class))).thenReturn(eventRowsFetchSpec);
            when(eventRowsFetchSpec.all()).thenReturn(Flux.just(event));

            EventQuery query = EventQuery.since(CREATED).andStatuses(Set.of(EventStatus.SENT));
            StepVerifier.create(store.retrieve(query))
                    .expectNext(event)
                    .verifyComplete();

            verify(databaseClient).sql(sqlCaptor.capture());
            assertThat(sqlCaptor.getValue())
                    .contains("created_at >= :since")
                    .contains("status IN (:statuses)")
                    .endsWith("ORDER BY created_at");
            verify(executeSpec).bind("since", CREATED);
            verify(executeSpec).bind(eq("statuses"), eq(List.of("sent")));
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("retrieve without filters should not bind anything")
        void retrieve_all() {
            when(databaseClient.sql(anyString())).thenReturn(executeSpec);
            when(executeSpec.map(any(Function.class))).thenReturn(eventRowsFetchSpec);
            when(eventRowsFetchSpec.all()).thenReturn(Flux.empty());

            StepVerifier.create(store.retrieve(EventQuery.all())).verifyComplete();

            verify(executeSpec, never()).bind(anyString(), any());
        }

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("ping should run a trivial query")
        void ping_runsSelectOne() {
            when(databaseClient.sql("SELECT 1")).thenReturn(executeSpec);
            when(executeSpec.fetch()).thenReturn(fetchSpec);
            when(fetchSpec.first()).thenReturn(Mono.just(Map.of("?column?", 1)));

            StepVerifier.create(store.ping()).expectNext(true).verifyComplete();
        }
    }

    @Test
    @DisplayName("should reject unsafe table names")
    void constructor_rejectsInvalidIdentifiers() {
        assertThatThrownBy(() -> new R2dbcDurableEventStore(databaseClient, "bus", "events; DROP TABLE x"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
