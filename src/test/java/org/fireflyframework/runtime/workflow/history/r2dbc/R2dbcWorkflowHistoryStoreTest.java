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

import org.fireflyframework.runtime.workflow.history.HistoryOrdering;
import org.fireflyframework.runtime.workflow.history.HistoryQuery;
import org.fireflyframework.runtime.workflow.model.ExecutionState;
import org.fireflyframework.runtime.workflow.model.TaskDefinition;
import org.fireflyframework.runtime.workflow.model.TemplateSnapshot;
import org.fireflyframework.runtime.workflow.model.TemplateState;
import org.fireflyframework.runtime.workflow.model.WorkflowReport;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.r2dbc.core.DatabaseClient.GenericExecuteSpec;
import org.springframework.r2dbc.core.RowsFetchSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link R2dbcWorkflowHistoryStore}.
 */
@ExtendWith(MockitoExtension.class)
class R2dbcWorkflowHistoryStoreTest {

    private static final Instant START = Instant.parse("2026-04-02T09:30:00Z");

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    @Mock
    private DatabaseClient databaseClient;

    @Mock
    private GenericExecuteSpec countSpec;

    @Mock
    private GenericExecuteSpec pageSpec;

    @Mock
    private RowsFetchSpec<Long> countFetch;

    @Mock
    private RowsFetchSpec<String> documentFetch;

    @Captor
    private ArgumentCaptor<String> sqlCaptor;

    private R2dbcWorkflowHistoryStore store;

    @BeforeEach
    void setUp() {
        store = new R2dbcWorkflowHistoryStore(databaseClient, objectMapper, "org-acme");
    }

    private static WorkflowReport report(Instant end) {
        TemplateSnapshot template = new TemplateSnapshot("tpl-1", 3, "Invoice approval", TemplateState.ACTIVE,
                List.of(TaskDefinition.of("check", "rules")), Map.of("check", List.of()));
        return new WorkflowReport("exec-1", "acme", "api", null, ExecutionState.END, START, end, template, List.of());
    }

    @SuppressWarnings("unchecked")
    private void setupFind(long total, String... documents) {
        when(databaseClient.sql(startsWith("SELECT COUNT(*)"))).thenReturn(countSpec);
        when(databaseClient.sql(startsWith("SELECT document"))).thenReturn(pageSpec);
        lenient().when(countSpec.bind(anyString(), any())).thenReturn(countSpec);
        lenient().when(pageSpec.bind(anyString(), any())).thenReturn(pageSpec);
        when(countSpec.map(any(Function.class))).thenReturn(countFetch);
        when(pageSpec.map(any(Function.class))).thenReturn(documentFetch);
        when(countFetch.one()).thenReturn(Mono.just(total));
        when(documentFetch.all()).thenReturn(Flux.just(documents));
    }

    @Test
    @DisplayName("should reject schema names that cannot be quoted safely")
    void constructor_rejectsInvalidSchema() {
        assertThatThrownBy(() -> new R2dbcWorkflowHistoryStore(databaseClient, objectMapper, "acme\"; DROP"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Writes")
    class WriteTests {

        @Test
        @DisplayName("init should create the tenant schema and table")
        void init_runsDdl() {
            when(databaseClient.sql(anyString())).thenReturn(pageSpec);
            when(pageSpec.then()).thenReturn(Mono.empty());

            StepVerifier.create(store.init()).verifyComplete();

            verify(databaseClient, times(7)).sql(sqlCaptor.capture());
            assertThat(sqlCaptor.getAllValues().get(0)).isEqualTo("CREATE SCHEMA IF NOT EXISTS \"org-acme\"");
            assertThat(sqlCaptor.getAllValues().get(1))
                    .contains("CREATE TABLE IF NOT EXISTS \"org-acme\".workflow_instances");
        }

        @Test
        @DisplayName("insert should store the columns and the JSON document")
        void insert_bindsColumnsAndDocument() throws Exception {
            when(databaseClient.sql(anyString())).thenReturn(pageSpec);
            when(pageSpec.bind(anyString(), any())).thenReturn(pageSpec);
            when(pageSpec.bindNull(anyString(), any())).thenReturn(pageSpec);
            when(pageSpec.then()).thenReturn(Mono.empty());

            StepVerifier.create(store.insert(report(null))).verifyComplete();

            ArgumentCaptor<String> documentCaptor = ArgumentCaptor.forClass(String.class);
            verify(pageSpec).bind(eq("document"), documentCaptor.capture());
            assertThat(objectMapper.readTree(documentCaptor.getValue()).get("id").asText()).isEqualTo("exec-1");
            verify(pageSpec).bind("state", "end");
            verify(pageSpec).bind("requester", "api");
            verify(pageSpec).bind("title", "Invoice approval");
            verify(pageSpec).bind("startAt", START);
            verify(pageSpec).bindNull("endAt", Instant.class);
        }
    }

    @Nested
    @DisplayName("Queries")
    class QueryTests {

        @Test
        @DisplayName("find should page, sort and count with the same filters")
        void find_appliesFiltersAndPaging() throws Exception {
            setupFind(12L, objectMapper.writeValueAsString(report(START.plusSeconds(60))));
            HistoryQuery query = HistoryQuery.builder()
                    .rootOnly(true)
                    .search("50%")
                    .limit(10)
                    .offset(0)
                    .build();

            StepVerifier.create(store.find(query))
                    .assertNext(page -> {
                        assertThat(page.count()).isEqualTo(12L);
                        assertThat(page.items()).singleElement()
                                .satisfies(item -> assertThat(item.id()).isEqualTo("exec-1"));
                    })
                    .verifyComplete();

            verify(databaseClient).sql(contains("ORDER BY end_at DESC LIMIT :limit OFFSET :offset"));
            verify(databaseClient, times(2)).sql(contains("requester NOT LIKE :requesterPrefix"));
            verify(countSpec).bind("requesterPrefix", "workflow://%");
            verify(pageSpec).bind("search", "%50\\%%");
            verify(pageSpec).bind("limit", 10);
            verify(pageSpec).bind("offset", 0);
        }

        @Test
        @DisplayName("find should omit the template graph unless full results are requested")
        void find_hidesGraphByDefault() throws Exception {
            setupFind(1L, objectMapper.writeValueAsString(report(START.plusSeconds(60))));

            StepVerifier.create(store.find(HistoryQuery.builder().order(HistoryOrdering.TITLE_ASC).build()))
                    .assertNext(page -> assertThat(page.items().get(0).template().graph()).isNull())
                    .verifyComplete();

            verify(databaseClient, times(2)).sql(sqlCaptor.capture());
            assertThat(sqlCaptor.getAllValues().get(1)).endsWith("ORDER BY title ASC");
        }

        @Test
        @DisplayName("findOne should return the full stored report")
        @SuppressWarnings("unchecked")
        void findOne_returnsFullReport() throws Exception {
            when(databaseClient.sql(anyString())).thenReturn(pageSpec);
            when(pageSpec.bind(anyString(), any())).thenReturn(pageSpec);
            when(pageSpec.map(any(Function.class))).thenReturn(documentFetch);
            when(documentFetch.one()).thenReturn(Mono.just(objectMapper.writeValueAsString(report(null))));

            StepVerifier.create(store.findOne("exec-1", true))
                    .assertNext(report -> {
                        assertThat(report.state()).isEqualTo(ExecutionState.END);
                        assertThat(report.template().graph()).containsKey("check");
                    })
                    .verifyComplete();

            verify(pageSpec).bind("id", "exec-1");
        }
    }
}
