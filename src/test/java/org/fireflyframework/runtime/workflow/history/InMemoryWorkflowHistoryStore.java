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

import org.fireflyframework.runtime.workflow.model.WorkflowReport;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory history store for registry tests.
 */
public class InMemoryWorkflowHistoryStore implements WorkflowHistoryStore {

    private final List<WorkflowReport> reports = new CopyOnWriteArrayList<>();
    private final AtomicInteger initCalls = new AtomicInteger();
    private volatile Supplier<Mono<Void>> initBehaviour = Mono::empty;
    private volatile RuntimeException insertFailure;

    public void initWith(Supplier<Mono<Void>> behaviour) {
        this.initBehaviour = behaviour;
    }

    public void failInserts(RuntimeException failure) {
        this.insertFailure = failure;
    }

    public List<WorkflowReport> reports() {
        return List.copyOf(reports);
    }

    public int initCalls() {
        return initCalls.get();
    }

    @Override
    public Mono<Void> init() {
        return Mono.defer(() -> {
            initCalls.incrementAndGet();
            return initBehaviour.get();
        });
    }

    @Override
    public Mono<Void> insert(WorkflowReport report) {
        return Mono.defer(() -> {
            if (insertFailure != null) {
                return Mono.error(insertFailure);
            }
            reports.add(report);
            return Mono.empty();
        });
    }

    @Override
    public Mono<WorkflowReport> findOne(String executionId, boolean full) {
        return Mono.justOrEmpty(reports.stream().filter(r -> r.id().equals(executionId)).findFirst());
    }

    @Override
    public Mono<HistoryPage> find(HistoryQuery query) {
        return Mono.just(new HistoryPage(reports.size(), reports));
    }
}
