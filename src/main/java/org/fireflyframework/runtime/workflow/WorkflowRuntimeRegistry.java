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


package org.fireflyframework.runtime.workflow;

import org.fireflyframework.runtime.fault.FaultHandler;
import org.fireflyframework.runtime.live.LiveChannel;
import org.fireflyframework.runtime.live.LiveSubscriberRegistry;
import org.fireflyframework.runtime.metrics.RuntimeMetrics;
import org.fireflyframework.runtime.tenant.OrganizationNames;
import org.fireflyframework.runtime.tenant.TenantStoreRegistry;
import org.fireflyframework.runtime.workflow.event.EngineEvent;
import org.fireflyframework.runtime.workflow.event.WorkflowUpdate;
import org.fireflyframework.runtime.workflow.history.ReportSanitizer;
import org.fireflyframework.runtime.workflow.model.ExecutionState;
import org.fireflyframework.runtime.workflow.model.WorkflowInstanceRecord;
import org.fireflyframework.runtime.workflow.model.WorkflowReport;
import org.fireflyframework.runtime.workflow.model.WorkflowStart;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks running workflow executions per organization and reports their
 * progress.
 * <p>
 * Each execution goes through {@code begin -> progress* -> end | error}. Every
 * engine event updates the execution's record and is broadcast to the live
 * subscribers of its organization; {@code begin} carries the full template,
 * later events only the delta. On a terminal event the merged report is
 * written to the organization's history in the background, and the record is
 * removed once that write was attempted.
 */
@Slf4j
public class WorkflowRuntimeRegistry implements DisposableBean {

    @FunctionalInterface
    private interface LifecycleHandler {
        Mono<Void> handle(WorkflowInstanceRecord record, EngineEvent event);
    }

    private final TenantStoreRegistry tenants;
    private final LiveSubscriberRegistry subscribers;
    private final OrganizationNames names;
    private final FaultHandler faultHandler;
    @Nullable
    private final RuntimeMetrics metrics;
    private final Clock clock;
    private final Duration shutdownTimeout;

    private final Map<String, Map<String, WorkflowInstanceRecord>> liveByOrganization = new ConcurrentHashMap<>();
    private final Map<ExecutionState, LifecycleHandler> handlers = new EnumMap<>(ExecutionState.class);
    private final Map<String, Mono<Void>> finalizations = new ConcurrentHashMap<>();

    public WorkflowRuntimeRegistry(TenantStoreRegistry tenants,
                                   LiveSubscriberRegistry subscribers,
                                   OrganizationNames names,
                                   FaultHandler faultHandler,
                                   @Nullable RuntimeMetrics metrics,
                                   Clock clock,
                                   Duration shutdownTimeout) {
        this.tenants = tenants;
        this.subscribers = subscribers;
        this.names = names;
        this.faultHandler = faultHandler;
        this.metrics = metrics;
        this.clock = clock;
        this.shutdownTimeout = shutdownTimeout;

        handlers.put(ExecutionState.BEGIN, this::onUpdate);
        handlers.put(ExecutionState.PROGRESS, this::onUpdate);
        handlers.put(ExecutionState.END, this::onTerminal);
        handlers.put(ExecutionState.ERROR, this::onTerminal);

        if (metrics != null) {
            metrics.bindLiveWorkflows(this::size);
        }
    }

    /**
     * Starts tracking an execution. Registering an execution that is already
     * tracked returns the existing record.
     *
     * @param start the start data
     * @return the live record
     */
    public WorkflowInstanceRecord register(WorkflowStart start) {
        return register(start, clock.instant());
    }

    private WorkflowInstanceRecord register(WorkflowStart start, Instant startTime) {
        String organization = names.normalize(start.organization());
        WorkflowInstanceRecord record = liveByOrganization
                .computeIfAbsent(organization, org -> new ConcurrentHashMap<>())
                .computeIfAbsent(start.executionId(),
                        id -> WorkflowInstanceRecord.from(start, organization, startTime));
        log.debug("Tracking workflow execution: id={}, template={}, organization={}",
                start.executionId(), start.template().id(), organization);
        return record;
    }

    /**
     * Applies an engine lifecycle event.
     * <p>
     * Events for executions that are not tracked are dropped, except a
     * {@code begin} event carrying start data, which starts tracking. A
     * {@code begin} naming an invalid organization is reported and dropped.
     *
     * @param event the engine event
     * @return completion once the update was broadcast; the history write of a
     * terminal event is not awaited
     */
    public Mono<Void> onEngineEvent(EngineEvent event) {
        return Mono.defer(() -> {
            WorkflowInstanceRecord record = find(event.executionId()).orElse(null);
            if (record == null) {
                if (event.type() == ExecutionState.BEGIN && event.start() != null) {
                    try {
                        record = register(event.start(), event.timestamp());
                    } catch (IllegalArgumentException e) {
                        faultHandler.report("Workflow execution " + event.executionId()
                                + " rejected, begin event dropped", e);
                        return Mono.empty();
                    }
                } else {
                    log.warn("UNKNOWN_EXECUTION: type={}, executionId={}, event dropped",
                            event.type().value(), event.executionId());
                    if (metrics != null) {
                        metrics.recordEngineEventDropped(event.type().value());
                    }
                    return Mono.empty();
                }
            }
            if (record.isFinalizing()) {
                log.warn("Execution {} is already finalized, {} event dropped",
                        event.executionId(), event.type().value());
                return Mono.empty();
            }
            return handlers.get(event.type()).handle(record, event);
        });
    }

    /**
     * Opens a live channel: the channel first receives the report of every
     * running execution of its organization, then every later update.
     *
     * @param organization the subscriber's organization, null for the default one
     * @param channel the channel
     * @return completion once the catch-up message was sent
     */
    public Mono<Void> connect(String organization, LiveChannel channel) {
        return Mono.defer(() -> {
            String org = names.normalize(organization);
            return subscribers.connect(org, channel, () -> reports(org));
        });
    }

    public void disconnect(LiveChannel channel) {
        subscribers.remove(channel);
    }

    /**
     * Returns the current report of every running execution of an organization.
     *
     * @param organization the organization, null for the default one
     * @return the reports
     */
    public List<WorkflowReport> reports(String organization) {
        Map<String, WorkflowInstanceRecord> records = liveByOrganization.get(names.normalize(organization));
        if (records == null) {
            return List.of();
        }
        return records.values().stream()
                .filter(record -> !record.isFinalizing())
                .map(WorkflowInstanceRecord::report)
                .toList();
    }

    public Optional<WorkflowInstanceRecord> find(String executionId) {
        for (Map<String, WorkflowInstanceRecord> records : liveByOrganization.values()) {
            WorkflowInstanceRecord record = records.get(executionId);
            if (record != null) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the number of executions currently tracked.
     */
    public int size() {
        return liveByOrganization.values().stream().mapToInt(Map::size).sum();
    }

    /**
     * Waits for every history write still in flight.
     *
     * @return completion once all pending writes were attempted
     */
    public Mono<Void> awaitFinalizations() {
        return Mono.when(List.copyOf(finalizations.values()));
    }

    @Override
    public void destroy() {
        if (finalizations.isEmpty()) {
            return;
        }
        log.info("Waiting for {} workflow history writes before shutdown", finalizations.size());
        try {
            awaitFinalizations().block(shutdownTimeout);
        } catch (RuntimeException e) {
            faultHandler.report("Workflow history writes did not complete before shutdown", e);
        }
    }

    private Mono<Void> onUpdate(WorkflowInstanceRecord record, EngineEvent event) {
        record.apply(event.type(), event.task(), event.timestamp());
        return broadcast(record, event);
    }

    private Mono<Void> onTerminal(WorkflowInstanceRecord record, EngineEvent event) {
        if (!record.markFinalizing()) {
            log.warn("Execution {} is already finalized, {} event dropped",
                    event.executionId(), event.type().value());
            return Mono.empty();
        }
        record.apply(event.type(), event.task(), event.timestamp());
        WorkflowReport report = record.report();
        finalizeRecord(record, report);

        log.info("WORKFLOW_FINALIZED: id={}, organization={}, state={}",
                record.executionId(), record.organization(), event.type().value());
        if (metrics != null) {
            metrics.recordWorkflowFinalized(event.type().value());
        }
        return broadcast(record, event);
    }

    private void finalizeRecord(WorkflowInstanceRecord record, WorkflowReport report) {
        String key = record.organization() + "/" + record.executionId();
        Mono<Void> write = tenants
                .scopedAccess(record.organization(),
                        handle -> handle.history().insert(ReportSanitizer.sanitize(report)))
                .doOnSuccess(v -> log.debug("Workflow report stored: id={}, organization={}",
                        record.executionId(), record.organization()))
                .onErrorResume(error -> {
                    faultHandler.report("Could not store report of workflow " + record.executionId()
                            + " for organization " + record.organization(), error);
                    return Mono.empty();
                })
                .doFinally(signal -> {
                    evict(record);
                    finalizations.remove(key);
                })
                .cache();
        finalizations.put(key, write);
        write.subscribe();
    }

    private void evict(WorkflowInstanceRecord record) {
        Map<String, WorkflowInstanceRecord> records = liveByOrganization.get(record.organization());
        if (records != null && records.remove(record.executionId(), record)) {
            log.debug("Workflow execution evicted: id={}, organization={}",
                    record.executionId(), record.organization());
        }
    }

    private Mono<Void> broadcast(WorkflowInstanceRecord record, EngineEvent event) {
        return subscribers.broadcastTo(record.organization(), WorkflowUpdate.of(record, event, clock.instant()));
    }
}
