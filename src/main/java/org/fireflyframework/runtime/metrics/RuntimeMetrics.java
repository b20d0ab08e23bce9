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

package org.fireflyframework.runtime.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.function.Supplier;

/**
 * Provides Micrometer metrics for the runtime reliability layer.
 * <p>
 * This class tracks the following metrics:
 * <ul>
 *   <li><b>bus.events.buffered</b> - Counter of events kept in memory while the backend was down</li>
 *   <li><b>bus.events.evicted</b> - Counter of buffered events dropped because the buffer was full</li>
 *   <li><b>bus.events.expired</b> - Counter of buffered events dropped after their TTL</li>
 *   <li><b>bus.events.drained</b> - Counter of buffered events written to the backend</li>
 *   <li><b>bus.writes.failed</b> - Counter of rejected backend writes (tags: operation)</li>
 *   <li><b>bus.buffer.size</b> - Gauge of currently buffered events</li>
 *   <li><b>faults</b> - Counter of reported faults (tags: type)</li>
 *   <li><b>workflows.finalized</b> - Counter of finalized workflow executions (tags: state)</li>
 *   <li><b>engine.events.dropped</b> - Counter of engine events for unknown executions (tags: type)</li>
 *   <li><b>workflows.live</b> - Gauge of executions currently held in memory</li>
 * </ul>
 * <p>
 * All metrics are prefixed with "firefly.runtime.".
 */
@Slf4j
public class RuntimeMetrics {

    private static final String METRIC_PREFIX = "firefly.runtime.";

    private static final String TAG_OPERATION = "operation";
    private static final String TAG_STATE = "state";
    private static final String TAG_TYPE = "type";

    private final MeterRegistry meterRegistry;

    public RuntimeMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        log.info("RuntimeMetrics initialized with MeterRegistry: {}", meterRegistry.getClass().getSimpleName());
    }

    // ==================== Bus Persistence Metrics ====================

    public void recordEventBuffered() {
        counter("bus.events.buffered", "Number of bus events buffered in memory").increment();
    }

    public void recordEventsEvicted(int count) {
        if (count > 0) {
            counter("bus.events.evicted", "Number of buffered bus events evicted on overflow").increment(count);
        }
    }

    public void recordEventExpired() {
        counter("bus.events.expired", "Number of buffered bus events expired after their TTL").increment();
    }

    public void recordEventsDrained(int count) {
        if (count > 0) {
            counter("bus.events.drained", "Number of buffered bus events written to the backend").increment(count);
        }
    }

    public void recordWriteFailure(String operation) {
        Counter.builder(METRIC_PREFIX + "bus.writes.failed")
                .description("Number of rejected durable backend operations")
                .tag(TAG_OPERATION, operation)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Registers a gauge reporting the number of buffered events.
     *
     * @param size supplier of the current buffer size
     */
    public void bindBufferSize(Supplier<Number> size) {
        Gauge.builder(METRIC_PREFIX + "bus.buffer.size", size)
                .description("Number of bus events currently buffered in memory")
                .register(meterRegistry);
    }

    // ==================== Workflow Runtime Metrics ====================

    public void recordWorkflowFinalized(String state) {
        Counter.builder(METRIC_PREFIX + "workflows.finalized")
                .description("Number of workflow executions finalized")
                .tag(TAG_STATE, normalizeTag(state))
                .register(meterRegistry)
                .increment();
    }

    public void recordEngineEventDropped(String type) {
        Counter.builder(METRIC_PREFIX + "engine.events.dropped")
                .description("Number of engine events referring to unknown executions")
                .tag(TAG_TYPE, normalizeTag(type))
                .register(meterRegistry)
                .increment();
        log.debug("METRIC: engine.events.dropped type={}", type);
    }

    /**
     * Registers a gauge reporting the number of live workflow executions.
     *
     * @param count supplier of the current count
     */
    public void bindLiveWorkflows(Supplier<Number> count) {
        Gauge.builder(METRIC_PREFIX + "workflows.live", count)
                .description("Number of workflow executions held in memory")
                .register(meterRegistry);
    }

    // ==================== Faults ====================

    public void recordFault(Throwable error) {
        Counter.builder(METRIC_PREFIX + "faults")
                .description("Number of faults reported on background paths")
                .tag(TAG_TYPE, error.getClass().getSimpleName())
                .register(meterRegistry)
                .increment();
    }

    private Counter counter(String name, String description) {
        return Counter.builder(METRIC_PREFIX + name)
                .description(description)
                .register(meterRegistry);
    }

    private String normalizeTag(String value) {
        if (value == null || value.isEmpty()) {
            return "unknown";
        }
        return value.toLowerCase(Locale.ROOT);
    }
}
