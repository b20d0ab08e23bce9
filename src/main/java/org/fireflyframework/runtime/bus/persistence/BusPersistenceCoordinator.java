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

package org.fireflyframework.runtime.bus.persistence;

import org.fireflyframework.runtime.bus.model.BusEvent;
import org.fireflyframework.runtime.bus.model.EventQuery;
import org.fireflyframework.runtime.bus.model.EventStatus;
import org.fireflyframework.runtime.fault.FaultHandler;
import org.fireflyframework.runtime.metrics.RuntimeMetrics;
import org.fireflyframework.runtime.properties.RuntimeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.lang.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decides where bus events are made durable.
 * <p>
 * Every operation first probes the backend. When it answers, operations write
 * through to it; when it does not (or none is configured), events are kept in
 * an {@link EventDurabilityQueue} and the caller is never failed. A background
 * loop drains the buffer into the backend once it is reachable again.
 * <p>
 * Buffered events are bounded twice: by the buffer capacity (oldest evicted
 * first) and by a TTL after which they are dropped. Events pulled from the
 * buffer by a drain are written at most once; a failure mid-drain is reported
 * to the {@link FaultHandler} and the remaining drained events are lost.
 */
@Slf4j
public class BusPersistenceCoordinator implements DisposableBean {

    @Nullable
    private final DurableEventStore backend;
    private final EventDurabilityQueue buffer;
    private final FaultHandler faultHandler;
    @Nullable
    private final RuntimeMetrics metrics;
    private final Duration memoryTtl;
    private final Duration drainInterval;
    private final Duration pingTimeout;
    private final Duration shutdownTimeout;
    private final Clock clock;
    private final Scheduler scheduler;

    private final Map<ExpiryKey, Disposable> expiries = new ConcurrentHashMap<>();
    private volatile Disposable drainLoop;

    public BusPersistenceCoordinator(@Nullable DurableEventStore backend,
                                     RuntimeProperties.PersistenceConfig config,
                                     FaultHandler faultHandler,
                                     @Nullable RuntimeMetrics metrics) {
        this(backend, new EventDurabilityQueue(config.getCapacity()), config, faultHandler, metrics,
                Clock.systemUTC(), Schedulers.parallel());
    }

    public BusPersistenceCoordinator(@Nullable DurableEventStore backend,
                                     EventDurabilityQueue buffer,
                                     RuntimeProperties.PersistenceConfig config,
                                     FaultHandler faultHandler,
                                     @Nullable RuntimeMetrics metrics,
                                     Clock clock,
                                     Scheduler scheduler) {
        this.backend = backend;
        this.buffer = buffer;
        this.faultHandler = faultHandler;
        this.metrics = metrics;
        this.memoryTtl = config.getMemoryTtl();
        this.drainInterval = config.getDrainInterval();
        this.pingTimeout = config.getPingTimeout();
        this.shutdownTimeout = config.getShutdownTimeout();
        this.clock = clock;
        this.scheduler = scheduler;
        if (metrics != null) {
            metrics.bindBufferSize(buffer::size);
        }
        if (backend == null) {
            log.info("No persistence backend configured, bus events are kept in memory only");
        }
    }

    /**
     * Initializes the backend.
     *
     * @return completion signal, failing with {@link BusPersistenceException}
     */
    public Mono<Void> init() {
        if (backend == null) {
            return Mono.empty();
        }
        return backend.init()
                .onErrorMap(error -> !(error instanceof BusPersistenceException),
                        error -> new BusPersistenceException("Could not initialize bus event backend", error))
                .doOnSuccess(v -> log.info("Bus event backend initialized"));
    }

    /**
     * Starts the drain loop. Safe to call multiple times; subsequent calls are no-ops.
     */
    public void start() {
        if (backend == null) {
            return;
        }
        if (drainLoop != null && !drainLoop.isDisposed()) {
            log.debug("BusPersistenceCoordinator already running");
            return;
        }

        log.info("Starting bus event drain loop with interval={}, capacity={}, memoryTtl={}",
                drainInterval, buffer.capacity(), memoryTtl);

        drainLoop = Flux.interval(drainInterval, scheduler)
                .onBackpressureDrop()
                .concatMap(tick -> drain())
                .subscribe();
    }

    /**
     * Initializes the backend and starts the drain loop once the application is ready.
     * A failed initialization is reported; the loop starts anyway so buffered
     * events are drained when the backend comes back.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        init()
                .onErrorResume(error -> {
                    faultHandler.report("Bus event backend initialization failed", error);
                    return Mono.empty();
                })
                .doFinally(signal -> start())
                .subscribe();
    }

    /**
     * Stops the drain loop, then makes one last attempt to drain the buffer.
     * Writes already in flight are not aborted.
     *
     * @return completion of the final drain
     */
    public Mono<Void> close() {
        return Mono.defer(() -> {
                    Disposable loop = drainLoop;
                    if (loop != null && !loop.isDisposed()) {
                        log.info("Stopping bus event drain loop, {} events still buffered", buffer.size());
                        loop.dispose();
                    }
                    return drain();
                })
                .doFinally(signal -> {
                    expiries.values().forEach(Disposable::dispose);
                    expiries.clear();
                });
    }

    @Override
    public void destroy() {
        try {
            close().block(shutdownTimeout);
        } catch (RuntimeException e) {
            faultHandler.report("Final drain of buffered bus events did not complete", e);
        }
    }

    /**
     * Stores a bus event, stamping its creation time.
     * <p>
     * With a healthy backend the write goes through and a rejected write fails
     * the returned {@link Mono} with {@link DurabilityWriteFailedException}.
     * Otherwise the event is buffered and the returned {@link Mono} always
     * succeeds.
     *
     * @param event the event to store
     * @return the stamped event
     */
    public Mono<BusEvent> store(BusEvent event) {
        return Mono.defer(() -> {
            BusEvent stamped = event.withCreatedAt(clock.instant());
            return ping().flatMap(healthy -> healthy
                    ? writeThrough(stamped)
                    : Mono.fromCallable(() -> keepInMemory(stamped)));
        });
    }

    /**
     * Updates the status of a stored event.
     * <p>
     * An event that is still buffered is updated in place, since it has not
     * reached the backend yet.
     *
     * @param id the event id
     * @param status the new status
     * @return completion signal
     */
    public Mono<Void> update(String id, EventStatus status) {
        return Mono.defer(() -> {
            if (buffer.updateStatus(id, status)) {
                log.debug("Updated buffered bus event: id={}, status={}", id, status);
                return Mono.empty();
            }
            return ping().flatMap(healthy -> {
                if (!healthy) {
                    log.debug("No buffered bus event to update while backend is down: id={}", id);
                    return Mono.<Void>empty();
                }
                return backend.update(id, status)
                        .onErrorResume(BackendUnavailableException.class, error -> {
                            log.warn("Backend became unreachable while updating bus event {}: {}", id, error.getMessage());
                            return Mono.empty();
                        })
                        .onErrorMap(error -> writeFailed("update", id, error));
            });
        });
    }

    /**
     * Retrieves stored events matching the query.
     *
     * @param query the filter
     * @return matching events, from the backend when healthy, else from the buffer
     */
    public Flux<BusEvent> retrieve(EventQuery query) {
        return ping().flatMapMany(healthy -> {
            if (!healthy) {
                return Flux.fromIterable(buffer.select(query));
            }
            return backend.retrieve(query)
                    .onErrorResume(BackendUnavailableException.class,
                            error -> Flux.fromIterable(buffer.select(query)))
                    .onErrorMap(error -> !(error instanceof BusPersistenceException),
                            error -> new BusPersistenceException("Could not retrieve bus events", error));
        });
    }

    /**
     * Retrieves stored events created at or after {@code since} with one of the given statuses.
     *
     * @param since lower bound on creation time, null for any
     * @param statuses accepted statuses, null or empty for any
     * @return matching events
     */
    public Flux<BusEvent> retrieve(@Nullable Instant since, @Nullable Set<EventStatus> statuses) {
        return retrieve(new EventQuery(since, statuses));
    }

    /**
     * Probes the backend.
     *
     * @return false when no backend is configured, the probe fails, or it times out
     */
    public Mono<Boolean> ping() {
        if (backend == null) {
            return Mono.just(false);
        }
        return Mono.defer(backend::ping)
                .timeout(pingTimeout, scheduler)
                .defaultIfEmpty(false)
                .onErrorResume(error -> {
                    log.debug("Bus event backend health probe failed: {}", error.toString());
                    return Mono.just(false);
                });
    }

    /**
     * Drains the buffer into the backend if it is reachable and the buffer is not empty.
     *
     * @return completion signal, never failing
     */
    public Mono<Void> drain() {
        if (backend == null || buffer.isEmpty()) {
            return Mono.empty();
        }
        return ping().flatMap(healthy -> {
            if (!healthy) {
                log.warn("No connection to backend, {} bus events kept in memory", buffer.size());
                return Mono.<Void>empty();
            }
            List<BusEvent> events = buffer.drainAll();
            if (events.isEmpty()) {
                return Mono.<Void>empty();
            }
            events.forEach(this::cancelExpiry);

            AtomicInteger written = new AtomicInteger();
            return Flux.fromIterable(events)
                    .concatMap(event -> backend.store(event).doOnSuccess(v -> written.incrementAndGet()))
                    .then()
                    .doOnSuccess(v -> log.info("BUS_BUFFER_DRAINED: count={}", events.size()))
                    .onErrorResume(error -> {
                        int lost = events.size() - written.get();
                        faultHandler.report(String.format(
                                "Drain of buffered bus events failed after %d of %d events, %d dropped",
                                written.get(), events.size(), lost), error);
                        if (metrics != null) {
                            metrics.recordWriteFailure("drain");
                        }
                        return Mono.empty();
                    })
                    .doFinally(signal -> {
                        if (metrics != null) {
                            metrics.recordEventsDrained(written.get());
                        }
                    });
        });
    }

    /**
     * Returns the number of events currently buffered in memory.
     */
    public int bufferedCount() {
        return buffer.size();
    }

    public boolean hasBackend() {
        return backend != null;
    }

    private Mono<BusEvent> writeThrough(BusEvent event) {
        return backend.store(event)
                .thenReturn(event)
                .onErrorResume(BackendUnavailableException.class, error -> {
                    log.warn("Backend became unreachable while storing bus event {}: {}", event.id(), error.getMessage());
                    return Mono.fromCallable(() -> keepInMemory(event));
                })
                .onErrorMap(error -> writeFailed("store", event.id(), error));
    }

    private BusEvent keepInMemory(BusEvent event) {
        List<BusEvent> evicted = buffer.put(event);
        scheduleExpiry(event);
        evicted.forEach(this::cancelExpiry);

        log.debug("BUS_EVENT_BUFFERED: id={}, topic={}, buffered={}", event.id(), event.topic(), buffer.size());
        if (!evicted.isEmpty()) {
            log.warn("Durability buffer full, {} oldest bus events dropped", evicted.size());
        }
        if (metrics != null) {
            metrics.recordEventBuffered();
            metrics.recordEventsEvicted(evicted.size());
        }
        return event;
    }

    private void scheduleExpiry(BusEvent event) {
        ExpiryKey key = new ExpiryKey(event.id(), event.createdAt());
        Disposable timer = Mono.delay(memoryTtl, scheduler)
                .subscribe(tick -> {
                    expiries.remove(key);
                    if (buffer.expire(key.id(), key.createdAt())) {
                        log.debug("Buffered bus event expired after {}: {}", memoryTtl, key.id());
                        if (metrics != null) {
                            metrics.recordEventExpired();
                        }
                    }
                });
        Disposable previous = expiries.put(key, timer);
        if (previous != null) {
            previous.dispose();
        }
    }

    private void cancelExpiry(BusEvent event) {
        Disposable timer = expiries.remove(new ExpiryKey(event.id(), event.createdAt()));
        if (timer != null) {
            timer.dispose();
        }
    }

    private Throwable writeFailed(String operation, String eventId, Throwable error) {
        if (error instanceof DurabilityWriteFailedException) {
            return error;
        }
        DurabilityWriteFailedException failure = new DurabilityWriteFailedException(eventId, error);
        if (metrics != null) {
            metrics.recordWriteFailure(operation);
        }
        faultHandler.report("Write-through " + operation + " of bus event " + eventId + " rejected", failure);
        return failure;
    }

    private record ExpiryKey(String id, Instant createdAt) {
    }
}
