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


package org.fireflyframework.runtime.health;

import org.fireflyframework.runtime.bus.persistence.BusPersistenceCoordinator;
import org.fireflyframework.runtime.live.LiveSubscriberRegistry;
import org.fireflyframework.runtime.workflow.WorkflowRuntimeRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

/**
 * Health indicator for the workflow runtime layer.
 * <p>
 * Reports down when a bus event backend is configured but unreachable; events
 * are still accepted in that state, the buffered count shows how many.
 */
@Slf4j
@RequiredArgsConstructor
public class RuntimeHealthIndicator implements ReactiveHealthIndicator {

    private final BusPersistenceCoordinator coordinator;
    private final WorkflowRuntimeRegistry runtimeRegistry;
    private final LiveSubscriberRegistry subscribers;

    @Override
    public Mono<Health> health() {
        return coordinator.ping()
                .map(backendUp -> {
                    String backend = !coordinator.hasBackend()
                            ? "memory-only"
                            : backendUp ? "connected" : "disconnected";
                    Health.Builder builder = coordinator.hasBackend() && !backendUp ? Health.down() : Health.up();

                    return builder
                            .withDetail("busBackend", backend)
                            .withDetail("bufferedEvents", coordinator.bufferedCount())
                            .withDetail("liveWorkflows", runtimeRegistry.size())
                            .withDetail("liveSubscribers", subscribers.subscriberCount())
                            .build();
                })
                .onErrorResume(e -> {
                    log.warn("Workflow runtime health check failed", e);
                    return Mono.just(Health.down()
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
