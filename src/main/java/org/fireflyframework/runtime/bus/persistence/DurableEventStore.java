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
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable backend for bus events.
 * <p>
 * Implemented once per backend kind. Every operation may fail; implementations
 * signal an unreachable backend with {@link BackendUnavailableException} so it
 * can be told apart from a rejected write.
 */
public interface DurableEventStore {

    /**
     * Prepares the backend (schema, indexes). Safe to call repeatedly.
     *
     * @return completion signal
     */
    Mono<Void> init();

    /**
     * Writes a stamped event.
     *
     * @param event the event to store
     * @return completion signal
     */
    Mono<Void> store(BusEvent event);

    /**
     * Updates the status of a stored event.
     *
     * @param id the event id
     * @param status the new status
     * @return completion signal
     */
    Mono<Void> update(String id, EventStatus status);

    /**
     * Retrieves stored events matching the query, oldest first.
     *
     * @param query the filter
     * @return matching events
     */
    Flux<BusEvent> retrieve(EventQuery query);

    /**
     * Checks backend reachability.
     *
     * @return true if the backend answered
     */
    Mono<Boolean> ping();
}
