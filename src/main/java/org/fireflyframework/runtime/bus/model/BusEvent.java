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

package org.fireflyframework.runtime.bus.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * An outbound bus event awaiting durable storage.
 * <p>
 * Identity is {@link #id()}. The persistence layer only ever changes
 * {@link #status()} and {@link #createdAt()}, always through the copy methods.
 *
 * @param id opaque event identifier
 * @param status delivery status
 * @param topic bus topic the event is published to
 * @param payload serialized message
 * @param createdAt time the event was handed to the persistence layer, null until stamped
 */
public record BusEvent(
        String id,
        EventStatus status,
        String topic,
        String payload,
        Instant createdAt
) implements Serializable {

    public BusEvent {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(status, "status cannot be null");
        Objects.requireNonNull(topic, "topic cannot be null");
    }

    /**
     * Creates a copy with the given status.
     *
     * @param newStatus the new status
     * @return updated event
     */
    public BusEvent withStatus(EventStatus newStatus) {
        return new BusEvent(id, newStatus, topic, payload, createdAt);
    }

    /**
     * Creates a copy stamped with the given creation time.
     *
     * @param timestamp the creation time
     * @return updated event
     */
    public BusEvent withCreatedAt(Instant timestamp) {
        return new BusEvent(id, status, topic, payload, timestamp);
    }
}
