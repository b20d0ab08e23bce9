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

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Filter applied when retrieving stored bus events.
 * <p>
 * An empty status set matches every status; a null {@code since} matches every
 * creation time.
 *
 * @param since lower bound (inclusive) on {@link BusEvent#createdAt()}, may be null
 * @param statuses accepted statuses, empty for any
 */
public record EventQuery(Instant since, Set<EventStatus> statuses) implements Predicate<BusEvent> {

    public EventQuery {
        statuses = statuses == null || statuses.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(statuses));
    }

    public static EventQuery all() {
        return new EventQuery(null, Set.of());
    }

    public static EventQuery since(Instant since) {
        return new EventQuery(since, Set.of());
    }

    public static EventQuery withStatus(EventStatus first, EventStatus... others) {
        return new EventQuery(null, EnumSet.of(first, others));
    }

    /**
     * Creates a copy restricted to the given statuses.
     *
     * @param accepted accepted statuses
     * @return updated query
     */
    public EventQuery andStatuses(Set<EventStatus> accepted) {
        return new EventQuery(since, accepted);
    }

    @Override
    public boolean test(BusEvent event) {
        boolean sinceMatches = since == null
                || (event.createdAt() != null && !event.createdAt().isBefore(since));
        boolean statusMatches = statuses.isEmpty() || statuses.contains(event.status());
        return sinceMatches && statusMatches;
    }
}
