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
import org.fireflyframework.runtime.bus.model.EventStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Bounded, insertion-ordered buffer of bus events that could not be written
 * to the durable backend yet.
 * <p>
 * When a {@link #put} pushes the buffer past its capacity, the oldest entries
 * are evicted first. Every mutation runs under the buffer's monitor, so the
 * drain loop and concurrent store/update calls never lose updates or drain the
 * same event twice.
 */
@Slf4j
public class EventDurabilityQueue {

    public static final int DEFAULT_CAPACITY = 1000;

    private final LinkedList<BusEvent> events = new LinkedList<>();
    private final int capacity;

    public EventDurabilityQueue() {
        this(DEFAULT_CAPACITY);
    }

    public EventDurabilityQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Appends an event at the tail, evicting the oldest entries while the
     * buffer exceeds its capacity.
     *
     * @param event the event to buffer
     * @return the evicted events, oldest first
     */
    public synchronized List<BusEvent> put(BusEvent event) {
        Objects.requireNonNull(event, "event cannot be null");
        events.addLast(event);
        if (events.size() <= capacity) {
            return List.of();
        }
        List<BusEvent> evicted = new ArrayList<>();
        while (events.size() > capacity) {
            BusEvent dropped = events.removeFirst();
            evicted.add(dropped);
            log.debug("Durability buffer full ({}), evicted oldest event: {}", capacity, dropped.id());
        }
        return evicted;
    }

    /**
     * Removes and returns every buffered event in insertion order.
     *
     * @return the drained events, empty if nothing was buffered
     */
    public synchronized List<BusEvent> drainAll() {
        List<BusEvent> drained = new ArrayList<>(events);
        events.clear();
        return drained;
    }

    /**
     * Overwrites the status of the first buffered event with the given id.
     *
     * @param id the event id
     * @param status the new status
     * @return true if a buffered event was updated
     */
    public synchronized boolean updateStatus(String id, EventStatus status) {
        ListIterator<BusEvent> iterator = events.listIterator();
        while (iterator.hasNext()) {
            BusEvent event = iterator.next();
            if (event.id().equals(id)) {
                iterator.set(event.withStatus(status));
                return true;
            }
        }
        return false;
    }

    /**
     * Removes the buffered event with the given id and creation time, if it is
     * still buffered. Used by TTL expiry; an event already drained is a no-op.
     *
     * @param id the event id
     * @param createdAt the creation stamp the expiry was scheduled for
     * @return true if an event was removed
     */
    public synchronized boolean expire(String id, Instant createdAt) {
        Iterator<BusEvent> iterator = events.iterator();
        while (iterator.hasNext()) {
            BusEvent event = iterator.next();
            if (event.id().equals(id) && Objects.equals(event.createdAt(), createdAt)) {
                iterator.remove();
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the buffered events matching the filter, in buffer order, without
     * removing them. For queries only; delivery goes through {@link #drainAll()}.
     *
     * @param filter the filter to apply
     * @return matching events
     */
    public synchronized List<BusEvent> select(Predicate<? super BusEvent> filter) {
        return events.stream().filter(filter).toList();
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized boolean isEmpty() {
        return events.isEmpty();
    }

    public int capacity() {
        return capacity;
    }
}
