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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventDurabilityQueueTest {

    private static final Instant CREATED = Instant.parse("2026-01-01T10:00:00Z");

    private static BusEvent event(String id) {
        return new BusEvent(id, EventStatus.PENDING, "orders", "{}", CREATED);
    }

    @Nested
    @DisplayName("Bounds")
    class BoundsTests {

        @Test
        @DisplayName("should evict the oldest events once capacity is exceeded")
        void put_overCapacity_evictsOldestFirst() {
            EventDurabilityQueue queue = new EventDurabilityQueue(3);

            for (int i = 1; i <= 3; i++) {
                assertThat(queue.put(event("e" + i))).isEmpty();
            }
            List<BusEvent> evicted = queue.put(event("e4"));

            assertThat(evicted).extracting(BusEvent::id).containsExactly("e1");
            assertThat(queue.size()).isEqualTo(3);
            assertThat(queue.drainAll()).extracting(BusEvent::id).containsExactly("e2", "e3", "e4");
        }

        @Test
        @DisplayName("should never hold more than its capacity")
        void put_manyEvents_staysBounded() {
            EventDurabilityQueue queue = new EventDurabilityQueue(10);

            for (int i = 0; i < 1000; i++) {
                queue.put(event("e" + i));
                assertThat(queue.size()).isLessThanOrEqualTo(10);
            }

            assertThat(queue.drainAll()).extracting(BusEvent::id).startsWith("e990").endsWith("e999");
        }

        @Test
        @DisplayName("should default to a capacity of 1000")
        void defaultCapacity() {
            assertThat(new EventDurabilityQueue().capacity()).isEqualTo(1000);
        }

        @Test
        @DisplayName("should reject a non-positive capacity")
        void constructor_invalidCapacity() {
            assertThatThrownBy(() -> new EventDurabilityQueue(0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Drain and update")
    class DrainTests {

        @Test
        @DisplayName("drainAll should return events in insertion order and empty the buffer")
        void drainAll_returnsInOrderAndEmpties() {
            EventDurabilityQueue queue = new EventDurabilityQueue(5);
            queue.put(event("a"));
            queue.put(event("b"));

            assertThat(queue.drainAll()).extracting(BusEvent::id).containsExactly("a", "b");
            assertThat(queue.isEmpty()).isTrue();
            assertThat(queue.drainAll()).isEmpty();
        }

        @Test
        @DisplayName("updateStatus should change a buffered event in place")
        void updateStatus_keepsPosition() {
            EventDurabilityQueue queue = new EventDurabilityQueue(5);
            queue.put(event("a"));
            queue.put(event("b"));

            assertThat(queue.updateStatus("a", EventStatus.SENT)).isTrue();
            assertThat(queue.updateStatus("missing", EventStatus.SENT)).isFalse();

            List<BusEvent> drained = queue.drainAll();
            assertThat(drained).extracting(BusEvent::id).containsExactly("a", "b");
            assertThat(drained.get(0).status()).isEqualTo(EventStatus.SENT);
        }

        @Test
        @DisplayName("expire should remove only the matching event, even after a status update")
        void expire_matchesIdAndCreation() {
            EventDurabilityQueue queue = new EventDurabilityQueue(5);
            queue.put(event("a"));
            queue.put(event("b"));
            queue.updateStatus("a", EventStatus.FAILED);

            assertThat(queue.expire("a", CREATED.plusSeconds(1))).isFalse();
            assertThat(queue.expire("a", CREATED)).isTrue();
            assertThat(queue.expire("a", CREATED)).isFalse();
            assertThat(queue.drainAll()).extracting(BusEvent::id).containsExactly("b");
        }

        @Test
        @DisplayName("select should filter without removing")
        void select_doesNotRemove() {
            EventDurabilityQueue queue = new EventDurabilityQueue(5);
            queue.put(event("a"));
            queue.put(event("b").withStatus(EventStatus.SENT));

            assertThat(queue.select(EventQuery.withStatus(EventStatus.SENT)))
                    .extracting(BusEvent::id).containsExactly("b");
            assertThat(queue.size()).isEqualTo(2);
        }
    }

    @Test
    @DisplayName("concurrent producers and a drainer should neither lose nor duplicate events")
    void concurrentPutAndDrain_deliversEachEventOnce() throws InterruptedException {
        EventDurabilityQueue queue = new EventDurabilityQueue(100_000);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        List<BusEvent> drained = new CopyOnWriteArrayList<>();

        for (int t = 0; t < 4; t++) {
            int thread = t;
            executor.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    queue.put(event(thread + "-" + i));
                    if (i % 50 == 0) {
                        drained.addAll(queue.drainAll());
                    }
                }
                done.countDown();
            });
        }
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();
        drained.addAll(queue.drainAll());

        assertThat(drained).hasSize(2000);
        assertThat(drained).extracting(BusEvent::id).doesNotHaveDuplicates();
    }
}
