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


package org.fireflyframework.runtime.live;

import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LiveSubscriberRegistry}.
 */
class LiveSubscriberRegistryTest {

    private LiveSubscriberRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new LiveSubscriberRegistry(JsonMapper.builder().build());
    }

    @Test
    @DisplayName("broadcast should reach every channel of the organization only")
    void broadcastTo_reachesOrganizationOnly() {
        RecordingLiveChannel first = new RecordingLiveChannel("a1");
        RecordingLiveChannel second = new RecordingLiveChannel("a2");
        RecordingLiveChannel other = new RecordingLiveChannel("b1");
        registry.add("acme", first);
        registry.add("acme", second);
        registry.add("globex", other);

        StepVerifier.create(registry.broadcastTo("acme", Map.of("type", "begin"))).verifyComplete();

        assertThat(first.messages()).containsExactly("{\"type\":\"begin\"}");
        assertThat(second.messages()).containsExactly("{\"type\":\"begin\"}");
        assertThat(other.messages()).isEmpty();
    }

    @Test
    @DisplayName("a failing channel should not stop delivery to the others")
    void broadcastTo_toleratesFailingChannel() {
        RecordingLiveChannel broken = new RecordingLiveChannel("broken");
        RecordingLiveChannel healthy = new RecordingLiveChannel("healthy");
        broken.breakChannel();
        registry.add("acme", broken);
        registry.add("acme", healthy);

        StepVerifier.create(registry.broadcastTo("acme", Map.of("n", 1))).verifyComplete();

        assertThat(healthy.messages()).hasSize(1);
        assertThat(broken.messages()).isEmpty();
    }

    @Test
    @DisplayName("broadcast to an organization without subscribers should complete")
    void broadcastTo_noSubscribers() {
        StepVerifier.create(registry.broadcastTo("nobody", Map.of("n", 1))).verifyComplete();
    }

    @Test
    @DisplayName("removed channels should no longer be counted or reached")
    void remove_detachesChannel() {
        RecordingLiveChannel channel = new RecordingLiveChannel("a1");
        registry.add("acme", channel);
        registry.add("globex", new RecordingLiveChannel("b1"));
        assertThat(registry.subscriberCount()).isEqualTo(2);

        assertThat(registry.remove(channel)).isTrue();
        assertThat(registry.remove(channel)).isFalse();

        registry.broadcastTo("acme", Map.of("n", 1)).block();
        assertThat(channel.messages()).isEmpty();
        assertThat(registry.subscriberCount("acme")).isZero();
        assertThat(registry.subscriberCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("a sink channel should buffer messages until its consumer subscribes")
    void sinkChannel_buffersUntilSubscribed() {
        SinkLiveChannel channel = new SinkLiveChannel("s1");

        registry.connect("acme", channel, () -> Map.of("catchUp", true)).block();
        registry.broadcastTo("acme", Map.of("n", 1)).block();
        channel.close();

        StepVerifier.create(channel.messages())
                .expectNext("{\"catchUp\":true}")
                .expectNext("{\"n\":1}")
                .verifyComplete();
    }

    @Test
    @DisplayName("updates broadcast during catch-up should follow the snapshot")
    void connect_holdsBackUpdatesUntilSnapshotDelivered() {
        RecordingLiveChannel channel = new RecordingLiveChannel("a1");

        StepVerifier.create(registry.connect("acme", channel, () -> {
                    registry.broadcastTo("acme", Map.of("n", 1)).block();
                    registry.broadcastTo("acme", Map.of("n", 2)).block();
                    return List.of();
                }))
                .verifyComplete();
        registry.broadcastTo("acme", Map.of("n", 3)).block();

        assertThat(channel.messages()).containsExactly("[]", "{\"n\":1}", "{\"n\":2}", "{\"n\":3}");
    }

    @Test
    @DisplayName("a connected channel should be removable by the channel it was connected with")
    void connect_thenRemove() {
        RecordingLiveChannel channel = new RecordingLiveChannel("a1");
        registry.connect("acme", channel, List::of).block();
        assertThat(registry.subscriberCount("acme")).isEqualTo(1);

        assertThat(registry.remove(channel)).isTrue();

        assertThat(registry.subscriberCount("acme")).isZero();
    }

    @Test
    @DisplayName("concurrent broadcasts should all reach a sink channel")
    void broadcastTo_concurrentSendersToSinkChannel() throws Exception {
        SinkLiveChannel channel = new SinkLiveChannel("s1");
        registry.add("acme", channel);
        List<String> received = new CopyOnWriteArrayList<>();
        channel.messages().subscribe(received::add);

        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> senders = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            senders.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    registry.broadcastTo("acme", "m-" + thread + "-" + i).block();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> sender : senders) {
            sender.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertThat(received).hasSize(threads * perThread).doesNotHaveDuplicates();
    }
}
