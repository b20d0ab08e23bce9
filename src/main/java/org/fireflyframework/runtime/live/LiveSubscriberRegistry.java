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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Open live channels, grouped by organization.
 * <p>
 * A message is only ever delivered to channels of the organization it is
 * addressed to. Delivery failures on one channel are logged and do not affect
 * the others.
 */
@Slf4j
public class LiveSubscriberRegistry {

    private final Map<String, Set<LiveChannel>> channelsByOrganization = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;

    public LiveSubscriberRegistry(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void add(String organization, LiveChannel channel) {
        channelsByOrganization
                .computeIfAbsent(organization, org -> ConcurrentHashMap.newKeySet())
                .add(channel);
        log.debug("Live subscriber connected: channel={}, organization={}", channel.id(), organization);
    }

    /**
     * Adds a channel that first receives a catch-up snapshot. Messages
     * broadcast while the snapshot is being delivered reach the channel after
     * it, in broadcast order.
     *
     * @param organization the organization
     * @param channel the channel
     * @param catchUp supplies the snapshot, evaluated once the channel is registered
     * @return completion once the snapshot and any held-back messages were delivered
     */
    public Mono<Void> connect(String organization, LiveChannel channel, Supplier<?> catchUp) {
        CatchUpLiveChannel gated = new CatchUpLiveChannel(channel);
        add(organization, gated);
        return Mono.fromSupplier(catchUp)
                .flatMap(this::serialize)
                .flatMap(gated::open)
                .doOnError(error -> remove(channel));
    }

    /**
     * Removes a channel from whichever organization it belongs to.
     *
     * @param channel the channel
     * @return true if the channel was registered
     */
    public boolean remove(LiveChannel channel) {
        boolean removed = false;
        for (Set<LiveChannel> channels : channelsByOrganization.values()) {
            removed |= channels.removeIf(registered -> isSameChannel(registered, channel));
        }
        if (removed) {
            log.debug("Live subscriber disconnected: channel={}", channel.id());
        }
        return removed;
    }

    /**
     * Delivers a payload to every channel of an organization.
     *
     * @param organization the organization
     * @param payload the payload, serialized to JSON once
     * @return completion once every delivery was attempted
     */
    public Mono<Void> broadcastTo(String organization, Object payload) {
        Set<LiveChannel> channels = channelsByOrganization.get(organization);
        if (channels == null || channels.isEmpty()) {
            return Mono.empty();
        }
        List<LiveChannel> targets = List.copyOf(channels);
        return serialize(payload)
                .flatMapMany(json -> Flux.fromIterable(targets).flatMap(channel -> deliver(channel, json)))
                .then();
    }

    public int subscriberCount() {
        return channelsByOrganization.values().stream().mapToInt(Set::size).sum();
    }

    public int subscriberCount(String organization) {
        Set<LiveChannel> channels = channelsByOrganization.get(organization);
        return channels != null ? channels.size() : 0;
    }

    private static boolean isSameChannel(LiveChannel registered, LiveChannel channel) {
        if (registered instanceof CatchUpLiveChannel) {
            return ((CatchUpLiveChannel) registered).delegate().equals(channel);
        }
        return registered.equals(channel);
    }

    private Mono<String> serialize(Object payload) {
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(payload));
    }

    private Mono<Void> deliver(LiveChannel channel, String json) {
        return channel.send(json)
                .onErrorResume(error -> {
                    log.warn("Could not deliver live update to channel {}: {}", channel.id(), error.getMessage());
                    return Mono.empty();
                });
    }
}
