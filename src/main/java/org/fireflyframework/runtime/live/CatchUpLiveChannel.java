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

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Wraps a newly connected channel so that messages broadcast before its
 * catch-up snapshot was delivered are held back and sent after it, in order.
 * A message the delegate rejects during catch-up is logged and skipped.
 */
@Slf4j
class CatchUpLiveChannel implements LiveChannel {

    private final LiveChannel delegate;
    private final List<String> pending = new ArrayList<>();
    private boolean open;

    CatchUpLiveChannel(LiveChannel delegate) {
        this.delegate = delegate;
    }

    LiveChannel delegate() {
        return delegate;
    }

    @Override
    public String id() {
        return delegate.id();
    }

    @Override
    public Mono<Void> send(String json) {
        return Mono.defer(() -> {
            synchronized (this) {
                if (!open) {
                    pending.add(json);
                    return Mono.empty();
                }
            }
            return delegate.send(json);
        });
    }

    /**
     * Delivers the catch-up message, then everything held back meanwhile.
     *
     * @param catchUp the serialized snapshot
     * @return completion once the channel delivers directly
     */
    Mono<Void> open(String catchUp) {
        return deliver(catchUp).then(flushPending());
    }

    private Mono<Void> flushPending() {
        return Mono.defer(() -> {
            List<String> held;
            synchronized (this) {
                if (pending.isEmpty()) {
                    open = true;
                    return Mono.empty();
                }
                held = new ArrayList<>(pending);
                pending.clear();
            }
            return Flux.fromIterable(held)
                    .concatMap(this::deliver)
                    .then(flushPending());
        });
    }

    private Mono<Void> deliver(String json) {
        return delegate.send(json)
                .onErrorResume(error -> {
                    log.warn("Could not deliver live update to channel {}: {}", delegate.id(), error.getMessage());
                    return Mono.empty();
                });
    }
}
