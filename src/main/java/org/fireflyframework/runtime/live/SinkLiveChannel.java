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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * {@link LiveChannel} buffering messages in a Reactor sink until the
 * transport consumes them through {@link #messages()}. Safe for concurrent
 * senders.
 */
public class SinkLiveChannel implements LiveChannel {

    private final String id;
    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();

    public SinkLiveChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Mono<Void> send(String json) {
        return Mono.defer(() -> {
            Sinks.EmitResult result = emit(json);
            if (result.isFailure()) {
                return Mono.error(new IllegalStateException("Live channel " + id + " rejected message: " + result));
            }
            return Mono.empty();
        });
    }

    /**
     * Returns the outbound messages. Only one subscriber is supported.
     */
    public Flux<String> messages() {
        return sink.asFlux();
    }

    public synchronized void close() {
        sink.tryEmitComplete();
    }

    // unicast sinks reject concurrent emissions
    private synchronized Sinks.EmitResult emit(String json) {
        return sink.tryEmitNext(json);
    }
}
