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

import reactor.core.publisher.Mono;

/**
 * An open connection to a live subscriber.
 */
public interface LiveChannel {

    /**
     * Identifies the channel, for logging.
     */
    String id();

    /**
     * Pushes a JSON message to the subscriber.
     *
     * @param json the serialized message
     * @return completion signal, failing if the channel is closed
     */
    Mono<Void> send(String json);
}
