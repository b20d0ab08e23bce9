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


package org.fireflyframework.runtime.live.websocket;

import org.fireflyframework.runtime.live.SinkLiveChannel;
import org.fireflyframework.runtime.workflow.WorkflowRuntimeRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

/**
 * WebSocket endpoint streaming live workflow updates.
 * <p>
 * The subscriber's organization is read from a handshake header. On connect
 * the client receives the reports of every running execution of its
 * organization, then one message per lifecycle event. Inbound messages are
 * ignored.
 */
@Slf4j
public class WorkflowWebSocketHandler implements WebSocketHandler {

    private final WorkflowRuntimeRegistry runtimeRegistry;
    private final String organizationHeader;

    public WorkflowWebSocketHandler(WorkflowRuntimeRegistry runtimeRegistry, String organizationHeader) {
        this.runtimeRegistry = runtimeRegistry;
        this.organizationHeader = organizationHeader;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        String organization = session.getHandshakeInfo().getHeaders().getFirst(organizationHeader);
        SinkLiveChannel channel = new SinkLiveChannel(session.getId());

        Mono<Void> outbound = session.send(channel.messages().map(session::textMessage));
        Mono<Void> inbound = session.receive().then();

        return runtimeRegistry.connect(organization, channel)
                .doOnSuccess(v -> log.debug("Live session opened: session={}, organization={}",
                        session.getId(), organization))
                .then(Mono.firstWithSignal(inbound, outbound))
                .doFinally(signal -> {
                    runtimeRegistry.disconnect(channel);
                    channel.close();
                    log.debug("Live session closed: session={}, signal={}", session.getId(), signal);
                });
    }
}
