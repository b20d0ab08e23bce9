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


package org.fireflyframework.runtime.config;

import org.fireflyframework.runtime.live.websocket.WorkflowWebSocketHandler;
import org.fireflyframework.runtime.properties.RuntimeProperties;
import org.fireflyframework.runtime.workflow.WorkflowRuntimeRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;
import org.springframework.web.reactive.socket.WebSocketHandler;

import java.util.Map;

/**
 * Auto-configuration exposing live workflow updates over a WebSocket endpoint.
 * <p>
 * Only active in reactive web applications where a {@link WorkflowRuntimeRegistry}
 * is available. The handler adapter comes from WebFlux itself.
 */
@Slf4j
@AutoConfiguration(after = WorkflowRuntimeAutoConfiguration.class,
        afterName = "org.springframework.boot.autoconfigure.web.reactive.WebFluxAutoConfiguration")
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.REACTIVE)
@ConditionalOnClass(WebSocketHandler.class)
@ConditionalOnBean(WorkflowRuntimeRegistry.class)
@ConditionalOnProperty(prefix = "firefly.runtime.live", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkflowRuntimeWebSocketAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WorkflowWebSocketHandler workflowWebSocketHandler(WorkflowRuntimeRegistry workflowRuntimeRegistry,
                                                             RuntimeProperties properties) {
        log.info("Creating WorkflowWebSocketHandler on {}", properties.getLive().getPath());
        return new WorkflowWebSocketHandler(workflowRuntimeRegistry, properties.getLive().getOrganizationHeader());
    }

    @Bean
    @ConditionalOnMissingBean(name = "workflowWebSocketHandlerMapping")
    public HandlerMapping workflowWebSocketHandlerMapping(WorkflowWebSocketHandler handler,
                                                          RuntimeProperties properties) {
        return new SimpleUrlHandlerMapping(Map.of(properties.getLive().getPath(), handler), -1);
    }
}
