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

package org.fireflyframework.runtime.fault;

import org.fireflyframework.runtime.metrics.RuntimeMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

/**
 * Default {@link FaultHandler}: logs every fault at ERROR level and counts it
 * when metrics are available.
 */
@Slf4j
public class LoggingFaultHandler implements FaultHandler {

    @Nullable
    private final RuntimeMetrics metrics;

    public LoggingFaultHandler(@Nullable RuntimeMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void report(String message, Throwable error) {
        log.error("RUNTIME_FAULT: {} ({})", message, error.getClass().getSimpleName(), error);
        if (metrics != null) {
            metrics.recordFault(error);
        }
    }
}
