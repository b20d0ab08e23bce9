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

package org.fireflyframework.runtime.bus.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery status of a bus event.
 */
public enum EventStatus {

    /**
     * Event handed to the bus transport, delivery not yet confirmed.
     */
    PENDING,

    /**
     * Event delivered by the bus transport.
     */
    SENT,

    /**
     * Event delivery failed.
     */
    FAILED;

    /**
     * Returns the lower-case value used in stored documents.
     *
     * @return the stored value
     */
    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a stored value back to its status.
     *
     * @param value the stored value, case-insensitive
     * @return the matching status
     * @throws IllegalArgumentException if the value is unknown
     */
    public static EventStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
