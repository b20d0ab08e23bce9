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


package org.fireflyframework.runtime.tenant;

import lombok.Getter;

/**
 * Thrown when the storage handle of an organization could not be created,
 * either because the store is unreachable or because its initialization failed.
 * <p>
 * A failed attempt is never cached; the next call tries again.
 */
@Getter
public class TenantInitFailedException extends TenantStoreException {

    private final String organization;

    public TenantInitFailedException(String organization, String reason) {
        super("Could not set up storage for organization '" + organization + "': " + reason);
        this.organization = organization;
    }

    public TenantInitFailedException(String organization, Throwable cause) {
        super("Could not set up storage for organization '" + organization + "': " + cause.getMessage(), cause);
        this.organization = organization;
    }
}
