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

import java.util.regex.Pattern;

/**
 * Maps organization names to tenant database names and back.
 */
public class OrganizationNames {

    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private final String prefix;
    private final String defaultOrganization;

    public OrganizationNames(String prefix, String defaultOrganization) {
        this.prefix = prefix;
        this.defaultOrganization = defaultOrganization;
    }

    /**
     * Resolves the organization to use, falling back to the default one.
     *
     * @param organization the requested organization, may be null or blank
     * @return a valid organization name
     * @throws IllegalArgumentException if the name contains unsupported characters
     */
    public String normalize(String organization) {
        if (organization == null || organization.isBlank()) {
            return defaultOrganization;
        }
        String trimmed = organization.trim();
        if (!VALID_NAME.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Invalid organization name: " + organization);
        }
        return trimmed;
    }

    public String databaseName(String organization) {
        return prefix + normalize(organization);
    }

    public boolean isTenantDatabase(String databaseName) {
        return databaseName != null && databaseName.startsWith(prefix) && databaseName.length() > prefix.length();
    }

    public String organizationOf(String databaseName) {
        return databaseName.substring(prefix.length());
    }

    public String defaultOrganization() {
        return defaultOrganization;
    }
}
