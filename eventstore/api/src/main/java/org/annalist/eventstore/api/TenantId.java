/*
 * Copyright 2020 Johan Haleby
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.annalist.eventstore.api;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Identifies the tenant that owns a stream. A lowercase slug of 2 to 63 characters that starts and ends with a letter or digit,
 * e.g. {@code acme} or {@code north-wind-2}.
 */
public record TenantId(String value) {
    private static final Pattern SLUG = Pattern.compile("^[a-z0-9][a-z0-9-]*[a-z0-9]$");

    public TenantId {
        Objects.requireNonNull(value, TenantId.class.getSimpleName() + " cannot be null");
        if (value.length() < 2 || value.length() > 63) {
            throw new IllegalArgumentException("Tenant id must be between 2 and 63 characters but was \"" + value + "\"");
        } else if (!SLUG.matcher(value).matches()) {
            throw new IllegalArgumentException("Tenant id must be a lowercase slug but was \"" + value + "\"");
        }
    }

    public static TenantId of(String value) {
        return new TenantId(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
