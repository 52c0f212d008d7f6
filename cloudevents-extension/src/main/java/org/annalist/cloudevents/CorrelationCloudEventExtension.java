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

package org.annalist.cloudevents;

import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Optional tracing attributes. {@value #CORRELATION_ID} ties together every event caused by the same request,
 * {@value #CAUSATION_ID} names the message that directly caused the event. Only attributes that have a value are written.
 */
public class CorrelationCloudEventExtension implements CloudEventExtension {
    public static final String CORRELATION_ID = "correlationid";
    public static final String CAUSATION_ID = "causationid";

    private @Nullable String correlationId;
    private @Nullable String causationId;

    public CorrelationCloudEventExtension(@Nullable String correlationId, @Nullable String causationId) {
        this.correlationId = correlationId;
        this.causationId = causationId;
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object correlationId = extensions.getExtension(CORRELATION_ID);
        if (correlationId != null) {
            this.correlationId = correlationId.toString();
        }
        Object causationId = extensions.getExtension(CAUSATION_ID);
        if (causationId != null) {
            this.causationId = causationId.toString();
        }
    }

    @Override
    public @Nullable Object getValue(String key) throws IllegalArgumentException {
        if (CORRELATION_ID.equals(key)) {
            return correlationId;
        } else if (CAUSATION_ID.equals(key)) {
            return causationId;
        }
        throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
    }

    @Override
    public Set<String> getKeys() {
        Set<String> keys = new LinkedHashSet<>();
        if (correlationId != null) {
            keys.add(CORRELATION_ID);
        }
        if (causationId != null) {
            keys.add(CAUSATION_ID);
        }
        return keys;
    }
}
