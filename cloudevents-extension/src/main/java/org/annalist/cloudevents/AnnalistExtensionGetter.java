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

import io.cloudevents.CloudEvent;

import java.time.OffsetDateTime;
import java.util.Optional;

import static org.annalist.cloudevents.AnnalistCloudEventExtension.*;
import static org.annalist.cloudevents.CorrelationCloudEventExtension.CAUSATION_ID;
import static org.annalist.cloudevents.CorrelationCloudEventExtension.CORRELATION_ID;

/**
 * Utility class that helps get annalist extension values, and converts them to the correct type, from a {@link CloudEvent}.
 */
public class AnnalistExtensionGetter {

    /**
     * Get the stream version from a {@link CloudEvent} that has {@link AnnalistCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the stream version
     */
    public static long getStreamVersion(CloudEvent cloudEvent) {
        return getLong(cloudEvent, STREAM_VERSION);
    }

    /**
     * Get the global position from a {@link CloudEvent} read from the event log.
     *
     * @param cloudEvent The cloud event
     * @return the global position
     */
    public static long getGlobalPosition(CloudEvent cloudEvent) {
        return getLong(cloudEvent, GLOBAL_POSITION);
    }

    /**
     * Get the stream id from a {@link CloudEvent} that has {@link AnnalistCloudEventExtension} applied.
     *
     * @param cloudEvent The cloud event
     * @return the stream id
     */
    public static String getStreamId(CloudEvent cloudEvent) {
        return getString(cloudEvent, STREAM_ID);
    }

    /**
     * @param cloudEvent The cloud event
     * @return the tenant id
     * @throws IllegalArgumentException if the cloud event carries no tenant id
     */
    public static String getTenantId(CloudEvent cloudEvent) {
        return getString(cloudEvent, TENANT_ID);
    }

    public static Optional<String> findTenantId(CloudEvent cloudEvent) {
        return Optional.ofNullable(cloudEvent.getExtension(TENANT_ID)).map(Object::toString);
    }

    public static OffsetDateTime getRecordedAt(CloudEvent cloudEvent) {
        Object recordedAt = requireExtension(cloudEvent, RECORDED_AT);
        if (recordedAt instanceof OffsetDateTime) {
            return (OffsetDateTime) recordedAt;
        }
        return OffsetDateTime.parse(recordedAt.toString());
    }

    public static Optional<String> getCorrelationId(CloudEvent cloudEvent) {
        return Optional.ofNullable(cloudEvent.getExtension(CORRELATION_ID)).map(Object::toString);
    }

    public static Optional<String> getCausationId(CloudEvent cloudEvent) {
        return Optional.ofNullable(cloudEvent.getExtension(CAUSATION_ID)).map(Object::toString);
    }

    private static long getLong(CloudEvent cloudEvent, String key) {
        Object value = requireExtension(cloudEvent, key);
        if (!(value instanceof Number)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + key + " value that is an instance of " + long.class.getSimpleName());
        }
        return ((Number) value).longValue();
    }

    private static String getString(CloudEvent cloudEvent, String key) {
        Object value = requireExtension(cloudEvent, key);
        if (!(value instanceof String)) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain a " + key + " value that is an instance of " + String.class.getSimpleName());
        }
        return (String) value;
    }

    private static Object requireExtension(CloudEvent cloudEvent, String key) {
        Object value = cloudEvent.getExtension(key);
        if (value == null) {
            throw new IllegalArgumentException(CloudEvent.class.getSimpleName() + " does not contain the " + key + " key");
        }
        return value;
    }
}
