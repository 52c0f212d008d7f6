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
import io.cloudevents.CloudEventExtension;
import io.cloudevents.CloudEventExtensions;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Set;

/**
 * A {@link CloudEvent} {@link CloudEventExtension} holding the metadata that the event log assigns when an event is appended:<br><br>
 *
 * <table>
 *     <tr><th>Key</th><th>Description</th></tr>
 *     <tr><td>{@value #STREAM_ID}</td><td>The id of the stream that owns the event</td></tr>
 *     <tr><td>{@value #STREAM_VERSION}</td><td>The 1-based version of the event in its stream</td></tr>
 *     <tr><td>{@value #GLOBAL_POSITION}</td><td>The position of the event in the log as a whole</td></tr>
 *     <tr><td>{@value #TENANT_ID}</td><td>The tenant that owns the stream</td></tr>
 *     <tr><td>{@value #RECORDED_AT}</td><td>When the event log accepted the event</td></tr>
 * </table>
 * <p>
 * Callers only ever supply {@value #TENANT_ID} themselves, the other attributes are overwritten by the event log.
 */
public class AnnalistCloudEventExtension implements CloudEventExtension {
    public static final String STREAM_ID = "streamid";
    public static final String STREAM_VERSION = "streamversion";
    public static final String GLOBAL_POSITION = "globalposition";
    public static final String TENANT_ID = "tenantid";
    public static final String RECORDED_AT = "recordedat";

    static final Set<String> KEYS = Set.of(STREAM_ID, STREAM_VERSION, GLOBAL_POSITION, TENANT_ID, RECORDED_AT);

    private String streamId;
    private long streamVersion;
    private long globalPosition;
    private String tenantId;
    private OffsetDateTime recordedAt;

    public AnnalistCloudEventExtension(String streamId, long streamVersion, long globalPosition, String tenantId, OffsetDateTime recordedAt) {
        Objects.requireNonNull(streamId, "StreamId cannot be null");
        Objects.requireNonNull(tenantId, "TenantId cannot be null");
        Objects.requireNonNull(recordedAt, "RecordedAt cannot be null");
        if (streamVersion < 1) {
            throw new IllegalArgumentException("Stream version cannot be less than 1");
        } else if (globalPosition < 1) {
            throw new IllegalArgumentException("Global position cannot be less than 1");
        }
        this.streamId = streamId;
        this.streamVersion = streamVersion;
        this.globalPosition = globalPosition;
        this.tenantId = tenantId;
        this.recordedAt = recordedAt;
    }

    public static AnnalistCloudEventExtension annalist(String streamId, long streamVersion, long globalPosition, String tenantId, OffsetDateTime recordedAt) {
        return new AnnalistCloudEventExtension(streamId, streamVersion, globalPosition, tenantId, recordedAt);
    }

    @Override
    public void readFrom(CloudEventExtensions extensions) {
        Object streamId = extensions.getExtension(STREAM_ID);
        if (streamId != null) {
            this.streamId = streamId.toString();
        }

        Object streamVersion = extensions.getExtension(STREAM_VERSION);
        if (streamVersion instanceof Number) {
            this.streamVersion = ((Number) streamVersion).longValue();
        }

        Object globalPosition = extensions.getExtension(GLOBAL_POSITION);
        if (globalPosition instanceof Number) {
            this.globalPosition = ((Number) globalPosition).longValue();
        }

        Object tenantId = extensions.getExtension(TENANT_ID);
        if (tenantId != null) {
            this.tenantId = tenantId.toString();
        }

        Object recordedAt = extensions.getExtension(RECORDED_AT);
        if (recordedAt instanceof OffsetDateTime) {
            this.recordedAt = (OffsetDateTime) recordedAt;
        } else if (recordedAt != null) {
            this.recordedAt = OffsetDateTime.parse(recordedAt.toString());
        }
    }

    @Override
    public Object getValue(String key) throws IllegalArgumentException {
        switch (key) {
            case STREAM_ID:
                return streamId;
            case STREAM_VERSION:
                return streamVersion;
            case GLOBAL_POSITION:
                return globalPosition;
            case TENANT_ID:
                return tenantId;
            case RECORDED_AT:
                return recordedAt;
            default:
                throw new IllegalArgumentException(this.getClass().getSimpleName() + " doesn't expect the attribute key \"" + key + "\"");
        }
    }

    @Override
    public Set<String> getKeys() {
        return KEYS;
    }
}
