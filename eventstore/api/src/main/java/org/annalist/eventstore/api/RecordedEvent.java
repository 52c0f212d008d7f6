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

import io.cloudevents.CloudEvent;
import org.annalist.cloudevents.AnnalistExtensionGetter;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * A typed view of a {@link CloudEvent} that has been read back from the event log.
 */
public record RecordedEvent(long globalPosition, String streamId, long streamVersion, TenantId tenantId, String type,
                            OffsetDateTime recordedAt, CloudEvent cloudEvent) {

    public RecordedEvent {
        Objects.requireNonNull(streamId, "streamId cannot be null");
        Objects.requireNonNull(tenantId, "tenantId cannot be null");
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
    }

    public static RecordedEvent from(CloudEvent cloudEvent) {
        return new RecordedEvent(
                AnnalistExtensionGetter.getGlobalPosition(cloudEvent),
                AnnalistExtensionGetter.getStreamId(cloudEvent),
                AnnalistExtensionGetter.getStreamVersion(cloudEvent),
                TenantId.of(AnnalistExtensionGetter.getTenantId(cloudEvent)),
                cloudEvent.getType(),
                AnnalistExtensionGetter.getRecordedAt(cloudEvent),
                cloudEvent);
    }

    public Optional<String> correlationId() {
        return AnnalistExtensionGetter.getCorrelationId(cloudEvent);
    }

    public Optional<String> causationId() {
        return AnnalistExtensionGetter.getCausationId(cloudEvent);
    }
}
