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

package org.annalist.eventstore.api.internal;

import io.cloudevents.CloudEvent;
import io.cloudevents.SpecVersion;
import org.annalist.cloudevents.AnnalistExtensionGetter;
import org.annalist.eventstore.api.TenantId;
import org.annalist.eventstore.api.TenantMismatchException;

import java.util.List;
import java.util.Objects;

/**
 * Internal validation shared by the event store implementations. Never use this class directly from your own code!
 */
public class AppendedEvents {

    /**
     * Verifies that every event is a CloudEvent v1 that carries a valid tenant id, and that they all carry the same one.
     *
     * @return The tenant of the events, {@code null} if {@code events} is empty
     */
    public static TenantId requireSingleTenant(String streamId, List<CloudEvent> events) {
        TenantId tenant = null;
        for (CloudEvent event : events) {
            Objects.requireNonNull(event, CloudEvent.class.getSimpleName() + " cannot be null");
            if (event.getSpecVersion() != SpecVersion.V1) {
                throw new IllegalArgumentException("Spec version needs to be " + SpecVersion.V1);
            }
            TenantId eventTenant = AnnalistExtensionGetter.findTenantId(event)
                    .map(TenantId::of)
                    .orElseThrow(() -> new IllegalArgumentException("Event " + event.getId() + " written to stream " + streamId + " has no tenant id"));
            if (tenant == null) {
                tenant = eventTenant;
            } else if (!tenant.equals(eventTenant)) {
                throw new TenantMismatchException(streamId, tenant, eventTenant);
            }
        }
        return tenant;
    }

    /**
     * @throws TenantMismatchException if the stream is owned by another tenant than {@code tenant}
     */
    public static void requireOwner(String streamId, TenantId owner, TenantId tenant) {
        if (owner != null && !owner.equals(tenant)) {
            throw new TenantMismatchException(streamId, owner, tenant);
        }
    }
}
