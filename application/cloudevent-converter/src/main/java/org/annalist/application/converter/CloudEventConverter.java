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

package org.annalist.application.converter;

import io.cloudevents.CloudEvent;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts the domain events of one aggregate type to the cloud events stored in the log, and back.
 *
 * @param <T> The type of your domain events
 */
public interface CloudEventConverter<T> {

    CloudEvent toCloudEvent(T domainEvent);

    /**
     * @throws UnknownEventTypeException If the type of {@code cloudEvent} isn't known to the converter
     */
    T toDomainEvent(CloudEvent cloudEvent);

    /**
     * The event types this converter knows about.
     */
    EventTypeRegistry<T> eventTypes();

    default List<CloudEvent> toCloudEvents(List<? extends T> domainEvents) {
        return domainEvents.stream().map(this::toCloudEvent).collect(Collectors.toList());
    }

    /**
     * @return {@code true} if {@link #toDomainEvent(CloudEvent)} can decode {@code cloudEvent}
     */
    default boolean canConvert(CloudEvent cloudEvent) {
        return eventTypes().isRegistered(cloudEvent.getType());
    }
}
