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

package org.annalist.application.converter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.CloudEventData;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.data.BytesCloudEventData;
import org.annalist.application.converter.CloudEventConverter;
import org.annalist.application.converter.EventTypeRegistry;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * A {@link CloudEventConverter} that stores domain events as JSON written by a Jackson {@link ObjectMapper}. The cloud
 * event type of each domain event class comes from an {@link EventTypeRegistry}, so renaming a class never changes
 * what is stored in the log.
 * <p>
 * By default every cloud event gets a random id, the current time and no subject. Use {@link #builder(ObjectMapper, URI, EventTypeRegistry)}
 * to derive the id and subject from the domain event or to fix the clock.
 *
 * @param <T> The type of your domain events
 */
public class JacksonCloudEventConverter<T> implements CloudEventConverter<T> {
    private static final String JSON = "application/json";

    private final ObjectMapper objectMapper;
    private final URI source;
    private final EventTypeRegistry<T> eventTypes;
    private final Function<T, String> idMapper;
    private final Function<T, @Nullable String> subjectMapper;
    private final Clock clock;

    public JacksonCloudEventConverter(ObjectMapper objectMapper, URI source, EventTypeRegistry<T> eventTypes) {
        this(builder(objectMapper, source, eventTypes));
    }

    private JacksonCloudEventConverter(Builder<T> builder) {
        this.objectMapper = builder.objectMapper;
        this.source = builder.source;
        this.eventTypes = builder.eventTypes;
        this.idMapper = builder.idMapper;
        this.subjectMapper = builder.subjectMapper;
        this.clock = builder.clock;
    }

    public static <T> Builder<T> builder(ObjectMapper objectMapper, URI source, EventTypeRegistry<T> eventTypes) {
        return new Builder<>(objectMapper, source, eventTypes);
    }

    /**
     * @throws org.annalist.application.converter.UnknownEventTypeException If the class of {@code domainEvent} isn't registered
     */
    @Override
    public CloudEvent toCloudEvent(T domainEvent) {
        requireNonNull(domainEvent, "domainEvent cannot be null");
        @SuppressWarnings("unchecked")
        Class<? extends T> domainEventType = (Class<? extends T>) domainEvent.getClass();
        String type = eventTypes.getCloudEventType(domainEventType);
        final byte[] json;
        try {
            json = objectMapper.writeValueAsBytes(domainEvent);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write " + type + " as JSON", e);
        }
        return CloudEventBuilder.v1()
                .withId(idMapper.apply(domainEvent))
                .withSource(source)
                .withType(type)
                .withTime(OffsetDateTime.now(clock))
                .withSubject(subjectMapper.apply(domainEvent))
                .withDataContentType(JSON)
                .withData(BytesCloudEventData.wrap(json))
                .build();
    }

    /**
     * @throws org.annalist.application.converter.UnknownEventTypeException If the type of {@code cloudEvent} isn't registered
     */
    @Override
    public T toDomainEvent(CloudEvent cloudEvent) {
        requireNonNull(cloudEvent, CloudEvent.class.getSimpleName() + " cannot be null");
        Class<? extends T> domainEventType = eventTypes.getDomainEventType(cloudEvent.getType());
        CloudEventData data = cloudEvent.getData();
        if (data == null) {
            throw new IllegalArgumentException("Cloud event " + cloudEvent.getId() + " of type " + cloudEvent.getType() + " has no data");
        }
        try {
            return objectMapper.readValue(data.toBytes(), domainEventType);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read cloud event " + cloudEvent.getId() + " as " + domainEventType.getName(), e);
        }
    }

    @Override
    public EventTypeRegistry<T> eventTypes() {
        return eventTypes;
    }

    public static final class Builder<T> {
        private final ObjectMapper objectMapper;
        private final URI source;
        private final EventTypeRegistry<T> eventTypes;
        private Function<T, String> idMapper = __ -> UUID.randomUUID().toString();
        private Function<T, @Nullable String> subjectMapper = __ -> null;
        private Clock clock = Clock.systemUTC();

        private Builder(ObjectMapper objectMapper, URI source, EventTypeRegistry<T> eventTypes) {
            this.objectMapper = requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
            this.source = requireNonNull(source, "source cannot be null");
            this.eventTypes = requireNonNull(eventTypes, EventTypeRegistry.class.getSimpleName() + " cannot be null");
        }

        /**
         * @param idMapper Derives the cloud event id from the domain event. Ids must be unique per source.
         */
        public Builder<T> idMapper(Function<T, String> idMapper) {
            this.idMapper = requireNonNull(idMapper, "idMapper cannot be null");
            return this;
        }

        public Builder<T> subjectMapper(Function<T, @Nullable String> subjectMapper) {
            this.subjectMapper = requireNonNull(subjectMapper, "subjectMapper cannot be null");
            return this;
        }

        /**
         * @param clock Decides the cloud event time
         */
        public Builder<T> clock(Clock clock) {
            this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
            return this;
        }

        public JacksonCloudEventConverter<T> build() {
            return new JacksonCloudEventConverter<>(this);
        }
    }
}
