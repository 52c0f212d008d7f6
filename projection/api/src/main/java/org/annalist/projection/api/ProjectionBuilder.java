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

package org.annalist.projection.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEventData;
import org.annalist.eventstore.api.RecordedEvent;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Builds a {@link Projection} from one handler per event type.
 */
public final class ProjectionBuilder {
    private final String name;
    private final Map<String, EventHandler> handlers = new LinkedHashMap<>();
    private ObjectMapper objectMapper = new ObjectMapper();
    private @Nullable Runnable clear;

    ProjectionBuilder(String name) {
        requireNonNull(name, "name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Projection name cannot be blank");
        }
        this.name = name;
    }

    /**
     * @param objectMapper Used by typed handlers to decode event data
     */
    public ProjectionBuilder objectMapper(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        return this;
    }

    public ProjectionBuilder on(String eventType, EventHandler handler) {
        requireNonNull(eventType, "eventType cannot be null");
        requireNonNull(handler, EventHandler.class.getSimpleName() + " cannot be null");
        if (handlers.putIfAbsent(eventType, handler) != null) {
            throw new IllegalArgumentException("Projection " + name + " already has a handler for " + eventType);
        }
        return this;
    }

    public <T> ProjectionBuilder on(String eventType, Class<T> dataType, TypedEventHandler<T> handler) {
        requireNonNull(dataType, "dataType cannot be null");
        requireNonNull(handler, TypedEventHandler.class.getSimpleName() + " cannot be null");
        ObjectMapper mapper = objectMapper;
        return on(eventType, event -> handler.handle(decode(mapper, event, dataType), event));
    }

    public ProjectionBuilder clearWith(Runnable clear) {
        this.clear = requireNonNull(clear, "clear cannot be null");
        return this;
    }

    /**
     * @throws IllegalStateException If no clear action has been defined
     */
    public Projection build() {
        if (clear == null) {
            throw new IllegalStateException("Projection " + name + " needs a clear action, define it with clearWith(..)");
        }
        return new HandlerTableProjection(name, new LinkedHashMap<>(handlers), clear);
    }

    private static <T> T decode(ObjectMapper objectMapper, RecordedEvent event, Class<T> dataType) {
        CloudEventData data = requireNonNull(event.cloudEvent().getData(), "data of event at position " + event.globalPosition() + " cannot be null");
        try {
            return objectMapper.readValue(data.toBytes(), dataType);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static final class HandlerTableProjection implements Projection {
        private final String name;
        private final Map<String, EventHandler> handlers;
        private final Runnable clear;

        private HandlerTableProjection(String name, Map<String, EventHandler> handlers, Runnable clear) {
            this.name = name;
            this.handlers = Collections.unmodifiableMap(handlers);
            this.clear = clear;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public Set<String> eventTypes() {
            return handlers.keySet();
        }

        @Override
        public void handle(RecordedEvent event) {
            EventHandler handler = handlers.get(event.type());
            if (handler != null) {
                handler.handle(event);
            }
        }

        @Override
        public void clear() {
            clear.run();
        }

        @Override
        public String toString() {
            return "Projection{name='" + name + "', eventTypes=" + handlers.keySet() + '}';
        }
    }
}
