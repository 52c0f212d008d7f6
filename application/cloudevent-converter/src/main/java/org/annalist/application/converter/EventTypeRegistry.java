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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Maps stable cloud event type identifiers (e.g. {@code order.placed.v1}) to domain event classes and back.
 * <p>
 * Every type is registered explicitly. Class names are never used as type identifiers, so domain event classes
 * can be renamed or moved without breaking already stored events.
 *
 * <pre>
 * EventTypeRegistry&lt;OrderEvent&gt; registry = EventTypeRegistry.&lt;OrderEvent&gt;builder()
 *         .register("order.placed.v1", OrderPlaced.class)
 *         .register("order.shipped.v1", OrderShipped.class)
 *         .build();
 * </pre>
 *
 * @param <T> The base type of your domain events
 */
public final class EventTypeRegistry<T> {
    private final Map<String, Class<? extends T>> classByType;
    private final Map<Class<? extends T>, String> typeByClass;

    private EventTypeRegistry(Map<String, Class<? extends T>> classByType, Map<Class<? extends T>, String> typeByClass) {
        this.classByType = Collections.unmodifiableMap(classByType);
        this.typeByClass = Collections.unmodifiableMap(typeByClass);
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * @throws UnknownEventTypeException If {@code type} isn't registered
     */
    public String getCloudEventType(Class<? extends T> type) {
        requireNonNull(type, "type cannot be null");
        String cloudEventType = typeByClass.get(type);
        if (cloudEventType == null) {
            throw new UnknownEventTypeException(type.getName());
        }
        return cloudEventType;
    }

    /**
     * @throws UnknownEventTypeException If {@code cloudEventType} isn't registered
     */
    public Class<? extends T> getDomainEventType(String cloudEventType) {
        requireNonNull(cloudEventType, "cloudEventType cannot be null");
        Class<? extends T> type = classByType.get(cloudEventType);
        if (type == null) {
            throw new UnknownEventTypeException(cloudEventType);
        }
        return type;
    }

    public boolean isRegistered(String cloudEventType) {
        return classByType.containsKey(cloudEventType);
    }

    public Set<String> cloudEventTypes() {
        return classByType.keySet();
    }

    @Override
    public String toString() {
        return "EventTypeRegistry" + classByType.keySet();
    }

    public static final class Builder<T> {
        private final Map<String, Class<? extends T>> classByType = new LinkedHashMap<>();
        private final Map<Class<? extends T>, String> typeByClass = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder<T> register(String cloudEventType, Class<? extends T> domainEventType) {
            requireNonNull(cloudEventType, "cloudEventType cannot be null");
            requireNonNull(domainEventType, "domainEventType cannot be null");
            if (cloudEventType.isBlank()) {
                throw new IllegalArgumentException("cloudEventType cannot be blank");
            }
            if (classByType.containsKey(cloudEventType)) {
                throw new IllegalArgumentException("Cloud event type " + cloudEventType + " is already registered to " + classByType.get(cloudEventType).getName());
            }
            if (typeByClass.containsKey(domainEventType)) {
                throw new IllegalArgumentException(domainEventType.getName() + " is already registered as " + typeByClass.get(domainEventType));
            }
            classByType.put(cloudEventType, domainEventType);
            typeByClass.put(domainEventType, cloudEventType);
            return this;
        }

        public EventTypeRegistry<T> build() {
            return new EventTypeRegistry<>(new LinkedHashMap<>(classByType), new LinkedHashMap<>(typeByClass));
        }
    }
}
