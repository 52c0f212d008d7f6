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

package org.annalist.application.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.UncheckedIOException;

import static java.util.Objects.requireNonNull;

/**
 * A {@link SnapshotSerializer} that writes state as JSON with Jackson.
 *
 * @param <S> The state type
 */
public class JacksonSnapshotSerializer<S> implements SnapshotSerializer<S> {
    private final ObjectMapper objectMapper;
    private final Class<S> stateType;

    /**
     * Create a serializer with an {@link ObjectMapper} that supports {@code java.time} types.
     */
    public JacksonSnapshotSerializer(Class<S> stateType) {
        this(new ObjectMapper().registerModule(new JavaTimeModule()).disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS), stateType);
    }

    public JacksonSnapshotSerializer(ObjectMapper objectMapper, Class<S> stateType) {
        requireNonNull(objectMapper, ObjectMapper.class.getSimpleName() + " cannot be null");
        requireNonNull(stateType, "stateType cannot be null");
        this.objectMapper = objectMapper;
        this.stateType = stateType;
    }

    @Override
    public String serialize(S state) {
        try {
            return objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public S deserialize(String serialized) {
        try {
            return objectMapper.readValue(serialized, stateType);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
