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

package org.annalist.snapshot.api;

import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

/**
 * The serialized state of an aggregate after all events up to and including {@code version} have been applied.
 *
 * @param streamId  The stream the state was derived from
 * @param version   The stream version the state reflects, always greater than 0
 * @param state     The serialized state, typically JSON
 * @param createdAt When the snapshot was taken
 */
public record Snapshot(String streamId, long version, String state, OffsetDateTime createdAt) {

    public Snapshot {
        requireNonNull(streamId, "streamId cannot be null");
        requireNonNull(state, "state cannot be null");
        requireNonNull(createdAt, "createdAt cannot be null");
        if (version < 1) {
            throw new IllegalArgumentException("Snapshot version must be greater than 0, was " + version);
        }
    }
}
