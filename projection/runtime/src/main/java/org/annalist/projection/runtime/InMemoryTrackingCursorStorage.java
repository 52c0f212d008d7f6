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

package org.annalist.projection.runtime;

import org.annalist.projection.api.TrackingCursor;
import org.annalist.projection.api.TrackingCursorStorage;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link TrackingCursorStorage} that keeps cursors in memory. Projections using it replay the whole log after a restart.
 */
public class InMemoryTrackingCursorStorage implements TrackingCursorStorage {
    private final ConcurrentMap<String, TrackingCursor> cursors = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTrackingCursorStorage() {
        this(Clock.systemUTC());
    }

    public InMemoryTrackingCursorStorage(Clock clock) {
        this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
    }

    @Override
    public Optional<TrackingCursor> read(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        return Optional.ofNullable(cursors.get(projectionName));
    }

    @Override
    public TrackingCursor save(String projectionName, long position) {
        requireNonNull(projectionName, "projectionName cannot be null");
        return cursors.compute(projectionName, (name, current) -> {
            if (current != null && current.lastProcessedPosition() > position) {
                throw new IllegalArgumentException(String.format("Cannot move cursor of %s back from %d to %d", name, current.lastProcessedPosition(), position));
            }
            return new TrackingCursor(name, position, OffsetDateTime.now(clock));
        });
    }

    @Override
    public void reset(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        cursors.remove(projectionName);
    }
}
