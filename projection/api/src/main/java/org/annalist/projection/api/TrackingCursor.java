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

import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

/**
 * How far a projection has come in the log.
 *
 * @param projectionName        The projection
 * @param lastProcessedPosition The global position of the last event whose effects are in the read model
 * @param updatedAt             When the cursor was last saved
 */
public record TrackingCursor(String projectionName, long lastProcessedPosition, OffsetDateTime updatedAt) {

    public TrackingCursor {
        requireNonNull(projectionName, "projectionName cannot be null");
        requireNonNull(updatedAt, "updatedAt cannot be null");
        if (lastProcessedPosition < 0) {
            throw new IllegalArgumentException("lastProcessedPosition cannot be negative");
        }
    }
}
