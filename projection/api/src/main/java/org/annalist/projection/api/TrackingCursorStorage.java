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

import java.util.Optional;

/**
 * Durable storage of {@link TrackingCursor}s, one per projection.
 */
public interface TrackingCursorStorage {

    /**
     * @return The cursor of the projection, or {@code Optional.empty()} if it has never been saved or has been reset
     */
    Optional<TrackingCursor> read(String projectionName);

    /**
     * Move the cursor of {@code projectionName} to {@code position}. Saving the current position again is allowed.
     *
     * @return The saved cursor
     * @throws IllegalArgumentException If {@code position} is behind the stored position
     */
    TrackingCursor save(String projectionName, long position);

    /**
     * Remove the cursor so that the projection starts over from the beginning of the log.
     */
    void reset(String projectionName);

    /**
     * @return The last processed position of {@code projectionName}, 0 if there is no cursor
     */
    default long lastProcessedPosition(String projectionName) {
        return read(projectionName).map(TrackingCursor::lastProcessedPosition).orElse(0L);
    }
}
