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

import java.util.Optional;

/**
 * Stores snapshots of aggregate state so that loading an aggregate doesn't need to replay its whole stream.
 * <p>
 * Snapshots are an optimization only. The event log stays the source of truth, and a store that loses snapshots
 * only makes loading slower.
 */
public interface SnapshotStore {

    /**
     * Save a snapshot. Saving a snapshot for a {@code (streamId, version)} that already exists does nothing.
     */
    void save(Snapshot snapshot);

    /**
     * @return The snapshot with the highest version for the stream, or {@code Optional.empty()} if there is none.
     */
    Optional<Snapshot> loadLatest(String streamId);

    /**
     * Delete all but the {@code retain} newest snapshots of a stream.
     *
     * @param retain The number of snapshots to keep, must be greater than 0
     * @return The number of deleted snapshots
     */
    int prune(String streamId, int retain);
}
