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

package org.annalist.snapshot.inmemory;

import org.annalist.snapshot.api.Snapshot;
import org.annalist.snapshot.api.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

import static java.util.Objects.requireNonNull;

/**
 * A {@link SnapshotStore} that keeps snapshots in memory.
 */
public class InMemorySnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(InMemorySnapshotStore.class);

    private final Map<String, NavigableMap<Long, Snapshot>> snapshots = new ConcurrentHashMap<>();

    @Override
    public void save(Snapshot snapshot) {
        requireNonNull(snapshot, Snapshot.class.getSimpleName() + " cannot be null");
        Snapshot existing = snapshots.computeIfAbsent(snapshot.streamId(), __ -> new ConcurrentSkipListMap<>()).putIfAbsent(snapshot.version(), snapshot);
        if (existing != null) {
            log.debug("Snapshot of stream {} at version {} already exists, ignoring", snapshot.streamId(), snapshot.version());
        }
    }

    @Override
    public Optional<Snapshot> loadLatest(String streamId) {
        requireNonNull(streamId, "streamId cannot be null");
        NavigableMap<Long, Snapshot> forStream = snapshots.get(streamId);
        if (forStream == null) {
            return Optional.empty();
        }
        Map.Entry<Long, Snapshot> latest = forStream.lastEntry();
        return latest == null ? Optional.empty() : Optional.of(latest.getValue());
    }

    @Override
    public int prune(String streamId, int retain) {
        requireNonNull(streamId, "streamId cannot be null");
        if (retain < 1) {
            throw new IllegalArgumentException("retain must be greater than 0");
        }
        NavigableMap<Long, Snapshot> forStream = snapshots.get(streamId);
        int deleted = 0;
        if (forStream != null) {
            synchronized (forStream) {
                while (forStream.size() > retain) {
                    forStream.pollFirstEntry();
                    deleted++;
                }
            }
        }
        return deleted;
    }
}
