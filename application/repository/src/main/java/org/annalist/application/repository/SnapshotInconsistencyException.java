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

/**
 * Thrown when a snapshot claims a version that the stream never reached, i.e. the snapshot store and the event log disagree.
 */
public class SnapshotInconsistencyException extends RuntimeException {
    public final String streamId;
    public final long snapshotVersion;
    public final long streamVersion;

    public SnapshotInconsistencyException(String streamId, long snapshotVersion, long streamVersion) {
        super(String.format("Snapshot of stream %s is at version %d but the stream is at version %d", streamId, snapshotVersion, streamVersion));
        this.streamId = streamId;
        this.snapshotVersion = snapshotVersion;
        this.streamVersion = streamVersion;
    }
}
