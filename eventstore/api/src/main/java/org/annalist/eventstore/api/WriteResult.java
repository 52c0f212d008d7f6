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

package org.annalist.eventstore.api;

import io.cloudevents.CloudEvent;
import org.annalist.cloudevents.AnnalistExtensionGetter;

import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

import static java.util.stream.Collectors.toUnmodifiableList;

/**
 * The result of a write to the event store.
 */
public class WriteResult {

    private final String streamId;
    private final long oldStreamVersion;
    private final long newStreamVersion;
    private final List<CloudEvent> writtenEvents;

    public WriteResult(String streamId, long oldStreamVersion, long newStreamVersion, List<CloudEvent> writtenEvents) {
        Objects.requireNonNull(streamId, "streamId cannot be null");
        Objects.requireNonNull(writtenEvents, "writtenEvents cannot be null");
        this.streamId = streamId;
        this.oldStreamVersion = oldStreamVersion;
        this.newStreamVersion = newStreamVersion;
        this.writtenEvents = List.copyOf(writtenEvents);
    }

    public String getStreamId() {
        return streamId;
    }

    public long getOldStreamVersion() {
        return oldStreamVersion;
    }

    public long getStreamVersion() {
        return newStreamVersion;
    }

    /**
     * @return The events as they were stored, with every log assigned extension applied.
     */
    public List<CloudEvent> getWrittenEvents() {
        return writtenEvents;
    }

    /**
     * @return The global positions assigned to the written events, in append order. Empty if nothing was written.
     */
    public List<Long> globalPositions() {
        return writtenEvents.stream().map(AnnalistExtensionGetter::getGlobalPosition).collect(toUnmodifiableList());
    }

    public long lastGlobalPosition() {
        if (writtenEvents.isEmpty()) {
            throw new IllegalStateException("No events were written to " + streamId);
        }
        return AnnalistExtensionGetter.getGlobalPosition(writtenEvents.get(writtenEvents.size() - 1));
    }

    public boolean isEmpty() {
        return writtenEvents.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WriteResult)) return false;
        WriteResult that = (WriteResult) o;
        return oldStreamVersion == that.oldStreamVersion && newStreamVersion == that.newStreamVersion && Objects.equals(streamId, that.streamId) && Objects.equals(globalPositions(), that.globalPositions());
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, oldStreamVersion, newStreamVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", WriteResult.class.getSimpleName() + "[", "]")
                .add("streamId='" + streamId + "'")
                .add("oldStreamVersion=" + oldStreamVersion)
                .add("newStreamVersion=" + newStreamVersion)
                .add("globalPositions=" + globalPositions())
                .toString();
    }
}
