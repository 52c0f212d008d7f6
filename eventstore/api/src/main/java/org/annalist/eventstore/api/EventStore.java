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

import java.util.stream.Stream;

/**
 * The append-only event log. Every event belongs to exactly one stream, gets a 1-based version within that stream and a
 * position in the log as a whole when it's written. Events are never updated or removed.
 * <p>
 * Every event passed to {@code write} must carry the {@value org.annalist.cloudevents.AnnalistCloudEventExtension#TENANT_ID}
 * extension, all events of one write must belong to the same tenant, and that tenant must own the stream. The first
 * write to a stream decides its owner.
 */
public interface EventStore {

    /**
     * Conditionally write {@code events} to the stream. Either all events are written, with consecutive stream versions and global positions,
     * or none are.
     *
     * @param streamId       The id of the stream
     * @param writeCondition The write condition that must be fulfilled for the events to be written
     * @param events         The events to write
     * @return The result of the write
     * @throws ConcurrencyConflictException if {@code writeCondition} isn't fulfilled by the current stream version
     * @throws TenantMismatchException      if the events don't belong to the tenant that owns the stream
     */
    WriteResult write(String streamId, WriteCondition writeCondition, Stream<CloudEvent> events);

    /**
     * Write {@code events} if, and only if, the stream is currently at {@code expectedVersion}. Use {@code 0} for a stream that must not exist yet.
     */
    default WriteResult write(String streamId, long expectedVersion, Stream<CloudEvent> events) {
        return write(streamId, WriteCondition.streamVersionEq(expectedVersion), events);
    }

    /**
     * Unconditionally append {@code events} to the stream.
     */
    default WriteResult write(String streamId, Stream<CloudEvent> events) {
        return write(streamId, WriteCondition.anyStreamVersion(), events);
    }

    /**
     * Read the events of a stream whose version is greater than or equal to {@code fromVersion}, in version order.
     * {@code 0} and {@code 1} both mean "from the start". {@link EventStream#version()} is always the current version of the stream.
     */
    EventStream<CloudEvent> read(String streamId, long fromVersion);

    default EventStream<CloudEvent> read(String streamId) {
        return read(streamId, 1);
    }

    /**
     * Like {@link #read(String, long)} but a stream that is owned by another tenant is returned as an empty stream.
     */
    EventStream<CloudEvent> read(TenantId tenantId, String streamId, long fromVersion);

    /**
     * @return {@code true} if at least one event has been written to the stream
     */
    boolean exists(String streamId);
}
