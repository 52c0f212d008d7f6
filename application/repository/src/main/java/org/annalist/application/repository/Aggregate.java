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

import org.annalist.eventstore.api.TenantId;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The current state of one stream together with the events raised since it was loaded. Not thread-safe, an aggregate
 * instance belongs to the unit of work that loaded it.
 *
 * @param <S> The state type
 * @param <E> The domain event type
 */
public final class Aggregate<S, E> {
    private final AggregateDefinition<S, E> definition;
    private final String streamId;
    private final @Nullable TenantId tenantId;
    private long version;
    private long snapshotVersion;
    private S state;
    private final List<E> uncommittedEvents = new ArrayList<>();

    Aggregate(AggregateDefinition<S, E> definition, String streamId, @Nullable TenantId tenantId, long version, long snapshotVersion, S state) {
        this.definition = requireNonNull(definition, "definition cannot be null");
        this.streamId = requireNonNull(streamId, "streamId cannot be null");
        this.tenantId = tenantId;
        this.version = version;
        this.snapshotVersion = snapshotVersion;
        this.state = requireNonNull(state, "state cannot be null");
    }

    /**
     * Apply {@code event} to the state and queue it for the next save.
     */
    public Aggregate<S, E> raise(E event) {
        requireNonNull(event, "event cannot be null");
        state = definition.evolve(state, event);
        uncommittedEvents.add(event);
        return this;
    }

    public String streamId() {
        return streamId;
    }

    public Optional<TenantId> tenantId() {
        return Optional.ofNullable(tenantId);
    }

    /**
     * @return The stream version this aggregate was loaded at, or saved at last. 0 for a stream without events.
     */
    public long version() {
        return version;
    }

    public S state() {
        return state;
    }

    public List<E> uncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    public boolean isNew() {
        return version == 0;
    }

    long snapshotVersion() {
        return snapshotVersion;
    }

    void markCommitted(long newVersion) {
        version = newVersion;
        uncommittedEvents.clear();
    }

    void markSnapshotted(long version) {
        snapshotVersion = version;
    }

    @Override
    public String toString() {
        return definition.name() + "{streamId='" + streamId + "', tenantId=" + tenantId + ", version=" + version + ", uncommittedEvents=" + uncommittedEvents.size() + '}';
    }
}
