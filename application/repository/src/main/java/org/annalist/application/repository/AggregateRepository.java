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

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.annalist.application.converter.CloudEventConverter;
import org.annalist.cloudevents.AnnalistCloudEventExtension;
import org.annalist.cloudevents.AnnalistExtensionGetter;
import org.annalist.cloudevents.CorrelationCloudEventExtension;
import org.annalist.eventstore.api.*;
import org.annalist.snapshot.api.Snapshot;
import org.annalist.snapshot.api.SnapshotStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;
import static org.annalist.eventstore.api.WriteCondition.streamVersionEq;

/**
 * Loads aggregates by folding their events into state, starting from the latest snapshot when there is one, and saves
 * the events raised on them with optimistic concurrency.
 * <p>
 * A stream without events is not an error for {@link #get(String)}, it yields an aggregate at version 0 in its initial state.
 * {@link ConcurrencyConflictException} from {@link #save(Aggregate)} is never retried here, reload and decide again.
 *
 * @param <S> The state type
 * @param <E> The domain event type
 */
public class AggregateRepository<S, E> {
    private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

    private final EventStore eventStore;
    private final @Nullable SnapshotStore snapshotStore;
    private final CloudEventConverter<E> cloudEventConverter;
    private final @Nullable SnapshotSerializer<S> snapshotSerializer;
    private final AggregateDefinition<S, E> definition;
    private final Clock clock;

    /**
     * Create a repository that always replays the full stream.
     */
    public AggregateRepository(EventStore eventStore, CloudEventConverter<E> cloudEventConverter, AggregateDefinition<S, E> definition) {
        this(eventStore, null, cloudEventConverter, null, definition, Clock.systemUTC());
    }

    public AggregateRepository(EventStore eventStore, @Nullable SnapshotStore snapshotStore, CloudEventConverter<E> cloudEventConverter,
                               @Nullable SnapshotSerializer<S> snapshotSerializer, AggregateDefinition<S, E> definition, Clock clock) {
        requireNonNull(eventStore, EventStore.class.getSimpleName() + " cannot be null");
        requireNonNull(cloudEventConverter, CloudEventConverter.class.getSimpleName() + " cannot be null");
        requireNonNull(definition, AggregateDefinition.class.getSimpleName() + " cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if ((snapshotStore == null) != (snapshotSerializer == null)) {
            throw new IllegalArgumentException("snapshotStore and snapshotSerializer must both be defined or both be null");
        }
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.cloudEventConverter = cloudEventConverter;
        this.snapshotSerializer = snapshotSerializer;
        this.definition = definition;
        this.clock = clock;
    }

    /**
     * @return The aggregate of {@code streamId}, at version 0 if the stream has no events.
     */
    public Aggregate<S, E> get(String streamId) {
        requireNonNull(streamId, "streamId cannot be null");
        return rehydrate(null, streamId);
    }

    /**
     * Like {@link #get(String)} but a stream owned by another tenant is treated as if it had no events.
     */
    public Aggregate<S, E> get(TenantId tenantId, String streamId) {
        requireNonNull(tenantId, TenantId.class.getSimpleName() + " cannot be null");
        requireNonNull(streamId, "streamId cannot be null");
        return rehydrate(tenantId, streamId);
    }

    /**
     * @throws AggregateNotFoundException If the stream has no events
     */
    public Aggregate<S, E> load(String streamId) {
        Aggregate<S, E> aggregate = get(streamId);
        if (aggregate.isNew()) {
            throw new AggregateNotFoundException(streamId);
        }
        return aggregate;
    }

    /**
     * @throws AggregateNotFoundException If the stream has no events visible to {@code tenantId}
     */
    public Aggregate<S, E> load(TenantId tenantId, String streamId) {
        Aggregate<S, E> aggregate = get(tenantId, streamId);
        if (aggregate.isNew()) {
            throw new AggregateNotFoundException(streamId);
        }
        return aggregate;
    }

    /**
     * Create an aggregate for a new stream. Saving it fails with {@link ConcurrencyConflictException} if the stream already has events.
     */
    public Aggregate<S, E> create(String streamId, TenantId tenantId) {
        requireNonNull(streamId, "streamId cannot be null");
        requireNonNull(tenantId, TenantId.class.getSimpleName() + " cannot be null");
        return new Aggregate<>(definition, streamId, tenantId, 0, 0, definition.initialState(streamId));
    }

    public List<RecordedEvent> save(Aggregate<S, E> aggregate) {
        return save(aggregate, EventMetadata.none());
    }

    /**
     * Append the uncommitted events of {@code aggregate}, expecting the stream to still be at the version the aggregate was loaded at.
     *
     * @return The committed events, empty if there was nothing to save
     * @throws ConcurrencyConflictException If the stream has moved on since the aggregate was loaded
     */
    public List<RecordedEvent> save(Aggregate<S, E> aggregate, EventMetadata metadata) {
        requireNonNull(aggregate, Aggregate.class.getSimpleName() + " cannot be null");
        requireNonNull(metadata, EventMetadata.class.getSimpleName() + " cannot be null");
        if (!aggregate.hasUncommittedEvents()) {
            return List.of();
        }
        TenantId tenantId = aggregate.tenantId().orElseThrow(() -> new IllegalStateException("Tenant of " + aggregate + " is unknown, create it with a tenant id"));

        List<CloudEvent> cloudEvents = cloudEventConverter.toCloudEvents(aggregate.uncommittedEvents()).stream()
                .map(cloudEvent -> addMetadata(cloudEvent, tenantId, metadata))
                .collect(Collectors.toList());

        long expectedVersion = aggregate.version();
        WriteResult writeResult = eventStore.write(aggregate.streamId(), streamVersionEq(expectedVersion), cloudEvents.stream());
        aggregate.markCommitted(writeResult.getStreamVersion());
        log.debug("Saved {} event(s) to {} {} (version {} -> {})", cloudEvents.size(), definition.name(), aggregate.streamId(), expectedVersion, writeResult.getStreamVersion());

        snapshotIfDue(aggregate);
        return writeResult.getWrittenEvents().stream().map(RecordedEvent::from).collect(Collectors.toList());
    }

    public AggregateDefinition<S, E> definition() {
        return definition;
    }

    private Aggregate<S, E> rehydrate(@Nullable TenantId tenantId, String streamId) {
        Optional<S> snapshotState = Optional.empty();
        long snapshotVersion = 0;
        Optional<Snapshot> snapshot = latestSnapshot(streamId);
        if (snapshot.isPresent()) {
            snapshotState = decode(snapshot.get());
            if (snapshotState.isPresent()) {
                snapshotVersion = snapshot.get().version();
            }
        }

        // Read from the snapshot version itself so that the tenant of the stream is known even when no event was added after the snapshot
        long fromVersion = Math.max(1, snapshotVersion);
        EventStream<CloudEvent> eventStream = tenantId == null ? eventStore.read(streamId, fromVersion) : eventStore.read(tenantId, streamId, fromVersion);

        if (eventStream.version() < snapshotVersion) {
            if (tenantId != null && eventStream.isEmpty()) {
                // Stream is owned by someone else
                return new Aggregate<>(definition, streamId, tenantId, 0, 0, definition.initialState(streamId));
            }
            throw new SnapshotInconsistencyException(streamId, snapshotVersion, eventStream.version());
        }

        S state = snapshotState.orElseGet(() -> definition.initialState(streamId));
        TenantId streamTenant = tenantId;
        for (CloudEvent cloudEvent : eventStream) {
            if (streamTenant == null) {
                streamTenant = TenantId.of(AnnalistExtensionGetter.getTenantId(cloudEvent));
            }
            if (AnnalistExtensionGetter.getStreamVersion(cloudEvent) > snapshotVersion) {
                state = definition.evolve(state, cloudEventConverter.toDomainEvent(cloudEvent));
            }
        }
        return new Aggregate<>(definition, streamId, streamTenant, eventStream.version(), snapshotVersion, state);
    }

    private Optional<Snapshot> latestSnapshot(String streamId) {
        if (snapshotStore == null || !definition.isSnapshotEnabled()) {
            return Optional.empty();
        }
        return snapshotStore.loadLatest(streamId);
    }

    private Optional<S> decode(Snapshot snapshot) {
        try {
            return Optional.of(requireNonNull(snapshotSerializer).deserialize(snapshot.state()));
        } catch (RuntimeException e) {
            log.warn("Couldn't decode snapshot of {} {} at version {}, replaying all events instead", definition.name(), snapshot.streamId(), snapshot.version(), e);
            return Optional.empty();
        }
    }

    private void snapshotIfDue(Aggregate<S, E> aggregate) {
        if (snapshotStore == null || !definition.isSnapshotEnabled() || aggregate.version() - aggregate.snapshotVersion() < definition.snapshotInterval()) {
            return;
        }
        try {
            String state = requireNonNull(snapshotSerializer).serialize(aggregate.state());
            snapshotStore.save(new Snapshot(aggregate.streamId(), aggregate.version(), state, OffsetDateTime.now(clock)));
            aggregate.markSnapshotted(aggregate.version());
            log.debug("Took snapshot of {} {} at version {}", definition.name(), aggregate.streamId(), aggregate.version());
        } catch (RuntimeException e) {
            log.warn("Couldn't take snapshot of {} {} at version {}", definition.name(), aggregate.streamId(), aggregate.version(), e);
        }
    }

    private static CloudEvent addMetadata(CloudEvent cloudEvent, TenantId tenantId, EventMetadata metadata) {
        CloudEventBuilder builder = CloudEventBuilder.v1(cloudEvent).withExtension(AnnalistCloudEventExtension.TENANT_ID, tenantId.value());
        if (!metadata.isEmpty()) {
            builder.withExtension(new CorrelationCloudEventExtension(metadata.correlationId(), metadata.causationId()));
        }
        return builder.build();
    }
}
