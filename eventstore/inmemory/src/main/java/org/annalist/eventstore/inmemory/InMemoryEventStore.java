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

package org.annalist.eventstore.inmemory;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.annalist.cloudevents.AnnalistCloudEventExtension;
import org.annalist.cloudevents.AnnalistExtensionGetter;
import org.annalist.eventstore.api.*;
import org.annalist.eventstore.api.internal.AppendedEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.util.Objects.requireNonNull;

/**
 * This is an {@link EventStore} that stores events in-memory. This is mainly useful for testing
 * and/or demo purposes. It also supports the {@link EventStoreQueries} contract.
 * <p>
 * Writes are serialized by a single monitor so global positions are gapless and become visible in order.
 */
public class InMemoryEventStore implements EventStore, EventStoreQueries {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    // We cannot use ConcurrentMap since it doesn't maintain insertion order
    private final Map<String, List<CloudEvent>> state = new LinkedHashMap<>();
    private final List<CloudEvent> globalLog = new ArrayList<>();

    private final Clock clock;
    private final AppendListener listener;

    /**
     * Create an instance of {@link InMemoryEventStore}
     */
    public InMemoryEventStore() {
        this(AppendListener.noop());
    }

    /**
     * Create an instance of {@link InMemoryEventStore} that has a <code>listener</code> that will be invoked
     * after events have been written to the event store.
     *
     * @param listener A listener that will be invoked after events have been written (synchronously!)
     */
    public InMemoryEventStore(AppendListener listener) {
        this(Clock.systemUTC(), listener);
    }

    public InMemoryEventStore(Clock clock, AppendListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        this.clock = clock;
        this.listener = listener;
    }

    @Override
    public WriteResult write(String streamId, WriteCondition writeCondition, Stream<CloudEvent> events) {
        requireNonNull(streamId, "StreamId cannot be null");
        requireTrue(writeCondition != null, WriteCondition.class.getSimpleName() + " cannot be null");
        requireNonNull(events, "Events cannot be null");
        List<CloudEvent> eventsToWrite = events.collect(Collectors.toList());
        TenantId tenant = AppendedEvents.requireSingleTenant(streamId, eventsToWrite);

        final WriteResult writeResult;
        synchronized (state) {
            List<CloudEvent> currentEvents = state.getOrDefault(streamId, Collections.emptyList());
            long currentStreamVersion = calculateStreamVersion(currentEvents);
            if (!writeCondition.isFulfilledBy(currentStreamVersion)) {
                throw new ConcurrencyConflictException(streamId, currentStreamVersion, writeCondition);
            }

            if (eventsToWrite.isEmpty()) {
                return new WriteResult(streamId, currentStreamVersion, currentStreamVersion, Collections.emptyList());
            }

            if (!currentEvents.isEmpty()) {
                AppendedEvents.requireOwner(streamId, TenantId.of(AnnalistExtensionGetter.getTenantId(currentEvents.get(0))), tenant);
            }

            OffsetDateTime recordedAt = OffsetDateTime.now(clock);
            long streamVersion = currentStreamVersion;
            long globalPosition = globalLog.size();
            List<CloudEvent> newEvents = new ArrayList<>(eventsToWrite.size());
            for (CloudEvent event : eventsToWrite) {
                newEvents.add(CloudEventBuilder.v1(event)
                        .withExtension(new AnnalistCloudEventExtension(streamId, ++streamVersion, ++globalPosition, tenant.value(), recordedAt))
                        .build());
            }

            List<CloudEvent> eventList = new ArrayList<>(currentEvents);
            eventList.addAll(newEvents);
            state.put(streamId, eventList);
            globalLog.addAll(newEvents);
            writeResult = new WriteResult(streamId, currentStreamVersion, streamVersion, newEvents);
        }

        log.debug("Appended {} event(s) to stream {} (version {} -> {})", eventsToWrite.size(), streamId, writeResult.getOldStreamVersion(), writeResult.getStreamVersion());
        listener.eventsAppended(writeResult);
        return writeResult;
    }

    @Override
    public EventStream<CloudEvent> read(String streamId, long fromVersion) {
        requireNonNull(streamId, "StreamId cannot be null");
        synchronized (state) {
            List<CloudEvent> events = state.get(streamId);
            if (events == null) {
                return EventStream.empty(streamId);
            }
            int skip = (int) Math.min(events.size(), Math.max(0, fromVersion - 1));
            return EventStream.of(streamId, calculateStreamVersion(events), events.subList(skip, events.size()));
        }
    }

    @Override
    public EventStream<CloudEvent> read(TenantId tenantId, String streamId, long fromVersion) {
        requireNonNull(tenantId, TenantId.class.getSimpleName() + " cannot be null");
        synchronized (state) {
            List<CloudEvent> events = state.get(streamId);
            if (events != null && !tenantId.value().equals(AnnalistExtensionGetter.getTenantId(events.get(0)))) {
                return EventStream.empty(streamId);
            }
            return read(streamId, fromVersion);
        }
    }

    @Override
    public boolean exists(String streamId) {
        synchronized (state) {
            return state.containsKey(streamId);
        }
    }

    @Override
    public List<CloudEvent> readFromPosition(long position, int limit) {
        requireTrue(limit > 0, "limit must be greater than 0");
        synchronized (state) {
            int from = (int) Math.min(globalLog.size(), Math.max(0, position - 1));
            int to = (int) Math.min(globalLog.size(), (long) from + limit);
            return List.copyOf(globalLog.subList(from, to));
        }
    }

    @Override
    public List<CloudEvent> readFromPosition(TenantId tenantId, long position, int limit) {
        requireNonNull(tenantId, TenantId.class.getSimpleName() + " cannot be null");
        requireTrue(limit > 0, "limit must be greater than 0");
        synchronized (state) {
            int from = (int) Math.min(globalLog.size(), Math.max(0, position - 1));
            return globalLog.subList(from, globalLog.size()).stream()
                    .filter(e -> tenantId.value().equals(AnnalistExtensionGetter.getTenantId(e)))
                    .limit(limit)
                    .collect(Collectors.toUnmodifiableList());
        }
    }

    @Override
    public long headPosition() {
        synchronized (state) {
            return globalLog.size();
        }
    }

    private static long calculateStreamVersion(List<CloudEvent> events) {
        if (events == null || events.isEmpty()) {
            return 0;
        }
        return AnnalistExtensionGetter.getStreamVersion(events.get(events.size() - 1));
    }

    private static void requireTrue(boolean bool, String message) {
        if (!bool) {
            throw new IllegalArgumentException(message);
        }
    }
}
