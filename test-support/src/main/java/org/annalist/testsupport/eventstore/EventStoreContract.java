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

package org.annalist.testsupport.eventstore;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.annalist.cloudevents.AnnalistExtensionGetter;
import org.annalist.eventstore.api.*;
import org.annalist.testsupport.domain.OrderCloudEvents;
import org.annalist.testsupport.domain.OrderEvent;
import org.annalist.testsupport.domain.OrderPlaced;
import org.annalist.testsupport.domain.OrderShipped;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static org.annalist.cloudevents.AnnalistCloudEventExtension.*;
import static org.annalist.testsupport.domain.OrderCloudEvents.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

/**
 * Behaviour every {@link EventStore} implementation must have. Extend it and provide the store under test.
 */
@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(60)
public abstract class EventStoreContract {

    protected static final String ACME = "acme";
    protected static final String GLOBEX = "globex";

    protected final OrderCloudEvents orderCloudEvents = new OrderCloudEvents();

    protected abstract EventStore eventStore();

    protected abstract EventStoreQueries eventStoreQueries();

    @Test
    void read_and_write_returns_events_in_version_order() {
        // Given
        eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));

        // When
        eventStore().write("ORD-1", 1, events(ACME, shipped("ORD-1")));

        // Then
        EventStream<OrderEvent> eventStream = eventStore().read("ORD-1", 0).map(orderCloudEvents::toDomainEvent);
        assertAll(
                () -> assertThat(eventStream.version()).isEqualTo(2),
                () -> assertThat(eventStream.events()).containsExactly(placed("ORD-1"), shipped("ORD-1"))
        );
    }

    @Test
    void adds_log_assigned_extensions_to_each_event() {
        // When
        WriteResult writeResult = eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1"), shipped("ORD-1")));

        // Then
        List<CloudEvent> events = eventStore().read("ORD-1").events();
        assertAll(
                () -> assertThat(events).extracting(e -> e.getExtension(STREAM_ID)).containsOnly("ORD-1"),
                () -> assertThat(events).extracting(AnnalistExtensionGetter::getStreamVersion).containsExactly(1L, 2L),
                () -> assertThat(events).extracting(AnnalistExtensionGetter::getGlobalPosition).containsExactlyElementsOf(writeResult.globalPositions()),
                () -> assertThat(events).extracting(AnnalistExtensionGetter::getTenantId).containsOnly(ACME),
                () -> assertThat(events).extracting(AnnalistExtensionGetter::getRecordedAt).doesNotContainNull(),
                () -> assertThat(events).extracting(CloudEvent::getType).containsExactly(OrderPlaced.TYPE, OrderShipped.TYPE)
        );
    }

    @Test
    void write_result_contains_old_and_new_version_and_positions() {
        // Given
        eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));

        // When
        WriteResult writeResult = eventStore().write("ORD-1", 1, events(ACME, shipped("ORD-1"), cancelled("ORD-1")));

        // Then
        assertAll(
                () -> assertThat(writeResult.getStreamId()).isEqualTo("ORD-1"),
                () -> assertThat(writeResult.getOldStreamVersion()).isEqualTo(1),
                () -> assertThat(writeResult.getStreamVersion()).isEqualTo(3),
                () -> assertThat(writeResult.globalPositions()).containsExactly(2L, 3L),
                () -> assertThat(writeResult.lastGlobalPosition()).isEqualTo(3L)
        );
    }

    @Test
    void reading_a_stream_that_does_not_exist_returns_an_empty_stream_with_version_zero() {
        EventStream<CloudEvent> eventStream = eventStore().read("unknown");

        assertAll(
                () -> assertThat(eventStream.isEmpty()).isTrue(),
                () -> assertThat(eventStream.version()).isZero(),
                () -> assertThat(eventStream.events()).isEmpty(),
                () -> assertThat(eventStore().exists("unknown")).isFalse()
        );
    }

    @Test
    void read_from_version_skips_earlier_events_but_reports_current_version() {
        // Given
        eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1"), shipped("ORD-1"), cancelled("ORD-1")));

        // When
        EventStream<CloudEvent> eventStream = eventStore().read("ORD-1", 2);

        // Then
        assertAll(
                () -> assertThat(eventStream.version()).isEqualTo(3),
                () -> assertThat(eventStream.events().stream().map(AnnalistExtensionGetter::getStreamVersion)).containsExactly(2L, 3L),
                () -> assertThat(eventStore().read("ORD-1", 4).events()).isEmpty()
        );
    }

    @Test
    void writing_zero_events_returns_current_version_and_writes_nothing() {
        // Given
        eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));

        // When
        WriteResult writeResult = eventStore().write("ORD-1", 1, Stream.empty());

        // Then
        assertAll(
                () -> assertThat(writeResult.getStreamVersion()).isEqualTo(1),
                () -> assertThat(writeResult.isEmpty()).isTrue(),
                () -> assertThat(eventStoreQueries().headPosition()).isEqualTo(1)
        );
    }

    @Nested
    class OptimisticConcurrency {

        @Test
        void throws_concurrency_conflict_when_expected_version_does_not_match() {
            // Given
            eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1"), shipped("ORD-1")));

            // When
            Throwable throwable = catchThrowable(() -> eventStore().write("ORD-1", 1, events(ACME, cancelled("ORD-1"))));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class);
            ConcurrencyConflictException conflict = (ConcurrencyConflictException) throwable;
            assertAll(
                    () -> assertThat(conflict.eventStreamId).isEqualTo("ORD-1"),
                    () -> assertThat(conflict.eventStreamVersion).isEqualTo(2),
                    () -> assertThat(conflict.writeCondition).isEqualTo(WriteCondition.streamVersionEq(1)),
                    () -> assertThat(eventStore().read("ORD-1").version()).isEqualTo(2)
            );
        }

        @Test
        void expected_version_zero_fails_when_stream_already_exists() {
            // Given
            eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));

            // When
            Throwable throwable = catchThrowable(() -> eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1"))));

            // Then
            assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class);
        }

        @Test
        void any_stream_version_always_appends() {
            // Given
            eventStore().write("ORD-1", events(ACME, placed("ORD-1")));

            // When
            WriteResult writeResult = eventStore().write("ORD-1", events(ACME, shipped("ORD-1")));

            // Then
            assertThat(writeResult.getStreamVersion()).isEqualTo(2);
        }

        @Test
        void exactly_one_of_many_concurrent_writers_with_the_same_expected_version_succeeds() throws Exception {
            // Given
            eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));
            int writers = 8;
            ExecutorService executor = Executors.newFixedThreadPool(writers);
            CyclicBarrier barrier = new CyclicBarrier(writers);
            AtomicInteger successes = new AtomicInteger();
            AtomicInteger conflicts = new AtomicInteger();

            // When
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                futures.add(executor.submit(() -> {
                    barrier.await();
                    try {
                        eventStore().write("ORD-1", 1, events(ACME, shipped("ORD-1")));
                        successes.incrementAndGet();
                    } catch (ConcurrencyConflictException e) {
                        conflicts.incrementAndGet();
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            // Then
            assertAll(
                    () -> assertThat(successes).hasValue(1),
                    () -> assertThat(conflicts).hasValue(writers - 1),
                    () -> assertThat(eventStore().read("ORD-1").version()).isEqualTo(2)
            );
        }
    }

    @Nested
    class Atomicity {

        @Test
        void nothing_is_written_when_one_event_in_the_batch_is_invalid() {
            // Given
            CloudEvent valid = orderCloudEvents.toCloudEvent(ACME, placed("ORD-1"));
            CloudEvent withoutTenant = CloudEventBuilder.v1(orderCloudEvents.toCloudEvent(ACME, shipped("ORD-1"))).withoutExtension(TENANT_ID).build();

            // When
            Throwable throwable = catchThrowable(() -> eventStore().write("ORD-1", 0, Stream.of(valid, withoutTenant)));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class),
                    () -> assertThat(eventStore().exists("ORD-1")).isFalse(),
                    () -> assertThat(eventStoreQueries().headPosition()).isZero()
            );
        }

        @Test
        void nothing_is_written_when_a_batch_mixes_tenants() {
            // When
            Throwable throwable = catchThrowable(() -> eventStore().write("ORD-1", 0, Stream.of(
                    orderCloudEvents.toCloudEvent(ACME, placed("ORD-1")),
                    orderCloudEvents.toCloudEvent(GLOBEX, shipped("ORD-1")))));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(TenantMismatchException.class),
                    () -> assertThat(eventStore().read("ORD-1").events()).isEmpty()
            );
        }
    }

    @Nested
    class GlobalPosition {

        @Test
        void positions_are_strictly_increasing_across_streams() {
            // Given
            eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));
            eventStore().write("ORD-2", 0, events(GLOBEX, placed("ORD-2"), shipped("ORD-2")));
            eventStore().write("ORD-1", 1, events(ACME, shipped("ORD-1")));

            // When
            List<CloudEvent> events = eventStoreQueries().readFromPosition(1, 100);

            // Then
            assertAll(
                    () -> assertThat(events).extracting(AnnalistExtensionGetter::getGlobalPosition).containsExactly(1L, 2L, 3L, 4L),
                    () -> assertThat(events).extracting(AnnalistExtensionGetter::getStreamId).containsExactly("ORD-1", "ORD-2", "ORD-2", "ORD-1"),
                    () -> assertThat(eventStoreQueries().headPosition()).isEqualTo(4)
            );
        }

        @Test
        void read_from_position_is_inclusive_and_honors_limit() {
            // Given
            eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1"), shipped("ORD-1"), cancelled("ORD-1")));
            eventStore().write("ORD-2", 0, events(ACME, placed("ORD-2")));

            // When
            List<CloudEvent> events = eventStoreQueries().readFromPosition(2, 2);

            // Then
            assertAll(
                    () -> assertThat(events).extracting(AnnalistExtensionGetter::getGlobalPosition).containsExactly(2L, 3L),
                    () -> assertThat(eventStoreQueries().readFromPosition(2, 2)).extracting(CloudEvent::getId).isEqualTo(events.stream().map(CloudEvent::getId).collect(Collectors.toList())),
                    () -> assertThat(eventStoreQueries().readFromPosition(5, 10)).isEmpty(),
                    () -> assertThat(eventStoreQueries().readFromPosition(0, 10)).hasSize(4)
            );
        }

        @Test
        void positions_are_gapless_and_ordered_when_many_streams_are_written_concurrently() throws Exception {
            // Given
            int writers = 6;
            int eventsPerWriter = 20;
            ExecutorService executor = Executors.newFixedThreadPool(writers);

            // When
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String streamId = "ORD-" + i;
                futures.add(executor.submit(() -> {
                    for (int version = 0; version < eventsPerWriter; version++) {
                        eventStore().write(streamId, version, events(ACME, new OrderPlaced(streamId + "-" + version, streamId, "c", version)));
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            // Then
            List<CloudEvent> events = eventStoreQueries().readFromPosition(1, writers * eventsPerWriter + 10);
            assertAll(
                    () -> assertThat(events).extracting(AnnalistExtensionGetter::getGlobalPosition)
                            .containsExactlyElementsOf(LongStream.rangeClosed(1, (long) writers * eventsPerWriter).boxed().collect(Collectors.toList())),
                    () -> assertThat(eventStore().read("ORD-3").events().stream().map(AnnalistExtensionGetter::getStreamVersion))
                            .containsExactlyElementsOf(LongStream.rangeClosed(1, eventsPerWriter).boxed().collect(Collectors.toList()))
            );
        }
    }

    @Nested
    class TenantIsolation {

        @Test
        void cannot_append_events_of_another_tenant_to_a_stream() {
            // Given
            eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));

            // When
            Throwable throwable = catchThrowable(() -> eventStore().write("ORD-1", 1, events(GLOBEX, shipped("ORD-1"))));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(TenantMismatchException.class),
                    () -> assertThat(eventStore().read("ORD-1").version()).isEqualTo(1)
            );
        }

        @Test
        void tenant_scoped_read_hides_streams_of_other_tenants() {
            // Given
            eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));

            // When
            EventStream<CloudEvent> asGlobex = eventStore().read(TenantId.of(GLOBEX), "ORD-1", 0);
            EventStream<CloudEvent> asAcme = eventStore().read(TenantId.of(ACME), "ORD-1", 0);

            // Then
            assertAll(
                    () -> assertThat(asGlobex.isEmpty()).isTrue(),
                    () -> assertThat(asGlobex.events()).isEmpty(),
                    () -> assertThat(asAcme.version()).isEqualTo(1)
            );
        }

        @Test
        void tenant_scoped_read_from_position_only_returns_events_of_that_tenant() {
            // Given
            eventStore().write("ORD-1", 0, events(ACME, placed("ORD-1")));
            eventStore().write("ORD-2", 0, events(GLOBEX, placed("ORD-2")));
            eventStore().write("ORD-3", 0, events(ACME, placed("ORD-3")));

            // When
            List<CloudEvent> events = eventStoreQueries().readFromPosition(TenantId.of(ACME), 1, 10);

            // Then
            assertThat(events).extracting(AnnalistExtensionGetter::getStreamId).containsExactly("ORD-1", "ORD-3");
        }

        @Test
        void rejects_events_with_an_invalid_tenant_id() {
            // When
            Throwable throwable = catchThrowable(() -> eventStore().write("ORD-1", 0, events("Not A Slug", placed("ORD-1"))));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }
    }

    protected Stream<CloudEvent> events(String tenantId, OrderEvent... events) {
        return Stream.of(events).map(e -> orderCloudEvents.toCloudEvent(tenantId, e));
    }
}
