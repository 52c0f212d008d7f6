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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.annalist.application.converter.EventTypeRegistry;
import org.annalist.application.converter.jackson.JacksonCloudEventConverter;
import org.annalist.eventstore.api.ConcurrencyConflictException;
import org.annalist.eventstore.api.RecordedEvent;
import org.annalist.eventstore.api.TenantId;
import org.annalist.eventstore.inmemory.InMemoryEventStore;
import org.annalist.snapshot.api.Snapshot;
import org.annalist.snapshot.api.SnapshotStore;
import org.annalist.snapshot.inmemory.InMemorySnapshotStore;
import org.annalist.testsupport.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static java.time.ZoneOffset.UTC;
import static org.annalist.testsupport.domain.OrderCloudEvents.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class AggregateRepositoryTest {
    private static final TenantId ACME = TenantId.of("acme");
    private static final TenantId GLOBEX = TenantId.of("globex");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), UTC);

    private InMemoryEventStore eventStore;
    private InMemorySnapshotStore snapshotStore;
    private JacksonCloudEventConverter<OrderEvent> converter;
    private AggregateDefinition<Order, OrderEvent> orders;

    @BeforeEach
    void create_repository_dependencies() {
        eventStore = new InMemoryEventStore();
        snapshotStore = new InMemorySnapshotStore();
        EventTypeRegistry<OrderEvent> registry = EventTypeRegistry.<OrderEvent>builder()
                .register(OrderPlaced.TYPE, OrderPlaced.class)
                .register(OrderShipped.TYPE, OrderShipped.class)
                .register(OrderCancelled.TYPE, OrderCancelled.class)
                .build();
        converter = new JacksonCloudEventConverter<>(new ObjectMapper(), URI.create("urn:annalist:orders"), registry);
        orders = AggregateDefinition.of("order", Order.class, Order::initial, Order::evolve);
    }

    @Test
    void get_returns_new_aggregate_at_version_zero_for_stream_without_events() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);

        // When
        Aggregate<Order, OrderEvent> order = repository.get("ORD-1");

        // Then
        assertAll(
                () -> assertThat(order.version()).isZero(),
                () -> assertThat(order.isNew()).isTrue(),
                () -> assertThat(order.state()).isEqualTo(Order.initial("ORD-1")),
                () -> assertThat(order.tenantId()).isEmpty()
        );
    }

    @Test
    void load_throws_aggregate_not_found_exception_for_stream_without_events() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);

        // When
        Throwable throwable = catchThrowable(() -> repository.load("ORD-1"));

        // Then
        assertThat(throwable).isExactlyInstanceOf(AggregateNotFoundException.class).hasMessage("Aggregate with stream id ORD-1 was not found");
    }

    @Test
    void save_appends_uncommitted_events_and_moves_the_aggregate_to_the_new_version() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);
        Aggregate<Order, OrderEvent> order = repository.create("ORD-1", ACME);
        order.raise(order.state().place("John", 1000));
        order.raise(order.state().ship("UPS"));

        // When
        List<RecordedEvent> committed = repository.save(order);

        // Then
        assertAll(
                () -> assertThat(committed).extracting(RecordedEvent::streamVersion).containsExactly(1L, 2L),
                () -> assertThat(committed).extracting(RecordedEvent::tenantId).containsOnly(ACME),
                () -> assertThat(committed).extracting(RecordedEvent::type).containsExactly("order.placed.v1", "order.shipped.v1"),
                () -> assertThat(order.version()).isEqualTo(2),
                () -> assertThat(order.hasUncommittedEvents()).isFalse(),
                () -> assertThat(repository.load("ORD-1").state().status()).isEqualTo(Order.Status.SHIPPED)
        );
    }

    @Test
    void save_without_uncommitted_events_does_nothing() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);

        // When
        List<RecordedEvent> committed = repository.save(repository.create("ORD-1", ACME));

        // Then
        assertAll(
                () -> assertThat(committed).isEmpty(),
                () -> assertThat(eventStore.exists("ORD-1")).isFalse()
        );
    }

    @Test
    void concurrent_modification_is_reported_and_not_retried() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);
        Aggregate<Order, OrderEvent> created = repository.create("ORD-1", ACME).raise(placed("ORD-1"));
        repository.save(created);
        Aggregate<Order, OrderEvent> first = repository.load("ORD-1").raise(shipped("ORD-1"));
        Aggregate<Order, OrderEvent> second = repository.load("ORD-1").raise(cancelled("ORD-1"));
        repository.save(first);

        // When
        Throwable throwable = catchThrowable(() -> repository.save(second));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class),
                () -> assertThat(second.version()).isEqualTo(1),
                () -> assertThat(second.hasUncommittedEvents()).isTrue(),
                () -> assertThat(eventStore.read("ORD-1").version()).isEqualTo(2)
        );
    }

    @Test
    void creating_an_existing_stream_fails_on_save() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);
        repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1")));

        // When
        Throwable throwable = catchThrowable(() -> repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1"))));

        // Then
        assertThat(throwable).isExactlyInstanceOf(ConcurrencyConflictException.class);
    }

    @Test
    void metadata_is_added_to_every_saved_event() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);
        Aggregate<Order, OrderEvent> order = repository.create("ORD-1", ACME).raise(placed("ORD-1")).raise(shipped("ORD-1"));

        // When
        List<RecordedEvent> committed = repository.save(order, EventMetadata.correlatedBy("checkout-42").causedBy("cmd-7"));

        // Then
        assertAll(
                () -> assertThat(committed).extracting(RecordedEvent::correlationId).containsOnly(Optional.of("checkout-42")),
                () -> assertThat(committed).extracting(RecordedEvent::causationId).containsOnly(Optional.of("cmd-7"))
        );
    }

    @Test
    void aggregate_loaded_with_tenant_of_another_owner_is_new() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);
        repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1")));

        // When
        Aggregate<Order, OrderEvent> seenByGlobex = repository.get(GLOBEX, "ORD-1");

        // Then
        assertAll(
                () -> assertThat(seenByGlobex.isNew()).isTrue(),
                () -> assertThat(repository.get(ACME, "ORD-1").version()).isEqualTo(1),
                () -> assertThat(catchThrowable(() -> repository.load(GLOBEX, "ORD-1"))).isInstanceOf(AggregateNotFoundException.class)
        );
    }

    @Test
    void replaying_the_same_events_always_yields_the_same_state() {
        // Given
        AggregateRepository<Order, OrderEvent> repository = new AggregateRepository<>(eventStore, converter, orders);
        repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1")).raise(shipped("ORD-1")).raise(cancelled("ORD-1")));

        // When
        Order first = repository.load("ORD-1").state();
        Order second = repository.load("ORD-1").state();

        // Then
        assertAll(
                () -> assertThat(first).isEqualTo(second),
                () -> assertThat(first.changes()).isEqualTo(3),
                () -> assertThat(first.status()).isEqualTo(Order.Status.CANCELLED)
        );
    }

    @Nested
    class Snapshots {

        private AggregateRepository<Order, OrderEvent> repository(SnapshotStore snapshotStore, int interval) {
            return new AggregateRepository<>(eventStore, snapshotStore, converter, new JacksonSnapshotSerializer<>(Order.class), orders.withSnapshotInterval(interval), CLOCK);
        }

        @Test
        void snapshot_is_taken_when_interval_is_reached() {
            // Given
            AggregateRepository<Order, OrderEvent> repository = repository(snapshotStore, 2);
            Aggregate<Order, OrderEvent> order = repository.create("ORD-1", ACME).raise(placed("ORD-1"));
            repository.save(order);
            assertThat(snapshotStore.loadLatest("ORD-1")).isEmpty();

            // When
            repository.save(order.raise(shipped("ORD-1")));

            // Then
            assertThat(snapshotStore.loadLatest("ORD-1")).hasValueSatisfying(snapshot -> assertAll(
                    () -> assertThat(snapshot.version()).isEqualTo(2),
                    () -> assertThat(snapshot.createdAt()).isEqualTo(OffsetDateTime.now(CLOCK)),
                    () -> assertThat(snapshot.state()).contains("\"status\":\"SHIPPED\"")
            ));
        }

        @Test
        void state_from_snapshot_and_later_events_equals_state_from_full_replay() {
            // Given
            AggregateRepository<Order, OrderEvent> withSnapshots = repository(snapshotStore, 2);
            Aggregate<Order, OrderEvent> order = withSnapshots.create("ORD-1", ACME);
            for (OrderEvent event : List.of(placed("ORD-1"), shipped("ORD-1"), cancelled("ORD-1"), cancelled("ORD-1"), cancelled("ORD-1"))) {
                withSnapshots.save(order.raise(event));
            }

            // When
            Aggregate<Order, OrderEvent> fromSnapshot = withSnapshots.load("ORD-1");
            Aggregate<Order, OrderEvent> fromReplay = new AggregateRepository<>(eventStore, converter, orders).load("ORD-1");

            // Then
            assertAll(
                    () -> assertThat(snapshotStore.loadLatest("ORD-1")).hasValueSatisfying(s -> assertThat(s.version()).isEqualTo(4)),
                    () -> assertThat(fromSnapshot.state()).isEqualTo(fromReplay.state()),
                    () -> assertThat(fromSnapshot.version()).isEqualTo(5),
                    () -> assertThat(fromSnapshot.state().changes()).isEqualTo(5)
            );
        }

        @Test
        void aggregate_loaded_from_snapshot_without_later_events_can_be_saved() {
            // Given
            AggregateRepository<Order, OrderEvent> repository = repository(snapshotStore, 1);
            repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1")));

            // When
            Aggregate<Order, OrderEvent> order = repository.load("ORD-1");
            repository.save(order.raise(shipped("ORD-1")));

            // Then
            assertAll(
                    () -> assertThat(order.tenantId()).hasValue(ACME),
                    () -> assertThat(repository.load("ORD-1").state().status()).isEqualTo(Order.Status.SHIPPED)
            );
        }

        @Test
        void failure_to_save_snapshot_does_not_fail_the_save() {
            // Given
            SnapshotStore failing = new InMemorySnapshotStore() {
                @Override
                public void save(Snapshot snapshot) {
                    throw new IllegalStateException("snapshot store is down");
                }
            };
            AggregateRepository<Order, OrderEvent> repository = repository(failing, 1);

            // When
            List<RecordedEvent> committed = repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1")));

            // Then
            assertAll(
                    () -> assertThat(committed).hasSize(1),
                    () -> assertThat(repository.load("ORD-1").state().status()).isEqualTo(Order.Status.PLACED)
            );
        }

        @Test
        void undecodable_snapshot_is_ignored_and_all_events_are_replayed() {
            // Given
            AggregateRepository<Order, OrderEvent> repository = repository(snapshotStore, 10);
            repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1")).raise(shipped("ORD-1")));
            snapshotStore.save(new Snapshot("ORD-1", 2, "not json", OffsetDateTime.now(CLOCK)));

            // When
            Aggregate<Order, OrderEvent> order = repository.load("ORD-1");

            // Then
            assertAll(
                    () -> assertThat(order.state().status()).isEqualTo(Order.Status.SHIPPED),
                    () -> assertThat(order.state().changes()).isEqualTo(2)
            );
        }

        @Test
        void snapshot_beyond_the_stream_version_is_an_inconsistency() {
            // Given
            AggregateRepository<Order, OrderEvent> repository = repository(snapshotStore, 10);
            repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1")));
            snapshotStore.save(new Snapshot("ORD-1", 5, new JacksonSnapshotSerializer<>(Order.class).serialize(Order.initial("ORD-1")), OffsetDateTime.now(CLOCK)));

            // When
            Throwable throwable = catchThrowable(() -> repository.get("ORD-1"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(SnapshotInconsistencyException.class)
                    .hasMessage("Snapshot of stream ORD-1 is at version 5 but the stream is at version 1");
        }

        @Test
        void snapshots_are_ignored_when_interval_is_zero() {
            // Given
            AggregateRepository<Order, OrderEvent> repository = repository(snapshotStore, 0);

            // When
            repository.save(repository.create("ORD-1", ACME).raise(placed("ORD-1")).raise(shipped("ORD-1")));

            // Then
            assertThat(snapshotStore.loadLatest("ORD-1")).isEmpty();
        }
    }
}
