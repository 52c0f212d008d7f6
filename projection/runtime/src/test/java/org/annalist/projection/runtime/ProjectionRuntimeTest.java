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

package org.annalist.projection.runtime;

import io.cloudevents.CloudEvent;
import org.annalist.eventstore.inmemory.InMemoryEventStore;
import org.annalist.notification.inmemory.InProcessNotificationFeed;
import org.annalist.projection.api.Projection;
import org.annalist.projection.api.ProjectionFailure;
import org.annalist.projection.api.ProjectionFailureListener;
import org.annalist.projection.api.ProjectionUnitOfWork;
import org.annalist.projection.api.TrackingCursor;
import org.annalist.projection.api.TrackingCursorStorage;
import org.annalist.testsupport.domain.OrderCloudEvents;
import org.annalist.testsupport.domain.OrderEvent;
import org.annalist.testsupport.domain.OrderPlaced;
import org.annalist.testsupport.domain.OrderShipped;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.annalist.testsupport.domain.OrderCloudEvents.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class ProjectionRuntimeTest {

    private static final ProjectionRunnerConfig FAST = ProjectionRunnerConfig.defaults()
            .withPollInterval(Duration.ofMillis(50))
            .withBackoff(Duration.ofMillis(5), Duration.ofMillis(20), 2.0)
            .withShutdownGracePeriod(Duration.ofSeconds(2));

    private final OrderCloudEvents orderCloudEvents = new OrderCloudEvents();
    private final Map<String, String> orderStatuses = new ConcurrentHashMap<>();
    private InProcessNotificationFeed feed;
    private InMemoryEventStore eventStore;
    private InMemoryTrackingCursorStorage cursorStorage;
    private ProjectionRuntime runtime;

    @BeforeEach
    void create_event_store() {
        feed = new InProcessNotificationFeed();
        eventStore = new InMemoryEventStore(feed);
        cursorStorage = new InMemoryTrackingCursorStorage();
    }

    @AfterEach
    void stop_runtime() {
        if (runtime != null) {
            runtime.close();
        }
        feed.close();
    }

    @Test
    void catches_up_with_events_written_before_start() {
        // Given
        eventStore.write("ORD-1", 0, events(placed("ORD-1"), shipped("ORD-1")));
        eventStore.write("ORD-2", 0, events(placed("ORD-2")));
        runtime = new ProjectionRuntime(eventStore, cursorStorage, null, FAST, ProjectionFailureListener.noop()).register(orderStatusProjection());

        // When
        runtime.start();

        // Then
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertAll(
                () -> assertThat(orderStatuses).containsExactlyInAnyOrderEntriesOf(Map.of("ORD-1", "shipped", "ORD-2", "placed")),
                () -> assertThat(cursorStorage.lastProcessedPosition("order-status")).isEqualTo(3)
        ));
    }

    @Test
    void commit_notifications_wake_the_projection_before_the_poll_interval_elapses() {
        // Given
        ProjectionRunnerConfig slowPolling = FAST.withPollInterval(Duration.ofMinutes(5));
        runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, slowPolling, ProjectionFailureListener.noop()).register(orderStatusProjection());
        runtime.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> runtime.status("order-status").state() == ProjectionState.IDLE);

        // When
        eventStore.write("ORD-1", 0, events(placed("ORD-1")));

        // Then
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertThat(orderStatuses).containsEntry("ORD-1", "placed"));
    }

    @Test
    void events_are_processed_in_batches_of_the_configured_size() {
        // Given
        IntStream.rangeClosed(1, 7).forEach(i -> eventStore.write("ORD-" + i, 0, events(placed("ORD-" + i))));
        runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST.withBatchSize(2), ProjectionFailureListener.noop()).register(orderStatusProjection());

        // When
        runtime.start();

        // Then
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertAll(
                () -> assertThat(orderStatuses).hasSize(7),
                () -> assertThat(runtime.status("order-status").lastProcessedPosition()).isEqualTo(7)
        ));
    }

    @Test
    void events_without_a_handler_still_advance_the_cursor() {
        // Given
        eventStore.write("ORD-1", 0, events(placed("ORD-1"), shipped("ORD-1"), cancelled("ORD-1")));
        runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(orderStatusProjection());

        // When
        runtime.start();

        // Then
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertAll(
                () -> assertThat(cursorStorage.lastProcessedPosition("order-status")).isEqualTo(3),
                () -> assertThat(orderStatuses).containsExactlyEntriesOf(Map.of("ORD-1", "shipped"))
        ));
    }

    @Test
    void restarted_projection_continues_after_its_cursor() {
        // Given
        AtomicInteger placedCount = new AtomicInteger();
        eventStore.write("ORD-1", 0, events(placed("ORD-1")));
        runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(countingProjection(placedCount));
        runtime.start();
        await().atMost(2, TimeUnit.SECONDS).until(() -> cursorStorage.lastProcessedPosition("placed-count") == 1);
        runtime.stop();

        // When
        eventStore.write("ORD-2", 0, events(placed("ORD-2")));
        runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(countingProjection(placedCount));
        runtime.start();

        // Then
        await().atMost(2, TimeUnit.SECONDS).until(() -> cursorStorage.lastProcessedPosition("placed-count") == 2);
        assertThat(placedCount).hasValue(2);
    }

    @Nested
    class Failures {

        @Test
        void failing_batch_is_retried_until_it_succeeds_and_escalated_from_the_third_failure_on() {
            // Given
            AtomicInteger remainingFailures = new AtomicInteger(4);
            List<ProjectionFailure> escalations = new CopyOnWriteArrayList<>();
            Projection projection = Projection.named("flaky")
                    .on(OrderPlaced.TYPE, OrderPlaced.class, (placed, event) -> orderStatuses.put(placed.orderId(), "placed"))
                    .on(OrderShipped.TYPE, event -> {
                        if (remainingFailures.getAndDecrement() > 0) {
                            throw new IllegalStateException("read model unavailable");
                        }
                        orderStatuses.put(event.streamId(), "shipped");
                    })
                    .clearWith(orderStatuses::clear)
                    .build();
            eventStore.write("ORD-1", 0, events(placed("ORD-1"), shipped("ORD-1")));
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, escalations::add).register(projection);

            // When
            runtime.start();

            // Then
            await().atMost(3, TimeUnit.SECONDS).untilAsserted(() -> assertAll(
                    () -> assertThat(orderStatuses).containsEntry("ORD-1", "shipped"),
                    () -> assertThat(runtime.status("flaky").consecutiveFailures()).isZero(),
                    () -> assertThat(runtime.status("flaky").lastProcessedPosition()).isEqualTo(2)
            ));
            assertAll(
                    () -> assertThat(escalations).extracting(ProjectionFailure::consecutiveFailures).containsExactly(3, 4),
                    () -> assertThat(escalations).extracting(ProjectionFailure::position).containsOnly(OptionalLong.of(2)),
                    () -> assertThat(escalations).extracting(ProjectionFailure::operation).containsOnly("handling order.shipped.v1"),
                    () -> assertThat(escalations).extracting(ProjectionFailure::projectionName).containsOnly("flaky"),
                    () -> assertThat(runtime.status("flaky").lastError()).isNull(),
                    () -> assertThat(cursorStorage.lastProcessedPosition("flaky")).isEqualTo(2)
            );
        }

        @Test
        void failing_projection_reports_its_failures_in_the_status_and_does_not_move_its_cursor() {
            // Given
            Projection projection = Projection.named("broken")
                    .on(OrderPlaced.TYPE, event -> {
                        throw new IllegalStateException("boom");
                    })
                    .clearWith(() -> {
                    })
                    .build();
            eventStore.write("ORD-1", 0, events(placed("ORD-1")));
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(projection);

            // When
            runtime.start();

            // Then
            await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertThat(runtime.status("broken").consecutiveFailures()).isGreaterThanOrEqualTo(3));
            ProjectionStatus status = runtime.status("broken");
            assertAll(
                    () -> assertThat(status.isFailing()).isTrue(),
                    () -> assertThat(status.lastError()).contains("boom"),
                    () -> assertThat(cursorStorage.read("broken")).isEmpty()
            );
        }

        @Test
        void throwing_failure_listener_does_not_stop_the_projection() {
            // Given
            AtomicInteger remainingFailures = new AtomicInteger(3);
            Projection projection = Projection.named("flaky")
                    .on(OrderPlaced.TYPE, event -> {
                        if (remainingFailures.getAndDecrement() > 0) {
                            throw new IllegalStateException("boom");
                        }
                        orderStatuses.put(event.streamId(), "placed");
                    })
                    .clearWith(orderStatuses::clear)
                    .build();
            eventStore.write("ORD-1", 0, events(placed("ORD-1")));
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, failure -> {
                throw new IllegalStateException("pager is down");
            }).register(projection);

            // When
            runtime.start();

            // Then
            await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertThat(orderStatuses).containsEntry("ORD-1", "placed"));
        }
    }

    @Nested
    class Rebuild {

        @Test
        void failing_cursor_reset_is_escalated_as_a_rebuild_failure_without_a_position() {
            // Given
            List<ProjectionFailure> escalations = new CopyOnWriteArrayList<>();
            TrackingCursorStorage lockedCursors = new DelegatingCursorStorage(cursorStorage) {
                @Override
                public void reset(String projectionName) {
                    throw new IllegalStateException("cursor table is locked");
                }
            };
            eventStore.write("ORD-1", 0, events(placed("ORD-1")));
            runtime = new ProjectionRuntime(eventStore, lockedCursors, feed, FAST, escalations::add).register(orderStatusProjection());
            runtime.start();
            await().atMost(2, TimeUnit.SECONDS).until(() -> cursorStorage.lastProcessedPosition("order-status") == 1);

            // When
            runtime.rebuild("order-status");

            // Then
            await().atMost(2, TimeUnit.SECONDS).until(() -> !escalations.isEmpty());
            ProjectionFailure failure = escalations.get(0);
            assertAll(
                    () -> assertThat(failure.operation()).isEqualTo("clearing the read model and resetting the cursor"),
                    () -> assertThat(failure.position()).isEmpty(),
                    () -> assertThat(failure.describe()).isEqualTo("while clearing the read model and resetting the cursor"),
                    () -> assertThat(failure.cause()).hasMessage("cursor table is locked"),
                    () -> assertThat(runtime.status("order-status").state()).isEqualTo(ProjectionState.REBUILDING)
            );
        }

        @Test
        void rebuild_produces_the_same_read_model_as_the_original_run() throws Exception {
            // Given
            eventStore.write("ORD-1", 0, events(placed("ORD-1"), shipped("ORD-1")));
            eventStore.write("ORD-2", 0, events(placed("ORD-2")));
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(orderStatusProjection());
            runtime.start();
            await().atMost(2, TimeUnit.SECONDS).until(() -> cursorStorage.lastProcessedPosition("order-status") == 3);
            Map<String, String> before = Map.copyOf(orderStatuses);
            orderStatuses.put("ORD-STALE", "corrupted");

            // When
            runtime.rebuild("order-status").get(2, TimeUnit.SECONDS);

            // Then
            await().atMost(2, TimeUnit.SECONDS).untilAsserted(() -> assertAll(
                    () -> assertThat(orderStatuses).isEqualTo(before),
                    () -> assertThat(runtime.status("order-status").lastProcessedPosition()).isEqualTo(3),
                    () -> assertThat(runtime.status("order-status").state()).isNotEqualTo(ProjectionState.REBUILDING)
            ));
        }

        @Test
        void rebuild_of_unknown_projection_is_rejected() {
            // Given
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(orderStatusProjection());

            // When
            Throwable throwable = catchThrowable(() -> runtime.rebuild("unknown"));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("No projection named unknown is registered");
        }

        @Test
        void rebuild_of_stopped_projection_fails() {
            // Given
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(orderStatusProjection());
            runtime.start();
            runtime.stop();

            // When
            CompletableFuture<Void> rebuild = runtime.rebuild("order-status");

            // Then
            assertThat(catchThrowable(() -> rebuild.get(1, TimeUnit.SECONDS))).isInstanceOf(ExecutionException.class).hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    class Redelivery {
        private static final int NUMBER_OF_ORDERS = 100;
        private static final int EVENTS_PER_ORDER = 10;

        @BeforeEach
        void write_one_thousand_events() {
            IntStream.range(0, NUMBER_OF_ORDERS).forEach(order -> {
                String orderId = "ORD-" + order;
                eventStore.write(orderId, 0, IntStream.range(0, EVENTS_PER_ORDER)
                        .mapToObj(n -> new OrderPlaced(orderId + "-placed-" + n, orderId, "customer-" + order, 100L * n))
                        .map(e -> orderCloudEvents.toCloudEvent("acme", e)));
            });
        }

        @Test
        void events_applied_before_a_crash_are_delivered_again_and_an_idempotent_read_model_ends_up_as_after_a_clean_run() {
            // Given
            int total = NUMBER_OF_ORDERS * EVENTS_PER_ORDER;
            Map<String, Long> cleanRun = new ConcurrentHashMap<>();
            try (ProjectionRuntime clean = new ProjectionRuntime(eventStore, new InMemoryTrackingCursorStorage(), null, FAST.withBatchSize(100), ProjectionFailureListener.noop())
                    .register(orderVersionProjection(cleanRun), ProjectionUnitOfWork.direct())) {
                clean.start();
                await().atMost(5, TimeUnit.SECONDS).until(() -> clean.status("order-versions").lastProcessedPosition() == total);
            }

            Map<String, Long> readModel = new ConcurrentHashMap<>();
            AtomicBoolean crashing = new AtomicBoolean(true);
            TrackingCursorStorage crashingCursors = new DelegatingCursorStorage(cursorStorage) {
                @Override
                public TrackingCursor save(String projectionName, long position) {
                    if (position > 500 && crashing.get()) {
                        throw new IllegalStateException("process died before the cursor was saved");
                    }
                    return super.save(projectionName, position);
                }
            };
            runtime = new ProjectionRuntime(eventStore, crashingCursors, null, FAST.withBatchSize(100), ProjectionFailureListener.noop())
                    .register(orderVersionProjection(readModel), ProjectionUnitOfWork.direct());
            runtime.start();
            await().atMost(5, TimeUnit.SECONDS).until(() -> runtime.status("order-versions").consecutiveFailures() > 0);
            runtime.stop();
            long savedBeforeCrash = cursorStorage.lastProcessedPosition("order-versions");
            long appliedBeforeCrash = readModel.values().stream().mapToLong(Long::longValue).sum();

            // When
            crashing.set(false);
            runtime = new ProjectionRuntime(eventStore, crashingCursors, null, FAST.withBatchSize(100), ProjectionFailureListener.noop())
                    .register(orderVersionProjection(readModel), ProjectionUnitOfWork.direct());
            runtime.start();

            // Then
            await().atMost(5, TimeUnit.SECONDS).until(() -> cursorStorage.lastProcessedPosition("order-versions") == total);
            assertAll(
                    () -> assertThat(savedBeforeCrash).isEqualTo(500),
                    () -> assertThat(appliedBeforeCrash).isEqualTo(600),
                    () -> assertThat(readModel).hasSize(NUMBER_OF_ORDERS).isEqualTo(cleanRun)
            );
        }

        private Projection orderVersionProjection(Map<String, Long> versions) {
            return Projection.named("order-versions")
                    .on(OrderPlaced.TYPE, event -> versions.merge(event.streamId(), event.streamVersion(), Long::max))
                    .clearWith(versions::clear)
                    .build();
        }
    }

    @Nested
    class Lifecycle {

        @Test
        void projection_names_must_be_unique() {
            // Given
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(orderStatusProjection());

            // When
            Throwable throwable = catchThrowable(() -> runtime.register(orderStatusProjection()));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Projection order-status is already registered");
        }

        @Test
        void projections_cannot_be_registered_after_start() {
            // Given
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(orderStatusProjection());
            runtime.start();

            // When
            Throwable throwable = catchThrowable(() -> runtime.register(countingProjection(new AtomicInteger())));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class);
        }

        @Test
        void stop_stops_every_projection() {
            // Given
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST.withPollInterval(Duration.ofMinutes(5)), ProjectionFailureListener.noop())
                    .register(orderStatusProjection())
                    .register(countingProjection(new AtomicInteger()));
            runtime.start();

            // When
            runtime.stop();

            // Then
            assertAll(
                    () -> assertThat(runtime.status()).extracting(ProjectionStatus::state).containsOnly(ProjectionState.STOPPED),
                    () -> assertThat(runtime.projectionNames()).containsExactly("order-status", "placed-count")
            );
        }

        @Test
        void stopped_runtime_cannot_be_started_again() {
            // Given
            runtime = new ProjectionRuntime(eventStore, cursorStorage, feed, FAST, ProjectionFailureListener.noop()).register(orderStatusProjection());
            runtime.start();
            runtime.stop();

            // When
            Throwable throwable = catchThrowable(runtime::start);

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class).hasMessage("The projection runtime has been stopped");
        }
    }

    private Projection orderStatusProjection() {
        return Projection.named("order-status")
                .on(OrderPlaced.TYPE, OrderPlaced.class, (placed, event) -> orderStatuses.put(placed.orderId(), "placed"))
                .on(OrderShipped.TYPE, OrderShipped.class, (shipped, event) -> orderStatuses.put(shipped.orderId(), "shipped"))
                .clearWith(() -> orderStatuses.clear())
                .build();
    }

    private static Projection countingProjection(AtomicInteger count) {
        return Projection.named("placed-count")
                .on(OrderPlaced.TYPE, event -> count.incrementAndGet())
                .clearWith(() -> count.set(0))
                .build();
    }

    private static class DelegatingCursorStorage implements TrackingCursorStorage {
        private final TrackingCursorStorage delegate;

        DelegatingCursorStorage(TrackingCursorStorage delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<TrackingCursor> read(String projectionName) {
            return delegate.read(projectionName);
        }

        @Override
        public TrackingCursor save(String projectionName, long position) {
            return delegate.save(projectionName, position);
        }

        @Override
        public void reset(String projectionName) {
            delegate.reset(projectionName);
        }
    }

    private Stream<CloudEvent> events(OrderEvent... events) {
        return Stream.of(events).map(e -> orderCloudEvents.toCloudEvent("acme", e));
    }
}
