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

package org.annalist.engine;

import com.zaxxer.hikari.HikariDataSource;
import org.annalist.application.converter.CloudEventConverter;
import org.annalist.application.repository.AggregateDefinition;
import org.annalist.application.repository.AggregateRepository;
import org.annalist.application.repository.SnapshotSerializer;
import org.annalist.eventstore.api.AppendListener;
import org.annalist.eventstore.api.EventStore;
import org.annalist.eventstore.api.EventStoreQueries;
import org.annalist.eventstore.jdbc.JdbcEventStore;
import org.annalist.eventstore.jdbc.JdbcEventStoreConfig;
import org.annalist.notification.api.NotificationFeed;
import org.annalist.notification.inmemory.InProcessNotificationFeed;
import org.annalist.notification.postgres.PostgresNotificationFeed;
import org.annalist.notification.postgres.PostgresNotifyAppendHook;
import org.annalist.pool.BudgetReport;
import org.annalist.pool.ConnectionPoolBudget;
import org.annalist.pool.PooledDataSourceFactory;
import org.annalist.projection.api.Projection;
import org.annalist.projection.api.ProjectionFailureListener;
import org.annalist.projection.api.ProjectionUnitOfWork;
import org.annalist.projection.jdbc.JdbcProjectionUnitOfWork;
import org.annalist.projection.jdbc.JdbcTrackingCursorStorage;
import org.annalist.projection.runtime.ProjectionRunnerConfig;
import org.annalist.projection.runtime.ProjectionRuntime;
import org.annalist.projection.runtime.ProjectionStatus;
import org.annalist.retry.RetryStrategy;
import org.annalist.snapshot.api.SnapshotStore;
import org.annalist.snapshot.jdbc.JdbcSnapshotStore;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * The event-sourced storage engine on top of a relational database.
 * <p>
 * {@link Builder#start()} brings the engine up in a fixed order:
 * <ol>
 *     <li>create the connection pools and the projections, registering every pool with the {@link ConnectionPoolBudget}</li>
 *     <li>validate the budget against the connection ceiling, which fails the startup in {@link org.annalist.pool.BudgetMode#STRICT strict} mode</li>
 *     <li>open the event log, the snapshot store and the notification feed</li>
 *     <li>start the projection runtime</li>
 * </ol>
 * {@link #close()} stops the runtime, the feed and the pools in reverse order.
 */
public class EventSourcingEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventSourcingEngine.class);

    private final JdbcEngineSettings settings;
    private final JdbcEventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final NotificationFeed notificationFeed;
    private final ProjectionRuntime projectionRuntime;
    private final PooledDataSourceFactory pools;
    private volatile boolean closed;

    private EventSourcingEngine(JdbcEngineSettings settings, JdbcEventStore eventStore, SnapshotStore snapshotStore, NotificationFeed notificationFeed,
                                ProjectionRuntime projectionRuntime, PooledDataSourceFactory pools) {
        this.settings = settings;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.notificationFeed = notificationFeed;
        this.projectionRuntime = projectionRuntime;
        this.pools = pools;
    }

    public static Builder builder(JdbcEngineSettings settings) {
        return new Builder(settings);
    }

    public EventStore eventStore() {
        return eventStore;
    }

    public EventStoreQueries queries() {
        return eventStore;
    }

    public SnapshotStore snapshotStore() {
        return snapshotStore;
    }

    public NotificationFeed notificationFeed() {
        return notificationFeed;
    }

    /**
     * Create a repository for an aggregate type that snapshots according to {@link AggregateDefinition#snapshotInterval()}.
     */
    public <S, E> AggregateRepository<S, E> repository(AggregateDefinition<S, E> definition, CloudEventConverter<E> converter, SnapshotSerializer<S> serializer) {
        return new AggregateRepository<>(eventStore, snapshotStore, converter, serializer, definition, settings.clock);
    }

    /**
     * Create a repository for an aggregate type that always replays its full stream.
     */
    public <S, E> AggregateRepository<S, E> repository(AggregateDefinition<S, E> definition, CloudEventConverter<E> converter) {
        return new AggregateRepository<>(eventStore, converter, definition);
    }

    /**
     * @see ProjectionRuntime#rebuild(String)
     */
    public CompletableFuture<Void> rebuild(String projectionName) {
        return projectionRuntime.rebuild(projectionName);
    }

    public List<ProjectionStatus> projectionStatus() {
        return projectionRuntime.status();
    }

    public BudgetReport budgetReport() {
        return pools.budget().report();
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.info("Stopping event sourcing engine");
        projectionRuntime.stop();
        notificationFeed.close();
        pools.close();
        log.info("Event sourcing engine stopped");
    }

    public static final class Builder {
        private final JdbcEngineSettings settings;
        private final List<Function<DataSource, Projection>> projectionFactories = new ArrayList<>();
        private ProjectionRunnerConfig projectionRunnerConfig = ProjectionRunnerConfig.defaults();
        private ProjectionFailureListener failureListener = ProjectionFailureListener.noop();

        private Builder(JdbcEngineSettings settings) {
            this.settings = requireNonNull(settings, JdbcEngineSettings.class.getSimpleName() + " cannot be null");
        }

        /**
         * Register a projection whose read model doesn't live in the database.
         */
        public Builder projection(Projection projection) {
            requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
            projectionFactories.add(__ -> projection);
            return this;
        }

        /**
         * Register a projection whose read model lives in the database. The factory gets the projection pool, and read
         * model writes made through it commit in the same transaction as the projection's cursor.
         */
        public Builder projection(Function<DataSource, Projection> projectionFactory) {
            projectionFactories.add(requireNonNull(projectionFactory, "projectionFactory cannot be null"));
            return this;
        }

        public Builder projectionRunnerConfig(ProjectionRunnerConfig projectionRunnerConfig) {
            this.projectionRunnerConfig = requireNonNull(projectionRunnerConfig, ProjectionRunnerConfig.class.getSimpleName() + " cannot be null");
            return this;
        }

        public Builder failureListener(ProjectionFailureListener failureListener) {
            this.failureListener = requireNonNull(failureListener, ProjectionFailureListener.class.getSimpleName() + " cannot be null");
            return this;
        }

        /**
         * Start the engine.
         *
         * @throws org.annalist.pool.BudgetExceededException If the connection budget is exceeded in strict mode
         */
        public EventSourcingEngine start() {
            ConnectionPoolBudget budget = new ConnectionPoolBudget(settings.budgetMode);
            PooledDataSourceFactory pools = new PooledDataSourceFactory(budget, settings.jdbcUrl, settings.username, settings.password);
            List<AutoCloseable> started = new ArrayList<>();
            started.add(pools);
            try {
                // Register components
                HikariDataSource writerPool = pools.create("writer", settings.writerPool);
                HikariDataSource projectionPool = pools.create("projections", settings.projectionPool);
                @Nullable HikariDataSource listenerPool = settings.notificationMode == NotificationMode.POSTGRES_LISTEN ? pools.create("listener", settings.listenerPool) : null;
                List<Projection> projections = new ArrayList<>(projectionFactories.size());
                projectionFactories.forEach(factory -> projections.add(requireNonNull(factory.apply(projectionPool), "Projection factory returned null")));

                // Validate
                budget.validate(settings.connectionCeiling);

                // Open storage and notifications
                JdbcEventStoreConfig eventStoreConfig = new JdbcEventStoreConfig.Builder().tablePrefix(settings.tablePrefix).clock(settings.clock).build();
                JdbcEventStore eventStore;
                NotificationFeed notificationFeed;
                if (listenerPool == null) {
                    InProcessNotificationFeed inProcessFeed = new InProcessNotificationFeed();
                    started.add(inProcessFeed);
                    eventStore = new JdbcEventStore(writerPool, eventStoreConfig, inProcessFeed, Collections.emptyList());
                    notificationFeed = inProcessFeed;
                } else {
                    eventStore = new JdbcEventStore(writerPool, eventStoreConfig, AppendListener.noop(), List.of(new PostgresNotifyAppendHook(settings.notificationChannel)));
                    PostgresNotificationFeed postgresFeed = new PostgresNotificationFeed(listenerPool, settings.notificationChannel, eventStore::headPosition,
                            RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(5), 2.0), Duration.ofMillis(500));
                    started.add(postgresFeed);
                    postgresFeed.start();
                    notificationFeed = postgresFeed;
                }
                SnapshotStore snapshotStore = new JdbcSnapshotStore(new JdbcTemplate(writerPool), settings.tablePrefix, true);

                // Start projections
                JdbcTrackingCursorStorage cursorStorage = new JdbcTrackingCursorStorage(new JdbcTemplate(projectionPool), settings.tablePrefix, true, settings.clock);
                ProjectionRuntime projectionRuntime = new ProjectionRuntime(eventStore, cursorStorage, notificationFeed, projectionRunnerConfig, failureListener);
                started.add(projectionRuntime);
                ProjectionUnitOfWork unitOfWork = new JdbcProjectionUnitOfWork(projectionPool);
                projections.forEach(projection -> projectionRuntime.register(projection, unitOfWork));
                projectionRuntime.start();

                log.info("Event sourcing engine started with {} projection(s) and {} notifications", projections.size(), settings.notificationMode);
                return new EventSourcingEngine(settings, eventStore, snapshotStore, notificationFeed, projectionRuntime, pools);
            } catch (RuntimeException e) {
                log.error("Failed to start event sourcing engine with settings {}", settings, e);
                closeInReverseOrder(started, e);
                throw e;
            }
        }

        private static void closeInReverseOrder(List<AutoCloseable> started, RuntimeException startupFailure) {
            for (int i = started.size() - 1; i >= 0; i--) {
                try {
                    started.get(i).close();
                } catch (Exception e) {
                    startupFailure.addSuppressed(e);
                }
            }
        }
    }
}
