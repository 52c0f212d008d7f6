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

import org.annalist.eventstore.api.EventStoreQueries;
import org.annalist.notification.api.NotificationFeed;
import org.annalist.projection.api.Projection;
import org.annalist.projection.api.ProjectionFailureListener;
import org.annalist.projection.api.ProjectionUnitOfWork;
import org.annalist.projection.api.TrackingCursorStorage;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CompletableFuture;

import static java.util.Objects.requireNonNull;

/**
 * Hosts the registered projections, one {@link ProjectionRunner} each. Projections must be registered before
 * {@link #start()}.
 */
public class ProjectionRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProjectionRuntime.class);

    private final EventStoreQueries eventStoreQueries;
    private final TrackingCursorStorage cursorStorage;
    private final @Nullable NotificationFeed notificationFeed;
    private final ProjectionRunnerConfig config;
    private final ProjectionFailureListener failureListener;
    private final Map<String, ProjectionRunner> runners = new LinkedHashMap<>();

    private boolean started;
    private boolean stopped;

    public ProjectionRuntime(EventStoreQueries eventStoreQueries, TrackingCursorStorage cursorStorage, @Nullable NotificationFeed notificationFeed) {
        this(eventStoreQueries, cursorStorage, notificationFeed, ProjectionRunnerConfig.defaults(), ProjectionFailureListener.noop());
    }

    public ProjectionRuntime(EventStoreQueries eventStoreQueries, TrackingCursorStorage cursorStorage, @Nullable NotificationFeed notificationFeed,
                             ProjectionRunnerConfig config, ProjectionFailureListener failureListener) {
        this.eventStoreQueries = requireNonNull(eventStoreQueries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        this.cursorStorage = requireNonNull(cursorStorage, TrackingCursorStorage.class.getSimpleName() + " cannot be null");
        this.notificationFeed = notificationFeed;
        this.config = requireNonNull(config, ProjectionRunnerConfig.class.getSimpleName() + " cannot be null");
        this.failureListener = requireNonNull(failureListener, ProjectionFailureListener.class.getSimpleName() + " cannot be null");
    }

    public ProjectionRuntime register(Projection projection) {
        return register(projection, ProjectionUnitOfWork.direct());
    }

    /**
     * Register a projection whose batches run inside {@code unitOfWork}.
     *
     * @throws IllegalArgumentException If a projection with the same name is already registered
     * @throws IllegalStateException    If the runtime has already been started
     */
    public synchronized ProjectionRuntime register(Projection projection, ProjectionUnitOfWork unitOfWork) {
        requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
        if (started) {
            throw new IllegalStateException("Cannot register projection " + projection.name() + " after the runtime has been started");
        }
        if (runners.containsKey(projection.name())) {
            throw new IllegalArgumentException("Projection " + projection.name() + " is already registered");
        }
        runners.put(projection.name(), new ProjectionRunner(projection, eventStoreQueries, cursorStorage, unitOfWork, notificationFeed, config, failureListener));
        return this;
    }

    public synchronized void start() {
        if (stopped) {
            throw new IllegalStateException("The projection runtime has been stopped");
        }
        if (started) {
            return;
        }
        started = true;
        runners.values().forEach(ProjectionRunner::start);
        log.info("Started {} projection(s): {}", runners.size(), runners.keySet());
    }

    /**
     * @throws IllegalArgumentException If no projection with the given name is registered
     */
    public CompletableFuture<Void> rebuild(String projectionName) {
        return runner(projectionName).rebuild();
    }

    public ProjectionStatus status(String projectionName) {
        return runner(projectionName).status();
    }

    public synchronized List<ProjectionStatus> status() {
        List<ProjectionStatus> statuses = new ArrayList<>(runners.size());
        runners.values().forEach(runner -> statuses.add(runner.status()));
        return Collections.unmodifiableList(statuses);
    }

    public synchronized Set<String> projectionNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(runners.keySet()));
    }

    /**
     * Stop all projections, giving them {@link ProjectionRunnerConfig#shutdownGracePeriod} to finish the batch in progress.
     */
    public synchronized void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        runners.values().forEach(ProjectionRunner::requestStop);
        long deadline = System.nanoTime() + config.shutdownGracePeriod.toNanos();
        for (ProjectionRunner runner : runners.values()) {
            long remaining = Math.max(0, deadline - System.nanoTime());
            if (!runner.awaitStop(Duration.ofNanos(remaining))) {
                log.warn("Projection {} was interrupted during shutdown", runner.projectionName());
            }
        }
        log.info("Stopped {} projection(s)", runners.size());
    }

    @Override
    public void close() {
        stop();
    }

    private synchronized ProjectionRunner runner(String projectionName) {
        ProjectionRunner runner = runners.get(projectionName);
        if (runner == null) {
            throw new IllegalArgumentException("No projection named " + projectionName + " is registered");
        }
        return runner;
    }
}
