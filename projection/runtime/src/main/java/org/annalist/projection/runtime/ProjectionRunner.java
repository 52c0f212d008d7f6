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
import org.annalist.eventstore.api.EventStoreQueries;
import org.annalist.eventstore.api.RecordedEvent;
import org.annalist.notification.api.NotificationFeed;
import org.annalist.notification.api.WakeupSubscription;
import org.annalist.notification.api.internal.Subscriptions;
import org.annalist.projection.api.HandlerFailureException;
import org.annalist.projection.api.Projection;
import org.annalist.projection.api.ProjectionFailure;
import org.annalist.projection.api.ProjectionFailureListener;
import org.annalist.projection.api.ProjectionUnitOfWork;
import org.annalist.projection.api.TrackingCursorStorage;
import org.annalist.retry.ErrorInfo;
import org.annalist.retry.RetryStrategy;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

import static java.util.Objects.requireNonNull;
import static org.annalist.cloudevents.AnnalistExtensionGetter.getGlobalPosition;

/**
 * Keeps one {@link Projection} up to date with the event log on a thread of its own.
 * <p>
 * The runner reads batches of events after the projection's cursor, hands each event to the projection and then saves
 * the cursor at the last position of the batch, all through the {@link ProjectionUnitOfWork}. Between batches it waits
 * for a wakeup from the {@link NotificationFeed} or for the poll interval, whichever comes first.
 * <p>
 * A failing batch is retried with exponential backoff and never skipped. From {@link ProjectionRunnerConfig#escalationThreshold}
 * consecutive failures on, every failure is also reported to the {@link ProjectionFailureListener}.
 */
public class ProjectionRunner {
    private static final Logger log = LoggerFactory.getLogger(ProjectionRunner.class);

    private final Projection projection;
    private final EventStoreQueries eventStoreQueries;
    private final TrackingCursorStorage cursorStorage;
    private final ProjectionUnitOfWork unitOfWork;
    private final @Nullable NotificationFeed notificationFeed;
    private final ProjectionRunnerConfig config;
    private final ProjectionFailureListener failureListener;
    private final Subscriptions localWakeups = new Subscriptions();
    private final AtomicReference<CompletableFuture<Void>> pendingRebuild = new AtomicReference<>();

    private volatile ProjectionState state = ProjectionState.IDLE;
    private volatile long lastProcessedPosition;
    private volatile int consecutiveFailures;
    private volatile @Nullable Throwable lastError;
    private volatile boolean stopRequested;
    private volatile boolean rebuilding;
    private volatile @Nullable WakeupSubscription wakeup;
    private @Nullable Thread thread;

    public ProjectionRunner(Projection projection, EventStoreQueries eventStoreQueries, TrackingCursorStorage cursorStorage, ProjectionUnitOfWork unitOfWork,
                            @Nullable NotificationFeed notificationFeed, ProjectionRunnerConfig config, ProjectionFailureListener failureListener) {
        this.projection = requireNonNull(projection, Projection.class.getSimpleName() + " cannot be null");
        this.eventStoreQueries = requireNonNull(eventStoreQueries, EventStoreQueries.class.getSimpleName() + " cannot be null");
        this.cursorStorage = requireNonNull(cursorStorage, TrackingCursorStorage.class.getSimpleName() + " cannot be null");
        this.unitOfWork = requireNonNull(unitOfWork, ProjectionUnitOfWork.class.getSimpleName() + " cannot be null");
        this.notificationFeed = notificationFeed;
        this.config = requireNonNull(config, ProjectionRunnerConfig.class.getSimpleName() + " cannot be null");
        this.failureListener = requireNonNull(failureListener, ProjectionFailureListener.class.getSimpleName() + " cannot be null");
    }

    public synchronized void start() {
        if (thread != null) {
            throw new IllegalStateException("Projection " + projection.name() + " is already started");
        }
        wakeup = notificationFeed == null ? localWakeups.subscribe() : notificationFeed.subscribe();
        Thread runnerThread = new Thread(this::run, "annalist-projection-" + projection.name());
        runnerThread.setDaemon(true);
        thread = runnerThread;
        state = ProjectionState.CATCHING_UP;
        runnerThread.start();
    }

    /**
     * Clear the read model, reset the cursor and replay the whole log. Consumption stops until the reset is done.
     * Requesting a rebuild while one is pending returns the pending request.
     *
     * @return A future that completes when the read model has been cleared and the cursor reset, before the replay
     */
    public CompletableFuture<Void> rebuild() {
        if (stopRequested || state == ProjectionState.STOPPED) {
            return CompletableFuture.failedFuture(new IllegalStateException("Projection " + projection.name() + " is stopped"));
        }
        CompletableFuture<Void> requested = new CompletableFuture<>();
        CompletableFuture<Void> existing = pendingRebuild.compareAndExchange(null, requested);
        if (existing != null) {
            return existing;
        }
        log.info("Rebuild of projection {} requested", projection.name());
        wakeUp();
        return requested;
    }

    /**
     * Ask the runner to stop after the batch in progress. Returns immediately.
     */
    public synchronized void requestStop() {
        stopRequested = true;
        if (thread == null) {
            state = ProjectionState.STOPPED;
        }
        wakeUp();
    }

    /**
     * Wait for the runner to stop, interrupting it if it hasn't stopped within {@code gracePeriod}.
     *
     * @return {@code true} if the runner stopped within the grace period
     */
    public boolean awaitStop(Duration gracePeriod) {
        Thread runnerThread;
        synchronized (this) {
            runnerThread = thread;
        }
        if (runnerThread == null) {
            return true;
        }
        try {
            runnerThread.join(Math.max(1, gracePeriod.toMillis()));
            if (!runnerThread.isAlive()) {
                return true;
            }
            log.warn("Projection {} didn't stop within {}, interrupting it", projection.name(), gracePeriod);
            runnerThread.interrupt();
            runnerThread.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    public boolean stop(Duration gracePeriod) {
        requestStop();
        return awaitStop(gracePeriod);
    }

    public ProjectionStatus status() {
        Throwable error = lastError;
        return new ProjectionStatus(projection.name(), state, lastProcessedPosition, consecutiveFailures, error == null ? null : error.getMessage());
    }

    public String projectionName() {
        return projection.name();
    }

    private void run() {
        String name = projection.name();
        try {
            lastProcessedPosition = withRetry("reading the cursor", () -> cursorStorage.lastProcessedPosition(name), this::notStopped);
            log.info("Projection {} starting after position {}", name, lastProcessedPosition);
            while (notStopped()) {
                rebuildIfRequested();
                catchUp();
                if (!notStopped() || pendingRebuild.get() != null) {
                    continue;
                }
                state = ProjectionState.IDLE;
                awaitWakeup();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            if (!stopRequested) {
                log.error("Projection {} stopped unexpectedly", name, e);
            }
        } finally {
            state = ProjectionState.STOPPED;
            WakeupSubscription subscription = wakeup;
            if (subscription != null) {
                subscription.close();
            }
            localWakeups.closeAll();
            CompletableFuture<Void> rebuild = pendingRebuild.getAndSet(null);
            if (rebuild != null) {
                rebuild.completeExceptionally(new IllegalStateException("Projection " + name + " was stopped before it could be rebuilt"));
            }
            log.info("Projection {} stopped at position {}", name, lastProcessedPosition);
        }
    }

    private void rebuildIfRequested() {
        CompletableFuture<Void> requested = pendingRebuild.get();
        if (requested == null) {
            return;
        }
        state = ProjectionState.REBUILDING;
        rebuilding = true;
        try {
            // The read model and the cursor are cleared in one unit of work
            withRetry("clearing the read model and resetting the cursor", () -> {
                unitOfWork.execute(() -> {
                    projection.clear();
                    cursorStorage.reset(projection.name());
                });
                return null;
            }, this::notStopped);
            lastProcessedPosition = 0;
            markHealthy();
            pendingRebuild.set(null);
            log.info("Projection {} cleared, replaying the log", projection.name());
            requested.complete(null);
        } catch (RuntimeException e) {
            rebuilding = false;
            pendingRebuild.set(null);
            requested.completeExceptionally(e);
        }
    }

    private void catchUp() {
        while (canContinueBatches()) {
            state = rebuilding ? ProjectionState.REBUILDING : ProjectionState.CATCHING_UP;
            int processed;
            try {
                processed = withRetry("processing events after position " + lastProcessedPosition, this::processNextBatch, this::canContinueBatches);
            } catch (RuntimeException e) {
                log.debug("Projection {} abandoned the batch after position {}", projection.name(), lastProcessedPosition);
                return;
            }
            markHealthy();
            if (processed < config.batchSize) {
                if (rebuilding) {
                    rebuilding = false;
                    log.info("Projection {} rebuilt up to position {}", projection.name(), lastProcessedPosition);
                }
                return;
            }
        }
    }

    private int processNextBatch() {
        List<CloudEvent> events = eventStoreQueries.readFromPosition(lastProcessedPosition + 1, config.batchSize);
        if (events.isEmpty()) {
            return 0;
        }
        long lastPositionInBatch = getGlobalPosition(events.get(events.size() - 1));
        unitOfWork.execute(() -> {
            for (CloudEvent cloudEvent : events) {
                RecordedEvent event = RecordedEvent.from(cloudEvent);
                if (projection.eventTypes().contains(event.type())) {
                    try {
                        projection.handle(event);
                    } catch (RuntimeException e) {
                        throw new HandlerFailureException(projection.name(), event.globalPosition(), event.type(), e);
                    }
                }
            }
            cursorStorage.save(projection.name(), lastPositionInBatch);
        });
        lastProcessedPosition = lastPositionInBatch;
        log.debug("Projection {} processed {} event(s) up to position {}", projection.name(), events.size(), lastPositionInBatch);
        return events.size();
    }

    private <T> T withRetry(String operation, Supplier<T> action, BooleanSupplier keepTrying) {
        return RetryStrategy.exponentialBackoff(config.initialBackoff, config.maxBackoff, config.backoffMultiplier)
                .retryIf(__ -> keepTrying.getAsBoolean())
                .onError((errorInfo, throwable) -> onFailure(operation, errorInfo, throwable))
                .execute(action);
    }

    private void onFailure(String operation, ErrorInfo errorInfo, Throwable throwable) {
        String name = projection.name();
        int failures = errorInfo.attemptNumber();
        consecutiveFailures = failures;
        lastError = throwable;
        final ProjectionFailure failure;
        if (throwable instanceof HandlerFailureException) {
            HandlerFailureException handlerFailure = (HandlerFailureException) throwable;
            failure = ProjectionFailure.atPosition(name, "handling " + handlerFailure.eventType, handlerFailure.globalPosition, failures, throwable);
        } else {
            failure = ProjectionFailure.whileDoing(name, operation, failures, throwable);
        }
        if (failures < config.escalationThreshold) {
            log.warn("Projection {} failed {} (attempt {}), retrying", name, failure.describe(), failures, throwable);
            return;
        }
        log.error("Projection {} failed {} times in a row {}", name, failures, failure.describe(), throwable);
        try {
            failureListener.onEscalation(failure);
        } catch (RuntimeException e) {
            log.error("Failure listener of projection {} threw an exception", name, e);
        }
    }

    private void awaitWakeup() throws InterruptedException {
        WakeupSubscription subscription = wakeup;
        if (subscription == null || subscription.isClosed()) {
            // The feed was closed underneath us, keep polling
            subscription = localWakeups.subscribe();
            wakeup = subscription;
        }
        subscription.awaitWakeup(config.pollInterval);
    }

    private void wakeUp() {
        WakeupSubscription subscription = wakeup;
        if (subscription != null) {
            subscription.wake();
        }
    }

    private void markHealthy() {
        consecutiveFailures = 0;
        lastError = null;
    }

    private boolean notStopped() {
        return !stopRequested && !Thread.currentThread().isInterrupted();
    }

    private boolean canContinueBatches() {
        return notStopped() && pendingRebuild.get() == null;
    }
}
