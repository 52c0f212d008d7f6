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

package org.annalist.notification.postgres;

import org.annalist.notification.api.NotificationFeed;
import org.annalist.notification.api.WakeupSubscription;
import org.annalist.notification.api.internal.Subscriptions;
import org.annalist.retry.RetryStrategy;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

import static java.util.Objects.requireNonNull;

/**
 * A {@link NotificationFeed} that {@code LISTEN}s on a PostgreSQL channel, so that readers are woken by commits made from
 * any process. The notifications are sent by {@link PostgresNotifyAppendHook}.
 * <p>
 * A background thread holds one dedicated connection from the {@link DataSource}. If the connection is lost the thread
 * reconnects with backoff and wakes all subscriptions, since notifications sent while disconnected are lost.
 */
public class PostgresNotificationFeed implements NotificationFeed {
    private static final Logger log = LoggerFactory.getLogger(PostgresNotificationFeed.class);

    public static final String DEFAULT_CHANNEL = "annalist_events";

    private final DataSource dataSource;
    private final String channel;
    private final LongSupplier headPosition;
    private final RetryStrategy reconnectStrategy;
    private final Duration pollTimeout;
    private final Subscriptions subscriptions = new Subscriptions();
    private final AtomicLong highestObservedPosition = new AtomicLong();
    private final ExecutorService listenerThread;

    private volatile boolean running;
    private volatile boolean listening;

    /**
     * Create a feed listening on {@value #DEFAULT_CHANNEL}, reconnecting with exponential backoff from 100 ms up to 5 seconds.
     *
     * @param dataSource   Where the listening connection is taken from
     * @param headPosition Reads the current head position of the log, called on start and after each reconnect
     */
    public PostgresNotificationFeed(DataSource dataSource, LongSupplier headPosition) {
        this(dataSource, DEFAULT_CHANNEL, headPosition, RetryStrategy.exponentialBackoff(Duration.ofMillis(100), Duration.ofSeconds(5), 2.0), Duration.ofMillis(500));
    }

    /**
     * @param dataSource        Where the listening connection is taken from
     * @param channel           The channel to listen on
     * @param headPosition      Reads the current head position of the log, called on start and after each reconnect
     * @param reconnectStrategy Backoff between reconnection attempts. Its retry predicate is replaced, reconnecting stops when the feed is closed.
     * @param pollTimeout       How long to block waiting for notifications before checking whether the feed has been closed
     */
    public PostgresNotificationFeed(DataSource dataSource, String channel, LongSupplier headPosition, RetryStrategy.Retry reconnectStrategy, Duration pollTimeout) {
        requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null");
        requireNonNull(headPosition, "headPosition cannot be null");
        requireNonNull(reconnectStrategy, RetryStrategy.class.getSimpleName() + " cannot be null");
        requireNonNull(pollTimeout, "pollTimeout cannot be null");
        if (pollTimeout.isNegative() || pollTimeout.isZero()) {
            throw new IllegalArgumentException("pollTimeout must be positive");
        }
        this.dataSource = dataSource;
        this.channel = NotificationChannel.requireValid(channel);
        this.headPosition = headPosition;
        this.pollTimeout = pollTimeout;
        this.reconnectStrategy = reconnectStrategy
                .retryIf(__ -> running)
                .onError((info, throwable) -> {
                    if (running) {
                        log.warn("Listening on channel {} failed (attempt {}), reconnecting in {}", channel, info.attemptNumber(),
                                info.nextBackoff().orElse(Duration.ZERO), throwable);
                    }
                });
        this.listenerThread = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "annalist-notification-listener-" + channel);
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("Notification feed on channel " + channel + " is already started");
        }
        if (listenerThread.isShutdown()) {
            throw new IllegalStateException("Notification feed on channel " + channel + " is closed");
        }
        highestObservedPosition.accumulateAndGet(headPosition.getAsLong(), Math::max);
        running = true;
        listenerThread.execute(this::listenUntilClosed);
    }

    @Override
    public WakeupSubscription subscribe() {
        return subscriptions.subscribe();
    }

    @Override
    public long currentPosition() {
        return highestObservedPosition.get();
    }

    /**
     * @return {@code true} when the listening connection is established
     */
    public boolean isListening() {
        return listening;
    }

    public String channel() {
        return channel;
    }

    @Override
    public synchronized void close() {
        running = false;
        subscriptions.closeAll();
        listenerThread.shutdown();
        try {
            if (!listenerThread.awaitTermination(pollTimeout.toMillis() + 1000, TimeUnit.MILLISECONDS)) {
                listenerThread.shutdownNow();
            }
        } catch (InterruptedException e) {
            listenerThread.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Stopped listening on channel {}", channel);
    }

    private void listenUntilClosed() {
        try {
            reconnectStrategy.execute(this::listen);
        } catch (RuntimeException e) {
            if (running) {
                log.error("Gave up listening on channel {}, readers will rely on polling", channel, e);
            }
        } finally {
            listening = false;
        }
    }

    private void listen() {
        try (Connection connection = dataSource.getConnection()) {
            PGConnection pgConnection = connection.unwrap(PGConnection.class);
            try (Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + channel);
            }
            if (!connection.getAutoCommit()) {
                connection.commit();
            }
            listening = true;
            highestObservedPosition.accumulateAndGet(headPosition.getAsLong(), Math::max);
            subscriptions.wakeAll();
            log.info("Listening on channel {} from position {}", channel, highestObservedPosition.get());

            int timeoutMillis = (int) Math.max(1, pollTimeout.toMillis());
            while (running) {
                PGNotification[] notifications = pgConnection.getNotifications(timeoutMillis);
                if (notifications != null && notifications.length > 0) {
                    for (PGNotification notification : notifications) {
                        observe(notification.getParameter());
                    }
                    subscriptions.wakeAll();
                }
            }
        } catch (SQLException e) {
            throw new DataAccessResourceFailureException("Lost notification connection on channel " + channel, e);
        } finally {
            listening = false;
        }
    }

    private void observe(String payload) {
        try {
            highestObservedPosition.accumulateAndGet(Long.parseLong(payload), Math::max);
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric payload '{}' on channel {}", payload, channel);
        }
    }
}
