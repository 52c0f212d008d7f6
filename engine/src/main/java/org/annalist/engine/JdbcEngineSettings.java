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

import org.annalist.pool.BudgetMode;
import org.annalist.pool.PoolSettings;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.util.StringJoiner;

import static java.util.Objects.requireNonNull;

/**
 * Everything {@link EventSourcingEngine} needs to connect to the database and size its connection pools.
 * Create it with {@link #builder(String)}.
 */
public final class JdbcEngineSettings {
    public final String jdbcUrl;
    public final @Nullable String username;
    public final @Nullable String password;
    public final PoolSettings writerPool;
    public final PoolSettings projectionPool;
    public final PoolSettings listenerPool;
    public final int connectionCeiling;
    public final BudgetMode budgetMode;
    public final String tablePrefix;
    public final NotificationMode notificationMode;
    public final String notificationChannel;
    public final Clock clock;

    private JdbcEngineSettings(Builder builder) {
        this.jdbcUrl = builder.jdbcUrl;
        this.username = builder.username;
        this.password = builder.password;
        this.writerPool = builder.writerPool;
        this.projectionPool = builder.projectionPool;
        this.listenerPool = builder.listenerPool;
        this.connectionCeiling = builder.connectionCeiling;
        this.budgetMode = builder.budgetMode;
        this.tablePrefix = builder.tablePrefix;
        this.notificationMode = builder.notificationMode == null ? defaultNotificationMode(jdbcUrl) : builder.notificationMode;
        this.notificationChannel = builder.notificationChannel;
        this.clock = builder.clock;
    }

    public static Builder builder(String jdbcUrl) {
        return new Builder(jdbcUrl);
    }

    private static NotificationMode defaultNotificationMode(String jdbcUrl) {
        return jdbcUrl.startsWith("jdbc:postgresql:") ? NotificationMode.POSTGRES_LISTEN : NotificationMode.IN_PROCESS;
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", JdbcEngineSettings.class.getSimpleName() + "[", "]")
                .add("jdbcUrl='" + jdbcUrl + "'")
                .add("username='" + username + "'")
                .add("writerPool=" + writerPool)
                .add("projectionPool=" + projectionPool)
                .add("listenerPool=" + listenerPool)
                .add("connectionCeiling=" + connectionCeiling)
                .add("budgetMode=" + budgetMode)
                .add("tablePrefix='" + tablePrefix + "'")
                .add("notificationMode=" + notificationMode)
                .add("notificationChannel='" + notificationChannel + "'")
                .toString();
    }

    public static final class Builder {
        private final String jdbcUrl;
        private @Nullable String username;
        private @Nullable String password;
        private PoolSettings writerPool = PoolSettings.of(10, 5);
        private PoolSettings projectionPool = PoolSettings.of(5, 2);
        private PoolSettings listenerPool = PoolSettings.of(1, 0);
        private int connectionCeiling = 100;
        private BudgetMode budgetMode = BudgetMode.ADVISORY;
        private String tablePrefix = "annalist_";
        private @Nullable NotificationMode notificationMode;
        private String notificationChannel = "annalist_events";
        private Clock clock = Clock.systemUTC();

        private Builder(String jdbcUrl) {
            this.jdbcUrl = requireNonNull(jdbcUrl, "jdbcUrl cannot be null");
        }

        public Builder credentials(@Nullable String username, @Nullable String password) {
            this.username = username;
            this.password = password;
            return this;
        }

        /**
         * @param writerPool Pool used by the event log, the snapshot store and repositories. Default is 10 connections with 5 overflow.
         */
        public Builder writerPool(PoolSettings writerPool) {
            this.writerPool = requireNonNull(writerPool, "writerPool cannot be null");
            return this;
        }

        /**
         * @param projectionPool Pool shared by projection read models and tracking cursors. Default is 5 connections with 2 overflow.
         */
        public Builder projectionPool(PoolSettings projectionPool) {
            this.projectionPool = requireNonNull(projectionPool, "projectionPool cannot be null");
            return this;
        }

        /**
         * @param listenerPool Pool of the {@code LISTEN} connection, only created in {@link NotificationMode#POSTGRES_LISTEN}. Default is 1 connection.
         */
        public Builder listenerPool(PoolSettings listenerPool) {
            this.listenerPool = requireNonNull(listenerPool, "listenerPool cannot be null");
            return this;
        }

        /**
         * @param connectionCeiling The number of connections the database accepts from this process. Default is 100.
         */
        public Builder connectionCeiling(int connectionCeiling) {
            if (connectionCeiling < 1) {
                throw new IllegalArgumentException("connectionCeiling must be greater than 0");
            }
            this.connectionCeiling = connectionCeiling;
            return this;
        }

        public Builder budgetMode(BudgetMode budgetMode) {
            this.budgetMode = requireNonNull(budgetMode, BudgetMode.class.getSimpleName() + " cannot be null");
            return this;
        }

        public Builder tablePrefix(String tablePrefix) {
            this.tablePrefix = requireNonNull(tablePrefix, "tablePrefix cannot be null");
            return this;
        }

        /**
         * @param notificationMode Default is {@link NotificationMode#POSTGRES_LISTEN} for PostgreSQL URLs and {@link NotificationMode#IN_PROCESS} otherwise.
         */
        public Builder notificationMode(NotificationMode notificationMode) {
            this.notificationMode = requireNonNull(notificationMode, NotificationMode.class.getSimpleName() + " cannot be null");
            return this;
        }

        public Builder notificationChannel(String notificationChannel) {
            this.notificationChannel = requireNonNull(notificationChannel, "notificationChannel cannot be null");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
            return this;
        }

        public JdbcEngineSettings build() {
            return new JdbcEngineSettings(this);
        }
    }
}
