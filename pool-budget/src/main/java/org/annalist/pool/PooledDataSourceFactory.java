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

package org.annalist.pool;

import com.zaxxer.hikari.HikariDataSource;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Creates HikariCP pools that are registered with a {@link ConnectionPoolBudget} before they open their first
 * connection. The pool may grow to {@code poolSize + maxOverflow} connections and keeps {@code poolSize} idle ones.
 * <p>
 * Closing the factory closes every pool it created, newest first.
 */
public class PooledDataSourceFactory implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PooledDataSourceFactory.class);

    private final ConnectionPoolBudget budget;
    private final String jdbcUrl;
    private final @Nullable String username;
    private final @Nullable String password;
    private final List<HikariDataSource> created = new ArrayList<>();

    public PooledDataSourceFactory(ConnectionPoolBudget budget, String jdbcUrl, @Nullable String username, @Nullable String password) {
        this.budget = requireNonNull(budget, ConnectionPoolBudget.class.getSimpleName() + " cannot be null");
        this.jdbcUrl = requireNonNull(jdbcUrl, "jdbcUrl cannot be null");
        this.username = username;
        this.password = password;
    }

    /**
     * @throws IllegalArgumentException If {@code componentName} already has a pool in the budget
     * @throws IllegalStateException    If the budget has already been validated
     */
    public synchronized HikariDataSource create(String componentName, PoolSettings settings) {
        requireNonNull(settings, PoolSettings.class.getSimpleName() + " cannot be null");
        budget.register(componentName, settings.poolSize, settings.maxOverflow);

        // The no-arg HikariDataSource starts its pool on the first getConnection()
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("annalist-" + componentName);
        dataSource.setJdbcUrl(jdbcUrl);
        if (username != null) {
            dataSource.setUsername(username);
        }
        if (password != null) {
            dataSource.setPassword(password);
        }
        dataSource.setMaximumPoolSize(settings.maxConnections());
        dataSource.setMinimumIdle(settings.poolSize);
        dataSource.setConnectionTimeout(settings.connectionTimeout.toMillis());
        dataSource.setIdleTimeout(settings.idleTimeout.toMillis());

        created.add(dataSource);
        log.info("Created connection pool {} with {} connection(s) and {} overflow", dataSource.getPoolName(), settings.poolSize, settings.maxOverflow);
        return dataSource;
    }

    public ConnectionPoolBudget budget() {
        return budget;
    }

    @Override
    public synchronized void close() {
        for (int i = created.size() - 1; i >= 0; i--) {
            HikariDataSource dataSource = created.get(i);
            if (!dataSource.isClosed()) {
                log.debug("Closing connection pool {}", dataSource.getPoolName());
                dataSource.close();
            }
        }
        created.clear();
    }
}
