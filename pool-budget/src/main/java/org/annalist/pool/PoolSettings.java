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

import java.time.Duration;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Sizing of one component's connection pool. The pool keeps {@code poolSize} connections and may open
 * {@code maxOverflow} more under load.
 */
public final class PoolSettings {
    public final int poolSize;
    public final int maxOverflow;
    public final Duration connectionTimeout;
    public final Duration idleTimeout;

    private PoolSettings(int poolSize, int maxOverflow, Duration connectionTimeout, Duration idleTimeout) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be greater than 0");
        }
        if (maxOverflow < 0) {
            throw new IllegalArgumentException("maxOverflow cannot be negative");
        }
        requireNonNull(connectionTimeout, "connectionTimeout cannot be null");
        requireNonNull(idleTimeout, "idleTimeout cannot be null");
        this.poolSize = poolSize;
        this.maxOverflow = maxOverflow;
        this.connectionTimeout = connectionTimeout;
        this.idleTimeout = idleTimeout;
    }

    public static PoolSettings of(int poolSize, int maxOverflow) {
        return new PoolSettings(poolSize, maxOverflow, Duration.ofSeconds(30), Duration.ofMinutes(10));
    }

    public PoolSettings withConnectionTimeout(Duration connectionTimeout) {
        return new PoolSettings(poolSize, maxOverflow, connectionTimeout, idleTimeout);
    }

    public PoolSettings withIdleTimeout(Duration idleTimeout) {
        return new PoolSettings(poolSize, maxOverflow, connectionTimeout, idleTimeout);
    }

    public int maxConnections() {
        return poolSize + maxOverflow;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PoolSettings)) return false;
        PoolSettings that = (PoolSettings) o;
        return poolSize == that.poolSize && maxOverflow == that.maxOverflow && Objects.equals(connectionTimeout, that.connectionTimeout) && Objects.equals(idleTimeout, that.idleTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(poolSize, maxOverflow, connectionTimeout, idleTimeout);
    }

    @Override
    public String toString() {
        return "PoolSettings{" +
                "poolSize=" + poolSize +
                ", maxOverflow=" + maxOverflow +
                ", connectionTimeout=" + connectionTimeout +
                ", idleTimeout=" + idleTimeout +
                '}';
    }
}
