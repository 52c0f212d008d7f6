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

package org.annalist.eventstore.jdbc;

import java.time.Clock;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Configuration for the {@link JdbcEventStore}.
 */
public class JdbcEventStoreConfig {
    public static final String DEFAULT_TABLE_PREFIX = "annalist_";
    private static final Pattern VALID_PREFIX = Pattern.compile("^[a-z_][a-z0-9_]*$");

    public final String tablePrefix;
    public final boolean createTables;
    public final Clock clock;

    private JdbcEventStoreConfig(String tablePrefix, boolean createTables, Clock clock) {
        Objects.requireNonNull(tablePrefix, "tablePrefix cannot be null");
        Objects.requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (!VALID_PREFIX.matcher(tablePrefix).matches()) {
            throw new IllegalArgumentException("Table prefix must only contain lowercase letters, digits and underscores but was " + tablePrefix);
        }
        this.tablePrefix = tablePrefix;
        this.createTables = createTables;
        this.clock = clock;
    }

    public static JdbcEventStoreConfig defaults() {
        return new Builder().build();
    }

    public String eventsTable() {
        return tablePrefix + "events";
    }

    public String positionTable() {
        return tablePrefix + "event_position";
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JdbcEventStoreConfig)) return false;
        JdbcEventStoreConfig that = (JdbcEventStoreConfig) o;
        return createTables == that.createTables && Objects.equals(tablePrefix, that.tablePrefix) && Objects.equals(clock, that.clock);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tablePrefix, createTables, clock);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", JdbcEventStoreConfig.class.getSimpleName() + "[", "]")
                .add("tablePrefix='" + tablePrefix + "'")
                .add("createTables=" + createTables)
                .toString();
    }

    public static final class Builder {
        private String tablePrefix = DEFAULT_TABLE_PREFIX;
        private boolean createTables = true;
        private Clock clock = Clock.systemUTC();

        /**
         * @param tablePrefix Prefix of every table the event store uses. Default is {@value #DEFAULT_TABLE_PREFIX}.
         */
        public Builder tablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
            return this;
        }

        /**
         * @param createTables Whether missing tables and indexes are created when the event store is instantiated. Default is {@code true}.
         */
        public Builder createTables(boolean createTables) {
            this.createTables = createTables;
            return this;
        }

        /**
         * @param clock The clock that decides the recorded-at time of appended events. Default is the UTC system clock.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JdbcEventStoreConfig build() {
            return new JdbcEventStoreConfig(tablePrefix, createTables, clock);
        }
    }
}
