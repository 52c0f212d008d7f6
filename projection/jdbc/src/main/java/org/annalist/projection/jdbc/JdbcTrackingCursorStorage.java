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

package org.annalist.projection.jdbc;

import org.annalist.projection.api.TrackingCursor;
import org.annalist.projection.api.TrackingCursorStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A {@link TrackingCursorStorage} backed by the {@code <prefix>tracking_cursors} table.
 * <p>
 * Writes go through the {@link JdbcTemplate} and therefore join a transaction bound to the same {@link DataSource},
 * such as the one started by {@link JdbcProjectionUnitOfWork}.
 */
public class JdbcTrackingCursorStorage implements TrackingCursorStorage {
    private static final Logger log = LoggerFactory.getLogger(JdbcTrackingCursorStorage.class);
    private static final Pattern TABLE_PREFIX = Pattern.compile("^[a-z_][a-z0-9_]*$");

    private static final RowMapper<TrackingCursor> CURSOR_ROW_MAPPER = (rs, __) ->
            new TrackingCursor(rs.getString("projection_name"), rs.getLong("last_position"), rs.getObject("updated_at", OffsetDateTime.class));

    private final JdbcTemplate jdbcTemplate;
    private final String table;
    private final Clock clock;

    public JdbcTrackingCursorStorage(DataSource dataSource) {
        this(new JdbcTemplate(requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null")), "annalist_", true, Clock.systemUTC());
    }

    public JdbcTrackingCursorStorage(JdbcTemplate jdbcTemplate, String tablePrefix, boolean createTable, Clock clock) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(tablePrefix, "tablePrefix cannot be null");
        requireNonNull(clock, Clock.class.getSimpleName() + " cannot be null");
        if (!TABLE_PREFIX.matcher(tablePrefix).matches()) {
            throw new IllegalArgumentException("Invalid table prefix: " + tablePrefix);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.table = tablePrefix + "tracking_cursors";
        this.clock = clock;
        if (createTable) {
            createTableIfMissing();
        }
    }

    @Override
    public Optional<TrackingCursor> read(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        List<TrackingCursor> cursors = jdbcTemplate.query("SELECT projection_name, last_position, updated_at FROM " + table + " WHERE projection_name = ?",
                CURSOR_ROW_MAPPER, projectionName);
        return cursors.stream().findFirst();
    }

    @Override
    public TrackingCursor save(String projectionName, long position) {
        requireNonNull(projectionName, "projectionName cannot be null");
        if (position < 0) {
            throw new IllegalArgumentException("position cannot be negative");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);
        int updated = jdbcTemplate.update("UPDATE " + table + " SET last_position = ?, updated_at = ? WHERE projection_name = ? AND last_position <= ?",
                position, now, projectionName, position);
        if (updated == 0) {
            Optional<TrackingCursor> stored = read(projectionName);
            if (stored.isPresent()) {
                throw new IllegalArgumentException(String.format("Cannot move cursor of %s back from %d to %d", projectionName, stored.get().lastProcessedPosition(), position));
            }
            jdbcTemplate.update("INSERT INTO " + table + " (projection_name, last_position, updated_at) VALUES (?, ?, ?)", projectionName, position, now);
        }
        log.trace("Cursor of projection {} saved at position {}", projectionName, position);
        return new TrackingCursor(projectionName, position, now);
    }

    @Override
    public void reset(String projectionName) {
        requireNonNull(projectionName, "projectionName cannot be null");
        jdbcTemplate.update("DELETE FROM " + table + " WHERE projection_name = ?", projectionName);
        log.debug("Cursor of projection {} reset", projectionName);
    }

    private void createTableIfMissing() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + table + " (" +
                "projection_name VARCHAR(255) PRIMARY KEY, " +
                "last_position BIGINT NOT NULL, " +
                "updated_at TIMESTAMP WITH TIME ZONE NOT NULL)");
    }
}
