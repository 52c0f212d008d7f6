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

package org.annalist.snapshot.jdbc;

import org.annalist.snapshot.api.Snapshot;
import org.annalist.snapshot.api.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import javax.sql.DataSource;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import static java.util.Objects.requireNonNull;

/**
 * A {@link SnapshotStore} that keeps snapshots in the {@code <prefix>snapshots} table, keyed by stream id and version.
 */
public class JdbcSnapshotStore implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);
    private static final Pattern TABLE_PREFIX = Pattern.compile("^[a-z_][a-z0-9_]*$");

    private static final RowMapper<Snapshot> SNAPSHOT_ROW_MAPPER = (rs, __) ->
            new Snapshot(rs.getString("stream_id"), rs.getLong("version"), rs.getString("state"), rs.getObject("created_at", OffsetDateTime.class));

    private final JdbcTemplate jdbcTemplate;
    private final String table;

    public JdbcSnapshotStore(DataSource dataSource) {
        this(new JdbcTemplate(requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null")), "annalist_", true);
    }

    public JdbcSnapshotStore(JdbcTemplate jdbcTemplate, String tablePrefix, boolean createTable) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(tablePrefix, "tablePrefix cannot be null");
        if (!TABLE_PREFIX.matcher(tablePrefix).matches()) {
            throw new IllegalArgumentException("Invalid table prefix: " + tablePrefix);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.table = tablePrefix + "snapshots";
        if (createTable) {
            createTableIfMissing();
        }
    }

    @Override
    public void save(Snapshot snapshot) {
        requireNonNull(snapshot, Snapshot.class.getSimpleName() + " cannot be null");
        try {
            jdbcTemplate.update("INSERT INTO " + table + " (stream_id, version, state, created_at) VALUES (?, ?, ?, ?)",
                    snapshot.streamId(), snapshot.version(), snapshot.state(), snapshot.createdAt());
            log.debug("Saved snapshot of stream {} at version {}", snapshot.streamId(), snapshot.version());
        } catch (DuplicateKeyException e) {
            log.debug("Snapshot of stream {} at version {} already exists, ignoring", snapshot.streamId(), snapshot.version());
        }
    }

    @Override
    public Optional<Snapshot> loadLatest(String streamId) {
        requireNonNull(streamId, "streamId cannot be null");
        List<Snapshot> snapshots = jdbcTemplate.query("SELECT stream_id, version, state, created_at FROM " + table + " WHERE stream_id = ? ORDER BY version DESC LIMIT 1",
                SNAPSHOT_ROW_MAPPER, streamId);
        return snapshots.stream().findFirst();
    }

    @Override
    public int prune(String streamId, int retain) {
        requireNonNull(streamId, "streamId cannot be null");
        if (retain < 1) {
            throw new IllegalArgumentException("retain must be greater than 0");
        }
        List<Long> retained = jdbcTemplate.queryForList("SELECT version FROM " + table + " WHERE stream_id = ? ORDER BY version DESC LIMIT ?", Long.class, streamId, retain);
        if (retained.size() < retain) {
            return 0;
        }
        long oldestRetained = retained.get(retained.size() - 1);
        int deleted = jdbcTemplate.update("DELETE FROM " + table + " WHERE stream_id = ? AND version < ?", streamId, oldestRetained);
        log.debug("Pruned {} snapshot(s) of stream {}", deleted, streamId);
        return deleted;
    }

    private void createTableIfMissing() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + table + " (" +
                "stream_id VARCHAR(255) NOT NULL, " +
                "version BIGINT NOT NULL, " +
                "state TEXT NOT NULL, " +
                "created_at TIMESTAMP WITH TIME ZONE NOT NULL, " +
                "PRIMARY KEY (stream_id, version))");
    }
}
