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

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import io.cloudevents.core.format.EventFormat;
import io.cloudevents.core.provider.EventFormatProvider;
import io.cloudevents.jackson.JsonFormat;
import org.annalist.cloudevents.AnnalistCloudEventExtension;
import org.annalist.cloudevents.AnnalistExtensionGetter;
import org.annalist.cloudevents.AnnalistExtensionRemover;
import org.annalist.eventstore.api.*;
import org.annalist.eventstore.api.internal.AppendedEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Objects.requireNonNull;

/**
 * An {@link EventStore} backed by a relational database, accessed with Spring's {@link JdbcTemplate}. Tested against PostgreSQL and H2.
 * <p>
 * Global positions come from a single counter row that every append increments first thing in its transaction. The row lock
 * serializes appends, which makes positions gapless and guarantees that commits happen in position order, so a reader that
 * has seen position P will never later find an event below P. Appends to different streams contend on that row, reads never do.
 * <p>
 * The {@link CloudEvent} is stored as JSON without the log-assigned extensions. These live in columns of their own and are added
 * back when reading.
 */
public class JdbcEventStore implements EventStore, EventStoreQueries {
    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final JdbcEventStoreConfig config;
    private final AppendListener listener;
    private final List<JdbcAppendHook> appendHooks;
    private final EventFormat cloudEventSerializer;
    private final RowMapper<CloudEvent> cloudEventRowMapper;

    private final String selectColumns;

    public JdbcEventStore(DataSource dataSource, JdbcEventStoreConfig config) {
        this(dataSource, config, AppendListener.noop(), Collections.emptyList());
    }

    public JdbcEventStore(DataSource dataSource, JdbcEventStoreConfig config, AppendListener listener, List<JdbcAppendHook> appendHooks) {
        this(new JdbcTemplate(requireNonNull(dataSource, DataSource.class.getSimpleName() + " cannot be null")), new DataSourceTransactionManager(dataSource), config, listener, appendHooks);
    }

    /**
     * Create an event store that participates in transactions managed by {@code transactionManager}, e.g. to append events and
     * update other tables atomically.
     */
    public JdbcEventStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, JdbcEventStoreConfig config, AppendListener listener, List<JdbcAppendHook> appendHooks) {
        requireNonNull(jdbcTemplate, JdbcTemplate.class.getSimpleName() + " cannot be null");
        requireNonNull(transactionManager, PlatformTransactionManager.class.getSimpleName() + " cannot be null");
        requireNonNull(config, JdbcEventStoreConfig.class.getSimpleName() + " cannot be null");
        requireNonNull(listener, AppendListener.class.getSimpleName() + " cannot be null");
        requireNonNull(appendHooks, "appendHooks cannot be null");
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.config = config;
        this.listener = listener;
        this.appendHooks = List.copyOf(appendHooks);
        this.cloudEventSerializer = EventFormatProvider.getInstance().resolveFormat(JsonFormat.CONTENT_TYPE);
        this.cloudEventRowMapper = (rs, __) -> toCloudEvent(rs.getString("cloud_event"), rs.getString("stream_id"), rs.getLong("stream_version"),
                rs.getLong("global_position"), rs.getString("tenant_id"), rs.getObject("recorded_at", OffsetDateTime.class));
        this.selectColumns = "SELECT global_position, stream_id, stream_version, tenant_id, recorded_at, cloud_event FROM " + config.eventsTable();

        if (config.createTables) {
            createTablesIfMissing();
        }
    }

    @Override
    public WriteResult write(String streamId, WriteCondition writeCondition, Stream<CloudEvent> events) {
        requireNonNull(streamId, "StreamId cannot be null");
        if (writeCondition == null) {
            throw new IllegalArgumentException(WriteCondition.class.getSimpleName() + " cannot be null");
        }
        requireNonNull(events, "Events cannot be null");
        List<CloudEvent> eventsToWrite = events.collect(Collectors.toList());
        TenantId tenant = AppendedEvents.requireSingleTenant(streamId, eventsToWrite);

        if (eventsToWrite.isEmpty()) {
            long currentStreamVersion = currentStreamVersion(streamId);
            if (!writeCondition.isFulfilledBy(currentStreamVersion)) {
                throw new ConcurrencyConflictException(streamId, currentStreamVersion, writeCondition);
            }
            return new WriteResult(streamId, currentStreamVersion, currentStreamVersion, Collections.emptyList());
        }

        try {
            WriteResult writeResult = transactionTemplate.execute(__ -> append(streamId, writeCondition, tenant, eventsToWrite));
            log.debug("Appended {} event(s) to stream {} (version {} -> {})", eventsToWrite.size(), streamId, writeResult.getOldStreamVersion(), writeResult.getStreamVersion());
            return writeResult;
        } catch (DuplicateKeyException e) {
            // Only reachable if someone writes to the events table without going through the position counter
            long currentStreamVersion = currentStreamVersion(streamId);
            log.warn("Unique constraint violated when appending to stream {}, reporting as concurrency conflict", streamId, e);
            throw new ConcurrencyConflictException(streamId, currentStreamVersion, writeCondition);
        }
    }

    private WriteResult append(String streamId, WriteCondition writeCondition, TenantId tenant, List<CloudEvent> eventsToWrite) {
        int numberOfEvents = eventsToWrite.size();
        int updated = jdbcTemplate.update("UPDATE " + config.positionTable() + " SET last_position = last_position + ? WHERE id = 1", numberOfEvents);
        if (updated != 1) {
            throw new IllegalStateException("Position counter row is missing in " + config.positionTable() + ", create the tables or enable createTables");
        }
        long lastPosition = requireNonNull(jdbcTemplate.queryForObject("SELECT last_position FROM " + config.positionTable() + " WHERE id = 1", Long.class));

        StreamHead head = streamHead(streamId);
        if (!writeCondition.isFulfilledBy(head.version())) {
            throw new ConcurrencyConflictException(streamId, head.version(), writeCondition);
        }
        AppendedEvents.requireOwner(streamId, head.tenant(), tenant);

        OffsetDateTime recordedAt = OffsetDateTime.now(config.clock).truncatedTo(ChronoUnit.MICROS);
        long streamVersion = head.version();
        long globalPosition = lastPosition - numberOfEvents;
        List<CloudEvent> written = new ArrayList<>(numberOfEvents);
        List<Object[]> rows = new ArrayList<>(numberOfEvents);
        for (CloudEvent event : eventsToWrite) {
            CloudEvent withExtensions = CloudEventBuilder.v1(event)
                    .withExtension(new AnnalistCloudEventExtension(streamId, ++streamVersion, ++globalPosition, tenant.value(), recordedAt))
                    .build();
            written.add(withExtensions);
            rows.add(new Object[]{globalPosition, streamId, streamVersion, tenant.value(), event.getId(), event.getType(), recordedAt,
                    AnnalistExtensionGetter.getCorrelationId(event).orElse(null), AnnalistExtensionGetter.getCausationId(event).orElse(null), serialize(event)});
        }

        jdbcTemplate.batchUpdate("INSERT INTO " + config.eventsTable() +
                " (global_position, stream_id, stream_version, tenant_id, event_id, event_type, recorded_at, correlation_id, causation_id, cloud_event)" +
                " VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)", rows);

        WriteResult writeResult = new WriteResult(streamId, head.version(), streamVersion, written);
        appendHooks.forEach(hook -> hook.beforeCommit(jdbcTemplate, writeResult));
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                listener.eventsAppended(writeResult);
            }
        });
        return writeResult;
    }

    @Override
    public EventStream<CloudEvent> read(String streamId, long fromVersion) {
        requireNonNull(streamId, "StreamId cannot be null");
        return transactionTemplate.execute(__ -> {
            long currentVersion = currentStreamVersion(streamId);
            if (currentVersion == 0) {
                return EventStream.empty(streamId);
            }
            List<CloudEvent> events = jdbcTemplate.query(selectColumns + " WHERE stream_id = ? AND stream_version >= ? AND stream_version <= ? ORDER BY stream_version",
                    cloudEventRowMapper, streamId, Math.max(1, fromVersion), currentVersion);
            return EventStream.of(streamId, currentVersion, events);
        });
    }

    @Override
    public EventStream<CloudEvent> read(TenantId tenantId, String streamId, long fromVersion) {
        requireNonNull(tenantId, TenantId.class.getSimpleName() + " cannot be null");
        TenantId owner = streamHead(streamId).tenant();
        if (owner != null && !owner.equals(tenantId)) {
            return EventStream.empty(streamId);
        }
        return read(streamId, fromVersion);
    }

    @Override
    public boolean exists(String streamId) {
        return currentStreamVersion(streamId) > 0;
    }

    @Override
    public List<CloudEvent> readFromPosition(long position, int limit) {
        requireLimit(limit);
        return jdbcTemplate.query(selectColumns + " WHERE global_position >= ? ORDER BY global_position LIMIT ?", cloudEventRowMapper, position, limit);
    }

    @Override
    public List<CloudEvent> readFromPosition(TenantId tenantId, long position, int limit) {
        requireNonNull(tenantId, TenantId.class.getSimpleName() + " cannot be null");
        requireLimit(limit);
        return jdbcTemplate.query(selectColumns + " WHERE tenant_id = ? AND global_position >= ? ORDER BY global_position LIMIT ?", cloudEventRowMapper, tenantId.value(), position, limit);
    }

    @Override
    public long headPosition() {
        List<Long> positions = jdbcTemplate.queryForList("SELECT last_position FROM " + config.positionTable() + " WHERE id = 1", Long.class);
        return positions.isEmpty() ? 0 : positions.get(0);
    }

    private long currentStreamVersion(String streamId) {
        return streamHead(streamId).version();
    }

    private StreamHead streamHead(String streamId) {
        List<StreamHead> heads = jdbcTemplate.query("SELECT stream_version, tenant_id FROM " + config.eventsTable() + " WHERE stream_id = ? ORDER BY stream_version DESC LIMIT 1",
                (rs, __) -> new StreamHead(rs.getLong("stream_version"), TenantId.of(rs.getString("tenant_id"))), streamId);
        return heads.isEmpty() ? StreamHead.EMPTY : heads.get(0);
    }

    private String serialize(CloudEvent cloudEvent) {
        return new String(cloudEventSerializer.serialize(AnnalistExtensionRemover.removeAnnalistExtensions(cloudEvent)), UTF_8);
    }

    private CloudEvent toCloudEvent(String json, String streamId, long streamVersion, long globalPosition, String tenantId, OffsetDateTime recordedAt) {
        CloudEvent cloudEvent = cloudEventSerializer.deserialize(json.getBytes(UTF_8));
        return CloudEventBuilder.v1(cloudEvent)
                .withExtension(new AnnalistCloudEventExtension(streamId, streamVersion, globalPosition, tenantId, recordedAt))
                .build();
    }

    private void createTablesIfMissing() {
        String events = config.eventsTable();
        String position = config.positionTable();
        log.info("Creating event store tables {} and {} unless they exist", events, position);
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + events + " (" +
                "global_position BIGINT NOT NULL PRIMARY KEY, " +
                "stream_id VARCHAR(255) NOT NULL, " +
                "stream_version BIGINT NOT NULL, " +
                "tenant_id VARCHAR(63) NOT NULL, " +
                "event_id VARCHAR(255) NOT NULL, " +
                "event_type VARCHAR(255) NOT NULL, " +
                "recorded_at TIMESTAMP WITH TIME ZONE NOT NULL, " +
                "correlation_id VARCHAR(255), " +
                "causation_id VARCHAR(255), " +
                "cloud_event VARCHAR NOT NULL, " +
                "CONSTRAINT " + events + "_stream_version_uk UNIQUE (stream_id, stream_version))");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + events + "_tenant_idx ON " + events + " (tenant_id, global_position)");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS " + events + "_correlation_idx ON " + events + " (correlation_id)");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + position + " (id INT NOT NULL PRIMARY KEY, last_position BIGINT NOT NULL)");
        Long rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + position, Long.class);
        if (rows == null || rows == 0) {
            try {
                jdbcTemplate.update("INSERT INTO " + position + " (id, last_position) VALUES (1, 0)");
            } catch (DuplicateKeyException e) {
                log.debug("Position counter row in {} was created concurrently", position);
            }
        }
    }

    private static void requireLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be greater than 0");
        }
    }

    private record StreamHead(long version, TenantId tenant) {
        private static final StreamHead EMPTY = new StreamHead(0, null);
    }
}
