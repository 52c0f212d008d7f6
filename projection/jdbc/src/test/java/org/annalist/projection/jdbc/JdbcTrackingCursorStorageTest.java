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
import org.annalist.testsupport.jdbc.H2Database;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class JdbcTrackingCursorStorageTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private DataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private JdbcTrackingCursorStorage storage;

    @BeforeEach
    void create_storage() {
        dataSource = H2Database.newDatabase();
        jdbcTemplate = new JdbcTemplate(dataSource);
        storage = new JdbcTrackingCursorStorage(jdbcTemplate, "annalist_", true, Clock.fixed(NOW, UTC));
    }

    @Test
    void projection_without_cursor_starts_at_zero() {
        assertAll(
                () -> assertThat(storage.read("orders")).isEmpty(),
                () -> assertThat(storage.lastProcessedPosition("orders")).isZero()
        );
    }

    @Test
    void first_save_inserts_and_later_saves_move_the_cursor_forward() {
        // Given
        storage.save("orders", 3);

        // When
        storage.save("orders", 3);
        storage.save("orders", 12);

        // Then
        assertAll(
                () -> assertThat(storage.read("orders")).hasValue(new TrackingCursor("orders", 12, OffsetDateTime.ofInstant(NOW, UTC))),
                () -> assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM annalist_tracking_cursors", Integer.class)).isEqualTo(1)
        );
    }

    @Test
    void cursor_cannot_move_backwards() {
        // Given
        storage.save("orders", 10);

        // When
        Throwable throwable = catchThrowable(() -> storage.save("orders", 4));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Cannot move cursor of orders back from 10 to 4"),
                () -> assertThat(storage.lastProcessedPosition("orders")).isEqualTo(10)
        );
    }

    @Test
    void reset_deletes_the_cursor() {
        // Given
        storage.save("orders", 10);
        storage.save("invoices", 2);

        // When
        storage.reset("orders");

        // Then
        assertAll(
                () -> assertThat(storage.read("orders")).isEmpty(),
                () -> assertThat(storage.lastProcessedPosition("invoices")).isEqualTo(2)
        );
    }

    @Test
    void cursor_save_is_rolled_back_with_the_unit_of_work() {
        // Given
        storage.save("orders", 1);
        JdbcProjectionUnitOfWork unitOfWork = new JdbcProjectionUnitOfWork(dataSource);

        // When
        Throwable throwable = catchThrowable(() -> unitOfWork.execute(() -> {
            storage.save("orders", 5);
            throw new IllegalStateException("handler failed");
        }));

        // Then
        assertAll(
                () -> assertThat(throwable).isExactlyInstanceOf(IllegalStateException.class),
                () -> assertThat(storage.lastProcessedPosition("orders")).isEqualTo(1)
        );
    }

    @Test
    void cursors_survive_a_new_storage_instance() {
        // Given
        storage.save("orders", 7);

        // When
        JdbcTrackingCursorStorage restarted = new JdbcTrackingCursorStorage(dataSource);

        // Then
        assertThat(restarted.lastProcessedPosition("orders")).isEqualTo(7);
    }

    @Test
    void invalid_table_prefix_is_rejected() {
        // When
        Throwable throwable = catchThrowable(() -> new JdbcTrackingCursorStorage(jdbcTemplate, "drop table;", false, Clock.systemUTC()));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessage("Invalid table prefix: drop table;");
    }
}
