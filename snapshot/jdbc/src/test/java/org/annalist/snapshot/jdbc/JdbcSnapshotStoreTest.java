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

import org.annalist.snapshot.api.SnapshotStore;
import org.annalist.testsupport.jdbc.H2Database;
import org.annalist.testsupport.snapshot.SnapshotStoreContract;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayName("JdbcSnapshotStore")
class JdbcSnapshotStoreTest extends SnapshotStoreContract {

    private DataSource dataSource;
    private JdbcSnapshotStore snapshotStore;

    @BeforeEach
    void create_snapshot_store() {
        dataSource = H2Database.newDatabase();
        snapshotStore = new JdbcSnapshotStore(dataSource);
    }

    @Override
    protected SnapshotStore snapshotStore() {
        return snapshotStore;
    }

    @Test
    void snapshots_survive_a_new_store_instance() {
        // Given
        snapshotStore.save(snapshot("ORD-1", 3, "{\"status\":\"PLACED\"}"));

        // When
        JdbcSnapshotStore restarted = new JdbcSnapshotStore(dataSource);

        // Then
        assertThat(restarted.loadLatest("ORD-1")).hasValueSatisfying(s -> assertThat(s.state()).isEqualTo("{\"status\":\"PLACED\"}"));
    }

    @Test
    void table_name_uses_the_prefix() {
        // Given
        JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
        JdbcSnapshotStore billing = new JdbcSnapshotStore(jdbcTemplate, "billing_", true);

        // When
        billing.save(snapshot("INV-1", 1, "{}"));

        // Then
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM billing_snapshots", Long.class)).isEqualTo(1);
    }

    @Test
    void rejects_table_prefix_that_is_not_a_plain_identifier() {
        // When
        Throwable throwable = catchThrowable(() -> new JdbcSnapshotStore(new JdbcTemplate(dataSource), "x; DROP TABLE y", true));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
