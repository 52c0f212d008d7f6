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

package org.annalist.testsupport.snapshot;

import org.annalist.snapshot.api.Snapshot;
import org.annalist.snapshot.api.SnapshotStore;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.Optional;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

/**
 * Behaviour every {@link SnapshotStore} implementation must have.
 */
@DisplayNameGeneration(ReplaceUnderscores.class)
public abstract class SnapshotStoreContract {

    protected static final OffsetDateTime CREATED_AT = OffsetDateTime.of(2024, 5, 1, 12, 0, 0, 0, UTC);

    protected abstract SnapshotStore snapshotStore();

    @Test
    void load_latest_returns_empty_when_stream_has_no_snapshots() {
        // When
        Optional<Snapshot> snapshot = snapshotStore().loadLatest("ORD-1");

        // Then
        assertThat(snapshot).isEmpty();
    }

    @Test
    void load_latest_returns_the_snapshot_with_the_highest_version() {
        // Given
        snapshotStore().save(snapshot("ORD-1", 5, "{\"v\":5}"));
        snapshotStore().save(snapshot("ORD-1", 10, "{\"v\":10}"));
        snapshotStore().save(snapshot("ORD-1", 7, "{\"v\":7}"));
        snapshotStore().save(snapshot("ORD-2", 20, "{\"v\":20}"));

        // When
        Optional<Snapshot> snapshot = snapshotStore().loadLatest("ORD-1");

        // Then
        assertThat(snapshot).hasValue(snapshot("ORD-1", 10, "{\"v\":10}"));
    }

    @Test
    void saving_an_existing_version_again_is_a_no_op() {
        // Given
        snapshotStore().save(snapshot("ORD-1", 5, "{\"first\":true}"));

        // When
        snapshotStore().save(snapshot("ORD-1", 5, "{\"first\":false}"));

        // Then
        assertThat(snapshotStore().loadLatest("ORD-1")).hasValue(snapshot("ORD-1", 5, "{\"first\":true}"));
    }

    @Nested
    class Prune {

        @Test
        void keeps_the_newest_snapshots() {
            // Given
            for (long version = 1; version <= 5; version++) {
                snapshotStore().save(snapshot("ORD-1", version * 10, "{}"));
            }
            snapshotStore().save(snapshot("ORD-2", 10, "{}"));

            // When
            int deleted = snapshotStore().prune("ORD-1", 2);

            // Then
            assertAll(
                    () -> assertThat(deleted).isEqualTo(3),
                    () -> assertThat(snapshotStore().loadLatest("ORD-1")).hasValueSatisfying(s -> assertThat(s.version()).isEqualTo(50)),
                    () -> assertThat(snapshotStore().prune("ORD-1", 1)).isEqualTo(1),
                    () -> assertThat(snapshotStore().loadLatest("ORD-2")).isPresent()
            );
        }

        @Test
        void deletes_nothing_when_there_are_fewer_snapshots_than_retained() {
            // Given
            snapshotStore().save(snapshot("ORD-1", 1, "{}"));

            // When
            int deleted = snapshotStore().prune("ORD-1", 3);

            // Then
            assertAll(
                    () -> assertThat(deleted).isZero(),
                    () -> assertThat(snapshotStore().prune("ORD-unknown", 3)).isZero()
            );
        }

        @Test
        void retain_must_be_positive() {
            // When
            Throwable throwable = catchThrowable(() -> snapshotStore().prune("ORD-1", 0));

            // Then
            assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
        }
    }

    protected static Snapshot snapshot(String streamId, long version, String state) {
        return new Snapshot(streamId, version, state, CREATED_AT);
    }
}
