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

package org.annalist.eventstore.api;

import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class WriteConditionTest {

    @Test
    void any_stream_version_is_fulfilled_by_every_version() {
        WriteCondition writeCondition = WriteCondition.anyStreamVersion();

        assertAll(
                () -> assertThat(writeCondition.isFulfilledBy(0)).isTrue(),
                () -> assertThat(writeCondition.isFulfilledBy(17)).isTrue(),
                () -> assertThat(writeCondition.isAnyStreamVersion()).isTrue(),
                () -> assertThat(writeCondition).hasToString("any")
        );
    }

    @Test
    void stream_version_eq_is_only_fulfilled_by_the_expected_version() {
        WriteCondition writeCondition = WriteCondition.streamVersionEq(1);

        assertAll(
                () -> assertThat(writeCondition.isFulfilledBy(1)).isTrue(),
                () -> assertThat(writeCondition.isFulfilledBy(0)).isFalse(),
                () -> assertThat(writeCondition.isFulfilledBy(2)).isFalse(),
                () -> assertThat(writeCondition.isAnyStreamVersion()).isFalse()
        );
    }

    @Test
    void negative_expected_version_is_rejected() {
        Throwable throwable = catchThrowable(() -> WriteCondition.streamVersionEq(-1));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
