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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

@DisplayNameGeneration(ReplaceUnderscores.class)
class TenantIdTest {

    @ParameterizedTest
    @ValueSource(strings = {"ab", "acme", "north-wind-2", "0x"})
    void accepts_lowercase_slugs(String value) {
        assertThat(TenantId.of(value).value()).isEqualTo(value);
    }

    @ParameterizedTest
    @ValueSource(strings = {"a", "Acme", "-acme", "acme-", "ac me", "acme_corp", ""})
    void rejects_everything_else(String value) {
        Throwable throwable = catchThrowable(() -> TenantId.of(value));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @ValueSource(ints = {64, 100})
    void rejects_too_long_tenant_ids(int length) {
        Throwable throwable = catchThrowable(() -> TenantId.of("a".repeat(length)));

        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("between 2 and 63");
    }
}
