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

package org.annalist.cloudevents;

import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.OffsetDateTime;

import static java.time.ZoneOffset.UTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class AnnalistExtensionGetterTest {

    private static final OffsetDateTime RECORDED_AT = OffsetDateTime.of(2024, 3, 1, 10, 15, 0, 0, UTC);

    @Test
    void reads_every_log_assigned_attribute() {
        // Given
        CloudEvent cloudEvent = CloudEventBuilder.v1(bareEvent())
                .withExtension(new AnnalistCloudEventExtension("ORD-1", 2, 42, "acme", RECORDED_AT))
                .withExtension(new CorrelationCloudEventExtension("corr-1", "cmd-7"))
                .build();

        // Then
        assertAll(
                () -> assertThat(AnnalistExtensionGetter.getStreamId(cloudEvent)).isEqualTo("ORD-1"),
                () -> assertThat(AnnalistExtensionGetter.getStreamVersion(cloudEvent)).isEqualTo(2),
                () -> assertThat(AnnalistExtensionGetter.getGlobalPosition(cloudEvent)).isEqualTo(42),
                () -> assertThat(AnnalistExtensionGetter.getTenantId(cloudEvent)).isEqualTo("acme"),
                () -> assertThat(AnnalistExtensionGetter.getRecordedAt(cloudEvent)).isEqualTo(RECORDED_AT),
                () -> assertThat(AnnalistExtensionGetter.getCorrelationId(cloudEvent)).hasValue("corr-1"),
                () -> assertThat(AnnalistExtensionGetter.getCausationId(cloudEvent)).hasValue("cmd-7")
        );
    }

    @Test
    void accepts_numeric_extensions_of_any_width() {
        // Given
        CloudEvent cloudEvent = CloudEventBuilder.v1(bareEvent())
                .withExtension(AnnalistCloudEventExtension.STREAM_VERSION, 3)
                .build();

        // Then
        assertThat(AnnalistExtensionGetter.getStreamVersion(cloudEvent)).isEqualTo(3L);
    }

    @Test
    void throws_iae_when_extension_is_missing() {
        // When
        Throwable throwable = catchThrowable(() -> AnnalistExtensionGetter.getGlobalPosition(bareEvent()));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("globalposition");
    }

    @Test
    void optional_attributes_are_empty_when_absent() {
        assertAll(
                () -> assertThat(AnnalistExtensionGetter.getCorrelationId(bareEvent())).isEmpty(),
                () -> assertThat(AnnalistExtensionGetter.findTenantId(bareEvent())).isEmpty()
        );
    }

    private static CloudEvent bareEvent() {
        return CloudEventBuilder.v1()
                .withId("id")
                .withSource(URI.create("urn:test"))
                .withType("type")
                .build();
    }
}
