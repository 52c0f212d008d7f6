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
import org.assertj.core.api.SoftAssertions;
import org.assertj.core.api.junit.jupiter.SoftAssertionsExtension;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URI;
import java.time.OffsetDateTime;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.time.ZoneOffset.UTC;

@ExtendWith(SoftAssertionsExtension.class)
class AnnalistExtensionRemoverTest {

    @Test
    void removes_all_log_assigned_extensions_but_keeps_correlation(SoftAssertions softly) {
        // Given
        CloudEvent originalCloudEvent = CloudEventBuilder.v1()
                .withId("id")
                .withTime(OffsetDateTime.now(UTC))
                .withSource(URI.create("urn:test"))
                .withSubject("subject")
                .withType("type")
                .withData("text/plain", "hello".getBytes(UTF_8))
                .build();

        CloudEvent annalistCloudEvent = CloudEventBuilder.v1(originalCloudEvent)
                .withExtension(new AnnalistCloudEventExtension("streamId", 1, 10, "acme", OffsetDateTime.now(UTC)))
                .withExtension(new CorrelationCloudEventExtension("corr", null))
                .build();

        // When
        CloudEvent removed = AnnalistExtensionRemover.removeAnnalistExtensions(annalistCloudEvent);

        // Then
        AnnalistCloudEventExtension.KEYS.forEach(key -> softly.assertThat(removed.getExtension(key)).describedAs(key).isNull());
        softly.assertThat(removed.getExtension(CorrelationCloudEventExtension.CORRELATION_ID)).isEqualTo("corr");
        softly.assertThat(removed.getId()).isEqualTo("id");
    }
}
