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

package org.annalist.application.converter;

import org.annalist.testsupport.domain.OrderEvent;
import org.annalist.testsupport.domain.OrderPlaced;
import org.annalist.testsupport.domain.OrderShipped;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
class EventTypeRegistryTest {

    @Test
    void resolves_registered_types_in_both_directions() {
        // Given
        EventTypeRegistry<OrderEvent> registry = EventTypeRegistry.<OrderEvent>builder().register(OrderPlaced.TYPE, OrderPlaced.class).build();

        // Then
        assertAll(
                () -> assertThat(registry.getCloudEventType(OrderPlaced.class)).isEqualTo("order.placed.v1"),
                () -> assertThat(registry.getDomainEventType("order.placed.v1")).isEqualTo(OrderPlaced.class),
                () -> assertThat(registry.isRegistered("order.placed.v1")).isTrue(),
                () -> assertThat(registry.isRegistered("order.shipped.v1")).isFalse()
        );
    }

    @Test
    void the_same_type_identifier_cannot_be_registered_twice() {
        // Given
        EventTypeRegistry.Builder<OrderEvent> builder = EventTypeRegistry.<OrderEvent>builder().register("order.v1", OrderPlaced.class);

        // When
        Throwable throwable = catchThrowable(() -> builder.register("order.v1", OrderShipped.class));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class).hasMessageContaining("order.v1 is already registered");
    }

    @Test
    void the_same_class_cannot_be_registered_under_two_identifiers() {
        // Given
        EventTypeRegistry.Builder<OrderEvent> builder = EventTypeRegistry.<OrderEvent>builder().register("order.placed.v1", OrderPlaced.class);

        // When
        Throwable throwable = catchThrowable(() -> builder.register("order.placed.v2", OrderPlaced.class));

        // Then
        assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
