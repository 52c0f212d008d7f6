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

package org.annalist.testsupport.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cloudevents.CloudEvent;
import io.cloudevents.core.builder.CloudEventBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.OffsetDateTime;

import static java.time.ZoneOffset.UTC;
import static java.util.Objects.requireNonNull;
import static org.annalist.cloudevents.AnnalistCloudEventExtension.TENANT_ID;

/**
 * Converts order events to and from cloud events without going through the application layer.
 */
public class OrderCloudEvents {
    public static final URI SOURCE = URI.create("urn:annalist:orders");

    private final ObjectMapper objectMapper;

    public OrderCloudEvents(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public OrderCloudEvents() {
        this(new ObjectMapper());
    }

    public CloudEvent toCloudEvent(String tenantId, OrderEvent e) {
        try {
            return CloudEventBuilder.v1()
                    .withId(e.eventId())
                    .withSource(SOURCE)
                    .withType(typeOf(e))
                    .withTime(OffsetDateTime.now(UTC))
                    .withSubject(e.orderId())
                    .withDataContentType("application/json")
                    .withData(objectMapper.writeValueAsBytes(e))
                    .withExtension(TENANT_ID, tenantId)
                    .build();
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public OrderEvent toDomainEvent(CloudEvent cloudEvent) {
        Class<? extends OrderEvent> type = switch (cloudEvent.getType()) {
            case OrderPlaced.TYPE -> OrderPlaced.class;
            case OrderShipped.TYPE -> OrderShipped.class;
            case OrderCancelled.TYPE -> OrderCancelled.class;
            default -> throw new IllegalArgumentException("Unknown type " + cloudEvent.getType());
        };
        try {
            return objectMapper.readValue(requireNonNull(cloudEvent.getData(), "data").toBytes(), type);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static String typeOf(OrderEvent e) {
        if (e instanceof OrderPlaced) {
            return OrderPlaced.TYPE;
        } else if (e instanceof OrderShipped) {
            return OrderShipped.TYPE;
        }
        return OrderCancelled.TYPE;
    }

    public static OrderPlaced placed(String orderId) {
        return new OrderPlaced(orderId + "-placed", orderId, "customer-" + orderId, 1000);
    }

    public static OrderShipped shipped(String orderId) {
        return new OrderShipped(orderId + "-shipped", orderId, "postnord");
    }

    public static OrderCancelled cancelled(String orderId) {
        return new OrderCancelled(orderId + "-cancelled", orderId, "changed my mind");
    }
}
