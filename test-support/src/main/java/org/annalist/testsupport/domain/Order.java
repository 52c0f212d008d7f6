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

import java.util.UUID;

/**
 * Aggregate state of an order. {@link #evolve(Order, OrderEvent)} is a pure fold.
 */
public record Order(String orderId, Status status, String customer, long amountInCents, String carrier, int changes) {

    public enum Status {
        NEW, PLACED, SHIPPED, CANCELLED
    }

    public static Order initial(String orderId) {
        return new Order(orderId, Status.NEW, null, 0, null, 0);
    }

    public static Order evolve(Order order, OrderEvent event) {
        if (event instanceof OrderPlaced placed) {
            return new Order(order.orderId, Status.PLACED, placed.customer(), placed.amountInCents(), order.carrier, order.changes + 1);
        } else if (event instanceof OrderShipped shipped) {
            return new Order(order.orderId, Status.SHIPPED, order.customer, order.amountInCents, shipped.carrier(), order.changes + 1);
        } else if (event instanceof OrderCancelled) {
            return new Order(order.orderId, Status.CANCELLED, order.customer, order.amountInCents, order.carrier, order.changes + 1);
        }
        throw new IllegalArgumentException("Unknown event " + event);
    }

    public OrderPlaced place(String customer, long amountInCents) {
        if (status != Status.NEW) {
            throw new IllegalStateException("Order " + orderId + " is already " + status);
        }
        return new OrderPlaced(UUID.randomUUID().toString(), orderId, customer, amountInCents);
    }

    public OrderShipped ship(String carrier) {
        if (status != Status.PLACED) {
            throw new IllegalStateException("Cannot ship order " + orderId + " that is " + status);
        }
        return new OrderShipped(UUID.randomUUID().toString(), orderId, carrier);
    }
}
