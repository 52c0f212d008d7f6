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

package org.annalist.projection.api;

import org.annalist.eventstore.api.RecordedEvent;

import java.util.Set;

/**
 * A read model built from the events of the log, in global position order.
 * <p>
 * Implement this interface directly, or build a projection from handlers:
 * <pre>
 * Projection orderSummary = Projection.named("order-summary")
 *         .on("order.placed.v1", OrderPlaced.class, (placed, event) -&gt; summaries.upsert(placed))
 *         .on("order.cancelled.v1", event -&gt; summaries.markCancelled(event.streamId()))
 *         .clearWith(summaries::deleteAll)
 *         .build();
 * </pre>
 */
public interface Projection {

    /**
     * @return The unique name of the projection, used as the key of its tracking cursor
     */
    String name();

    /**
     * @return The cloud event types this projection handles. Other events are acknowledged without being handled.
     */
    Set<String> eventTypes();

    /**
     * Apply {@code event} to the read model. Only called for events whose type is in {@link #eventTypes()}.
     */
    void handle(RecordedEvent event);

    /**
     * Delete everything in the read model. Called before the log is replayed during a rebuild.
     */
    void clear();

    static ProjectionBuilder named(String name) {
        return new ProjectionBuilder(name);
    }
}
