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

import io.cloudevents.CloudEvent;

import java.util.List;

/**
 * Reads across streams, ordered by global position. Used for catch-up and rebuild of projections.
 * All methods are pure reads and may be called repeatedly with the same arguments.
 */
public interface EventStoreQueries {

    /**
     * @param position The first global position to include
     * @param limit    The maximum number of events to return
     * @return Events whose global position is greater than or equal to {@code position}, in ascending global position order
     */
    List<CloudEvent> readFromPosition(long position, int limit);

    /**
     * Like {@link #readFromPosition(long, int)} but only includes events of {@code tenantId}.
     */
    List<CloudEvent> readFromPosition(TenantId tenantId, long position, int limit);

    /**
     * @return The highest global position that has been committed, {@code 0} if the log is empty
     */
    long headPosition();
}
