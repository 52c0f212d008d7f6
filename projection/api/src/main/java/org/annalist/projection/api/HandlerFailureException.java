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

/**
 * A projection handler failed for an event. The batch it belongs to is aborted and retried.
 */
public class HandlerFailureException extends RuntimeException {
    public final String projectionName;
    public final long globalPosition;
    public final String eventType;

    public HandlerFailureException(String projectionName, long globalPosition, String eventType, Throwable cause) {
        super(String.format("Projection %s failed to handle %s at position %d: %s", projectionName, eventType, globalPosition, cause.getMessage()), cause);
        this.projectionName = projectionName;
        this.globalPosition = globalPosition;
        this.eventType = eventType;
    }
}
