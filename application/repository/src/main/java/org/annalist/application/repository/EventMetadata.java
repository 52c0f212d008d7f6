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

package org.annalist.application.repository;

import org.jspecify.annotations.Nullable;

/**
 * Correlation and causation ids added to every event of a save.
 */
public record EventMetadata(@Nullable String correlationId, @Nullable String causationId) {
    private static final EventMetadata NONE = new EventMetadata(null, null);

    public static EventMetadata none() {
        return NONE;
    }

    public static EventMetadata correlatedBy(String correlationId) {
        return new EventMetadata(correlationId, null);
    }

    public EventMetadata causedBy(String causationId) {
        return new EventMetadata(correlationId, causationId);
    }

    public boolean isEmpty() {
        return correlationId == null && causationId == null;
    }
}
