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

package org.annalist.projection.runtime;

import org.jspecify.annotations.Nullable;

/**
 * A point-in-time view of one projection runner.
 *
 * @param projectionName        The projection
 * @param state                 What the runner is doing
 * @param lastProcessedPosition The position of the last processed event
 * @param consecutiveFailures   Failures in a row at the current position, 0 when healthy
 * @param lastError             The message of the last failure, if the runner is currently failing
 */
public record ProjectionStatus(String projectionName, ProjectionState state, long lastProcessedPosition, int consecutiveFailures, @Nullable String lastError) {

    public boolean isFailing() {
        return consecutiveFailures > 0;
    }
}
