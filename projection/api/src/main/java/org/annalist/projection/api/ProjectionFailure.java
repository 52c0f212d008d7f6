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

import java.util.OptionalLong;

/**
 * A projection that keeps failing at the same step.
 *
 * @param projectionName      The projection
 * @param operation           What the runner was doing, for example {@code handling order.placed.v1} or {@code reading the cursor}
 * @param position            The position of the failing event, empty if the failure wasn't caused by a handler
 * @param consecutiveFailures How many times in a row the step has failed
 * @param cause               The last failure
 */
public record ProjectionFailure(String projectionName, String operation, OptionalLong position, int consecutiveFailures, Throwable cause) {

    public static ProjectionFailure atPosition(String projectionName, String operation, long position, int consecutiveFailures, Throwable cause) {
        return new ProjectionFailure(projectionName, operation, OptionalLong.of(position), consecutiveFailures, cause);
    }

    public static ProjectionFailure whileDoing(String projectionName, String operation, int consecutiveFailures, Throwable cause) {
        return new ProjectionFailure(projectionName, operation, OptionalLong.empty(), consecutiveFailures, cause);
    }

    /**
     * @return {@code "while handling order.placed.v1 at position 4"} or {@code "while reading the cursor"}
     */
    public String describe() {
        return position.isPresent() ? "while " + operation + " at position " + position.getAsLong() : "while " + operation;
    }
}
