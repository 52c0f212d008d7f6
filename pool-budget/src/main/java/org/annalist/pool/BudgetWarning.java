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

package org.annalist.pool;

/**
 * A finding of {@link ConnectionPoolBudget#validate(int)}.
 *
 * @param kind             What is wrong
 * @param totalConnections The sum of {@code poolSize + maxOverflow} over all registered components
 * @param ceiling          The ceiling the total was validated against
 */
public record BudgetWarning(Kind kind, int totalConnections, int ceiling) {

    public enum Kind {
        /**
         * The components may together open more connections than the ceiling.
         */
        CEILING_EXCEEDED,
        /**
         * The components may use more than 80 % of the ceiling.
         */
        LOW_HEADROOM
    }

    public String message() {
        if (kind == Kind.CEILING_EXCEEDED) {
            return String.format("Total connection budget %d exceeds the ceiling of %d", totalConnections, ceiling);
        }
        return String.format("Total connection budget %d uses more than 80%% of the ceiling of %d", totalConnections, ceiling);
    }
}
