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
 * Thrown by a {@link BudgetMode#STRICT strict} {@link ConnectionPoolBudget} whose components may open more connections
 * than the ceiling.
 */
public class BudgetExceededException extends RuntimeException {
    public final int totalConnections;
    public final int ceiling;

    public BudgetExceededException(int totalConnections, int ceiling) {
        super(String.format("Total connection budget %d exceeds the ceiling of %d", totalConnections, ceiling));
        this.totalConnections = totalConnections;
        this.ceiling = ceiling;
    }
}
