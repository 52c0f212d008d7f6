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

import static java.util.Objects.requireNonNull;

/**
 * The connections one component has declared that it may open.
 */
public record PoolBudgetEntry(String componentName, int poolSize, int maxOverflow) {

    public PoolBudgetEntry {
        requireNonNull(componentName, "componentName cannot be null");
        if (componentName.isBlank()) {
            throw new IllegalArgumentException("componentName cannot be blank");
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be greater than 0");
        }
        if (maxOverflow < 0) {
            throw new IllegalArgumentException("maxOverflow cannot be negative");
        }
    }

    public int maxConnections() {
        return poolSize + maxOverflow;
    }
}
