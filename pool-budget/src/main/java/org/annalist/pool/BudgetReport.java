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

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * A snapshot of a {@link ConnectionPoolBudget} for operational tooling.
 *
 * @param entries          The registered components, in registration order
 * @param totalConnections The sum of {@code poolSize + maxOverflow} over all entries
 * @param ceiling          The ceiling of the last validation, {@code null} if the budget hasn't been validated
 * @param warnings         The warnings of the last validation
 */
public record BudgetReport(List<PoolBudgetEntry> entries, int totalConnections, @Nullable Integer ceiling, List<BudgetWarning> warnings) {

    public BudgetReport {
        entries = List.copyOf(entries);
        warnings = List.copyOf(warnings);
    }

    public boolean isValidated() {
        return ceiling != null;
    }
}
