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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Keeps track of how many database connections every component may open, so that the total can be checked against
 * what the database accepts before anything starts serving.
 * <p>
 * The budget is bookkeeping only. It doesn't open or limit connections, each component is responsible for keeping
 * its pool within what it registered. Components register once at startup, then {@link #validate(int)} is called
 * after the last registration. Registering after validation is an error.
 */
public class ConnectionPoolBudget {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolBudget.class);

    private final BudgetMode mode;
    private final Map<String, PoolBudgetEntry> entries = new LinkedHashMap<>();
    private @Nullable Integer validatedCeiling;
    private List<BudgetWarning> warnings = Collections.emptyList();

    public ConnectionPoolBudget() {
        this(BudgetMode.ADVISORY);
    }

    public ConnectionPoolBudget(BudgetMode mode) {
        this.mode = requireNonNull(mode, BudgetMode.class.getSimpleName() + " cannot be null");
    }

    /**
     * @throws IllegalArgumentException If {@code componentName} is already registered
     * @throws IllegalStateException    If the budget has already been validated
     */
    public synchronized PoolBudgetEntry register(String componentName, int poolSize, int maxOverflow) {
        PoolBudgetEntry entry = new PoolBudgetEntry(componentName, poolSize, maxOverflow);
        if (validatedCeiling != null) {
            throw new IllegalStateException("Cannot register " + componentName + " after the connection budget has been validated");
        }
        if (entries.containsKey(componentName)) {
            throw new IllegalArgumentException("Component " + componentName + " is already registered in the connection budget");
        }
        entries.put(componentName, entry);
        log.debug("Registered {} with pool size {} and max overflow {}", componentName, poolSize, maxOverflow);
        return entry;
    }

    /**
     * Compare the total number of connections the registered components may open with {@code ceiling}.
     *
     * @param ceiling Typically the database's connection limit minus a safety margin
     * @return The warnings, also logged. Empty if the total is within 80 % of the ceiling.
     * @throws BudgetExceededException If the ceiling is exceeded and the mode is {@link BudgetMode#STRICT}
     */
    public synchronized List<BudgetWarning> validate(int ceiling) {
        if (ceiling < 1) {
            throw new IllegalArgumentException("ceiling must be greater than 0");
        }
        int total = totalConnections();
        List<BudgetWarning> found = new ArrayList<>();
        if (total > ceiling) {
            found.add(new BudgetWarning(BudgetWarning.Kind.CEILING_EXCEEDED, total, ceiling));
        } else if ((long) total * 5 > (long) ceiling * 4) {
            found.add(new BudgetWarning(BudgetWarning.Kind.LOW_HEADROOM, total, ceiling));
        }
        validatedCeiling = ceiling;
        warnings = Collections.unmodifiableList(found);

        if (found.isEmpty()) {
            log.info("Total connection budget {} of ceiling {} across {}", total, ceiling, entries.keySet());
        } else {
            found.forEach(warning -> log.warn("{}. Registered components: {}", warning.message(), entries.values()));
        }
        if (mode == BudgetMode.STRICT && total > ceiling) {
            throw new BudgetExceededException(total, ceiling);
        }
        return warnings;
    }

    public synchronized BudgetReport report() {
        return new BudgetReport(new ArrayList<>(entries.values()), totalConnections(), validatedCeiling, warnings);
    }

    public synchronized boolean isValidated() {
        return validatedCeiling != null;
    }

    public BudgetMode mode() {
        return mode;
    }

    private int totalConnections() {
        return entries.values().stream().mapToInt(PoolBudgetEntry::maxConnections).sum();
    }
}
