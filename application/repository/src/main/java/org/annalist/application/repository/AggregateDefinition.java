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

import java.util.function.BiFunction;
import java.util.function.Function;

import static java.util.Objects.requireNonNull;

/**
 * Describes how the state of an aggregate is derived from its events.
 *
 * <pre>
 * AggregateDefinition&lt;Order, OrderEvent&gt; orders = AggregateDefinition.of("order", Order.class, Order::initial, Order::evolve).withSnapshotInterval(50);
 * </pre>
 *
 * @param <S> The state type
 * @param <E> The domain event type
 */
public final class AggregateDefinition<S, E> {
    private final String name;
    private final Class<S> stateType;
    private final Function<String, S> initialState;
    private final BiFunction<S, E, S> evolve;
    private final int snapshotInterval;

    private AggregateDefinition(String name, Class<S> stateType, Function<String, S> initialState, BiFunction<S, E, S> evolve, int snapshotInterval) {
        requireNonNull(name, "name cannot be null");
        requireNonNull(stateType, "stateType cannot be null");
        requireNonNull(initialState, "initialState cannot be null");
        requireNonNull(evolve, "evolve cannot be null");
        if (snapshotInterval < 0) {
            throw new IllegalArgumentException("snapshotInterval cannot be negative");
        }
        this.name = name;
        this.stateType = stateType;
        this.initialState = initialState;
        this.evolve = evolve;
        this.snapshotInterval = snapshotInterval;
    }

    /**
     * @param name         The aggregate name, used in logs
     * @param stateType    The class of the state, used when deserializing snapshots
     * @param initialState Creates the state of an aggregate without events from its stream id
     * @param evolve       Applies an event to a state and returns the new state. Must be pure.
     */
    public static <S, E> AggregateDefinition<S, E> of(String name, Class<S> stateType, Function<String, S> initialState, BiFunction<S, E, S> evolve) {
        return new AggregateDefinition<>(name, stateType, initialState, evolve, 0);
    }

    /**
     * @param snapshotInterval Take a snapshot when at least this many events have been saved since the last one. 0 disables snapshots.
     */
    public AggregateDefinition<S, E> withSnapshotInterval(int snapshotInterval) {
        return new AggregateDefinition<>(name, stateType, initialState, evolve, snapshotInterval);
    }

    public String name() {
        return name;
    }

    public Class<S> stateType() {
        return stateType;
    }

    public S initialState(String streamId) {
        return requireNonNull(initialState.apply(streamId), "initial state cannot be null");
    }

    public S evolve(S state, E event) {
        return requireNonNull(evolve.apply(state, event), "evolve returned null for " + event);
    }

    public int snapshotInterval() {
        return snapshotInterval;
    }

    public boolean isSnapshotEnabled() {
        return snapshotInterval > 0;
    }

    @Override
    public String toString() {
        return "AggregateDefinition{name='" + name + "', stateType=" + stateType.getSimpleName() + ", snapshotInterval=" + snapshotInterval + '}';
    }
}
