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

package org.annalist.eventstore.api;

import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The events read from one stream, in stream version order.
 *
 * @param id      The stream id
 * @param version The current version of the whole stream, regardless of where the read started. {@code 0} if the stream has no events.
 * @param events  The events that were read, possibly only a suffix of the stream
 */
public record EventStream<T>(String id, long version, List<T> events) implements Iterable<T> {

    public EventStream {
        Objects.requireNonNull(id, "id cannot be null");
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative");
        }
        events = List.copyOf(events);
    }

    public static <T> EventStream<T> of(String id, long version, List<T> events) {
        return new EventStream<>(id, version, events);
    }

    public static <T> EventStream<T> empty(String id) {
        return new EventStream<>(id, 0, List.of());
    }

    /**
     * @return {@code true} if the stream has no events at all, not just none after the version that was read from
     */
    public boolean isEmpty() {
        return version == 0;
    }

    public <R> EventStream<R> map(Function<? super T, ? extends R> fn) {
        return new EventStream<>(id, version, events.stream().<R>map(fn).collect(Collectors.toList()));
    }

    @Override
    public Iterator<T> iterator() {
        return events.iterator();
    }

    @Override
    public String toString() {
        return "EventStream[id=" + id + ", version=" + version + ", read=" + events.size() + "]";
    }
}
