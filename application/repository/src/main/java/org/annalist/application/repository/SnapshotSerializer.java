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

/**
 * Serializes aggregate state for the snapshot store.
 *
 * @param <S> The state type
 */
public interface SnapshotSerializer<S> {

    String serialize(S state);

    /**
     * @throws RuntimeException If {@code serialized} cannot be turned back into a state
     */
    S deserialize(String serialized);
}
